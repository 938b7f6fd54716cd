package com.gdin.inspection.citegraph.service;

import cn.hutool.core.util.IdUtil;
import com.gdin.inspection.citegraph.assistant.CommonAssistant;
import com.gdin.inspection.citegraph.config.properties.LlmProperties;
import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.graph.compare.TextUnderstandingService;
import com.gdin.inspection.citegraph.util.LlmResponseUtil;
import dev.langchain4j.service.TokenStream;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeoutException;

/**
 * 基于通义千问流式接口的文本理解服务，每次调用使用独立会话。
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "gdin.ai.llm", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LlmTextUnderstandingService implements TextUnderstandingService {

    @Resource
    private AssistantGenerator assistantGenerator;

    @Resource
    private LlmProperties llmProperties;

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        CommonAssistant assistant = assistantGenerator.createTempAssistant(CommonAssistant.class, systemPrompt);
        String memoryId = IdUtil.getSnowflakeNextIdStr();
        TokenStream tokenStream = assistant.streamChat(memoryId, userPrompt);
        try {
            return LlmResponseUtil.getResponseWithoutThink(tokenStream, memoryId, llmProperties.getTimeoutSeconds() * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionFailedException("调用大模型被中断", e);
        } catch (TimeoutException e) {
            throw new ExtractionFailedException("调用大模型超时: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ExtractionFailedException("调用大模型失败: " + e.getMessage(), e);
        }
    }
}
