package com.gdin.inspection.citegraph.config;

import com.gdin.inspection.citegraph.config.properties.LlmProperties;
import dev.langchain4j.community.model.dashscope.QwenChatModel;
import dev.langchain4j.community.model.dashscope.QwenStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import jakarta.annotation.Resource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Qwen 模型配置。gdin.ai.llm.enabled=false 时不创建，测试里用 mock 的文本理解服务代替。
 */
@Configuration
@ConditionalOnProperty(prefix = "gdin.ai.llm", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AIConfig {
    @Resource
    private LlmProperties llmProperties;

    @Bean("commonCm")
    public ChatModel commonChatModel() {
        return QwenChatModel.builder()
                .baseUrl(llmProperties.getBaseUrl())
                .modelName(llmProperties.getModelName())
                .apiKey(llmProperties.getApiKey())
                .temperature(llmProperties.getTemperature())
                .build();
    }

    @Bean("commonScm")
    public StreamingChatModel commonStreamingChatModel() {
        return QwenStreamingChatModel.builder()
                .baseUrl(llmProperties.getBaseUrl())
                .modelName(llmProperties.getModelName())
                .apiKey(llmProperties.getApiKey())
                .temperature(llmProperties.getTemperature())
                .build();
    }
}
