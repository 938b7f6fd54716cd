package com.gdin.inspection.citegraph.service;

import com.gdin.inspection.citegraph.config.properties.LlmProperties;
import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.ChatMemoryProvider;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.service.AiServices;
import jakarta.annotation.Resource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "gdin.ai.llm", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AssistantGenerator {
    @Resource
    @Qualifier("commonCm")
    private ChatModel commonChatModel;

    @Resource
    @Qualifier("commonScm")
    private StreamingChatModel commonStreamingChatModel;

    @Resource
    private LlmProperties llmProperties;

    /**
     * 创建临时会话的AI助手实例（使用内存窗口模式），每次调用互不共享上下文
     * @param clazz 需要创建的AI服务接口类型
     * @param systemMessage 系统提示信息（可选）
     * @param <T> 泛型类型参数
     * @return 配置完成的临时AI服务实例
     */
    public <T> T createTempAssistant(@NonNull Class<T> clazz, String systemMessage) {
        ChatMemory chatMemory = MessageWindowChatMemory.withMaxMessages(llmProperties.getMaxMessages());
        // 固定内存提供者（忽略memoryId参数）
        ChatMemoryProvider chatMemoryProvider = memoryId -> chatMemory;
        AiServices<T> builder = AiServices.builder(clazz)
                .chatModel(commonChatModel)
                .streamingChatModel(commonStreamingChatModel)
                .chatMemoryProvider(chatMemoryProvider);

        // 可选配置系统消息
        if (systemMessage != null) builder.systemMessageProvider(memoryId -> systemMessage);

        return builder.build();
    }
}
