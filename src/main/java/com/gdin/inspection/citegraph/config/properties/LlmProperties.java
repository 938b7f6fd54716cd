package com.gdin.inspection.citegraph.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.llm")
@Component
public class LlmProperties implements Serializable {
    private Boolean enabled = true;
    private String baseUrl = "https://dashscope.aliyuncs.com/api/v1";
    private String apiKey;
    private String modelName = "qwen3-32b";
    private Float temperature = 0.3f;
    // 单次调用的等待上限
    private Long timeoutSeconds = 120L;
    private Integer maxMessages = 20;
}
