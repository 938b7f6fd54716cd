package com.gdin.inspection.citegraph.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.graph")
@Component
public class GraphProperties implements Serializable {
    private SemanticScholar semanticScholar = new SemanticScholar();
    private Assemble assemble = new Assemble();
    private Cluster cluster = new Cluster();
    private Compare compare = new Compare();

    @Data
    public static class SemanticScholar implements Serializable {
        private String baseUrl = "https://api.semanticscholar.org/graph/v1";
        // 可选，不填走匿名额度
        private String apiKey;
        private Long connectTimeoutSeconds = 10L;
        private Long responseTimeoutSeconds = 10L;
        // references / citations 单页条数上限
        private Integer pageLimit = 500;
        // 瞬时失败（超时、5xx、IO）的总尝试次数
        private Integer maxAttempts = 3;
        // 指数退避基数：base, 2*base, 4*base ...
        private Long baseDelayMillis = 1000L;
        // 429 且没有 Retry-After 时的冷却时间
        private Long rateLimitCooldownMillis = 5000L;
    }

    @Data
    public static class Assemble implements Serializable {
        private Integer maxIntermediate = 100;
        // 候选论文出现在种子参考文献里的权重
        private Double referenceWeight = 1.0;
        // 候选论文引用了种子时的权重
        private Double citationWeight = 1.0;
        // 并发请求数
        private Integer concurrentRequests = 5;
        // 是否对选中的中间论文再 resolve 一次以补全摘要等字段
        private Boolean enrichIntermediate = false;
    }

    @Data
    public static class Cluster implements Serializable {
        private Long seed = 42L;
        private Integer maxFeatures = 500;
        private Integer topTerms = 10;
        private Integer representativePapers = 5;
        // k-means 重启次数，取惯性最小的一次
        private Integer restarts = 10;
        private Integer maxIterations = 300;
        private Integer maxPropagationRounds = 100;
        private Double defaultContentWeight = 0.7;
        private Double defaultCitationWeight = 0.3;
    }

    @Data
    public static class Compare implements Serializable {
        private Integer maxParallel = 5;
        private Integer maxParallelCap = 16;
        // 每篇论文送进提示词的最大 token 数
        private Integer maxPaperTokens = 1200;
    }
}
