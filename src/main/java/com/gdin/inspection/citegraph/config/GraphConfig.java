package com.gdin.inspection.citegraph.config;

import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.graph.compare.TextUnderstandingService;
import com.gdin.inspection.citegraph.graph.extract.Extractor;
import com.gdin.inspection.citegraph.graph.extract.ExtractorRegistry;
import com.gdin.inspection.citegraph.graph.extract.KeywordExtractor;
import com.gdin.inspection.citegraph.graph.extract.LlmAttributeExtractor;
import com.gdin.inspection.citegraph.graph.prompts.AttributeExtractionPromptsZh;
import com.gdin.inspection.citegraph.util.HttpClientUtil;
import com.gdin.inspection.citegraph.util.TokenUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class GraphConfig {
    @Resource
    private GraphProperties graphProperties;

    @Bean("semanticScholarRestTemplate")
    public RestTemplate semanticScholarRestTemplate() {
        GraphProperties.SemanticScholar ss = graphProperties.getSemanticScholar();
        // 连接数和并发请求数保持一致
        int maxConnections = Math.max(1, graphProperties.getAssemble().getConcurrentRequests());
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(
                HttpClientUtil.getApacheClient(ss.getConnectTimeoutSeconds(), ss.getResponseTimeoutSeconds(), maxConnections)));
    }

    /**
     * keywords 总是可用；contributions / architecture 依赖文本理解服务，未启用大模型时不注册。
     */
    @Bean
    public ExtractorRegistry extractorRegistry(ObjectProvider<TextUnderstandingService> textUnderstandingService,
                                               TokenUtil tokenUtil) {
        List<Extractor> extractors = new ArrayList<>();
        extractors.add(new KeywordExtractor(graphProperties.getCluster().getMaxFeatures(), graphProperties.getCluster().getTopTerms()));

        TextUnderstandingService collaborator = textUnderstandingService.getIfAvailable();
        if (collaborator != null) {
            int maxTokens = graphProperties.getCompare().getMaxPaperTokens();
            extractors.add(new LlmAttributeExtractor("contributions", AttributeExtractionPromptsZh.SYSTEM_PROMPT,
                    AttributeExtractionPromptsZh.CONTRIBUTIONS_PROMPT, collaborator, tokenUtil, maxTokens));
            extractors.add(new LlmAttributeExtractor("architecture", AttributeExtractionPromptsZh.SYSTEM_PROMPT,
                    AttributeExtractionPromptsZh.ARCHITECTURE_PROMPT, collaborator, tokenUtil, maxTokens));
        } else {
            log.info("文本理解服务未启用，只注册本地抽取器");
        }
        ExtractorRegistry registry = new ExtractorRegistry(extractors);
        log.info("已注册抽取器: {}", registry.names());
        return registry;
    }
}
