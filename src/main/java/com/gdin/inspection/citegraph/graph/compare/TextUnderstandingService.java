package com.gdin.inspection.citegraph.graph.compare;

/**
 * 外部文本理解服务。实现可以很慢、会失败，调用方负责容错。
 */
public interface TextUnderstandingService {

    /**
     * @return 模型的原始回答
     * @throws com.gdin.inspection.citegraph.exception.ExtractionFailedException 超时或调用失败
     */
    String complete(String systemPrompt, String userPrompt);
}
