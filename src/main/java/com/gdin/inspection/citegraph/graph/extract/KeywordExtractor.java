package com.gdin.inspection.citegraph.graph.extract;

import com.gdin.inspection.citegraph.graph.cluster.TfidfVectorizer;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 本地关键词抽取：以整张图为语料做 TF-IDF，取该论文权重最高的词。不调用外部服务。
 */
public class KeywordExtractor implements Extractor {

    public static final String NAME = "keywords";
    public static final String ATTR_KEYWORDS = "keywords";

    private final int maxFeatures;
    private final int topK;

    public KeywordExtractor(int maxFeatures, int topK) {
        this.maxFeatures = maxFeatures;
        this.topK = topK;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, AttributeValue> extract(PaperNode paper, ResearchGraph graph) {
        List<String> docs = new ArrayList<>(graph.getNodes().size());
        int row = -1;
        for (int i = 0; i < graph.getNodes().size(); i++) {
            PaperNode n = graph.getNodes().get(i);
            if (n.getId().equals(paper.getId())) row = i;
            docs.add(n.contentText());
        }
        if (row < 0) {
            // 不在图里的论文单独成语料
            docs.add(paper.contentText());
            row = docs.size() - 1;
        }
        TfidfVectorizer.Matrix matrix = new TfidfVectorizer(maxFeatures).fitTransform(docs);
        return Map.of(ATTR_KEYWORDS, AttributeValue.of(matrix.topTerms(List.of(row), topK)));
    }
}
