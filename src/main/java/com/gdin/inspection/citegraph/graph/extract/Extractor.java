package com.gdin.inspection.citegraph.graph.extract;

import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;

import java.util.Map;

/**
 * 论文属性抽取器。返回的属性会合并进节点的 attributes，同名 key 覆盖。
 */
public interface Extractor {

    /**
     * 唯一名称，记录在 extractors_applied 中。
     */
    String name();

    /**
     * @param graph 论文所在的图，需要语料级统计的抽取器会用到
     * @throws com.gdin.inspection.citegraph.exception.ExtractionFailedException 单篇抽取失败
     */
    Map<String, AttributeValue> extract(PaperNode paper, ResearchGraph graph);
}
