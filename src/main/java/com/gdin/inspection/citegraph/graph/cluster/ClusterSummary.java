package com.gdin.inspection.citegraph.graph.cluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 单个簇的摘要。内容 / 混合聚类给出 topTerms，引用拓扑聚类给出连通性描述。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterSummary {

    @JsonProperty("cluster_id")
    int clusterId;

    @JsonProperty("size")
    int size;

    @JsonProperty("top_terms")
    List<String> topTerms;

    @JsonProperty("representative_paper_ids")
    List<String> representativePaperIds;

    @JsonProperty("sample_papers")
    List<String> samplePapers;

    @JsonProperty("avg_year")
    Double avgYear;

    @JsonProperty("internal_edges")
    Integer internalEdges;

    @JsonProperty("external_edges")
    Integer externalEdges;

    @JsonProperty("density")
    Double density;

    @JsonProperty("hub_paper_id")
    String hubPaperId;

    @JsonProperty("description")
    String description;
}
