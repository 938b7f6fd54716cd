package com.gdin.inspection.citegraph.graph.cluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 一次聚类的结果。assignments 按图中节点顺序排列，簇编号从 0 开始连续。
 * 引用拓扑聚类返回自然社区数，clusterCount 可能不等于 requestedClusters。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterResult {

    @JsonProperty("graph_id")
    String graphId;

    @JsonProperty("method")
    ClusterMethod method;

    @JsonProperty("requested_clusters")
    int requestedClusters;

    @JsonProperty("cluster_count")
    int clusterCount;

    @JsonProperty("assignments")
    Map<String, Integer> assignments;

    @JsonProperty("summaries")
    List<ClusterSummary> summaries;

    @JsonProperty("weights")
    Map<String, Double> weights;

    @JsonProperty("computed_at")
    Instant computedAt;
}
