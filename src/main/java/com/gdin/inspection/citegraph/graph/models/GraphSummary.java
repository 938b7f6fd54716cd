package com.gdin.inspection.citegraph.graph.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Jacksonized
@Builder
public class GraphSummary {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("version")
    long version;

    @JsonProperty("node_count")
    int nodeCount;

    @JsonProperty("edge_count")
    int edgeCount;

    @JsonProperty("extractors_applied")
    List<String> extractorsApplied;

    public static GraphSummary of(ResearchGraph graph) {
        return GraphSummary.builder()
                .id(graph.getId())
                .name(graph.getName())
                .createdAt(graph.getCreatedAt())
                .updatedAt(graph.getUpdatedAt())
                .version(graph.getVersion())
                .nodeCount(graph.getNodes().size())
                .edgeCount(graph.getEdges().size())
                .extractorsApplied(graph.getExtractorsApplied())
                .build();
    }
}
