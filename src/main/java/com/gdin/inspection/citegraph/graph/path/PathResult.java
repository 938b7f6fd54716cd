package com.gdin.inspection.citegraph.graph.path;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 路径查询结果：FOUND 时 papers 从 source 开始到 target 结束；NO_PATH 时 papers / edges 为空列表。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PathResult {

    public enum Status {
        FOUND, NO_PATH
    }

    @JsonProperty("status")
    Status status;

    @JsonProperty("source_id")
    String sourceId;

    @JsonProperty("target_id")
    String targetId;

    @JsonProperty("ranking")
    PathRanking ranking;

    @JsonProperty("papers")
    List<String> papers;

    @JsonProperty("edges")
    List<PathEdge> edges;

    @JsonProperty("length")
    int length;

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public static PathResult noPath(String sourceId, String targetId, PathRanking ranking) {
        return PathResult.builder()
                .status(Status.NO_PATH)
                .sourceId(sourceId)
                .targetId(targetId)
                .ranking(ranking)
                .papers(List.of())
                .edges(List.of())
                .length(0)
                .build();
    }

    @Value
    @Jacksonized
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PathEdge {
        @JsonProperty("id")
        String id;
        @JsonProperty("from")
        String from;
        @JsonProperty("to")
        String to;
        @JsonProperty("label")
        String label;
        @JsonProperty("context")
        String context;
        @JsonProperty("strength")
        double strength;
    }
}
