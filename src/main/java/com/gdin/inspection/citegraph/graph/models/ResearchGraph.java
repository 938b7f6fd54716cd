package com.gdin.inspection.citegraph.graph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 研究图快照。不可变，所有修改都通过 GraphStore 的更新操作生成新快照。
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchGraph {

    public static final String DEFAULT_NAME = "Untitled Graph";

    @JsonProperty("id")
    String id;

    @Builder.Default
    @JsonProperty("name")
    String name = DEFAULT_NAME;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("version")
    long version;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("nodes")
    List<PaperNode> nodes;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("edges")
    List<CitationEdge> edges;

    @Singular(value = "metadataEntry", ignoreNullCollections = true)
    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @Singular(value = "extractorApplied", ignoreNullCollections = true)
    @JsonProperty("extractors_applied")
    List<String> extractorsApplied;

    public Optional<PaperNode> findNode(String nodeId) {
        for (PaperNode n : nodes) {
            if (n.getId().equals(nodeId)) return Optional.of(n);
        }
        return Optional.empty();
    }

    public boolean containsNode(String nodeId) {
        return findNode(nodeId).isPresent();
    }

    public Optional<CitationEdge> findEdge(String edgeId) {
        for (CitationEdge e : edges) {
            if (e.getId().equals(edgeId)) return Optional.of(e);
        }
        return Optional.empty();
    }

    /**
     * 某节点的出边，保持插入顺序。
     */
    public List<CitationEdge> outgoingEdges(String nodeId) {
        List<CitationEdge> out = new ArrayList<>();
        for (CitationEdge e : edges) {
            if (e.getFromPaper().equals(nodeId)) out.add(e);
        }
        return out;
    }

    public boolean hasExtractorApplied(String name) {
        return extractorsApplied.contains(name);
    }

    /**
     * 用新边替换同 id 的边，位置不变。
     */
    public ResearchGraph withEdge(CitationEdge edge) {
        List<CitationEdge> replaced = new ArrayList<>(edges.size());
        boolean hit = false;
        for (CitationEdge e : edges) {
            if (e.getId().equals(edge.getId())) {
                replaced.add(edge);
                hit = true;
            } else {
                replaced.add(e);
            }
        }
        if (!hit) throw new IllegalArgumentException("边不存在: " + edge.getId());
        return toBuilder().clearEdges().edges(replaced).build();
    }

    /**
     * 用新节点替换同 id 的节点，位置不变。
     */
    public ResearchGraph withNode(PaperNode node) {
        List<PaperNode> replaced = new ArrayList<>(nodes.size());
        boolean hit = false;
        for (PaperNode n : nodes) {
            if (n.getId().equals(node.getId())) {
                replaced.add(node);
                hit = true;
            } else {
                replaced.add(n);
            }
        }
        if (!hit) throw new IllegalArgumentException("节点不存在: " + node.getId());
        return toBuilder().clearNodes().nodes(replaced).build();
    }
}
