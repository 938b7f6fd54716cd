package com.gdin.inspection.citegraph.graph.models;

import cn.hutool.core.util.StrUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组图期间的可变草稿，负责守住节点 / 边的不变式：
 * 节点 id 唯一；边的两端必须已存在；不允许自环；同一有序对只保留一条边。
 * <p>
 * 同一有序对重复写入时做合并：保留先写入那条边的 id 和位置，strength 取较大值，
 * context / deltaDescription 只在原值为空时补上。
 */
public class GraphDraft {

    private final Map<String, PaperNode> nodes = new LinkedHashMap<>();
    private final List<CitationEdge> edges = new ArrayList<>();
    private final Map<String, Integer> pairIndex = new HashMap<>();
    private int mergedDuplicates;

    public static GraphDraft of(ResearchGraph graph) {
        GraphDraft draft = new GraphDraft();
        graph.getNodes().forEach(draft::addNode);
        graph.getEdges().forEach(draft::addEdge);
        return draft;
    }

    /**
     * @return false 表示 id 已存在，保留先加入的节点
     */
    public boolean addNode(PaperNode node) {
        if (node == null || StrUtil.isBlank(node.getId())) throw new IllegalArgumentException("节点 id 不能为空");
        return nodes.putIfAbsent(node.getId(), node) == null;
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * @return true 新增了一条边，false 与已有边合并
     */
    public boolean addEdge(CitationEdge edge) {
        if (edge.getFromPaper().equals(edge.getToPaper())) {
            throw new IllegalArgumentException("不允许自环: " + edge.getFromPaper());
        }
        if (!nodes.containsKey(edge.getFromPaper()) || !nodes.containsKey(edge.getToPaper())) {
            throw new IllegalArgumentException("边的端点不在图中: " + edge.pairKey());
        }
        if (edge.getStrength() < 0.0 || edge.getStrength() > 1.0) {
            throw new IllegalArgumentException("strength 超出 [0,1]: " + edge.getStrength());
        }
        Integer existing = pairIndex.get(edge.pairKey());
        if (existing == null) {
            pairIndex.put(edge.pairKey(), edges.size());
            edges.add(edge);
            return true;
        }
        CitationEdge old = edges.get(existing);
        edges.set(existing, old.toBuilder()
                .strength(Math.max(old.getStrength(), edge.getStrength()))
                .context(StrUtil.isBlank(old.getContext()) ? edge.getContext() : old.getContext())
                .deltaDescription(StrUtil.isBlank(old.getDeltaDescription()) ? edge.getDeltaDescription() : old.getDeltaDescription())
                .build());
        mergedDuplicates++;
        return false;
    }

    public List<PaperNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public List<CitationEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int mergedDuplicates() {
        return mergedDuplicates;
    }
}
