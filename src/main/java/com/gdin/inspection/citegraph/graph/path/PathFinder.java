package com.gdin.inspection.citegraph.graph.path;

import com.gdin.inspection.citegraph.exception.NodeNotFoundException;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * 沿引用方向（from 引用 to）的有向路径查询。
 * <p>
 * 出边按边的插入顺序遍历，最先发现的前驱胜出，所以多条等长路径时结果是确定的。
 */
@Slf4j
@Component
public class PathFinder {

    // 每一跳的最小代价，保证 strength 为 1 的边也不是零代价
    static final double HOP_COST = 1e-6;

    /**
     * @throws NodeNotFoundException source 或 target 不在图中
     */
    public PathResult findPath(ResearchGraph graph, String sourceId, String targetId, PathRanking ranking) {
        PathRanking r = ranking == null ? PathRanking.SHORTEST : ranking;
        List<String> missing = new ArrayList<>(2);
        if (!graph.containsNode(sourceId)) missing.add(sourceId);
        if (!graph.containsNode(targetId)) missing.add(targetId);
        if (!missing.isEmpty()) throw new NodeNotFoundException(graph.getId(), missing);

        Map<String, List<CitationEdge>> out = outgoing(graph);
        Map<String, CitationEdge> via = r == PathRanking.SHORTEST
                ? bfs(out, sourceId, targetId)
                : dijkstra(out, sourceId, targetId);
        if (!sourceId.equals(targetId) && !via.containsKey(targetId)) {
            log.debug("图 {} 中 {} 到 {} 没有路径", graph.getId(), sourceId, targetId);
            return PathResult.noPath(sourceId, targetId, r);
        }

        List<CitationEdge> edges = new ArrayList<>();
        for (String cur = targetId; !cur.equals(sourceId); ) {
            CitationEdge e = via.get(cur);
            edges.add(e);
            cur = e.getFromPaper();
        }
        Collections.reverse(edges);
        List<String> papers = new ArrayList<>(edges.size() + 1);
        papers.add(sourceId);
        List<PathResult.PathEdge> pathEdges = new ArrayList<>(edges.size());
        for (CitationEdge e : edges) {
            papers.add(e.getToPaper());
            pathEdges.add(PathResult.PathEdge.builder()
                    .id(e.getId())
                    .from(e.getFromPaper())
                    .to(e.getToPaper())
                    .label(e.getContributionType())
                    .context(e.getContext())
                    .strength(e.getStrength())
                    .build());
        }
        return PathResult.builder()
                .status(PathResult.Status.FOUND)
                .sourceId(sourceId)
                .targetId(targetId)
                .ranking(r)
                .papers(papers)
                .edges(pathEdges)
                .length(edges.size())
                .build();
    }

    private static Map<String, List<CitationEdge>> outgoing(ResearchGraph graph) {
        Map<String, List<CitationEdge>> out = new LinkedHashMap<>();
        for (PaperNode n : graph.getNodes()) out.put(n.getId(), new ArrayList<>());
        for (CitationEdge e : graph.getEdges()) {
            List<CitationEdge> list = out.get(e.getFromPaper());
            if (list != null) list.add(e);
        }
        return out;
    }

    /**
     * @return 节点 -> 到达它的边（广度优先树）
     */
    private static Map<String, CitationEdge> bfs(Map<String, List<CitationEdge>> out, String source, String target) {
        Map<String, CitationEdge> via = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            if (cur.equals(target)) break;
            for (CitationEdge e : out.getOrDefault(cur, List.of())) {
                String next = e.getToPaper();
                if (next.equals(source) || via.containsKey(next)) continue;
                via.put(next, e);
                queue.add(next);
            }
        }
        return via;
    }

    /**
     * 代价 = (1 - strength) + HOP_COST，非负。代价相同时先入队的优先。
     */
    private static Map<String, CitationEdge> dijkstra(Map<String, List<CitationEdge>> out, String source, String target) {
        Map<String, Double> dist = new HashMap<>();
        Map<String, CitationEdge> via = new HashMap<>();
        PriorityQueue<Entry> queue = new PriorityQueue<>();
        long seq = 0;
        dist.put(source, 0.0);
        queue.add(new Entry(source, 0.0, seq++));
        while (!queue.isEmpty()) {
            Entry cur = queue.poll();
            if (cur.cost > dist.getOrDefault(cur.node, Double.MAX_VALUE)) continue;
            if (cur.node.equals(target)) break;
            for (CitationEdge e : out.getOrDefault(cur.node, List.of())) {
                double cost = cur.cost + Math.max(0.0, 1.0 - e.getStrength()) + HOP_COST;
                String next = e.getToPaper();
                if (next.equals(source)) continue;
                if (cost < dist.getOrDefault(next, Double.MAX_VALUE)) {
                    dist.put(next, cost);
                    via.put(next, e);
                    queue.add(new Entry(next, cost, seq++));
                }
            }
        }
        return via;
    }

    private record Entry(String node, double cost, long seq) implements Comparable<Entry> {
        @Override
        public int compareTo(Entry o) {
            int c = Double.compare(cost, o.cost);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }
}
