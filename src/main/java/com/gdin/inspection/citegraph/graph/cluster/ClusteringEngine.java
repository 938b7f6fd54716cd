package com.gdin.inspection.citegraph.graph.cluster;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.InsufficientDataException;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 三种聚类方式：
 * <ul>
 *     <li>content：TF-IDF + 固定种子 k-means，恰好 nClusters 个簇</li>
 *     <li>citation：把引用图视为无向图做标签传播，返回自然社区数（可能不等于 nClusters）</li>
 *     <li>hybrid：contentWeight * 余弦相似度 + citationWeight * 闭邻域 Jaccard，平均链接层次聚类到恰好 nClusters 个簇</li>
 * </ul>
 * 所有方法的簇编号都按节点顺序首次出现重新编号为 0..k-1。
 */
@Slf4j
@Component
public class ClusteringEngine {

    public static final String ATTR_CLUSTER_ID = "cluster_id";

    private final GraphProperties.Cluster props;

    @Autowired
    public ClusteringEngine(GraphProperties graphProperties) {
        this(graphProperties.getCluster());
    }

    public ClusteringEngine(GraphProperties.Cluster props) {
        this.props = props;
    }

    public ClusterResult cluster(ResearchGraph graph, ClusterMethod method, int nClusters,
                                 Double contentWeight, Double citationWeight) {
        if (method == null) throw new InvalidRequestException("聚类方法不能为空");
        if (nClusters < 1) throw new InvalidRequestException("nClusters 至少为 1");
        List<PaperNode> nodes = graph.getNodes();
        if (nodes.size() < nClusters) {
            throw new InsufficientDataException("节点数 " + nodes.size() + " 少于请求的簇数 " + nClusters);
        }
        log.info("开始聚类：图 {}，方法 {}，节点 {}，nClusters={}", graph.getId(), method.getValue(), nodes.size(), nClusters);

        TfidfVectorizer.Matrix tfidf = null;
        Map<String, Double> weights = null;
        int[] raw;
        switch (method) {
            case CONTENT -> {
                tfidf = vectorize(nodes);
                raw = new KMeans(nClusters, props.getSeed(), props.getRestarts(), props.getMaxIterations()).fit(tfidf.getRows());
            }
            case CITATION -> raw = new LabelPropagation(props.getMaxPropagationRounds()).fit(undirectedAdjacency(graph));
            default -> {
                weights = normalizeWeights(contentWeight, citationWeight);
                tfidf = vectorize(nodes);
                double[][] distance = hybridDistance(graph, tfidf, weights.get("content"), weights.get("citation"));
                raw = new AgglomerativeClusterer(nClusters).fit(distance);
            }
        }
        int[] labels = relabel(raw);
        int clusterCount = 0;
        for (int l : labels) clusterCount = Math.max(clusterCount, l + 1);

        Map<String, Integer> assignments = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) assignments.put(nodes.get(i).getId(), labels[i]);

        List<ClusterSummary> summaries = method == ClusterMethod.CITATION
                ? citationSummaries(graph, labels, clusterCount)
                : contentSummaries(nodes, labels, clusterCount, tfidf);

        if (method == ClusterMethod.CITATION && clusterCount != nClusters) {
            log.info("引用拓扑聚类得到 {} 个自然社区（请求 {}）", clusterCount, nClusters);
        }
        return ClusterResult.builder()
                .graphId(graph.getId())
                .method(method)
                .requestedClusters(nClusters)
                .clusterCount(clusterCount)
                .assignments(assignments)
                .summaries(summaries)
                .weights(weights)
                .computedAt(Instant.now())
                .build();
    }

    /**
     * 把 cluster_id 写进每个节点的属性（覆盖旧值），并在 metadata 中记录本次聚类概况。
     */
    public static ResearchGraph applyAssignments(ResearchGraph graph, ClusterResult result) {
        List<PaperNode> nodes = new ArrayList<>(graph.getNodes().size());
        for (PaperNode node : graph.getNodes()) {
            Integer clusterId = result.getAssignments().get(node.getId());
            if (clusterId == null) {
                throw new IllegalStateException("聚类结果与图不一致，缺少节点: " + node.getId());
            }
            nodes.add(node.withAttributes(Map.of(ATTR_CLUSTER_ID, AttributeValue.of(clusterId))));
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("method", result.getMethod().getValue());
        info.put("n_clusters", result.getClusterCount());
        info.put("requested_clusters", result.getRequestedClusters());
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (ClusterSummary s : result.getSummaries()) sizes.put(String.valueOf(s.getClusterId()), s.getSize());
        info.put("cluster_sizes", sizes);
        if (result.getWeights() != null) info.put("weights", result.getWeights());

        Map<String, Object> metadata = new LinkedHashMap<>(graph.getMetadata());
        metadata.put("clusters", info);
        return graph.toBuilder()
                .clearNodes().nodes(nodes)
                .clearMetadata().metadata(metadata)
                .build();
    }

    private TfidfVectorizer.Matrix vectorize(List<PaperNode> nodes) {
        List<String> docs = new ArrayList<>(nodes.size());
        for (PaperNode n : nodes) docs.add(n.contentText());
        return new TfidfVectorizer(props.getMaxFeatures()).fitTransform(docs);
    }

    /**
     * 负权重拒绝；两者都为 0 拒绝；和不为 1 时归一化。缺省值取配置。
     */
    Map<String, Double> normalizeWeights(Double contentWeight, Double citationWeight) {
        double cw = contentWeight == null ? props.getDefaultContentWeight() : contentWeight;
        double tw = citationWeight == null ? props.getDefaultCitationWeight() : citationWeight;
        if (cw < 0 || tw < 0 || Double.isNaN(cw) || Double.isNaN(tw)) {
            throw new InvalidRequestException("权重不能为负数: content=" + cw + ", citation=" + tw);
        }
        double sum = cw + tw;
        if (sum <= 0) throw new InvalidRequestException("contentWeight 与 citationWeight 不能同时为 0");
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("content", cw / sum);
        weights.put("citation", tw / sum);
        return weights;
    }

    private static double[][] hybridDistance(ResearchGraph graph, TfidfVectorizer.Matrix tfidf, double cw, double tw) {
        List<PaperNode> nodes = graph.getNodes();
        int n = nodes.size();
        List<Set<Integer>> closed = closedNeighbourhoods(graph);
        double[][] distance = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double sim = cw * tfidf.cosine(i, j) + tw * jaccard(closed.get(i), closed.get(j));
                double d = Math.max(0.0, 1.0 - sim);
                distance[i][j] = d;
                distance[j][i] = d;
            }
        }
        return distance;
    }

    /**
     * 闭邻域：自身 + 所有施引 / 被引邻居。直接相连的两篇论文也会有非零相似度。
     */
    private static List<Set<Integer>> closedNeighbourhoods(ResearchGraph graph) {
        Map<String, Integer> index = nodeIndex(graph);
        List<Set<Integer>> sets = new ArrayList<>(index.size());
        for (int i = 0; i < index.size(); i++) {
            Set<Integer> s = new HashSet<>();
            s.add(i);
            sets.add(s);
        }
        for (CitationEdge e : graph.getEdges()) {
            Integer a = index.get(e.getFromPaper());
            Integer b = index.get(e.getToPaper());
            if (a == null || b == null) continue;
            sets.get(a).add(b);
            sets.get(b).add(a);
        }
        return sets;
    }

    private static double jaccard(Set<Integer> a, Set<Integer> b) {
        int inter = 0;
        for (Integer x : a) {
            if (b.contains(x)) inter++;
        }
        int union = a.size() + b.size() - inter;
        return union == 0 ? 0.0 : (double) inter / union;
    }

    private static List<Map<Integer, Double>> undirectedAdjacency(ResearchGraph graph) {
        Map<String, Integer> index = nodeIndex(graph);
        List<Map<Integer, Double>> adjacency = new ArrayList<>(index.size());
        for (int i = 0; i < index.size(); i++) adjacency.add(new LinkedHashMap<>());
        for (CitationEdge e : graph.getEdges()) {
            Integer a = index.get(e.getFromPaper());
            Integer b = index.get(e.getToPaper());
            if (a == null || b == null || a.equals(b)) continue;
            // A->B 与 B->A 同时存在时权重相加
            double w = e.getStrength() > 0 ? e.getStrength() : 1e-6;
            adjacency.get(a).merge(b, w, Double::sum);
            adjacency.get(b).merge(a, w, Double::sum);
        }
        return adjacency;
    }

    private static Map<String, Integer> nodeIndex(ResearchGraph graph) {
        Map<String, Integer> index = new HashMap<>();
        List<PaperNode> nodes = graph.getNodes();
        for (int i = 0; i < nodes.size(); i++) index.put(nodes.get(i).getId(), i);
        return index;
    }

    /**
     * 按首次出现顺序把任意标签映射为 0..k-1。
     */
    static int[] relabel(int[] raw) {
        Map<Integer, Integer> mapping = new HashMap<>();
        int[] out = new int[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = mapping.computeIfAbsent(raw[i], k -> mapping.size());
        }
        return out;
    }

    private List<List<Integer>> members(int[] labels, int clusterCount) {
        List<List<Integer>> members = new ArrayList<>(clusterCount);
        for (int c = 0; c < clusterCount; c++) members.add(new ArrayList<>());
        for (int i = 0; i < labels.length; i++) members.get(labels[i]).add(i);
        return members;
    }

    private List<ClusterSummary> contentSummaries(List<PaperNode> nodes, int[] labels, int clusterCount,
                                                  TfidfVectorizer.Matrix tfidf) {
        List<ClusterSummary> summaries = new ArrayList<>(clusterCount);
        List<List<Integer>> members = members(labels, clusterCount);
        for (int c = 0; c < clusterCount; c++) {
            List<Integer> idx = members.get(c);
            List<PaperNode> papers = idx.stream().map(nodes::get).toList();
            List<PaperNode> reps = representatives(papers);
            summaries.add(ClusterSummary.builder()
                    .clusterId(c)
                    .size(idx.size())
                    .topTerms(tfidf.topTerms(idx, props.getTopTerms()))
                    .representativePaperIds(reps.stream().map(PaperNode::getId).toList())
                    .samplePapers(reps.stream().map(p -> StrUtil.blankToDefault(p.getTitle(), p.getId())).toList())
                    .avgYear(avgYear(papers))
                    .build());
        }
        return summaries;
    }

    private List<ClusterSummary> citationSummaries(ResearchGraph graph, int[] labels, int clusterCount) {
        List<PaperNode> nodes = graph.getNodes();
        Map<String, Integer> index = nodeIndex(graph);
        int[] internal = new int[clusterCount];
        int[] external = new int[clusterCount];
        int[] internalDegree = new int[nodes.size()];
        for (CitationEdge e : graph.getEdges()) {
            Integer a = index.get(e.getFromPaper());
            Integer b = index.get(e.getToPaper());
            if (a == null || b == null) continue;
            if (labels[a] == labels[b]) {
                internal[labels[a]]++;
                internalDegree[a]++;
                internalDegree[b]++;
            } else {
                external[labels[a]]++;
                external[labels[b]]++;
            }
        }
        List<ClusterSummary> summaries = new ArrayList<>(clusterCount);
        List<List<Integer>> members = members(labels, clusterCount);
        for (int c = 0; c < clusterCount; c++) {
            List<Integer> idx = members.get(c);
            List<PaperNode> papers = idx.stream().map(nodes::get).toList();
            int hub = idx.get(0);
            for (int i : idx) {
                if (internalDegree[i] > internalDegree[hub]) hub = i;
            }
            int size = idx.size();
            double density = size < 2 ? 0.0 : Math.min(1.0, internal[c] / (size * (size - 1) / 2.0));
            PaperNode hubPaper = nodes.get(hub);
            List<PaperNode> reps = representatives(papers);
            summaries.add(ClusterSummary.builder()
                    .clusterId(c)
                    .size(size)
                    .representativePaperIds(reps.stream().map(PaperNode::getId).toList())
                    .samplePapers(reps.stream().map(p -> StrUtil.blankToDefault(p.getTitle(), p.getId())).toList())
                    .avgYear(avgYear(papers))
                    .internalEdges(internal[c])
                    .externalEdges(external[c])
                    .density(density)
                    .hubPaperId(hubPaper.getId())
                    .description(String.format("%d 篇论文，簇内引用 %d 条，跨簇引用 %d 条，核心论文: %s",
                            size, internal[c], external[c], StrUtil.blankToDefault(hubPaper.getTitle(), hubPaper.getId())))
                    .build());
        }
        return summaries;
    }

    /**
     * 代表论文：按被引次数降序，同分保持节点顺序。
     */
    private List<PaperNode> representatives(List<PaperNode> papers) {
        List<PaperNode> sorted = new ArrayList<>(papers);
        sorted.sort(Comparator.comparingInt((PaperNode p) -> p.getCitationCount() == null ? 0 : p.getCitationCount()).reversed());
        return sorted.subList(0, Math.min(props.getRepresentativePapers(), sorted.size()));
    }

    private static Double avgYear(List<PaperNode> papers) {
        int count = 0;
        double sum = 0;
        for (PaperNode p : papers) {
            Integer y = p.effectiveYear();
            if (y == null) continue;
            sum += y;
            count++;
        }
        return count == 0 ? null : sum / count;
    }
}
