package com.gdin.inspection.citegraph.service;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.EdgeNotFoundException;
import com.gdin.inspection.citegraph.exception.GraphNotFoundException;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;
import com.gdin.inspection.citegraph.exception.NodeNotFoundException;
import com.gdin.inspection.citegraph.graph.assemble.AssemblyResult;
import com.gdin.inspection.citegraph.graph.assemble.NetworkAssembler;
import com.gdin.inspection.citegraph.graph.batch.BatchReport;
import com.gdin.inspection.citegraph.graph.batch.BatchRunner;
import com.gdin.inspection.citegraph.graph.batch.BatchStats;
import com.gdin.inspection.citegraph.graph.batch.CancellationToken;
import com.gdin.inspection.citegraph.graph.batch.ItemOutcome;
import com.gdin.inspection.citegraph.graph.cluster.ClusterMethod;
import com.gdin.inspection.citegraph.graph.cluster.ClusterResult;
import com.gdin.inspection.citegraph.graph.cluster.ClusteringEngine;
import com.gdin.inspection.citegraph.graph.compare.Comparison;
import com.gdin.inspection.citegraph.graph.compare.EdgeInnovation;
import com.gdin.inspection.citegraph.graph.compare.EdgeInnovationExtractor;
import com.gdin.inspection.citegraph.graph.compare.PaperComparator;
import com.gdin.inspection.citegraph.graph.compare.TextUnderstandingService;
import com.gdin.inspection.citegraph.graph.extract.Extractor;
import com.gdin.inspection.citegraph.graph.extract.ExtractorRegistry;
import com.gdin.inspection.citegraph.graph.filter.FilterCondition;
import com.gdin.inspection.citegraph.graph.filter.FilterEngine;
import com.gdin.inspection.citegraph.graph.filter.FilterLogic;
import com.gdin.inspection.citegraph.graph.filter.FilterResult;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.GraphSummary;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import com.gdin.inspection.citegraph.graph.path.PathFinder;
import com.gdin.inspection.citegraph.graph.path.PathRanking;
import com.gdin.inspection.citegraph.graph.path.PathResult;
import com.gdin.inspection.citegraph.graph.state.GraphStore;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 对外的图操作入口。所有写操作都经过 GraphStore.update，同一张图串行提交。
 */
@Slf4j
@Service
public class CitationGraphService {

    @Resource
    private NetworkAssembler networkAssembler;

    @Resource
    private ClusteringEngine clusteringEngine;

    @Resource
    private FilterEngine filterEngine;

    @Resource
    private PathFinder pathFinder;

    @Resource
    private PaperComparator paperComparator;

    @Resource
    private EdgeInnovationExtractor edgeInnovationExtractor;

    @Resource
    private BatchRunner batchRunner;

    @Resource
    private ExtractorRegistry extractorRegistry;

    @Resource
    private GraphStore graphStore;

    @Resource
    private GraphProperties graphProperties;

    @Autowired
    private ObjectProvider<TextUnderstandingService> textUnderstandingService;

    // jobId -> 运行中批处理的取消标记
    private final Map<String, CancellationToken> jobs = new ConcurrentHashMap<>();

    public AssemblyResult build(List<String> seedIdentifiers, boolean includeIntermediate, Integer maxDepth,
                                Integer maxIntermediate, String name) {
        int limit = maxIntermediate == null ? graphProperties.getAssemble().getMaxIntermediate() : maxIntermediate;
        int depth = maxDepth == null ? 1 : maxDepth;
        AssemblyResult result = networkAssembler.assemble(seedIdentifiers, includeIntermediate, limit, depth, name);
        ResearchGraph stored = graphStore.put(result.getGraph());
        log.info("图 {} 已保存：{} 个节点，{} 条边", stored.getId(), stored.getNodes().size(), stored.getEdges().size());
        return new AssemblyResult(stored, result.getStats());
    }

    public ClusterResult cluster(String graphId, ClusterMethod method, int nClusters,
                                 Double contentWeight, Double citationWeight) {
        return graphStore.updateClusters(graphId,
                graph -> clusteringEngine.cluster(graph, method, nClusters, contentWeight, citationWeight),
                ClusteringEngine::applyAssignments);
    }

    public ClusterResult clusters(String graphId) {
        graphStore.require(graphId);
        return graphStore.getClusters(graphId)
                .orElseThrow(() -> new InvalidRequestException("图尚未聚类: " + graphId));
    }

    public FilterResult filter(String graphId, List<FilterCondition> conditions, FilterLogic logic) {
        return filterEngine.filter(graphStore.require(graphId), conditions, logic);
    }

    public PathResult path(String graphId, String sourceId, String targetId, PathRanking ranking) {
        return pathFinder.findPath(graphStore.require(graphId), sourceId, targetId, ranking);
    }

    public Comparison compare(String graphId, String paperAId, String paperBId) {
        ResearchGraph graph = graphStore.require(graphId);
        List<String> missing = new ArrayList<>();
        PaperNode a = graph.findNode(paperAId).orElse(null);
        PaperNode b = graph.findNode(paperBId).orElse(null);
        if (a == null) missing.add(paperAId);
        if (b == null) missing.add(paperBId);
        if (!missing.isEmpty()) throw new NodeNotFoundException(graphId, missing);
        return paperComparator.compare(a, b, textUnderstandingService.getIfAvailable());
    }

    /**
     * 逐边比较引用方与被引方，结果写回边。单条失败不影响其它边。
     */
    public BatchReport compareEdges(String graphId, Integer maxParallel, String jobId) {
        return runEdgeBatch(graphId, maxParallel, jobId, edge -> compareAndWriteBack(graphId, edge.getId()));
    }

    /**
     * 单条边重试，失败直接抛出。
     */
    public CitationEdge compareSingleEdge(String graphId, String edgeId) {
        ResearchGraph graph = graphStore.require(graphId);
        if (graph.findEdge(edgeId).isEmpty()) throw new EdgeNotFoundException("边不存在: " + edgeId + " (graph " + graphId + ")");
        return compareAndWriteBack(graphId, edgeId);
    }

    public BatchReport extractEdgeInnovations(String graphId, Integer maxParallel, String jobId) {
        return runEdgeBatch(graphId, maxParallel, jobId, edge -> innovationAndWriteBack(graphId, edge.getId()));
    }

    /**
     * 对每个节点依次运行指定抽取器，一个节点的所有属性一次提交。
     * 已运行过的抽取器除非 force 否则跳过；全部节点成功后才记入 extractors_applied。
     */
    public BatchReport extract(String graphId, List<String> extractorNames, Integer maxParallel, boolean force, String jobId) {
        if (CollectionUtil.isEmpty(extractorNames)) throw new InvalidRequestException("抽取器列表不能为空");
        ResearchGraph graph = graphStore.require(graphId);

        List<Extractor> toRun = new ArrayList<>();
        for (String name : new LinkedHashSet<>(extractorNames)) {
            Extractor extractor = extractorRegistry.get(name);
            if (!force && graph.hasExtractorApplied(extractor.name())) {
                log.info("图 {} 已运行过抽取器 {}，跳过", graphId, extractor.name());
                continue;
            }
            toRun.add(extractor);
        }
        if (toRun.isEmpty()) {
            return new BatchReport(null, graph, BatchStats.of(List.of()), List.of());
        }

        CancellationToken token = registerJob(jobId);
        List<ItemOutcome> outcomes;
        try {
            outcomes = batchRunner.run(graph.getNodes(), PaperNode::getId, maxParallel, token, node -> {
                Map<String, AttributeValue> attrs = new LinkedHashMap<>();
                for (Extractor extractor : toRun) attrs.putAll(extractor.extract(node, graph));
                graphStore.update(graphId, g -> g.withNode(latestNode(g, node.getId()).withAttributes(attrs)));
            });
        } finally {
            jobs.remove(token.getJobId());
        }

        BatchStats stats = BatchStats.of(outcomes);
        ResearchGraph latest;
        if (stats.getFailed() == 0 && stats.getCancelled() == 0) {
            latest = graphStore.update(graphId, g -> {
                ResearchGraph.ResearchGraphBuilder builder = g.toBuilder();
                for (Extractor extractor : toRun) {
                    if (!g.hasExtractorApplied(extractor.name())) builder.extractorApplied(extractor.name());
                }
                return builder.build();
            });
        } else {
            latest = graphStore.require(graphId);
        }
        return new BatchReport(token.getJobId(), latest, stats, outcomes);
    }

    public ResearchGraph get(String graphId) {
        return graphStore.require(graphId);
    }

    public List<GraphSummary> list() {
        return graphStore.list();
    }

    public void delete(String graphId) {
        if (!graphStore.remove(graphId)) throw new GraphNotFoundException("图不存在: " + graphId);
        log.info("图 {} 已删除", graphId);
    }

    /**
     * @return 任务仍在运行并已标记取消时返回 true
     */
    public boolean cancel(String jobId) {
        CancellationToken token = jobs.get(jobId);
        if (token == null) return false;
        token.cancel();
        log.info("批处理任务 {} 已标记取消", jobId);
        return true;
    }

    private BatchReport runEdgeBatch(String graphId, Integer maxParallel, String jobId, Consumer<CitationEdge> work) {
        ResearchGraph graph = graphStore.require(graphId);
        CancellationToken token = registerJob(jobId);
        List<ItemOutcome> outcomes;
        try {
            outcomes = batchRunner.run(graph.getEdges(), CitationEdge::getId, maxParallel, token, work);
        } finally {
            jobs.remove(token.getJobId());
        }
        return new BatchReport(token.getJobId(), graphStore.require(graphId), BatchStats.of(outcomes), outcomes);
    }

    private CitationEdge compareAndWriteBack(String graphId, String edgeId) {
        return annotateEdge(graphId, edgeId, (from, to) -> {
            Comparison c = paperComparator.compare(from, to, textUnderstandingService.getIfAvailable());
            return edge -> applyComparison(edge, c);
        });
    }

    private CitationEdge innovationAndWriteBack(String graphId, String edgeId) {
        return annotateEdge(graphId, edgeId, (from, to) -> {
            EdgeInnovation innovation = edgeInnovationExtractor.extract(from, to, textUnderstandingService.getIfAvailable());
            return edge -> edge.toBuilder()
                    .context(innovation.getShortLabel())
                    .deltaDescription(innovation.getFullInsight())
                    .build();
        });
    }

    /**
     * 锁外调用文本理解服务，锁内基于最新的边写回，保证单条边要么完整更新要么不变。
     */
    private CitationEdge annotateEdge(String graphId, String edgeId, EdgeAnnotator annotator) {
        ResearchGraph graph = graphStore.require(graphId);
        CitationEdge edge = graph.findEdge(edgeId)
                .orElseThrow(() -> new EdgeNotFoundException("边不存在: " + edgeId + " (graph " + graphId + ")"));
        PaperNode from = latestNode(graph, edge.getFromPaper());
        PaperNode to = latestNode(graph, edge.getToPaper());
        Function<CitationEdge, CitationEdge> patch = annotator.annotate(from, to);

        AtomicReference<CitationEdge> written = new AtomicReference<>();
        graphStore.update(graphId, g -> {
            CitationEdge current = g.findEdge(edgeId)
                    .orElseThrow(() -> new EdgeNotFoundException("边不存在: " + edgeId + " (graph " + graphId + ")"));
            CitationEdge updated = patch.apply(current);
            written.set(updated);
            return g.withEdge(updated);
        });
        return written.get();
    }

    static CitationEdge applyComparison(CitationEdge edge, Comparison c) {
        String context = c.getSimilarities().isEmpty() && c.getDifferences().isEmpty()
                ? edge.getContext()
                : "Similarities: " + String.join("; ", head(c.getSimilarities()))
                + ". Differences: " + String.join("; ", head(c.getDifferences()));
        String delta = StrUtil.isNotBlank(c.getContributionDiff())
                ? c.getContributionDiff()
                : String.join("; ", c.getDifferences());
        return edge.toBuilder()
                .contributionType(c.getRelationshipType().getValue())
                .context(context)
                .deltaDescription(StrUtil.isBlank(delta) ? edge.getDeltaDescription() : delta)
                .build();
    }

    private static List<String> head(List<String> items) {
        return items.subList(0, Math.min(2, items.size()));
    }

    private static PaperNode latestNode(ResearchGraph graph, String nodeId) {
        return graph.findNode(nodeId)
                .orElseThrow(() -> new NodeNotFoundException(graph.getId(), List.of(nodeId)));
    }

    private CancellationToken registerJob(String jobId) {
        String id = StrUtil.isBlank(jobId) ? IdUtil.fastSimpleUUID() : jobId.trim();
        CancellationToken token = new CancellationToken(id);
        if (jobs.putIfAbsent(id, token) != null) throw new InvalidRequestException("任务 " + id + " 正在运行");
        return token;
    }

    @FunctionalInterface
    private interface EdgeAnnotator {
        Function<CitationEdge, CitationEdge> annotate(PaperNode citing, PaperNode cited);
    }
}
