package com.gdin.inspection.citegraph.graph.assemble;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;
import com.gdin.inspection.citegraph.exception.NoPapersResolvedException;
import com.gdin.inspection.citegraph.exception.SourceUnavailableException;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.GraphDraft;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.PaperRecord;
import com.gdin.inspection.citegraph.graph.models.PaperSource;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import com.gdin.inspection.citegraph.graph.source.MetadataSource;
import com.gdin.inspection.citegraph.graph.source.PaperIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * 把种子论文扩展成有界的引用网络。
 * <p>
 * 流程：
 * 1. 解析种子（并发），解析不到的记为警告；一个都解析不到则失败；
 * 2. 拉取每个种子的参考文献与施引文献（并发）；
 * 3. 统计候选论文在各种子参考 / 施引列表中出现的次数作为连接分，按 (分数降序, id 升序) 取前 maxIntermediate；
 * 4. 物化中间论文，对所有观测到的引用关系建边；maxDepth >= 2 时额外拉取中间论文的参考文献以观测它们之间的引用。
 * <p>
 * 并发只影响等待时间：所有结果按种子输入顺序 / 候选排名顺序汇总，与网络返回先后无关。
 */
@Slf4j
@Component
public class NetworkAssembler {

    static final double NON_INFLUENTIAL_STRENGTH = 0.5;

    private final MetadataSource metadataSource;
    private final GraphProperties.Assemble props;

    @Autowired
    public NetworkAssembler(MetadataSource metadataSource, GraphProperties graphProperties) {
        this(metadataSource, graphProperties.getAssemble());
    }

    public NetworkAssembler(MetadataSource metadataSource, GraphProperties.Assemble props) {
        this.metadataSource = metadataSource;
        this.props = props;
    }

    public AssemblyResult assemble(List<String> seeds, boolean includeIntermediate, int maxIntermediate, int maxDepth, String name) {
        if (CollectionUtil.isEmpty(seeds)) throw new InvalidRequestException("种子论文不能为空");
        if (maxIntermediate < 0) throw new InvalidRequestException("maxIntermediate 不能为负数");
        if (maxDepth < 1) throw new InvalidRequestException("maxDepth 至少为 1");

        log.info("开始组网：种子 {} 篇，includeIntermediate={}，maxIntermediate={}，maxDepth={}",
                seeds.size(), includeIntermediate, maxIntermediate, maxDepth);
        AssemblyStats.AssemblyStatsBuilder stats = AssemblyStats.builder();
        int failedFetches = 0;

        int threads = Math.max(1, props.getConcurrentRequests());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            // 1. 解析种子
            List<SeedResolution> resolutions = inOrder(seeds, raw -> resolveSeed(raw), pool);
            Map<String, PaperRecord> seedRecords = new LinkedHashMap<>();
            SourceUnavailableException lastFailure = null;
            int duplicateSeeds = 0;
            for (SeedResolution r : resolutions) {
                if (r.record == null) {
                    stats.unresolvedSeedId(r.raw);
                    stats.warning(r.failure == null
                            ? "种子论文未找到: " + r.raw
                            : "种子论文解析失败: " + r.raw + " (" + r.failure.getMessage() + ")");
                    if (r.failure != null) lastFailure = r.failure;
                    continue;
                }
                if (seedRecords.putIfAbsent(r.nodeId, r.record) != null) {
                    duplicateSeeds++;
                    stats.warning("重复的种子论文已合并: " + r.raw);
                }
            }
            if (seedRecords.isEmpty()) {
                log.error("没有任何种子论文可以解析: {}", seeds);
                throw new NoPapersResolvedException(seeds, lastFailure);
            }
            stats.duplicateSeeds(duplicateSeeds);

            // 2. 拉取种子的邻域
            Set<String> minted = new HashSet<>();
            for (SeedResolution r : resolutions) {
                if (r.minted) minted.add(r.nodeId);
            }
            List<String> seedIds = new ArrayList<>(seedRecords.keySet());
            List<Neighbourhood> neighbourhoods = inOrder(seedIds,
                    id -> minted.contains(id) ? new Neighbourhood(id) : fetchNeighbourhood(id), pool);
            for (Neighbourhood n : neighbourhoods) {
                failedFetches += n.failures;
                n.warnings.forEach(stats::warning);
            }

            GraphDraft draft = new GraphDraft();
            seedRecords.forEach((id, record) -> draft.addNode(record.toNode(id, PaperSource.INPUT)));

            int candidatesConsidered = 0;
            List<Candidate> selected = List.of();
            if (includeIntermediate && maxIntermediate > 0) {
                // 3. 连接分打分与选择
                List<Candidate> ranked = rankCandidates(neighbourhoods, seedRecords.keySet());
                candidatesConsidered = ranked.size();
                selected = ranked.subList(0, Math.min(maxIntermediate, ranked.size()));
                if (Boolean.TRUE.equals(props.getEnrichIntermediate())) {
                    selected = inOrder(selected, this::enrich, pool);
                }
                // 4. 物化中间论文
                for (Candidate c : selected) {
                    draft.addNode(c.record.toNode(c.id, PaperSource.INTERMEDIATE));
                }
            }

            // 5. 对观测到的引用关系建边
            for (Neighbourhood n : neighbourhoods) {
                for (PaperRecord ref : n.references) {
                    addObservedEdge(draft, n.nodeId, nodeIdOf(ref), ref);
                }
                for (PaperRecord citer : n.citers) {
                    addObservedEdge(draft, nodeIdOf(citer), n.nodeId, citer);
                }
            }
            if (maxDepth >= 2 && !selected.isEmpty()) {
                List<String> intermediateIds = selected.stream().map(c -> c.id).toList();
                List<Neighbourhood> second = inOrder(intermediateIds, this::fetchReferencesOnly, pool);
                for (Neighbourhood n : second) {
                    failedFetches += n.failures;
                    n.warnings.forEach(stats::warning);
                    for (PaperRecord ref : n.references) {
                        addObservedEdge(draft, n.nodeId, nodeIdOf(ref), ref);
                    }
                }
            }

            List<PaperNode> nodes = draft.nodes();
            List<CitationEdge> edges = draft.edges();
            int intermediates = (int) nodes.stream().filter(p -> p.getPaperSource() == PaperSource.INTERMEDIATE).count();
            AssemblyStats finalStats = stats
                    .totalPapers(nodes.size())
                    .inputPapers(nodes.size() - intermediates)
                    .intermediatePapers(intermediates)
                    .totalEdges(edges.size())
                    .candidatesConsidered(candidatesConsidered)
                    .unresolvedSeeds(resolutions.size() - seedRecords.size() - duplicateSeeds)
                    .duplicateEdgesMerged(draft.mergedDuplicates())
                    .failedFetches(failedFetches)
                    .dateRange(dateRange(nodes))
                    .build();

            Map<String, Object> metadata = new LinkedHashMap<>(finalStats.toMetadata());
            metadata.put("seed_identifiers", List.copyOf(seeds));
            metadata.put("include_intermediate", includeIntermediate);
            metadata.put("max_depth", maxDepth);
            ResearchGraph graph = ResearchGraph.builder()
                    .id(IdUtil.randomUUID())
                    .name(StrUtil.blankToDefault(name, ResearchGraph.DEFAULT_NAME))
                    .nodes(nodes)
                    .edges(edges)
                    .metadata(metadata)
                    .build();
            log.info("组网完成：节点 {}（中间论文 {}），边 {}，未解析种子 {}",
                    nodes.size(), intermediates, edges.size(), finalStats.getUnresolvedSeeds());
            return new AssemblyResult(graph, finalStats);
        } finally {
            pool.shutdown();
        }
    }

    /**
     * 连接分 = referenceWeight * 作为参考文献出现的种子数 + citationWeight * 作为施引文献出现的种子数。
     * 同一种子同一方向的列表先按归一化 id 去重；种子本身不参与候选。
     */
    List<Candidate> rankCandidates(List<Neighbourhood> neighbourhoods, Set<String> seedIds) {
        double refWeight = props.getReferenceWeight();
        double citeWeight = props.getCitationWeight();
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (Neighbourhood n : neighbourhoods) {
            score(n.references, refWeight, seedIds, candidates);
            score(n.citers, citeWeight, seedIds, candidates);
        }
        List<Candidate> ranked = new ArrayList<>(candidates.values());
        ranked.sort(Comparator.comparingDouble((Candidate c) -> c.score).reversed()
                .thenComparing(c -> c.id));
        return ranked;
    }

    private static void score(List<PaperRecord> records, double weight, Set<String> seedIds, Map<String, Candidate> candidates) {
        Set<String> seen = new HashSet<>();
        for (PaperRecord record : records) {
            String id = nodeIdOf(record);
            if (id == null || seedIds.contains(id) || !seen.add(id)) continue;
            candidates.computeIfAbsent(id, k -> new Candidate(k, record)).score += weight;
        }
    }

    private void addObservedEdge(GraphDraft draft, String from, String to, PaperRecord link) {
        if (from == null || to == null || from.equals(to)) return;
        if (!draft.containsNode(from) || !draft.containsNode(to)) return;
        draft.addEdge(CitationEdge.builder()
                .id(IdUtil.randomUUID())
                .fromPaper(from)
                .toPaper(to)
                .contributionType(CitationEdge.TYPE_REFERENCE)
                .strength(Boolean.FALSE.equals(link.getInfluential()) ? NON_INFLUENTIAL_STRENGTH : 1.0)
                .context(link.getCitationContext())
                .build());
    }

    private SeedResolution resolveSeed(String raw) {
        try {
            Optional<PaperRecord> record = metadataSource.resolve(raw);
            if (record.isEmpty()) {
                log.warn("种子论文未找到: {}", raw);
                return new SeedResolution(raw, null, null, false, null);
            }
            String id = nodeIdOf(record.get());
            // 没有外部 id 的记录（例如上传解析得到的）用内部 UUID，不再查询邻域
            if (id == null) return new SeedResolution(raw, IdUtil.randomUUID(), record.get(), true, null);
            return new SeedResolution(raw, id, record.get(), false, null);
        } catch (SourceUnavailableException e) {
            log.warn("种子论文解析失败: {} {}", raw, e.getMessage());
            return new SeedResolution(raw, null, null, false, e);
        }
    }

    private Neighbourhood fetchNeighbourhood(String nodeId) {
        Neighbourhood n = new Neighbourhood(nodeId);
        try {
            n.references = metadataSource.references(nodeId);
        } catch (SourceUnavailableException e) {
            n.failures++;
            n.warnings.add("获取参考文献失败: " + nodeId + " (" + e.getMessage() + ")");
        }
        try {
            n.citers = metadataSource.citers(nodeId);
        } catch (SourceUnavailableException e) {
            n.failures++;
            n.warnings.add("获取施引文献失败: " + nodeId + " (" + e.getMessage() + ")");
        }
        return n;
    }

    private Neighbourhood fetchReferencesOnly(String nodeId) {
        Neighbourhood n = new Neighbourhood(nodeId);
        try {
            n.references = metadataSource.references(nodeId);
        } catch (SourceUnavailableException e) {
            n.failures++;
            n.warnings.add("获取中间论文参考文献失败: " + nodeId + " (" + e.getMessage() + ")");
        }
        return n;
    }

    /**
     * 引用列表里的记录字段较少，补全一次；失败时保留原记录。
     */
    private Candidate enrich(Candidate c) {
        try {
            Optional<PaperRecord> full = metadataSource.resolve(c.id);
            if (full.isPresent()) {
                Candidate enriched = new Candidate(c.id, full.get());
                enriched.score = c.score;
                return enriched;
            }
        } catch (SourceUnavailableException e) {
            log.warn("补全中间论文失败，使用引用列表中的信息: {} {}", c.id, e.getMessage());
        }
        return c;
    }

    private static Map<String, Integer> dateRange(List<PaperNode> nodes) {
        Integer min = null;
        Integer max = null;
        for (PaperNode node : nodes) {
            Integer year = node.effectiveYear();
            if (year == null) continue;
            min = min == null ? year : Math.min(min, year);
            max = max == null ? year : Math.max(max, year);
        }
        if (min == null) return null;
        Map<String, Integer> range = new LinkedHashMap<>();
        range.put("start", min);
        range.put("end", max);
        return range;
    }

    static String nodeIdOf(PaperRecord record) {
        return record == null ? null : PaperIdentifiers.normalize(record.getPaperId());
    }

    /**
     * 每个输入提交一个任务，按输入顺序 join。
     */
    private static <I, O> List<O> inOrder(List<I> inputs, Function<I, O> task, ExecutorService pool) {
        List<CompletableFuture<O>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(input), pool));
        }
        List<O> out = new ArrayList<>(inputs.size());
        for (CompletableFuture<O> future : futures) {
            out.add(future.join());
        }
        return out;
    }

    private record SeedResolution(String raw, String nodeId, PaperRecord record, boolean minted,
                                  SourceUnavailableException failure) {
    }

    static final class Neighbourhood {
        final String nodeId;
        List<PaperRecord> references = List.of();
        List<PaperRecord> citers = List.of();
        final List<String> warnings = new ArrayList<>();
        int failures;

        Neighbourhood(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    static final class Candidate {
        final String id;
        final PaperRecord record;
        double score;

        Candidate(String id, PaperRecord record) {
            this.id = id;
            this.record = record;
        }
    }
}
