package com.gdin.inspection.citegraph.graph.state;

import com.gdin.inspection.citegraph.exception.GraphNotFoundException;
import com.gdin.inspection.citegraph.graph.cluster.ClusterResult;
import com.gdin.inspection.citegraph.graph.models.GraphSummary;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * 内存实现，线程安全，生命周期跟随进程。
 */
@Slf4j
@Component
public class InMemoryGraphStore implements GraphStore {

    // graphId -> 已提交快照
    private final Map<String, ResearchGraph> graphs = new ConcurrentHashMap<>();
    // graphId -> 写锁，只为存在的图保留
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, ClusterResult> clusters = new ConcurrentHashMap<>();

    @Override
    public ResearchGraph put(ResearchGraph graph) {
        if (graph == null || graph.getId() == null) throw new IllegalArgumentException("graph id 不能为空");
        ReentrantLock lock = lockForPut(graph.getId());
        try {
            Instant now = Instant.now();
            ResearchGraph committed = graph.toBuilder()
                    .createdAt(graph.getCreatedAt() == null ? now : graph.getCreatedAt())
                    .updatedAt(now)
                    .version(1L)
                    .build();
            graphs.put(committed.getId(), committed);
            clusters.remove(committed.getId());
            log.info("保存图 {}，节点 {}，边 {}", committed.getId(), committed.getNodes().size(), committed.getEdges().size());
            return committed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ResearchGraph> get(String graphId) {
        if (graphId == null) return Optional.empty();
        return Optional.ofNullable(graphs.get(graphId));
    }

    @Override
    public List<GraphSummary> list() {
        return graphs.values().stream()
                .sorted(Comparator.comparing(ResearchGraph::getCreatedAt).thenComparing(ResearchGraph::getId))
                .map(GraphSummary::of)
                .collect(Collectors.toList());
    }

    @Override
    public ResearchGraph update(String graphId, UnaryOperator<ResearchGraph> updater) {
        ReentrantLock lock = lockForExisting(graphId);
        try {
            ResearchGraph current = graphs.get(graphId);
            return commit(graphId, current, updater.apply(current));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ClusterResult updateClusters(String graphId, Function<ResearchGraph, ClusterResult> clusterer,
                                        BiFunction<ResearchGraph, ClusterResult, ResearchGraph> applier) {
        ReentrantLock lock = lockForExisting(graphId);
        try {
            ResearchGraph current = graphs.get(graphId);
            ClusterResult result = clusterer.apply(current);
            commit(graphId, current, applier.apply(current, result));
            clusters.put(graphId, result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String graphId) {
        if (graphId == null) return false;
        ReentrantLock lock = acquire(graphId);
        if (lock == null) return false;
        try {
            clusters.remove(graphId);
            locks.remove(graphId);
            return graphs.remove(graphId) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ClusterResult> getClusters(String graphId) {
        return Optional.ofNullable(clusters.get(graphId));
    }

    @PreDestroy
    public void clear() {
        log.info("清空内存图存储，共 {} 个图", graphs.size());
        graphs.clear();
        clusters.clear();
        locks.clear();
    }

    // 调用方已持有写锁
    private ResearchGraph commit(String graphId, ResearchGraph current, ResearchGraph next) {
        if (next == null || !graphId.equals(next.getId())) {
            throw new IllegalStateException("更新结果必须是同一个图: " + graphId);
        }
        ResearchGraph committed = next.toBuilder()
                .createdAt(current.getCreatedAt())
                .updatedAt(Instant.now())
                .version(current.getVersion() + 1)
                .build();
        graphs.put(graphId, committed);
        return committed;
    }

    private ReentrantLock lockForExisting(String graphId) {
        ReentrantLock lock = graphId == null ? null : acquire(graphId);
        if (lock == null) throw new GraphNotFoundException("图不存在: " + graphId);
        if (!graphs.containsKey(graphId)) {
            lock.unlock();
            throw new GraphNotFoundException("图不存在: " + graphId);
        }
        return lock;
    }

    private ReentrantLock lockForPut(String graphId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(graphId, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(graphId) == lock) return lock;
            lock.unlock();
        }
    }

    /**
     * 拿到该图当前登记的锁并加锁；图已被删除（锁已注销）时返回 null。
     */
    private ReentrantLock acquire(String graphId) {
        while (true) {
            ReentrantLock lock = locks.get(graphId);
            if (lock == null) return null;
            lock.lock();
            if (locks.get(graphId) == lock) return lock;
            // 等锁期间图被删除或重建
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }
}
