package com.gdin.inspection.citegraph.graph.state;

import com.gdin.inspection.citegraph.exception.GraphNotFoundException;
import com.gdin.inspection.citegraph.graph.cluster.ClusterResult;
import com.gdin.inspection.citegraph.graph.models.GraphSummary;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 图注册表：graphId -> 最近一次提交的 ResearchGraph 快照。
 * <p>
 * 同一个 graphId 的写操作串行执行；读操作不加锁，总是拿到最近一次完整提交的快照；
 * 不同 graphId 之间互不阻塞。
 */
public interface GraphStore {

    /**
     * 保存新图（或整体替换），version 从 1 开始。
     */
    ResearchGraph put(ResearchGraph graph);

    Optional<ResearchGraph> get(String graphId);

    /**
     * @throws GraphNotFoundException 图不存在
     */
    default ResearchGraph require(String graphId) {
        return get(graphId).orElseThrow(() -> new GraphNotFoundException("图不存在: " + graphId));
    }

    /**
     * 列出所有图的摘要，按创建时间排序。
     */
    List<GraphSummary> list();

    /**
     * 在该图的写锁内读取最新快照、应用 updater 并提交。updater 抛异常时不提交任何修改。
     *
     * @return 提交后的快照（version +1，updatedAt 刷新）
     * @throws GraphNotFoundException 图不存在
     */
    ResearchGraph update(String graphId, UnaryOperator<ResearchGraph> updater);

    boolean remove(String graphId);

    /**
     * 在同一把写锁内计算聚类、把分配写回图并覆盖聚类侧表，两者总是对应同一次聚类。
     *
     * @param clusterer 基于最新快照计算聚类
     * @param applier   把聚类结果写回图
     * @return 本次聚类结果
     * @throws GraphNotFoundException 图不存在
     */
    ClusterResult updateClusters(String graphId, Function<ResearchGraph, ClusterResult> clusterer,
                                 BiFunction<ResearchGraph, ClusterResult, ResearchGraph> applier);

    Optional<ClusterResult> getClusters(String graphId);
}
