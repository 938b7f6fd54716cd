package com.gdin.inspection.citegraph.graph.cluster;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 确定性的异步标签传播：按节点顺序逐个更新，取邻居中权重和最大的标签；
 * 并列时若当前标签在其中则保持不变，否则取最小标签。孤立节点自成一个社区。
 */
class LabelPropagation {

    private final int maxRounds;

    LabelPropagation(int maxRounds) {
        this.maxRounds = Math.max(1, maxRounds);
    }

    /**
     * @param adjacency 无向带权邻接表，adjacency.get(i) 为 邻居下标 -> 权重
     */
    int[] fit(List<Map<Integer, Double>> adjacency) {
        int n = adjacency.size();
        int[] labels = new int[n];
        for (int i = 0; i < n; i++) labels[i] = i;

        for (int round = 0; round < maxRounds; round++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                Map<Integer, Double> neighbours = adjacency.get(i);
                if (neighbours.isEmpty()) continue;
                Map<Integer, Double> weights = new HashMap<>();
                neighbours.forEach((j, w) -> weights.merge(labels[j], w, Double::sum));
                double max = Double.NEGATIVE_INFINITY;
                for (double w : weights.values()) max = Math.max(max, w);
                int chosen = Integer.MAX_VALUE;
                boolean keep = false;
                for (Map.Entry<Integer, Double> e : weights.entrySet()) {
                    if (Math.abs(e.getValue() - max) > 1e-12) continue;
                    if (e.getKey() == labels[i]) keep = true;
                    chosen = Math.min(chosen, e.getKey());
                }
                if (!keep && chosen != labels[i]) {
                    labels[i] = chosen;
                    changed = true;
                }
            }
            if (!changed) break;
        }
        return labels;
    }
}
