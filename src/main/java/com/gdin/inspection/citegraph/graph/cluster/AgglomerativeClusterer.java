package com.gdin.inspection.citegraph.graph.cluster;

import java.util.Arrays;

/**
 * 平均链接的凝聚层次聚类，输入为预计算的距离矩阵，合并到剩下 k 个簇为止。
 * 距离相同时优先合并下标更小的一对。
 */
class AgglomerativeClusterer {

    private final int k;

    AgglomerativeClusterer(int k) {
        this.k = k;
    }

    int[] fit(double[][] distance) {
        int n = distance.length;
        double[][] d = new double[n][];
        for (int i = 0; i < n; i++) d[i] = distance[i].clone();
        int[] size = new int[n];
        Arrays.fill(size, 1);
        boolean[] active = new boolean[n];
        Arrays.fill(active, true);
        // 每个原始点当前所属的簇代表
        int[] owner = new int[n];
        for (int i = 0; i < n; i++) owner[i] = i;

        int clusters = n;
        while (clusters > k) {
            int bi = -1;
            int bj = -1;
            double best = Double.MAX_VALUE;
            for (int i = 0; i < n; i++) {
                if (!active[i]) continue;
                for (int j = i + 1; j < n; j++) {
                    if (!active[j]) continue;
                    if (d[i][j] < best) {
                        best = d[i][j];
                        bi = i;
                        bj = j;
                    }
                }
            }
            // Lance-Williams 平均链接更新，把 bj 并入 bi
            for (int m = 0; m < n; m++) {
                if (!active[m] || m == bi || m == bj) continue;
                double merged = (size[bi] * d[bi][m] + size[bj] * d[bj][m]) / (size[bi] + size[bj]);
                d[bi][m] = merged;
                d[m][bi] = merged;
            }
            size[bi] += size[bj];
            active[bj] = false;
            for (int p = 0; p < n; p++) {
                if (owner[p] == bj) owner[p] = bi;
            }
            clusters--;
        }
        return owner;
    }
}
