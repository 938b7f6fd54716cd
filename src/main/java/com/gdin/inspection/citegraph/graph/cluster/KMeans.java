package com.gdin.inspection.citegraph.graph.cluster;

import java.util.Arrays;
import java.util.Random;

/**
 * 固定种子的 k-means（k-means++ 初始化，多次重启取惯性最小）。
 * 保证返回恰好 k 个非空簇：某簇变空时，从大小大于 1 的簇中取离其质心最远的点补进去。
 */
class KMeans {

    private final int k;
    private final long seed;
    private final int restarts;
    private final int maxIterations;

    KMeans(int k, long seed, int restarts, int maxIterations) {
        this.k = k;
        this.seed = seed;
        this.restarts = Math.max(1, restarts);
        this.maxIterations = Math.max(1, maxIterations);
    }

    int[] fit(double[][] points) {
        int[] best = null;
        double bestInertia = Double.MAX_VALUE;
        for (int run = 0; run < restarts; run++) {
            Random random = new Random(seed + run);
            int[] labels = lloyd(points, initCenters(points, random));
            double inertia = inertia(points, labels);
            if (best == null || inertia < bestInertia - 1e-12) {
                best = labels;
                bestInertia = inertia;
            }
        }
        return best;
    }

    private double[][] initCenters(double[][] points, Random random) {
        int n = points.length;
        double[][] centers = new double[k][];
        boolean[] chosen = new boolean[n];
        int first = random.nextInt(n);
        centers[0] = points[first].clone();
        chosen[first] = true;
        double[] dist = new double[n];
        for (int c = 1; c < k; c++) {
            double total = 0;
            for (int i = 0; i < n; i++) {
                double d = Double.MAX_VALUE;
                for (int j = 0; j < c; j++) d = Math.min(d, sqDist(points[i], centers[j]));
                dist[i] = chosen[i] ? 0 : d;
                total += dist[i];
            }
            int pick = -1;
            if (total > 0) {
                double r = random.nextDouble() * total;
                for (int i = 0; i < n; i++) {
                    r -= dist[i];
                    if (r <= 0 && dist[i] > 0) {
                        pick = i;
                        break;
                    }
                }
            }
            if (pick < 0) {
                // 剩余点都和已有中心重合，按顺序取一个未选过的
                for (int i = 0; i < n; i++) {
                    if (!chosen[i]) {
                        pick = i;
                        break;
                    }
                }
            }
            centers[c] = points[pick].clone();
            chosen[pick] = true;
        }
        return centers;
    }

    private int[] lloyd(double[][] points, double[][] centers) {
        int n = points.length;
        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        for (int iter = 0; iter < maxIterations; iter++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int nearest = nearest(points[i], centers);
                if (nearest != labels[i]) {
                    labels[i] = nearest;
                    changed = true;
                }
            }
            changed |= fillEmptyClusters(points, centers, labels);
            recomputeCenters(points, centers, labels);
            if (!changed) break;
        }
        return labels;
    }

    private boolean fillEmptyClusters(double[][] points, double[][] centers, int[] labels) {
        boolean changed = false;
        int[] sizes = new int[k];
        for (int l : labels) sizes[l]++;
        for (int c = 0; c < k; c++) {
            if (sizes[c] > 0) continue;
            int far = -1;
            double farDist = -1;
            for (int i = 0; i < points.length; i++) {
                if (sizes[labels[i]] <= 1) continue;
                double d = sqDist(points[i], centers[labels[i]]);
                if (d > farDist) {
                    farDist = d;
                    far = i;
                }
            }
            sizes[labels[far]]--;
            labels[far] = c;
            sizes[c] = 1;
            centers[c] = points[far].clone();
            changed = true;
        }
        return changed;
    }

    private void recomputeCenters(double[][] points, double[][] centers, int[] labels) {
        int dim = points[0].length;
        double[][] sums = new double[k][dim];
        int[] sizes = new int[k];
        for (int i = 0; i < points.length; i++) {
            sizes[labels[i]]++;
            for (int d = 0; d < dim; d++) sums[labels[i]][d] += points[i][d];
        }
        for (int c = 0; c < k; c++) {
            if (sizes[c] == 0) continue;
            for (int d = 0; d < dim; d++) sums[c][d] /= sizes[c];
            centers[c] = sums[c];
        }
    }

    private static int nearest(double[] p, double[][] centers) {
        int best = 0;
        double bestDist = Double.MAX_VALUE;
        for (int c = 0; c < centers.length; c++) {
            double d = sqDist(p, centers[c]);
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return best;
    }

    private double inertia(double[][] points, int[] labels) {
        int dim = points[0].length;
        double[][] centers = new double[k][dim];
        recomputeCenters(points, centers, labels);
        double sum = 0;
        for (int i = 0; i < points.length; i++) sum += sqDist(points[i], centers[labels[i]]);
        return sum;
    }

    private static double sqDist(double[] a, double[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            s += d * d;
        }
        return s;
    }
}
