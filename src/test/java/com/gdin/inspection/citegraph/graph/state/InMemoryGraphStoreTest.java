package com.gdin.inspection.citegraph.graph.state;

import com.gdin.inspection.citegraph.exception.GraphNotFoundException;
import com.gdin.inspection.citegraph.graph.cluster.ClusterMethod;
import com.gdin.inspection.citegraph.graph.cluster.ClusterResult;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.gdin.inspection.citegraph.graph.models.TestGraphs.graph;
import static com.gdin.inspection.citegraph.graph.models.TestGraphs.node;

public class InMemoryGraphStoreTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();

    @Test
    public void testPutAndUpdate() {
        ResearchGraph saved = store.put(graph("g1", List.of(node("A", "a", null, 2020)), List.of()));
        Assertions.assertEquals(1L, saved.getVersion());
        Assertions.assertNotNull(saved.getCreatedAt());

        ResearchGraph updated = store.update("g1", g -> g.withNode(g.getNodes().get(0)
                .withAttributes(Map.of("keywords", AttributeValue.of("x")))));
        Assertions.assertEquals(2L, updated.getVersion());
        Assertions.assertEquals(saved.getCreatedAt(), updated.getCreatedAt());
        Assertions.assertSame(updated, store.require("g1"));
        Assertions.assertEquals(1, store.list().size());
    }

    @Test
    public void testFailedUpdateCommitsNothing() {
        store.put(graph("g1", List.of(node("A", "a", null, 2020)), List.of()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.update("g1", g -> {
            throw new IllegalArgumentException("boom");
        }));
        Assertions.assertEquals(1L, store.require("g1").getVersion());
    }

    @Test
    public void testMissingGraph() {
        Assertions.assertThrows(GraphNotFoundException.class, () -> store.require("nope"));
        Assertions.assertThrows(GraphNotFoundException.class, () -> store.update("nope", g -> g));
        Assertions.assertFalse(store.remove("nope"));
        Assertions.assertThrows(GraphNotFoundException.class,
                () -> store.updateClusters("nope", g -> clustering(g.getId(), 0), (g, r) -> g));
        Assertions.assertTrue(store.getClusters("nope").isEmpty());
        Assertions.assertEquals(0, store.lockCount());
    }

    @Test
    public void testConcurrentUpdatesAreSerialized() {
        store.put(graph("g1", List.of(node("A", "a", null, 2020)), List.of()));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(CompletableFuture.runAsync(() -> store.update("g1", g -> g), pool));
            }
            futures.forEach(CompletableFuture::join);
        } finally {
            pool.shutdown();
        }
        Assertions.assertEquals(51L, store.require("g1").getVersion());
    }

    @Test
    public void testRemoveDropsClusters() {
        store.put(graph("g1", List.of(node("A", "a", null, 2020)), List.of()));
        Assertions.assertTrue(store.remove("g1"));
        Assertions.assertTrue(store.get("g1").isEmpty());
        Assertions.assertTrue(store.getClusters("g1").isEmpty());
        Assertions.assertEquals(0, store.lockCount());
        Assertions.assertThrows(GraphNotFoundException.class, () -> store.update("g1", g -> g));
        Assertions.assertEquals(0, store.lockCount());
    }

    @Test
    public void testConcurrentClusteringKeepsSideTableInStep() {
        store.put(graph("g1", List.of(node("A", "a", null, 2020)), List.of()));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<ClusterResult>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int clusterId = i;
                futures.add(CompletableFuture.supplyAsync(() -> store.updateClusters("g1",
                        g -> clustering(g.getId(), clusterId),
                        (g, r) -> g.withNode(g.getNodes().get(0)
                                .withAttributes(Map.of("cluster_id", AttributeValue.of(r.getAssignments().get("A")))))), pool));
            }
            futures.forEach(CompletableFuture::join);
        } finally {
            pool.shutdown();
        }
        ResearchGraph g = store.require("g1");
        Assertions.assertEquals(41L, g.getVersion());
        Object onNode = g.getNodes().get(0).getAttributes().get("cluster_id").raw();
        Assertions.assertEquals(store.getClusters("g1").orElseThrow().getAssignments().get("A"),
                ((Number) onNode).intValue());
    }

    @Test
    public void testFailedClusteringCommitsNothing() {
        store.put(graph("g1", List.of(node("A", "a", null, 2020)), List.of()));
        Assertions.assertThrows(IllegalStateException.class, () -> store.updateClusters("g1",
                g -> clustering(g.getId(), 3), (g, r) -> null));
        Assertions.assertEquals(1L, store.require("g1").getVersion());
        Assertions.assertTrue(store.getClusters("g1").isEmpty());
    }

    private static ClusterResult clustering(String graphId, int clusterId) {
        return ClusterResult.builder()
                .graphId(graphId)
                .method(ClusterMethod.CONTENT)
                .requestedClusters(1)
                .clusterCount(1)
                .assignments(Map.of("A", clusterId))
                .summaries(List.of())
                .computedAt(Instant.now())
                .build();
    }
}
