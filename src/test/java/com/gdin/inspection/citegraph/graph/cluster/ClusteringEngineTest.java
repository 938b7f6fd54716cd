package com.gdin.inspection.citegraph.graph.cluster;

import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.InsufficientDataException;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.gdin.inspection.citegraph.graph.models.TestGraphs.edge;
import static com.gdin.inspection.citegraph.graph.models.TestGraphs.graph;
import static com.gdin.inspection.citegraph.graph.models.TestGraphs.node;

@Slf4j
public class ClusteringEngineTest {

    private final ClusteringEngine engine = new ClusteringEngine(new GraphProperties.Cluster());

    private static ResearchGraph twoTopics() {
        List<PaperNode> nodes = List.of(
                node("g1", "Graph neural networks", "message passing over graph nodes with neural aggregation", 2018),
                node("g2", "Graph attention networks", "attention based message passing for graph nodes", 2018),
                node("g3", "Inductive graph representation", "neural message passing sampling graph nodes", 2017),
                node("p1", "Protein structure prediction", "protein folding amino acid structure prediction", 2021),
                node("p2", "Protein language models", "amino acid sequences predict protein folding structure", 2022),
                node("p3", "Folding with deep learning", "protein structure folding from amino acid residues", 2020));
        List<CitationEdge> edges = List.of(
                edge("e1", "g2", "g1", 1.0),
                edge("e2", "g3", "g1", 1.0),
                edge("e3", "g3", "g2", 1.0),
                edge("e4", "p2", "p1", 1.0),
                edge("e5", "p1", "p3", 1.0),
                edge("e6", "p2", "p3", 1.0));
        return graph("g", nodes, edges);
    }

    @Test
    public void testContentClustersSeparateTopics() {
        ClusterResult result = engine.cluster(twoTopics(), ClusterMethod.CONTENT, 2, null, null);
        log.info("assignments={}", result.getAssignments());
        assertTwoGroups(result.getAssignments());
        Assertions.assertEquals(2, result.getClusterCount());
        Assertions.assertEquals(2, result.getSummaries().size());
        Assertions.assertFalse(result.getSummaries().get(0).getTopTerms().isEmpty());
    }

    @Test
    public void testCitationFindsNaturalCommunities() {
        // 请求 3 个，拓扑上只有 2 个社区
        ClusterResult result = engine.cluster(twoTopics(), ClusterMethod.CITATION, 3, null, null);
        assertTwoGroups(result.getAssignments());
        Assertions.assertEquals(2, result.getClusterCount());
        Assertions.assertEquals(3, result.getRequestedClusters());
        ClusterSummary first = result.getSummaries().get(0);
        Assertions.assertEquals(3, first.getInternalEdges());
        Assertions.assertEquals(0, first.getExternalEdges());
        Assertions.assertEquals(1.0, first.getDensity(), 1e-9);
        Assertions.assertNotNull(first.getHubPaperId());
    }

    @Test
    public void testHybridNormalizesWeights() {
        ClusterResult result = engine.cluster(twoTopics(), ClusterMethod.HYBRID, 2, 3.0, 1.0);
        assertTwoGroups(result.getAssignments());
        Assertions.assertEquals(0.75, result.getWeights().get("content"), 1e-9);
        Assertions.assertEquals(0.25, result.getWeights().get("citation"), 1e-9);
    }

    @Test
    public void testDeterministic() {
        ClusterResult a = engine.cluster(twoTopics(), ClusterMethod.CONTENT, 2, null, null);
        ClusterResult b = engine.cluster(twoTopics(), ClusterMethod.CONTENT, 2, null, null);
        Assertions.assertEquals(a.getAssignments(), b.getAssignments());
    }

    @Test
    public void testApplyAssignmentsWritesAttributes() {
        ResearchGraph g = twoTopics();
        ClusterResult result = engine.cluster(g, ClusterMethod.CONTENT, 2, null, null);
        ResearchGraph applied = ClusteringEngine.applyAssignments(g, result);
        for (PaperNode n : applied.getNodes()) {
            Assertions.assertTrue(n.attribute(ClusteringEngine.ATTR_CLUSTER_ID).isPresent());
        }
        Assertions.assertTrue(applied.getMetadata().containsKey("clusters"));
        Assertions.assertEquals(g.getEdges(), applied.getEdges());
    }

    @Test
    public void testInvalidRequests() {
        ResearchGraph g = twoTopics();
        Assertions.assertThrows(InvalidRequestException.class, () -> engine.cluster(g, ClusterMethod.CONTENT, 0, null, null));
        Assertions.assertThrows(InsufficientDataException.class, () -> engine.cluster(g, ClusterMethod.CONTENT, 7, null, null));
        Assertions.assertThrows(InvalidRequestException.class, () -> engine.cluster(g, ClusterMethod.HYBRID, 2, -1.0, 1.0));
        Assertions.assertThrows(InvalidRequestException.class, () -> engine.cluster(g, ClusterMethod.HYBRID, 2, 0.0, 0.0));
        Assertions.assertThrows(InvalidRequestException.class, () -> ClusterMethod.fromValue("spectral"));
    }

    @Test
    public void testRelabelByFirstAppearance() {
        Assertions.assertArrayEquals(new int[]{0, 0, 1, 2, 1}, ClusteringEngine.relabel(new int[]{7, 7, 3, 9, 3}));
    }

    private static void assertTwoGroups(Map<String, Integer> assignments) {
        Assertions.assertEquals(assignments.get("g1"), assignments.get("g2"));
        Assertions.assertEquals(assignments.get("g1"), assignments.get("g3"));
        Assertions.assertEquals(assignments.get("p1"), assignments.get("p2"));
        Assertions.assertEquals(assignments.get("p1"), assignments.get("p3"));
        Assertions.assertNotEquals(assignments.get("g1"), assignments.get("p1"));
        Assertions.assertEquals(0, assignments.get("g1"));
    }
}
