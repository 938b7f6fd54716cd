package com.gdin.inspection.citegraph.service;

import com.gdin.inspection.citegraph.exception.EdgeNotFoundException;
import com.gdin.inspection.citegraph.exception.GraphNotFoundException;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;
import com.gdin.inspection.citegraph.exception.NodeNotFoundException;
import com.gdin.inspection.citegraph.graph.assemble.AssemblyResult;
import com.gdin.inspection.citegraph.graph.batch.BatchReport;
import com.gdin.inspection.citegraph.graph.batch.ItemOutcome;
import com.gdin.inspection.citegraph.graph.batch.ItemStatus;
import com.gdin.inspection.citegraph.graph.cluster.ClusterMethod;
import com.gdin.inspection.citegraph.graph.cluster.ClusterResult;
import com.gdin.inspection.citegraph.graph.compare.Comparison;
import com.gdin.inspection.citegraph.graph.compare.RelationshipType;
import com.gdin.inspection.citegraph.graph.compare.TextUnderstandingService;
import com.gdin.inspection.citegraph.graph.filter.FilterCondition;
import com.gdin.inspection.citegraph.graph.filter.FilterLogic;
import com.gdin.inspection.citegraph.graph.filter.FilterResult;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import com.gdin.inspection.citegraph.graph.path.PathRanking;
import com.gdin.inspection.citegraph.graph.path.PathResult;
import com.gdin.inspection.citegraph.graph.prompts.EdgeInnovationPromptsZh;
import com.gdin.inspection.citegraph.graph.source.FakeMetadataSource;
import com.gdin.inspection.citegraph.graph.source.MetadataSource;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.gdin.inspection.citegraph.graph.source.FakeMetadataSource.paper;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@Slf4j
@SpringBootTest
@ActiveProfiles("dev")
@TestPropertySource(properties = "environment.test=true")
public class CitationGraphServiceTest {

    private static final String COMPARE_JSON = """
            {"relationship_type": "extends",
             "similarities": ["both model sequences", "both use attention", "both are neural"],
             "differences": ["different pretraining objective"],
             "contribution_diff": "adds bidirectional pretraining"}""";

    private static final String INNOVATION_JSON = """
            {"short_label": "adopts the encoder architecture", "full_insight": "The citing paper reuses the encoder stack."}""";

    @TestConfiguration
    static class FakeSourceConfig {
        @Bean
        @Primary
        public MetadataSource fakeMetadataSource() {
            // A、B 都引用 X；A 还引用 Y；Z 引用 B
            return new FakeMetadataSource()
                    .add(paper("A", "Attention is all you need", 2017))
                    .add(paper("B", "BERT pretraining of deep bidirectional transformers", 2019))
                    .add(paper("X", "Neural machine translation by jointly learning to align", 2014))
                    .add(paper("Y", "Sequence to sequence learning", 2014))
                    .add(paper("Z", "RoBERTa robustly optimized pretraining", 2019))
                    .cites("A", "X")
                    .cites("B", "X")
                    .cites("A", "Y")
                    .cites("Z", "B")
                    .cites("X", "Y");
        }
    }

    @Resource
    private CitationGraphService citationGraphService;

    @MockBean
    private TextUnderstandingService textUnderstandingService;

    private final AtomicBoolean failRoberta = new AtomicBoolean(false);

    @BeforeEach
    void setUp() {
        failRoberta.set(false);
        when(textUnderstandingService.complete(anyString(), anyString())).thenAnswer(inv -> {
            String system = inv.getArgument(0);
            String user = inv.getArgument(1);
            if (failRoberta.get() && user.contains("RoBERTa")) return "抱歉，无法给出比较结果";
            if (EdgeInnovationPromptsZh.SYSTEM_PROMPT.equals(system)) return INNOVATION_JSON;
            return COMPARE_JSON;
        });
    }

    private String buildGraph() {
        AssemblyResult result = citationGraphService.build(List.of("A", "B"), true, 1, null, "lineage");
        log.info("graph={} stats={}", result.getGraphId(), result.getStats());
        return result.getGraphId();
    }

    private static CitationEdge edgeOf(ResearchGraph graph, String from, String to) {
        return graph.getEdges().stream()
                .filter(e -> e.getFromPaper().equals(from) && e.getToPaper().equals(to))
                .findFirst()
                .orElseThrow();
    }

    @Test
    public void testBuildClusterFilterPath() {
        String graphId = buildGraph();
        ResearchGraph graph = citationGraphService.get(graphId);
        Assertions.assertEquals(5, graph.getNodes().size());
        Assertions.assertEquals(1L, graph.getVersion());
        Assertions.assertTrue(citationGraphService.list().stream().anyMatch(s -> s.getId().equals(graphId)));

        Assertions.assertThrows(InvalidRequestException.class, () -> citationGraphService.clusters(graphId));
        ClusterResult clusters = citationGraphService.cluster(graphId, ClusterMethod.CONTENT, 2, null, null);
        Assertions.assertEquals(2, clusters.getClusterCount());
        Assertions.assertEquals(clusters.getAssignments(), citationGraphService.clusters(graphId).getAssignments());
        ResearchGraph clustered = citationGraphService.get(graphId);
        Assertions.assertEquals(2L, clustered.getVersion());
        for (PaperNode n : clustered.getNodes()) {
            Assertions.assertTrue(n.attribute("cluster_id").isPresent());
        }

        FilterResult filtered = citationGraphService.filter(graphId,
                List.of(new FilterCondition("year", ">=", 2017)), FilterLogic.AND);
        Assertions.assertEquals(3, filtered.getMatchCount());
        // 过滤结果不保存
        Assertions.assertTrue(citationGraphService.list().stream().noneMatch(s -> s.getId().equals(filtered.getFilteredGraph().getId())));

        PathResult path = citationGraphService.path(graphId, "Z", "X", PathRanking.SHORTEST);
        Assertions.assertEquals(List.of("Z", "B", "X"), path.getPapers());
        Assertions.assertFalse(citationGraphService.path(graphId, "X", "Z", null).isFound());
        Assertions.assertThrows(NodeNotFoundException.class, () -> citationGraphService.path(graphId, "Z", "nope", null));

        citationGraphService.delete(graphId);
        Assertions.assertThrows(GraphNotFoundException.class, () -> citationGraphService.get(graphId));
        Assertions.assertThrows(GraphNotFoundException.class, () -> citationGraphService.delete(graphId));
    }

    @Test
    public void testCompareTwoPapers() {
        String graphId = buildGraph();
        Comparison comparison = citationGraphService.compare(graphId, "B", "A");
        Assertions.assertEquals(RelationshipType.EXTENDS, comparison.getRelationshipType());
        Assertions.assertEquals(3, comparison.getSimilarities().size());
        Assertions.assertThrows(NodeNotFoundException.class, () -> citationGraphService.compare(graphId, "B", "nope"));
    }

    @Test
    public void testCompareEdgesIsolatesFailures() {
        String graphId = buildGraph();
        failRoberta.set(true);

        BatchReport report = citationGraphService.compareEdges(graphId, 2, "job-compare");
        ResearchGraph graph = report.getGraph();
        String failedEdge = edgeOf(graph, "Z", "B").getId();

        Assertions.assertEquals("job-compare", report.getJobId());
        Assertions.assertEquals(graph.getEdges().size(), report.getStats().getTotal());
        Assertions.assertEquals(1, report.getStats().getFailed());
        Assertions.assertEquals(graph.getEdges().size() - 1, report.getStats().getSucceeded());
        ItemOutcome failed = report.getItems().stream().filter(o -> o.getStatus() == ItemStatus.FAILED).findFirst().orElseThrow();
        Assertions.assertEquals(failedEdge, failed.getItemId());
        Assertions.assertEquals("EXTRACTION_FAILED", failed.getErrorCode());
        Assertions.assertTrue(failed.isRetryable());

        CitationEdge ok = edgeOf(graph, "B", "X");
        Assertions.assertEquals("extends", ok.getContributionType());
        Assertions.assertEquals("Similarities: both model sequences; both use attention. Differences: different pretraining objective",
                ok.getContext());
        Assertions.assertEquals("adds bidirectional pretraining", ok.getDeltaDescription());
        Assertions.assertNull(edgeOf(graph, "Z", "B").getContributionType());

        // 单条重试
        failRoberta.set(false);
        CitationEdge retried = citationGraphService.compareSingleEdge(graphId, failedEdge);
        Assertions.assertEquals("extends", retried.getContributionType());
        Assertions.assertEquals("extends", edgeOf(citationGraphService.get(graphId), "Z", "B").getContributionType());
        Assertions.assertThrows(EdgeNotFoundException.class,
                () -> citationGraphService.compareSingleEdge(graphId, "missing-edge"));
    }

    @Test
    public void testEdgeInnovations() {
        String graphId = buildGraph();
        BatchReport report = citationGraphService.extractEdgeInnovations(graphId, null, null);
        Assertions.assertEquals(0, report.getStats().getFailed());
        Assertions.assertNotNull(report.getJobId());
        CitationEdge edge = edgeOf(report.getGraph(), "A", "X");
        Assertions.assertEquals("adopts the encoder architecture", edge.getContext());
        Assertions.assertEquals("The citing paper reuses the encoder stack.", edge.getDeltaDescription());
    }

    @Test
    public void testExtractors() {
        String graphId = buildGraph();
        BatchReport report = citationGraphService.extract(graphId, List.of("keywords"), 2, false, null);
        Assertions.assertEquals(5, report.getStats().getSucceeded());
        Assertions.assertTrue(report.getGraph().hasExtractorApplied("keywords"));
        for (PaperNode n : report.getGraph().getNodes()) {
            Assertions.assertTrue(n.attribute("keywords").isPresent());
        }

        // 已运行过，不带 force 时跳过
        BatchReport skipped = citationGraphService.extract(graphId, List.of("keywords"), 2, false, null);
        Assertions.assertEquals(0, skipped.getStats().getTotal());

        BatchReport forced = citationGraphService.extract(graphId, List.of("keywords", "contributions"), 2, true, null);
        Assertions.assertEquals(5, forced.getStats().getSucceeded());

        Assertions.assertThrows(InvalidRequestException.class,
                () -> citationGraphService.extract(graphId, List.of("sentiment"), 2, false, null));
        Assertions.assertFalse(citationGraphService.cancel("no-such-job"));
    }
}
