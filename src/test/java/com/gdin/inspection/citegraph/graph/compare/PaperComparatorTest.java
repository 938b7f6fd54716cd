package com.gdin.inspection.citegraph.graph.compare;

import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.gdin.inspection.citegraph.graph.models.TestGraphs.node;

@Slf4j
@SpringBootTest
@ActiveProfiles("dev")
@TestPropertySource(properties = "environment.test=true")
public class PaperComparatorTest {

    @Resource
    private PaperComparator paperComparator;

    @Resource
    private EdgeInnovationExtractor edgeInnovationExtractor;

    private final PaperNode transformer = node("A", "Attention is all you need",
            "A sequence transduction model based solely on attention mechanisms.", 2017);
    private final PaperNode bert = node("B", "BERT",
            "Bidirectional pretraining of transformers with masked language modeling and attention.", 2019);

    @Test
    public void testCompareParsesModelAnswer() {
        AtomicReference<String> prompt = new AtomicReference<>();
        TextUnderstandingService collaborator = (system, user) -> {
            prompt.set(user);
            return """
                    <think>两篇都用注意力</think>
                    {"relationship_type": "Builds On", "similarities": "both rely on attention",
                     "differences": ["encoder only", "masked objective"], "architecture_diff": "",
                     "method_diff": "pretraining then fine-tuning"}""";
        };
        Comparison c = paperComparator.compare(bert, transformer, collaborator);
        log.info("comparison={}", c);

        Assertions.assertEquals(RelationshipType.BUILDS_ON, c.getRelationshipType());
        Assertions.assertEquals(List.of("both rely on attention"), c.getSimilarities());
        Assertions.assertEquals(List.of("encoder only", "masked objective"), c.getDifferences());
        Assertions.assertNull(c.getArchitectureDiff());
        Assertions.assertEquals("pretraining then fine-tuning", c.getMethodDiff());
        Assertions.assertEquals("B", c.getPaperAId());
        Assertions.assertTrue(prompt.get().contains("Attention is all you need"));
    }

    @Test
    public void testNoSharedTermsSkipsTheModel() {
        AtomicInteger calls = new AtomicInteger();
        PaperNode botany = node("C", "Leaf morphology", "Photosynthetic pigments in tropical ferns.", 2001);
        Comparison c = paperComparator.compare(transformer, botany, (system, user) -> {
            calls.incrementAndGet();
            return "{}";
        });
        Assertions.assertEquals(RelationshipType.UNRELATED, c.getRelationshipType());
        Assertions.assertTrue(c.getSimilarities().isEmpty());
        Assertions.assertEquals(0, calls.get());
    }

    @Test
    public void testBadAnswersFail() {
        Assertions.assertThrows(ExtractionFailedException.class,
                () -> paperComparator.compare(bert, transformer, (system, user) -> "not json"));
        Assertions.assertThrows(ExtractionFailedException.class,
                () -> paperComparator.compare(bert, transformer, (system, user) -> "{\"relationship_type\": \"refutes\"}"));
        Assertions.assertThrows(ExtractionFailedException.class,
                () -> paperComparator.compare(bert, transformer, (system, user) -> "{\"similarities\": []}"));
        Assertions.assertThrows(ExtractionFailedException.class,
                () -> paperComparator.compare(bert, transformer, null));
    }

    @Test
    public void testEdgeInnovation() {
        EdgeInnovation innovation = edgeInnovationExtractor.extract(bert, transformer, (system, user) -> """
                {"short_label": "reuses the transformer encoder stack with bidirectional self attention for pretraining",
                 "full_insight": "BERT keeps the encoder and drops the decoder."}""");
        Assertions.assertEquals("reuses the transformer encoder stack with bidirectional self attention for...",
                innovation.getShortLabel());
        Assertions.assertEquals("BERT keeps the encoder and drops the decoder.", innovation.getFullInsight());

        PaperNode noAbstractA = node("P", "P", null, 2020);
        PaperNode noAbstractB = node("Q", "Q", "  ", 2019);
        EdgeInnovation fallback = edgeInnovationExtractor.extract(noAbstractA, noAbstractB, null);
        Assertions.assertEquals(EdgeInnovationExtractor.FALLBACK_LABEL, fallback.getShortLabel());
        Assertions.assertEquals(EdgeInnovationExtractor.FALLBACK_INSIGHT, fallback.getFullInsight());

        Assertions.assertThrows(ExtractionFailedException.class,
                () -> edgeInnovationExtractor.extract(bert, transformer, (system, user) -> "……"));
    }
}
