package com.gdin.inspection.citegraph.graph.extract;

import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;
import com.gdin.inspection.citegraph.graph.cluster.TfidfVectorizer;
import com.gdin.inspection.citegraph.graph.compare.TextUnderstandingService;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import com.gdin.inspection.citegraph.util.TokenUtil;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.gdin.inspection.citegraph.graph.models.TestGraphs.graph;
import static com.gdin.inspection.citegraph.graph.models.TestGraphs.node;

public class ExtractorRegistryTest {

    private static ResearchGraph corpus() {
        return graph("g", List.of(
                node("A", "Protein folding", "protein structure prediction from amino acid sequences", 2021),
                node("B", "Graph networks", "message passing neural networks on graphs", 2018),
                node("C", "Image recognition", "deep residual networks for image recognition", 2015)), List.of());
    }

    @Test
    public void testKeywordsComeFromThePaper() {
        ResearchGraph g = corpus();
        PaperNode a = g.getNodes().get(0);
        Map<String, AttributeValue> attrs = new KeywordExtractor(500, 5).extract(a, g);
        List<String> keywords = attrs.get(KeywordExtractor.ATTR_KEYWORDS).asStringList();
        Assertions.assertFalse(keywords.isEmpty());
        Assertions.assertTrue(keywords.size() <= 5);
        Set<String> tokens = new HashSet<>(TfidfVectorizer.tokenize(a.contentText()));
        for (String k : keywords) {
            for (String part : k.split(" ")) Assertions.assertTrue(tokens.contains(part), k);
        }
    }

    @Test
    public void testLlmExtractorMapsJsonToAttributes() {
        TextUnderstandingService collaborator = (system, user) -> """
                ```json
                {"contributions": ["faster folding", "new benchmark"], "novelty_score": 0.8, "open_source": true,
                 "details": {"dataset": "CASP14"}, "empty": ""}
                ```""";
        LlmAttributeExtractor extractor = new LlmAttributeExtractor("contributions", "sys", "{title}\n{text}",
                collaborator, new TokenUtil(), 200);
        Map<String, AttributeValue> attrs = extractor.extract(corpus().getNodes().get(0), corpus());

        Assertions.assertEquals(List.of("faster folding", "new benchmark"), attrs.get("contributions").asStringList());
        Assertions.assertEquals(0.8, attrs.get("novelty_score").asNumber().orElseThrow(), 1e-9);
        Assertions.assertTrue(attrs.get("open_source").asBoolean().orElseThrow());
        Assertions.assertTrue(attrs.get("details").asString().contains("CASP14"));
        Assertions.assertFalse(attrs.containsKey("empty"));
    }

    @Test
    public void testLlmExtractorFailures() {
        LlmAttributeExtractor garbled = new LlmAttributeExtractor("architecture", "sys", "{title}\n{text}",
                (system, user) -> "no json here", new TokenUtil(), 200);
        Assertions.assertThrows(ExtractionFailedException.class,
                () -> garbled.extract(corpus().getNodes().get(0), corpus()));

        PaperNode bare = node("D", "Title only", null, 2020);
        Assertions.assertThrows(ExtractionFailedException.class, () -> garbled.extract(bare, corpus()));
    }

    @Test
    public void testRegistry() {
        ExtractorRegistry registry = new ExtractorRegistry(List.of(new KeywordExtractor(100, 3)));
        Assertions.assertEquals(List.of("keywords"), registry.names());
        Assertions.assertEquals("keywords", registry.get(" keywords ").name());
        Assertions.assertThrows(InvalidRequestException.class, () -> registry.get("sentiment"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new ExtractorRegistry(List.of(new KeywordExtractor(100, 3), new KeywordExtractor(50, 2))));
    }
}
