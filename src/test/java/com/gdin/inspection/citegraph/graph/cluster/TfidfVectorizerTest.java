package com.gdin.inspection.citegraph.graph.cluster;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TfidfVectorizerTest {

    @Test
    public void testTokenizeDropsStopWordsAndSingleLetters() {
        List<String> tokens = TfidfVectorizer.tokenize("The Transformer: attention-based models in 2017, a BERT x!");
        Assertions.assertEquals(List.of("transformer", "attention", "based", "models", "2017", "bert"), tokens);
    }

    @Test
    public void testTokenizeBlank() {
        Assertions.assertTrue(TfidfVectorizer.tokenize(null).isEmpty());
        Assertions.assertTrue(TfidfVectorizer.tokenize("  ").isEmpty());
        Assertions.assertTrue(TfidfVectorizer.tokenize("the and of").isEmpty());
    }

    @Test
    public void testBigramsFollowTokens() {
        List<String> grams = TfidfVectorizer.ngrams(TfidfVectorizer.tokenize("graph neural networks"));
        Assertions.assertEquals(List.of("graph", "neural", "networks", "graph neural", "neural networks"), grams);
    }

    @Test
    public void testCosineSeparatesTopics() {
        TfidfVectorizer.Matrix matrix = new TfidfVectorizer(100).fitTransform(List.of(
                "message passing graph neural networks",
                "graph attention networks with message passing",
                "protein folding from amino acid sequences"));
        Assertions.assertTrue(matrix.cosine(0, 1) > matrix.cosine(0, 2));
        Assertions.assertEquals(1.0, matrix.cosine(2, 2), 1e-9);
        Assertions.assertEquals(List.of("acid"), matrix.topTerms(List.of(2), 1));
    }
}
