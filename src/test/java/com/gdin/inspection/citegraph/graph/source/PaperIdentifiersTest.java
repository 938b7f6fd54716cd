package com.gdin.inspection.citegraph.graph.source;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PaperIdentifiersTest {

    @Test
    public void testNormalize() {
        Assertions.assertEquals("ARXIV:1706.03762", PaperIdentifiers.normalize("https://arxiv.org/abs/1706.03762v5"));
        Assertions.assertEquals("ARXIV:1706.03762", PaperIdentifiers.normalize("arXiv:1706.03762"));
        Assertions.assertEquals("ARXIV:1706.03762", PaperIdentifiers.normalize("1706.03762"));
        Assertions.assertEquals("ARXIV:hep-th/9901001", PaperIdentifiers.normalize("arxiv:hep-th/9901001"));
        Assertions.assertEquals("DOI:10.1038/nature14539", PaperIdentifiers.normalize("https://doi.org/10.1038/NATURE14539"));
        Assertions.assertEquals("DOI:10.1145/3065386", PaperIdentifiers.normalize("doi:10.1145/3065386"));
        Assertions.assertEquals("CorpusId:13756489", PaperIdentifiers.normalize("corpusid:13756489"));
        Assertions.assertEquals("204e3073870fae3d05bcbc2f6a8e263d9b72e776",
                PaperIdentifiers.normalize(" 204E3073870FAE3D05BCBC2F6A8E263D9B72E776 "));
        Assertions.assertNull(PaperIdentifiers.normalize("   "));
    }

    @Test
    public void testTitlesAreNotLookupKeys() {
        String title = PaperIdentifiers.normalize("Attention Is All You Need");
        Assertions.assertEquals("Attention Is All You Need", title);
        Assertions.assertFalse(PaperIdentifiers.isLookupKey(title));
        Assertions.assertTrue(PaperIdentifiers.isLookupKey(PaperIdentifiers.normalize("1706.03762")));
        Assertions.assertFalse(PaperIdentifiers.isLookupKey(null));
    }
}
