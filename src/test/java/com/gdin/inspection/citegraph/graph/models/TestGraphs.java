package com.gdin.inspection.citegraph.graph.models;

import java.util.List;

/**
 * 手工构造测试用的图。
 */
public final class TestGraphs {

    private TestGraphs() {
    }

    public static PaperNode node(String id, String title, String abstractText, int year) {
        return PaperNode.builder()
                .id(id)
                .title(title)
                .abstractText(abstractText)
                .authors(List.of("Author " + id))
                .year(year)
                .citationCount(0)
                .paperSource(PaperSource.INPUT)
                .build();
    }

    public static CitationEdge edge(String id, String from, String to, double strength) {
        return CitationEdge.builder().id(id).fromPaper(from).toPaper(to).strength(strength).build();
    }

    public static ResearchGraph graph(String id, List<PaperNode> nodes, List<CitationEdge> edges) {
        return ResearchGraph.builder().id(id).name("test graph").nodes(nodes).edges(edges).build();
    }
}
