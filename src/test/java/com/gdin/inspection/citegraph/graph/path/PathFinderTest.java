package com.gdin.inspection.citegraph.graph.path;

import com.gdin.inspection.citegraph.exception.NodeNotFoundException;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gdin.inspection.citegraph.graph.models.TestGraphs.edge;
import static com.gdin.inspection.citegraph.graph.models.TestGraphs.graph;
import static com.gdin.inspection.citegraph.graph.models.TestGraphs.node;

public class PathFinderTest {

    private final PathFinder pathFinder = new PathFinder();

    /**
     * A -> D 直连但很弱；A -> B -> C -> D 三跳但都很强。
     */
    private static ResearchGraph diamond() {
        return graph("g",
                List.of(node("A", "a", null, 2023), node("B", "b", null, 2022), node("C", "c", null, 2021),
                        node("D", "d", null, 2020), node("E", "e", null, 2019)),
                List.of(edge("ab", "A", "B", 0.9),
                        edge("bc", "B", "C", 0.9),
                        edge("cd", "C", "D", 0.9),
                        edge("ad", "A", "D", 0.1)));
    }

    @Test
    public void testShortestByHops() {
        PathResult result = pathFinder.findPath(diamond(), "A", "D", PathRanking.SHORTEST);
        Assertions.assertTrue(result.isFound());
        Assertions.assertEquals(List.of("A", "D"), result.getPapers());
        Assertions.assertEquals(1, result.getLength());
        Assertions.assertEquals("ad", result.getEdges().get(0).getId());
    }

    @Test
    public void testStrongestPrefersStrongEdges() {
        PathResult result = pathFinder.findPath(diamond(), "A", "D", PathRanking.STRONGEST);
        Assertions.assertEquals(List.of("A", "B", "C", "D"), result.getPapers());
        Assertions.assertEquals(3, result.getLength());
        Assertions.assertEquals(List.of("ab", "bc", "cd"), result.getEdges().stream().map(PathResult.PathEdge::getId).toList());
    }

    @Test
    public void testDirectionIsRespected() {
        PathResult result = pathFinder.findPath(diamond(), "D", "A", null);
        Assertions.assertFalse(result.isFound());
        Assertions.assertEquals(PathResult.Status.NO_PATH, result.getStatus());
        Assertions.assertTrue(result.getPapers().isEmpty());
        Assertions.assertEquals(PathRanking.SHORTEST, result.getRanking());

        Assertions.assertFalse(pathFinder.findPath(diamond(), "A", "E", PathRanking.STRONGEST).isFound());
    }

    @Test
    public void testSameSourceAndTarget() {
        PathResult result = pathFinder.findPath(diamond(), "B", "B", PathRanking.SHORTEST);
        Assertions.assertTrue(result.isFound());
        Assertions.assertEquals(List.of("B"), result.getPapers());
        Assertions.assertEquals(0, result.getLength());
    }

    @Test
    public void testMissingNode() {
        Assertions.assertThrows(NodeNotFoundException.class, () -> pathFinder.findPath(diamond(), "A", "Z", null));
        Assertions.assertThrows(NodeNotFoundException.class, () -> pathFinder.findPath(diamond(), "Y", "A", null));
    }
}
