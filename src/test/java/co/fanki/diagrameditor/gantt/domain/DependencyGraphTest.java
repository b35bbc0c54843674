package co.fanki.diagrameditor.gantt.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DependencyGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyGraphTest {

    private static DependencyGraph graph(final String... taskLines) {
        return DependencyGraph.of(GanttParser.parse("gantt\n"
                + String.join("\n", taskLines)).tasks());
    }

    private static DependencyGraph diamond() {
        return graph(
                "    A :2026-01-01, 2d",
                "    B :after A, 3d",
                "    C :after A, 1d",
                "    D :after B C, 1d");
    }

    @Test
    void whenDetectingCycles_givenAcyclicChart_shouldReturnNone() {
        assertTrue(diamond().detectCycles().isEmpty());
    }

    @Test
    void whenDetectingCycles_givenMutualDependency_shouldReportOneCycle() {
        final List<List<String>> cycles = graph(
                "    X :after Y, 1d",
                "    Y :after X, 1d").detectCycles();

        assertEquals(1, cycles.size());
        assertEquals(Set.of("x", "y"), Set.copyOf(cycles.get(0)));
    }

    @Test
    void whenDetectingCycles_givenSelfReference_shouldIgnoreIt() {
        assertTrue(graph("    Loop :after Loop, 1d").detectCycles().isEmpty());
    }

    @Test
    void whenBuilding_givenReferencesByIdAndLabel_shouldUseTaskKeys() {
        final DependencyGraph graph = graph(
                "    Design :des1, 2026-01-01, 2d",
                "    Build :after Design, 2d",
                "    Test :after des1, 1d");

        assertEquals(Set.of("build", "test"), graph.successors("des1"));
        assertEquals(Set.of("des1"), graph.predecessors("test"));
    }

    @Test
    void whenBuilding_givenUntil_shouldPointFromTaskToBound() {
        final DependencyGraph graph = graph(
                "    Gate :g1, 2026-01-10, 1d",
                "    Fill :f1, 2026-01-03, until g1");

        assertEquals(Set.of("g1"), graph.successors("f1"));
    }

    @Test
    void whenTraversing_givenDiamond_shouldCollectTransitiveNeighbours() {
        final DependencyGraph graph = diamond();

        assertEquals(Set.of("a", "b", "c"), graph.upstream("d"));
        assertEquals(Set.of("b", "c", "d"), graph.downstream("a"));
        assertTrue(graph.downstream("d").isEmpty());
        assertTrue(graph.upstream("unknown").isEmpty());
    }

    @Test
    void whenOrdering_givenDiamond_shouldPlaceDependenciesFirst() {
        final List<String> order = diamond().topologicalOrder();

        assertEquals("a", order.get(0));
        assertEquals("d", order.get(3));
    }

    @Test
    void whenOrdering_givenCycle_shouldLeaveCycleOut() {
        final List<String> order = graph(
                "    Root :2026-01-01, 1d",
                "    X :after Y, 1d",
                "    Y :after X, 1d").topologicalOrder();

        assertEquals(List.of("root"), order);
    }

}
