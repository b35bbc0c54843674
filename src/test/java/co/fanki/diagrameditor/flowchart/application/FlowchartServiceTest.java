package co.fanki.diagrameditor.flowchart.application;

import co.fanki.diagrameditor.flowchart.domain.ShapeKind;
import co.fanki.diagrameditor.shared.DomainException;
import co.fanki.diagrameditor.shared.EditResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FlowchartService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowchartServiceTest {

    private static final String CHART = String.join("\n",
            "flowchart TD",
            "    subgraph g1 [Group]",
            "      A[Start]:::hot",
            "    end",
            "    A --> B",
            "    classDef hot fill:#f00");

    private final FlowchartService service = new FlowchartService();

    @Test
    void whenParsing_givenChart_shouldReturnModelAndStyles() {
        final FlowchartService.FlowchartDocument document = service.parse(CHART);

        assertEquals(2, document.model().nodes().size());
        assertEquals(1, document.model().edges().size());
        assertEquals("hot", document.styles().classAssignments().get("A"));
    }

    @Test
    void whenParsing_givenNullCode_shouldThrow() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.parse(null));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenAddingNode_givenShapeAlias_shouldResolveIt() {
        final EditResult result = service.addNode(CHART, "C", "Data",
                "database");

        assertTrue(result.changed());
        assertEquals(ShapeKind.CYLINDER, service.parse(result.code()).model()
                .node("C").get().shape());
    }

    @Test
    void whenAddingEdge_givenGlyph_shouldUseItsKind() {
        final EditResult result = service.addEdge(CHART, "B", "A", null, "-.->");

        assertTrue(result.code().contains("    B -.-> A\n"));
    }

    @Test
    void whenAddingEdge_givenBlankSource_shouldThrow() {
        assertThrows(DomainException.class,
                () -> service.addEdge(CHART, "", "A", null, null));
    }

    @Test
    void whenRemovingEdge_givenMissingEdge_shouldReportNoChange() {
        final EditResult result = service.removeEdge(CHART, "B", "A");

        assertFalse(result.changed());
        assertEquals(CHART, result.code());
    }

    @Test
    void whenMovingNode_givenNoGroup_shouldMoveItOut() {
        assertEquals("g1", service.findSubgraph(CHART, "A"));

        final EditResult result = service.moveNode(CHART, "A", null);

        assertTrue(result.changed());
        assertNull(service.findSubgraph(result.code(), "A"));
    }

    @Test
    void whenCreatingSubgraph_givenNoNodes_shouldThrow() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.createSubgraph(CHART, List.of(), "x"));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenSettingDirection_givenBlank_shouldThrow() {
        assertThrows(DomainException.class,
                () -> service.setDirection(CHART, " "));
    }

    @Test
    void whenRenamingSubgraph_givenLabel_shouldChangeHeader() {
        final EditResult result = service.renameSubgraph(CHART, "g1", "Core");

        assertTrue(result.code().contains("subgraph g1 [Core]"));
    }

}
