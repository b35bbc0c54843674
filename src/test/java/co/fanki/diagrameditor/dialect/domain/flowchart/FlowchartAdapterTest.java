package co.fanki.diagrameditor.dialect.domain.flowchart;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;
import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import co.fanki.diagrameditor.flowchart.domain.ArrowKind;
import co.fanki.diagrameditor.flowchart.domain.FlowchartParser;
import co.fanki.diagrameditor.flowchart.domain.ShapeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests for {@link FlowchartAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowchartAdapterTest {

    private static final String CODE = "flowchart TD\n    A[\"Start\"] --> B";

    private final FlowchartAdapter adapter = new FlowchartAdapter();

    @Test
    void whenParsing_shouldExposeNodesAndEdgesInCommonShape() {
        final FlowchartDiagram diagram = adapter.parse(CODE);

        final List<DiagramNode> elements = diagram.elements();
        assertEquals(2, elements.size());
        assertEquals("Start", elements.get(0).label());
        assertEquals("rect", elements.get(0).kind());

        final DiagramLink link = diagram.connections().get(0);
        assertEquals("A", link.source());
        assertEquals("B", link.target());
        assertEquals("-->", link.type());
    }

    @Test
    void whenAddingNode_givenShapeName_shouldResolveShape() {
        final String result = adapter.addNode(CODE,
                new NodeDraft("C", "Ask", "diamond", null, null));

        assertEquals(ShapeKind.DIAMOND,
                FlowchartParser.parse(result).node("C").get().shape());
    }

    @Test
    void whenAddingEdge_givenThickGlyph_shouldWriteThickEdge() {
        final String result = adapter.addEdge(CODE,
                new EdgeDraft("B", "A", "==>", null));

        assertEquals(ArrowKind.THICK,
                FlowchartParser.parse(result).edges().get(1).arrowKind());
    }

    @Test
    void whenUpdatingEdge_givenNoConnector_shouldKeepArrow() {
        final String result = adapter.updateEdge(CODE, "A", "B",
                new EdgeDraft(null, null, null, "go"));

        assertEquals("go", FlowchartParser.parse(result).edges().get(0).label());
        assertEquals(ArrowKind.ARROW,
                FlowchartParser.parse(result).edges().get(0).arrowKind());
    }

    @Test
    void whenEditing_givenNullDraft_shouldReturnInput() {
        assertSame(CODE, adapter.addNode(CODE, null));
        assertSame(CODE, adapter.addEdge(CODE, null));
    }

    @Test
    void whenRemovingNode_shouldDelegateToMutator() {
        assertEquals("flowchart TD\n    A[\"Start\"]",
                adapter.removeNode(CODE, "B"));
    }

}
