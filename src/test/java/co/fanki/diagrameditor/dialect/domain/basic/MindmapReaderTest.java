package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link MindmapReader}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MindmapReaderTest {

    private static final String CODE = String.join("\n",
            "mindmap",
            "  root((Plan))",
            "    Goals",
            "      [Ship it]",
            "    ideas{{Ideas}}");

    private final MindmapReader reader = new MindmapReader();

    @Test
    void whenParsing_givenShapes_shouldReadLevelsAndMarkers() {
        final List<Mindmap.Node> nodes = reader.parse(CODE).nodes();

        assertEquals(4, nodes.size());
        assertEquals("Plan", nodes.get(0).label());
        assertEquals(0, nodes.get(0).level());
        assertEquals("((", nodes.get(0).shape());

        assertNull(nodes.get(1).shape());
        assertEquals(2, nodes.get(1).level());

        assertEquals("Ship it", nodes.get(2).label());
        assertEquals("[", nodes.get(2).shape());

        assertEquals("ideas", nodes.get(3).id());
        assertEquals("{{", nodes.get(3).shape());
    }

    @Test
    void whenListingConnections_shouldLinkEachNodeToItsParent() {
        final List<String> links = reader.parse(CODE).connections().stream()
                .map(MindmapReaderTest::describe)
                .toList();

        assertEquals(List.of("root>L2", "L2>L3", "root>ideas"), links);
    }

    @Test
    void whenAddingNode_shouldIndentByLevel() {
        assertEquals(CODE + "\n    Risks", reader.addNode(CODE, "Risks", 2));
        assertEquals(CODE + "\n  Risks", reader.addNode(CODE, "Risks", 0));
    }

    @Test
    void whenListingElements_givenRoot_shouldMarkItsKind() {
        assertEquals("root", reader.parse(CODE).elements().get(0).kind());
        assertEquals("node", reader.parse(CODE).elements().get(1).kind());
    }

    private static String describe(final DiagramLink link) {
        return link.source() + ">" + link.target();
    }

}
