package co.fanki.diagrameditor.flowchart.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FlowchartTokenizer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowchartTokenizerTest {

    @Test
    void whenTokenizing_givenPipeLabel_shouldReadNodesAndArrow() {
        final List<FlowToken> tokens =
                FlowchartTokenizer.tokenize("    A[Start] -->|yes| B((End))");

        assertEquals(3, tokens.size());
        final NodeToken source = assertInstanceOf(NodeToken.class, tokens.get(0));
        assertEquals("A", source.id());
        assertEquals(4, source.start());
        assertEquals("Start", source.shape().label());
        final ArrowToken arrow = assertInstanceOf(ArrowToken.class, tokens.get(1));
        assertEquals(ArrowKind.ARROW, arrow.kind());
        assertEquals("yes", arrow.label());
        final NodeToken target = assertInstanceOf(NodeToken.class, tokens.get(2));
        assertEquals(ShapeKind.CIRCLE, target.shape().kind());
    }

    @Test
    void whenTokenizing_givenInlineLabel_shouldReadLabelAndGlyph() {
        final List<FlowToken> tokens =
                FlowchartTokenizer.tokenize("A -- some text --> B");

        assertEquals(3, tokens.size());
        final ArrowToken arrow = assertInstanceOf(ArrowToken.class, tokens.get(1));
        assertEquals("some text", arrow.label());
        assertEquals("-->", arrow.glyph());
        assertEquals(ArrowKind.ARROW, arrow.kind());
    }

    @Test
    void whenTokenizing_givenInlineLabelOnOpenLine_shouldReadOpenKind() {
        final ArrowToken arrow = assertInstanceOf(ArrowToken.class,
                FlowchartTokenizer.tokenize("A -- note --- B").get(1));

        assertEquals(ArrowKind.OPEN, arrow.kind());
        assertEquals("note", arrow.label());
    }

    @Test
    void whenTokenizing_givenClassTag_shouldAttachIt() {
        final NodeToken node = assertInstanceOf(NodeToken.class,
                FlowchartTokenizer.tokenize("A[Hot]:::warm --> B").get(0));

        assertEquals("warm", node.cssClass());
        assertTrue(node.isDeclaration());
        assertEquals(13, node.end());
    }

    @Test
    void whenTokenizing_givenParallelMarker_shouldSkipIt() {
        final List<FlowToken> tokens =
                FlowchartTokenizer.tokenize("A & B --> C");

        assertEquals(4, tokens.size());
        assertInstanceOf(NodeToken.class, tokens.get(1));
        assertInstanceOf(ArrowToken.class, tokens.get(2));
    }

    @Test
    void whenTokenizing_givenGarbage_shouldNeverFail() {
        assertTrue(FlowchartTokenizer.tokenize(null).isEmpty());
        assertTrue(FlowchartTokenizer.tokenize("  ").isEmpty());
        final List<FlowToken> tokens = FlowchartTokenizer.tokenize("!!! ?? 42");
        assertTrue(tokens.isEmpty());
    }

    @Test
    void whenTokenizing_givenBareReference_shouldHaveNoShape() {
        final NodeToken node = assertInstanceOf(NodeToken.class,
                FlowchartTokenizer.tokenize("café").get(0));

        assertEquals("café", node.id());
        assertFalse(node.isDeclaration());
        assertNull(node.cssClass());
    }

    @Test
    void whenSelectingNodeTokens_givenRepeatedId_shouldReturnEach() {
        final List<NodeToken> tokens =
                FlowchartTokenizer.nodeTokens("A --> B --> A", "A");

        assertEquals(2, tokens.size());
        assertEquals(0, tokens.get(0).start());
        assertEquals(12, tokens.get(1).start());
    }

}
