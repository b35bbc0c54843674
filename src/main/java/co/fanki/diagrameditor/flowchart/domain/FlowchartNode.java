package co.fanki.diagrameditor.flowchart.domain;

/**
 * A flowchart node as recovered from the text.
 *
 * @param id the node id, unique within the document
 * @param label the display text
 * @param shape the semantic shape
 * @param shapeOpen the opening delimiter as written, null when the node
 *        was never declared with delimiters
 * @param shapeClose the closing delimiter as written, null likewise
 * @param sourceLine the line of the declaration, or of the first
 *        reference for nodes that are only referenced
 * @param declared true when the node has an explicit declaration
 *        (delimiters or an annotation line), false when it only appears
 *        as an edge endpoint or bare reference
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowchartNode(String id, String label, ShapeKind shape,
        String shapeOpen, String shapeClose, int sourceLine,
        boolean declared) {

    FlowchartNode withShapeAndLabel(final ShapeKind theShape,
            final String theLabel) {
        return new FlowchartNode(id, theLabel, theShape, shapeOpen,
                shapeClose, sourceLine, true);
    }

}
