package co.fanki.diagrameditor.flowchart.domain;

/**
 * A node reference, with or without a shape-delimited label.
 *
 * @param id the node id
 * @param start the inclusive start offset
 * @param end the exclusive end offset, past the shape and class tag
 * @param shape the shape found after the id, null for a bare reference
 * @param cssClass the inline {@code :::name} class tag, null when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeToken(String id, int start, int end,
        ShapeTable.ShapeMatch shape, String cssClass) implements FlowToken {

    /**
     * Checks whether this reference declares a shape.
     *
     * @return true when the id is followed by delimiters
     */
    public boolean isDeclaration() {
        return shape != null;
    }

}
