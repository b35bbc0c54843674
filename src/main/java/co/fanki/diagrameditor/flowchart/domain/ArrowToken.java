package co.fanki.diagrameditor.flowchart.domain;

/**
 * A connector between two node references.
 *
 * @param kind the connector kind
 * @param glyph the glyph as written, without any label
 * @param label the edge label, null when absent
 * @param minlen the stretch hint derived from the glyph length
 * @param start the inclusive start offset
 * @param end the exclusive end offset, past any pipe label
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ArrowToken(ArrowKind kind, String glyph, String label,
        int minlen, int start, int end) implements FlowToken {
}
