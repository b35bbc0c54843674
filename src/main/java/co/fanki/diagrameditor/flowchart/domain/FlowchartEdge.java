package co.fanki.diagrameditor.flowchart.domain;

/**
 * A connection between two nodes.
 *
 * @param source the source node id
 * @param target the target node id
 * @param label the edge label, empty when absent
 * @param arrowKind the connector kind
 * @param minlen the stretch hint, at least one
 * @param sourceLine the line the edge was found on
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowchartEdge(String source, String target, String label,
        ArrowKind arrowKind, int minlen, int sourceLine) {
}
