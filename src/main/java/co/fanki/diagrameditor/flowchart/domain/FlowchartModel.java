package co.fanki.diagrameditor.flowchart.domain;

import java.util.List;
import java.util.Optional;

/**
 * The structure recovered from a flowchart document.
 *
 * <p>Derived fresh on every parse; nothing here points back into a
 * previous version of the text.</p>
 *
 * @param direction the layout direction, {@code TD} when not declared
 * @param nodes the nodes in order of first appearance
 * @param edges the edges in source order
 * @param subgraphs the groups in order of their opening line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowchartModel(String direction, List<FlowchartNode> nodes,
        List<FlowchartEdge> edges, List<Subgraph> subgraphs) {

    /** Creates a model, copying the given lists. */
    public FlowchartModel {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        subgraphs = List.copyOf(subgraphs);
    }

    /**
     * Finds a node by id.
     *
     * @param id the node id
     * @return the node, if present
     */
    public Optional<FlowchartNode> node(final String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    /**
     * Finds a group by id.
     *
     * @param id the group id
     * @return the group, if present
     */
    public Optional<Subgraph> subgraph(final String id) {
        return subgraphs.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    /**
     * Checks whether an edge between two nodes exists.
     *
     * @param source the source id
     * @param target the target id
     * @return true when at least one such edge exists
     */
    public boolean hasEdge(final String source, final String target) {
        return edges.stream().anyMatch(e -> e.source().equals(source)
                && e.target().equals(target));
    }

    /**
     * Returns the innermost closed group whose line range contains a line.
     *
     * @param line the line index
     * @return the group, if any
     */
    public Optional<Subgraph> innermostGroupAt(final int line) {
        Subgraph best = null;
        for (final Subgraph group : subgraphs) {
            if (group.contains(line)
                    && (best == null || group.startLine() > best.startLine())) {
                best = group;
            }
        }
        return Optional.ofNullable(best);
    }

}
