package co.fanki.diagrameditor.dialect.domain;

/**
 * Structural editing of one diagram dialect.
 *
 * <p>Every mutation takes the current text and returns the new text.
 * Mutations are total: a target that cannot be found yields the input
 * unchanged.</p>
 *
 * @param <M> the dialect's model
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DiagramAdapter<M extends DiagramModel> extends DiagramReader<M> {

    /**
     * Adds an element.
     *
     * @param code the diagram text
     * @param draft the element to add
     * @return the new text
     */
    String addNode(String code, NodeDraft draft);

    /**
     * Updates an element.
     *
     * @param code the diagram text
     * @param id the element to update
     * @param draft the changes, null fields are kept
     * @return the new text
     */
    String updateNode(String code, String id, NodeDraft draft);

    /**
     * Removes an element with its connections.
     *
     * @param code the diagram text
     * @param id the element to remove
     * @return the new text
     */
    String removeNode(String code, String id);

    /**
     * Adds a connection.
     *
     * @param code the diagram text
     * @param draft the connection to add
     * @return the new text
     */
    String addEdge(String code, EdgeDraft draft);

    /**
     * Updates the first connection between two elements.
     *
     * @param code the diagram text
     * @param source the source id
     * @param target the target id
     * @param draft the changes, null fields are kept
     * @return the new text
     */
    String updateEdge(String code, String source, String target, EdgeDraft draft);

    /**
     * Removes the connections between two elements.
     *
     * @param code the diagram text
     * @param source the source id
     * @param target the target id
     * @return the new text
     */
    String removeEdge(String code, String source, String target);

    /**
     * Returns what elements are called in this dialect.
     *
     * @return e.g. {@code entity}
     */
    String nodeNoun();

    /**
     * Returns what connections are called in this dialect.
     *
     * @return e.g. {@code transition}
     */
    String edgeNoun();

}
