package co.fanki.diagrameditor.dialect.domain;

/**
 * Parses one diagram dialect.
 *
 * <p>Implementations never throw on malformed text: unknown lines are
 * left out of the model.</p>
 *
 * @param <M> the dialect's model
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DiagramReader<M extends DiagramModel> {

    /**
     * Returns the dialect this reader handles.
     *
     * @return the diagram type
     */
    DiagramType type();

    /**
     * Parses diagram text.
     *
     * @param code the diagram text, may be null
     * @return the model, never null
     */
    M parse(String code);

}
