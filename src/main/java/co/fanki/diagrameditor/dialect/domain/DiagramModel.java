package co.fanki.diagrameditor.dialect.domain;

import java.util.List;

/**
 * A parsed diagram of any dialect.
 *
 * <p>Each dialect keeps its own typed model; this contract projects it
 * onto elements and connections so the editor can select and inspect
 * without knowing the dialect.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DiagramModel {

    /**
     * Projects the model's elements.
     *
     * @return the elements, never null
     */
    List<DiagramNode> elements();

    /**
     * Projects the model's connections.
     *
     * @return the connections, empty for dialects without connections
     */
    default List<DiagramLink> connections() {
        return List.of();
    }

}
