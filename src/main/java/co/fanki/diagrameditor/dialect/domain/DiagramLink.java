package co.fanki.diagrameditor.dialect.domain;

/**
 * Dialect-neutral view of a connection between two elements.
 *
 * @param source the source element id
 * @param target the target element id
 * @param type the connector as written, e.g. {@code ||--o{} or {@code ->>}
 * @param label the connection text, empty when absent
 * @param lineIndex the line the connection was found on
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DiagramLink(String source, String target, String type,
        String label, int lineIndex) {
}
