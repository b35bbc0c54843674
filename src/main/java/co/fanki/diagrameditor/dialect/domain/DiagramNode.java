package co.fanki.diagrameditor.dialect.domain;

/**
 * Dialect-neutral view of a diagram element (class, entity, state,
 * participant, slice, ...).
 *
 * @param id the element id
 * @param label the display text
 * @param kind what the element is in its dialect, e.g. {@code actor}
 * @param lineIndex the declaring line, -1 for elements that are only
 *        referenced
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DiagramNode(String id, String label, String kind,
        int lineIndex) {
}
