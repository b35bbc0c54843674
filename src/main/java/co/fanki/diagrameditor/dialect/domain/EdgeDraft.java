package co.fanki.diagrameditor.dialect.domain;

/**
 * What the editor wants a connection to look like.
 *
 * @param source the source element id
 * @param target the target element id
 * @param type the connector as written in the dialect, null for the
 *        dialect's default on creation and "keep" on updates
 * @param label the connection text, null for "keep" on updates
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeDraft(String source, String target, String type,
        String label) {
}
