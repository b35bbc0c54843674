package co.fanki.diagrameditor.dialect.domain;

import java.util.List;

/**
 * What the editor wants an element to look like.
 *
 * <p>Fields a dialect does not use are ignored; null means "keep" on
 * updates.</p>
 *
 * @param id the element id
 * @param label the display text
 * @param shape the flowchart shape name
 * @param kind the dialect-specific kind, e.g. {@code actor}
 * @param members class members or entity attributes, one per line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeDraft(String id, String label, String shape, String kind,
        List<String> members) {

    /**
     * Creates a draft with only an id and a label.
     *
     * @param id the element id
     * @param label the display text
     * @return the draft
     */
    public static NodeDraft of(final String id, final String label) {
        return new NodeDraft(id, label, null, null, null);
    }

    /**
     * Checks whether the draft carries members.
     *
     * @return true when members were given
     */
    public boolean hasMembers() {
        return members != null && !members.isEmpty();
    }

}
