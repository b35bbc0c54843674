package co.fanki.diagrameditor.shared;

/**
 * The outcome of a text mutation.
 *
 * @param code the resulting text
 * @param changed false when the mutation found nothing to do and the
 *        text came back unchanged
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EditResult(String code, boolean changed) {

    /**
     * Builds a result by comparing the text before and after a mutation.
     *
     * @param before the original text
     * @param after the mutated text
     * @return the result
     */
    public static EditResult of(final String before, final String after) {
        return new EditResult(after, !after.equals(before));
    }

}
