package co.fanki.diagrameditor.gantt.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Editor metadata kept in {@code %%} comment lines right below a task.
 *
 * @param assignee comma separated people, null when absent
 * @param notes free text, null when absent
 * @param link a URL, null when absent
 * @param progress percentage between 0 and 100, null when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TaskMetadata(String assignee, String notes, String link,
        Integer progress) {

    /** Metadata of a task without comment lines. */
    public static final TaskMetadata EMPTY =
            new TaskMetadata(null, null, null, null);

    /** The metadata keys understood in comment lines. */
    public enum Key {
        ASSIGNEE, NOTES, LINK, PROGRESS;

        /**
         * The key as written before the colon.
         *
         * @return the lower-cased name
         */
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Finds a key by its written form.
         *
         * @param text the key text, may be null
         * @return the key, empty when unknown
         */
        public static Optional<Key> fromLabel(final String text) {
            if (text == null) {
                return Optional.empty();
            }
            for (final Key key : values()) {
                if (key.label().equalsIgnoreCase(text.trim())) {
                    return Optional.of(key);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Returns a copy with one value replaced.
     *
     * @param key the key to set
     * @param value the raw value, already validated
     * @return the new metadata
     */
    public TaskMetadata with(final Key key, final String value) {
        return switch (key) {
            case ASSIGNEE -> new TaskMetadata(value, notes, link, progress);
            case NOTES -> new TaskMetadata(assignee, value, link, progress);
            case LINK -> new TaskMetadata(assignee, notes, value, progress);
            case PROGRESS -> new TaskMetadata(assignee, notes, link,
                    value == null ? null : clampProgress(value));
        };
    }

    /**
     * Parses a progress value and clamps it to 0..100.
     *
     * @param value the text, digits with an optional trailing {@code %}
     * @return the percentage, null when the text holds no number
     */
    public static Integer clampProgress(final String value) {
        final String digits = value == null ? ""
                : value.trim().replace("%", "").trim();
        if (!digits.matches("-?\\d{1,9}")) {
            return null;
        }
        return Math.max(0, Math.min(100, Integer.parseInt(digits)));
    }

}
