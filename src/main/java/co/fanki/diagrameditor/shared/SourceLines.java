package co.fanki.diagrameditor.shared;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Line-level helpers shared by every diagram dialect.
 *
 * <p>Splitting keeps trailing empty lines so that {@link #join(List)}
 * restores the exact original text when nothing was changed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceLines {

    private SourceLines() {
    }

    /**
     * Splits text into a mutable list of lines.
     *
     * @param code the diagram text, may be null
     * @return the lines, never empty (an empty text yields one empty line)
     */
    public static List<String> split(final String code) {
        final String text = code == null ? "" : code;
        return new ArrayList<>(Arrays.asList(text.split("\n", -1)));
    }

    /**
     * Joins lines back with {@code \n}.
     *
     * @param lines the lines to join
     * @return the joined text
     */
    public static String join(final List<String> lines) {
        return String.join("\n", lines);
    }

    /**
     * Returns the leading whitespace of a line.
     *
     * @param line the line
     * @return the indentation, possibly empty
     */
    public static String indentOf(final String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }

    /**
     * Finds the insertion point for new content: the index right after
     * the last non-blank line that is not matched by the trailer
     * predicate (style directives and the like stay at the bottom).
     *
     * @param lines the document lines
     * @param trailer matches trimmed lines that must stay below new content
     * @return the insertion index, {@code lines.size()} when every line
     *         is blank or a trailer
     */
    public static int endOfContent(final List<String> lines,
            final Predicate<String> trailer) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            final String trimmed = lines.get(i).trim();
            if (!trimmed.isEmpty() && !trailer.test(trimmed)) {
                return i + 1;
            }
        }
        return lines.size();
    }

    /**
     * Returns the number of leading lines taken by a front matter block.
     *
     * <p>A block starts with a {@code ---} first line and runs up to the
     * next {@code ---}. When it never closes, only the first line is
     * counted.</p>
     *
     * @param lines the document lines
     * @return the index of the first line after front matter, zero when
     *         there is none
     */
    public static int frontMatterEnd(final List<String> lines) {
        if (lines.isEmpty() || !lines.get(0).trim().equals("---")) {
            return 0;
        }
        for (int i = 1; i < lines.size(); i++) {
            if (lines.get(i).trim().equals("---")) {
                return i + 1;
            }
        }
        return 1;
    }

    /**
     * Removes lines by index.
     *
     * @param code the text
     * @param indexes the line indexes to drop, unknown indexes are ignored
     * @return the new text, the same text when nothing was dropped
     */
    public static String removeLines(final String code,
            final Set<Integer> indexes) {
        if (indexes.isEmpty()) {
            return code;
        }
        final List<String> lines = split(code);
        final List<String> kept = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (!indexes.contains(i)) {
                kept.add(lines.get(i));
            }
        }
        return join(kept);
    }

    /**
     * Appends a line to the text. A trailing newline of the text is
     * reused instead of leaving a blank line behind.
     *
     * @param code the current text
     * @param line the line to append
     * @return the new text
     */
    public static String append(final String code, final String line) {
        final String text = code == null ? "" : code;
        if (text.isEmpty() || text.endsWith("\n")) {
            return text + line;
        }
        return text + "\n" + line;
    }

    /**
     * Escapes a label for use inside double quotes.
     *
     * @param value the raw label
     * @return the escaped label
     */
    public static String escapeQuotes(final String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

}
