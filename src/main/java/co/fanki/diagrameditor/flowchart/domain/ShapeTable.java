package co.fanki.diagrameditor.flowchart.domain;

import java.util.List;

/**
 * Bracket spellings of the classic node shapes.
 *
 * <p>The table is ordered: longer and more specific open delimiters come
 * first so that {@code (((} is never read as {@code ((} followed by text,
 * and {@code [/ /]} wins over {@code [/ \]} when both could close.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ShapeTable {

    /**
     * One bracket spelling.
     *
     * @param open the opening delimiter
     * @param close the closing delimiter
     * @param kind the shape it denotes
     */
    public record Delimiter(String open, String close, ShapeKind kind) {}

    /**
     * A shape found right after a node id.
     *
     * @param kind the shape kind
     * @param open the opening delimiter as written
     * @param close the closing delimiter as written
     * @param label the inner text, quotes removed and trimmed
     * @param end the offset right after the closing delimiter
     */
    public record ShapeMatch(ShapeKind kind, String open, String close,
            String label, int end) {}

    private static final List<Delimiter> DELIMITERS = List.of(
            new Delimiter("(((", ")))", ShapeKind.DOUBLE_CIRCLE),
            new Delimiter("([", "])", ShapeKind.STADIUM),
            new Delimiter("[[", "]]", ShapeKind.SUBROUTINE),
            new Delimiter("[(", ")]", ShapeKind.CYLINDER),
            new Delimiter("((", "))", ShapeKind.CIRCLE),
            new Delimiter("{{", "}}", ShapeKind.HEXAGON),
            new Delimiter("[/", "/]", ShapeKind.PARALLELOGRAM),
            new Delimiter("[\\", "\\]", ShapeKind.PARALLELOGRAM_ALT),
            new Delimiter("[/", "\\]", ShapeKind.TRAPEZOID),
            new Delimiter("[\\", "/]", ShapeKind.TRAPEZOID_ALT),
            new Delimiter(">", "]", ShapeKind.ASYMMETRIC),
            new Delimiter("{", "}", ShapeKind.DIAMOND),
            new Delimiter("(", ")", ShapeKind.ROUNDED),
            new Delimiter("[", "]", ShapeKind.RECT));

    private ShapeTable() {
    }

    /**
     * Returns the ordered delimiter table.
     *
     * @return the delimiters in matching order
     */
    public static List<Delimiter> delimiters() {
        return DELIMITERS;
    }

    /**
     * Resolves the shape denoted by a delimiter pair.
     *
     * @param open the opening delimiter
     * @param close the closing delimiter
     * @return the kind, or {@link ShapeKind#RECT} for unknown pairs
     */
    public static ShapeKind kindOf(final String open, final String close) {
        for (final Delimiter delimiter : DELIMITERS) {
            if (delimiter.open().equals(open)
                    && delimiter.close().equals(close)) {
                return delimiter.kind();
            }
        }
        return ShapeKind.RECT;
    }

    /**
     * Tries to read a shape-delimited label starting at an offset.
     *
     * <p>Quoted labels ({@code ["text"]} or {@code ['text']}) must be
     * followed directly by the close delimiter of the same pair. Unquoted
     * labels run until the first occurrence of the close delimiter.</p>
     *
     * @param text the line being scanned
     * @param start the offset right after the node id
     * @return the match, or null when no delimiter pair applies
     */
    public static ShapeMatch match(final String text, final int start) {
        for (final Delimiter delimiter : DELIMITERS) {
            final String open = delimiter.open();
            final String close = delimiter.close();
            if (!text.startsWith(open, start)) {
                continue;
            }
            final int innerStart = start + open.length();
            if (innerStart < text.length()
                    && (text.charAt(innerStart) == '"'
                    || text.charAt(innerStart) == '\'')) {
                final char quote = text.charAt(innerStart);
                final int endQuote = text.indexOf(quote, innerStart + 1);
                if (endQuote < 0 || !text.startsWith(close, endQuote + 1)) {
                    continue;
                }
                final String label = text.substring(innerStart + 1, endQuote);
                return new ShapeMatch(delimiter.kind(), open, close,
                        label.trim(), endQuote + 1 + close.length());
            }
            final int closeAt = text.indexOf(close, innerStart);
            if (closeAt < 0) {
                continue;
            }
            return new ShapeMatch(delimiter.kind(), open, close,
                    text.substring(innerStart, closeAt).trim(),
                    closeAt + close.length());
        }
        return null;
    }

}
