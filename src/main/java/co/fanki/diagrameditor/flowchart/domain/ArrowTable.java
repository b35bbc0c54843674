package co.fanki.diagrameditor.flowchart.domain;

import java.util.List;

/**
 * Recognizes connector glyph runs.
 *
 * <p>Forms are tried in a fixed order, most specific first. The order is
 * load-bearing: a bidirectional {@code <==>} must be tried before the
 * one-headed {@code ==>}, and {@code --o} before the open {@code ---},
 * otherwise a glyph would be split into two shorter tokens.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ArrowTable {

    /**
     * A recognized glyph run.
     *
     * @param kind the connector kind
     * @param raw the glyph as written
     * @param minlen the stretch hint, one for the shortest spelling
     */
    public record ArrowMatch(ArrowKind kind, String raw, int minlen) {}

    private static final List<ArrowKind> MATCH_ORDER = List.of(
            ArrowKind.BIDIRECTIONAL_THICK,
            ArrowKind.BIDIRECTIONAL_DOTTED,
            ArrowKind.BIDIRECTIONAL,
            ArrowKind.CIRCLE_BOTH,
            ArrowKind.CROSS_BOTH,
            ArrowKind.THICK,
            ArrowKind.DOTTED,
            ArrowKind.CIRCLE,
            ArrowKind.CROSS,
            ArrowKind.ARROW,
            ArrowKind.OPEN,
            ArrowKind.DOTTED_OPEN,
            ArrowKind.THICK_OPEN,
            ArrowKind.INVISIBLE);

    private ArrowTable() {
    }

    /**
     * Matches the longest connector glyph starting at an offset.
     *
     * @param text the line being scanned
     * @param start the offset to match at
     * @return the match, or null when no connector starts there
     */
    public static ArrowMatch match(final String text, final int start) {
        for (final ArrowKind kind : MATCH_ORDER) {
            final ArrowMatch match = matchForm(kind, text, start);
            if (match != null) {
                return match;
            }
        }
        return null;
    }

    /**
     * Classifies a complete glyph.
     *
     * @param raw the glyph text
     * @return the match when the whole text is one glyph, null otherwise
     */
    public static ArrowMatch classify(final String raw) {
        final ArrowMatch match = match(raw, 0);
        if (match == null || match.raw().length() != raw.length()) {
            return null;
        }
        return match;
    }

    private static ArrowMatch matchForm(final ArrowKind kind,
            final String text, final int start) {
        if (!text.startsWith(kind.prefix(), start)) {
            return null;
        }
        int pos = start + kind.prefix().length();
        int run = 0;
        while (pos < text.length() && text.charAt(pos) == kind.body()) {
            pos++;
            run++;
        }
        if (run < kind.minimumRun() || !text.startsWith(kind.suffix(), pos)) {
            return null;
        }
        final int end = pos + kind.suffix().length();
        final int minlen = kind == ArrowKind.INVISIBLE
                ? 1 : 1 + run - kind.minimumRun();
        return new ArrowMatch(kind, text.substring(start, end), minlen);
    }

}
