package co.fanki.diagrameditor.flowchart.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic classification of a flowchart connector.
 *
 * <p>Each kind knows its shortest glyph and which character repeats to
 * stretch it. {@link #glyph(int)} rebuilds a stretched glyph from a
 * {@code minlen} hint.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ArrowKind {

    /** Solid line with an arrow head. */
    ARROW("-->", "", '-', 2, ">"),
    /** Solid line without heads. */
    OPEN("---", "", '-', 3, ""),
    /** Dotted line with an arrow head. */
    DOTTED("-.->", "-", '.', 1, "->"),
    /** Dotted line without heads. */
    DOTTED_OPEN("-.-", "-", '.', 1, "-"),
    /** Thick line with an arrow head. */
    THICK("==>", "", '=', 2, ">"),
    /** Thick line without heads. */
    THICK_OPEN("===", "", '=', 3, ""),
    /** Invisible link, used only to influence layout. */
    INVISIBLE("~~~", "", '~', 3, ""),
    /** Solid line ending in a circle. */
    CIRCLE("--o", "", '-', 2, "o"),
    /** Solid line ending in a cross. */
    CROSS("--x", "", '-', 2, "x"),
    /** Solid line with heads on both ends. */
    BIDIRECTIONAL("<-->", "<", '-', 2, ">"),
    /** Dotted line with heads on both ends. */
    BIDIRECTIONAL_DOTTED("<-.->", "<-", '.', 1, "->"),
    /** Thick line with heads on both ends. */
    BIDIRECTIONAL_THICK("<==>", "<", '=', 2, ">"),
    /** Solid line with circles on both ends. */
    CIRCLE_BOTH("o--o", "o", '-', 2, "o"),
    /** Solid line with crosses on both ends. */
    CROSS_BOTH("x--x", "x", '-', 2, "x");

    private final String glyph;
    private final String prefix;
    private final char body;
    private final int minimumRun;
    private final String suffix;

    ArrowKind(final String theGlyph, final String thePrefix, final char theBody,
            final int theMinimumRun, final String theSuffix) {
        this.glyph = theGlyph;
        this.prefix = thePrefix;
        this.body = theBody;
        this.minimumRun = theMinimumRun;
        this.suffix = theSuffix;
    }

    /**
     * Returns the shortest spelling of this connector.
     *
     * @return the canonical glyph, e.g. {@code -->}
     */
    @JsonValue
    public String glyph() {
        return glyph;
    }

    /**
     * Builds the glyph for a given stretch hint.
     *
     * @param minlen the requested layout separation, values below one
     *        are treated as one. Invisible links do not stretch.
     * @return the stretched glyph
     */
    public String glyph(final int minlen) {
        final int run = this == INVISIBLE
                ? minimumRun : minimumRun + Math.max(1, minlen) - 1;
        return prefix + String.valueOf(body).repeat(run) + suffix;
    }

    String prefix() {
        return prefix;
    }

    char body() {
        return body;
    }

    int minimumRun() {
        return minimumRun;
    }

    String suffix() {
        return suffix;
    }

    /**
     * Resolves a kind from a glyph, accepting stretched spellings.
     *
     * @param glyph the glyph text, may be null
     * @return the kind, or {@link #ARROW} when the glyph is not recognized
     */
    public static ArrowKind fromGlyph(final String glyph) {
        if (glyph == null || glyph.isBlank()) {
            return ARROW;
        }
        final ArrowTable.ArrowMatch match = ArrowTable.classify(glyph.trim());
        return match != null ? match.kind() : ARROW;
    }

}
