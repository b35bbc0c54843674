package co.fanki.diagrameditor.flowchart.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Semantic shape of a flowchart node.
 *
 * <p>The first fourteen kinds are the classic shapes, each with a bracket
 * spelling (for example {@code ((}/{@code ))} for a circle). The rest are
 * extended shapes that can only be written through an annotation line
 * such as {@code A@{ shape: doc }}.</p>
 *
 * <p>Several annotation names map to the same kind. The first name in
 * each alias list is the canonical one used when writing annotations
 * back.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ShapeKind {

    RECT("rect", "[", "]", "rect", "proc", "process", "rectangle"),
    ROUNDED("rounded", "(", ")", "rounded", "event"),
    STADIUM("stadium", "([", "])", "stadium", "pill", "terminal"),
    DIAMOND("diamond", "{", "}", "diamond", "diam", "decision", "question"),
    CIRCLE("circle", "((", "))", "circle", "circ"),
    DOUBLE_CIRCLE("double-circle", "(((", ")))", "dbl-circ", "double-circle"),
    HEXAGON("hexagon", "{{", "}}", "hex", "hexagon", "prepare"),
    SUBROUTINE("subroutine", "[[", "]]", "subproc", "subroutine",
            "subprocess", "fr-rect", "framed-rectangle"),
    CYLINDER("cylinder", "[(", ")]", "cyl", "cylinder", "database", "db"),
    PARALLELOGRAM("parallelogram", "[/", "/]", "lean-r", "lean-right",
            "in-out"),
    PARALLELOGRAM_ALT("parallelogram-alt", "[\\", "\\]", "lean-l",
            "lean-left", "out-in"),
    TRAPEZOID("trapezoid", "[/", "\\]", "trap-b", "trapezoid",
            "trapezoid-bottom", "priority"),
    TRAPEZOID_ALT("trapezoid-alt", "[\\", "/]", "trap-t", "trapezoid-top",
            "inv-trapezoid", "manual"),
    ASYMMETRIC("asymmetric", ">", "]", "odd"),

    DOCUMENT("document", null, null, "doc", "document"),
    DOCUMENTS("documents", null, null, "docs", "documents", "st-doc",
            "stacked-document"),
    NOTCHED_RECT("notched-rect", null, null, "notch-rect", "card",
            "notched-rectangle"),
    CLOUD("cloud", null, null, "cloud"),
    BANG("bang", null, null, "bang"),
    BOLT("bolt", null, null, "bolt", "com-link", "lightning-bolt"),
    BRACE_L("brace-l", null, null, "brace-l", "comment", "brace"),
    BRACE_R("brace-r", null, null, "brace-r"),
    BRACES("braces", null, null, "braces"),
    TRIANGLE("triangle", null, null, "tri", "triangle", "extract"),
    FLAG("flag", null, null, "flag", "paper-tape"),
    HOURGLASS("hourglass", null, null, "hourglass", "collate"),
    LINED_RECT("lined-rect", null, null, "lin-rect", "lin-proc",
            "lined-rectangle", "lined-process", "shaded-process"),
    SMALL_CIRCLE("small-circle", null, null, "sm-circ", "small-circle",
            "start"),
    FRAMED_CIRCLE("framed-circle", null, null, "fr-circ", "framed-circle",
            "stop"),
    FILLED_CIRCLE("filled-circle", null, null, "f-circ", "filled-circle",
            "junction"),
    FORK("fork", null, null, "fork", "join"),
    TEXT_BLOCK("text-block", null, null, "text"),
    DELAY("delay", null, null, "delay", "half-rounded-rectangle"),
    H_CYLINDER("h-cylinder", null, null, "h-cyl", "horizontal-cylinder",
            "das"),
    LINED_CYLINDER("lined-cylinder", null, null, "lin-cyl",
            "lined-cylinder", "disk"),
    CURVED_TRAPEZOID("curved-trapezoid", null, null, "curv-trap",
            "curved-trapezoid", "display"),
    DIVIDED_RECT("divided-rect", null, null, "div-rect",
            "divided-rectangle", "div-proc", "divided-process"),
    FLIPPED_TRIANGLE("flipped-triangle", null, null, "flip-tri",
            "flipped-triangle", "manual-file"),
    SLOPED_RECT("sloped-rect", null, null, "sl-rect", "sloped-rectangle",
            "manual-input"),
    WINDOW_PANE("window-pane", null, null, "win-pane", "window-pane",
            "internal-storage"),
    CROSSED_CIRCLE("crossed-circle", null, null, "cross-circ",
            "crossed-circle", "summary"),
    LINED_DOCUMENT("lined-document", null, null, "lin-doc",
            "lined-document"),
    NOTCHED_PENTAGON("notched-pentagon", null, null, "notch-pent",
            "notched-pentagon", "loop-limit"),
    TAG_DOCUMENT("tag-document", null, null, "tag-doc", "tagged-document"),
    TAG_RECT("tag-rect", null, null, "tag-rect", "tag-proc",
            "tagged-rectangle", "tagged-process"),
    BOW_RECT("bow-rect", null, null, "bow-rect", "bow-tie-rectangle",
            "stored-data"),
    STACKED_RECT("stacked-rect", null, null, "st-rect",
            "stacked-rectangle", "processes", "procs");

    /** Alias (lower-cased) to kind, covering ids and annotation names. */
    private static final Map<String, ShapeKind> BY_NAME;

    static {
        final Map<String, ShapeKind> names = new HashMap<>();
        for (final ShapeKind kind : values()) {
            names.putIfAbsent(kind.id, kind);
            for (final String alias : kind.aliases) {
                names.putIfAbsent(alias, kind);
            }
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final String id;
    private final String open;
    private final String close;
    private final List<String> aliases;

    ShapeKind(final String theId, final String theOpen, final String theClose,
            final String... theAliases) {
        this.id = theId;
        this.open = theOpen;
        this.close = theClose;
        this.aliases = List.of(theAliases);
    }

    /**
     * Returns the stable external name of this shape.
     *
     * @return the shape id, e.g. {@code double-circle}
     */
    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Returns the canonical opening delimiter.
     *
     * @return the opening delimiter, or null for extended shapes
     */
    public String open() {
        return open;
    }

    /**
     * Returns the canonical closing delimiter.
     *
     * @return the closing delimiter, or null for extended shapes
     */
    public String close() {
        return close;
    }

    /**
     * Checks whether this shape has a bracket spelling.
     *
     * @return true for classic shapes
     */
    public boolean hasDelimiters() {
        return open != null;
    }

    /**
     * Returns the name written in annotation lines for this shape.
     *
     * @return the canonical annotation name
     */
    public String annotationName() {
        return aliases.get(0);
    }

    /**
     * Resolves a shape from an id or an annotation alias.
     *
     * <p>Unknown names fall back to {@link #RECT}, which is what the
     * renderer does with shapes it does not know.</p>
     *
     * @param name the shape name, may be null
     * @return the matching kind, never null
     */
    public static ShapeKind fromName(final String name) {
        if (name == null || name.isBlank()) {
            return RECT;
        }
        final ShapeKind kind = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
        return kind != null ? kind : RECT;
    }

}
