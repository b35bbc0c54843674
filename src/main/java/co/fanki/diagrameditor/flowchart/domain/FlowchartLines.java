package co.fanki.diagrameditor.flowchart.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the lines of a flowchart document.
 *
 * <p>Both the parser and the mutator read a document through this
 * classification, so they always agree on which lines carry nodes and
 * edges and which lines are structure or pass-through directives.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowchartLines {

    /** What a single line is. */
    public enum Kind {
        BLANK,
        COMMENT,
        FRONT_MATTER,
        HEADER,
        SUBGRAPH_OPEN,
        SUBGRAPH_CLOSE,
        DIRECTIVE,
        ANNOTATION,
        CONTENT
    }

    /**
     * A parsed {@code subgraph} opening line.
     *
     * @param id the group id
     * @param label the display label, the id when none is given
     */
    public record GroupHeader(String id, String label) {}

    /**
     * A parsed annotation line.
     *
     * @param nodeId the annotated node
     * @param shape the shape name, null when absent
     * @param label the label, null when absent
     */
    public record Annotation(String nodeId, String shape, String label) {}

    private static final Pattern HEADER =
            Pattern.compile("^(?:flowchart|graph)(?:\\s+(\\w+))?\\s*(?:;\\s*)?$",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern GROUP_OPEN =
            Pattern.compile("^subgraph\\s+([^\\s\\[]+)\\s*(?:\\[(.*)\\])?\\s*$");

    private static final Pattern ANNOTATION =
            Pattern.compile("^([\\w\\u00C0-\\u024F]+)@\\{\\s*(.+?)\\s*\\}$");

    private static final Pattern ANNOTATION_SHAPE =
            Pattern.compile("shape:\\s*([\\w-]+)");

    private static final Pattern ANNOTATION_LABEL =
            Pattern.compile("label:\\s*\"([^\"]*)\"");

    private static final List<String> DIRECTIVE_PREFIXES = List.of(
            "classDef ", "class ", "click ", "style ", "linkStyle ",
            "direction ", "accTitle", "accDescr");

    private static final List<String> TRAILER_PREFIXES = List.of(
            "classDef ", "class ", "style ", "linkStyle ");

    private static final List<String> DIRECTIONS =
            List.of("TB", "TD", "BT", "RL", "LR");

    private FlowchartLines() {
    }

    /**
     * Classifies every line of a document.
     *
     * <p>A front matter block is recognized only when the first line is
     * {@code ---}; it runs up to the next {@code ---}. When the block never
     * closes only the first line is treated as front matter.</p>
     *
     * @param lines the document lines
     * @return one kind per line
     */
    public static List<Kind> classify(final List<String> lines) {
        final List<Kind> kinds = new ArrayList<>(lines.size());
        final int frontMatterEnd = SourceLines.frontMatterEnd(lines);
        for (int i = 0; i < lines.size(); i++) {
            if (i < frontMatterEnd) {
                kinds.add(Kind.FRONT_MATTER);
            } else {
                kinds.add(classifyLine(lines.get(i).trim()));
            }
        }
        return kinds;
    }

    /**
     * Classifies one trimmed line outside front matter.
     *
     * @param trimmed the trimmed line
     * @return the line kind
     */
    public static Kind classifyLine(final String trimmed) {
        if (trimmed.isEmpty()) {
            return Kind.BLANK;
        }
        if (trimmed.startsWith("%%")) {
            return Kind.COMMENT;
        }
        if (HEADER.matcher(trimmed).matches()) {
            return Kind.HEADER;
        }
        if (trimmed.startsWith("subgraph ") || trimmed.startsWith("subgraph\t")) {
            return Kind.SUBGRAPH_OPEN;
        }
        if (trimmed.equals("end")) {
            return Kind.SUBGRAPH_CLOSE;
        }
        for (final String prefix : DIRECTIVE_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return Kind.DIRECTIVE;
            }
        }
        if (ANNOTATION.matcher(trimmed).matches()) {
            return Kind.ANNOTATION;
        }
        return Kind.CONTENT;
    }

    /**
     * Reads the direction from a header line.
     *
     * @param trimmed the trimmed header line
     * @return the upper-cased direction, null when the header has none or
     *         it is not a known direction
     */
    public static String direction(final String trimmed) {
        final Matcher matcher = HEADER.matcher(trimmed);
        if (!matcher.matches() || matcher.group(1) == null) {
            return null;
        }
        final String direction = matcher.group(1).toUpperCase(Locale.ROOT);
        return DIRECTIONS.contains(direction) ? direction : null;
    }

    /**
     * Parses a {@code subgraph} opening line.
     *
     * @param trimmed the trimmed line
     * @return the header, never null for lines classified as group opens
     */
    public static GroupHeader groupHeader(final String trimmed) {
        final Matcher matcher = GROUP_OPEN.matcher(trimmed);
        if (matcher.matches()) {
            final String id = matcher.group(1);
            final String label = matcher.group(2);
            if (label == null || label.isBlank()) {
                return new GroupHeader(id, id);
            }
            return new GroupHeader(id, unquote(label.trim()));
        }
        final String rest = trimmed.substring("subgraph".length()).trim();
        return new GroupHeader(rest, unquote(rest));
    }

    /**
     * Parses an annotation line.
     *
     * @param trimmed the trimmed line
     * @return the annotation, or null when the line is not one
     */
    public static Annotation annotation(final String trimmed) {
        final Matcher matcher = ANNOTATION.matcher(trimmed);
        if (!matcher.matches()) {
            return null;
        }
        final String body = matcher.group(2);
        final Matcher shape = ANNOTATION_SHAPE.matcher(body);
        final Matcher label = ANNOTATION_LABEL.matcher(body);
        return new Annotation(matcher.group(1),
                shape.find() ? shape.group(1) : null,
                label.find() ? label.group(1) : null);
    }

    /**
     * Checks whether a trimmed line must stay below newly inserted
     * declarations (class definitions, class assignments, styles).
     *
     * @param trimmed the trimmed line
     * @return true for style-related directives
     */
    public static boolean isStyleTrailer(final String trimmed) {
        for (final String prefix : TRAILER_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a trimmed line is a style directive or an annotation.
     *
     * @param trimmed the trimmed line
     * @return true when new edges should be inserted above it
     */
    public static boolean isTrailer(final String trimmed) {
        return isStyleTrailer(trimmed) || ANNOTATION.matcher(trimmed).matches();
    }

    private static String unquote(final String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\""))
                || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

}
