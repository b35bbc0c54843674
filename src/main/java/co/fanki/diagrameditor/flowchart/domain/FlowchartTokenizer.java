package co.fanki.diagrameditor.flowchart.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans one flowchart line into node references and connectors.
 *
 * <p>The scanner walks a character cursor left to right. At each position
 * it tries, in order: an inline-labeled connector ({@code -- text -->}),
 * a plain connector from {@link ArrowTable} with an optional
 * {@code |label|}, the parallel marker {@code &}, and a node id followed
 * by optional shape delimiters and an optional {@code :::class} tag.
 * Anything else is skipped one character at a time, so no input can make
 * the scanner fail.</p>
 *
 * <p>Offsets are relative to the line as given, leading indentation
 * included, so callers can splice replacements into the original text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowchartTokenizer {

    private FlowchartTokenizer() {
    }

    /**
     * Tokenizes a line.
     *
     * @param line the raw line, may be null
     * @return the tokens in source order, never null
     */
    public static List<FlowToken> tokenize(final String line) {
        final List<FlowToken> tokens = new ArrayList<>();
        if (line == null) {
            return tokens;
        }
        int pos = 0;
        while (pos < line.length()) {
            while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            if (pos >= line.length()) {
                break;
            }

            final ArrowToken inline = matchInlineLabel(line, pos);
            if (inline != null) {
                tokens.add(inline);
                pos = inline.end();
                continue;
            }

            final ArrowToken arrow = matchArrow(line, pos);
            if (arrow != null) {
                tokens.add(arrow);
                pos = arrow.end();
                continue;
            }

            if (line.charAt(pos) == '&') {
                pos++;
                continue;
            }

            final NodeToken node = matchNode(line, pos);
            if (node != null) {
                tokens.add(node);
                pos = node.end();
                continue;
            }
            pos++;
        }
        return tokens;
    }

    /**
     * Returns the node tokens of a line whose id matches.
     *
     * @param line the raw line
     * @param nodeId the node id to look for
     * @return the matching tokens, in source order
     */
    public static List<NodeToken> nodeTokens(final String line,
            final String nodeId) {
        final List<NodeToken> result = new ArrayList<>();
        for (final FlowToken token : tokenize(line)) {
            if (token instanceof NodeToken node && node.id().equals(nodeId)) {
                result.add(node);
            }
        }
        return result;
    }

    static boolean isIdStart(final char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_'
                || (c >= '\u00C0' && c <= '\u024F');
    }

    static boolean isIdPart(final char c) {
        return isIdStart(c) || (c >= '0' && c <= '9');
    }

    // -- Connectors ------------------------------------------------------

    private static ArrowToken matchArrow(final String line, final int pos) {
        final ArrowTable.ArrowMatch match = ArrowTable.match(line, pos);
        if (match == null) {
            return null;
        }
        final int afterGlyph = pos + match.raw().length();
        String label = null;
        int end = afterGlyph;
        if (afterGlyph < line.length() && line.charAt(afterGlyph) == '|') {
            final int labelEnd = line.indexOf('|', afterGlyph + 1);
            if (labelEnd > afterGlyph) {
                label = line.substring(afterGlyph + 1, labelEnd).trim();
                end = labelEnd + 1;
            }
        }
        return new ArrowToken(match.kind(), match.raw(), label,
                match.minlen(), pos, end);
    }

    /**
     * Matches {@code -- text -->} or {@code -- text ---}. The label may not
     * start with a dash nor contain {@code >}; the shortest label that is
     * followed by whitespace and a dash run wins.
     */
    private static ArrowToken matchInlineLabel(final String line, final int pos) {
        if (!line.startsWith("--", pos)) {
            return null;
        }
        int cursor = pos + 2;
        if (cursor >= line.length() || !Character.isWhitespace(line.charAt(cursor))) {
            return null;
        }
        while (cursor < line.length() && Character.isWhitespace(line.charAt(cursor))) {
            cursor++;
        }
        if (cursor >= line.length() || line.charAt(cursor) == '-') {
            return null;
        }
        final int labelStart = cursor;
        for (int k = labelStart + 1; k < line.length(); k++) {
            final char c = line.charAt(k);
            if (c == '>') {
                return null;
            }
            if (!Character.isWhitespace(c)) {
                continue;
            }
            int dashes = k;
            while (dashes < line.length() && Character.isWhitespace(line.charAt(dashes))) {
                dashes++;
            }
            int run = 0;
            while (dashes + run < line.length() && line.charAt(dashes + run) == '-') {
                run++;
            }
            final int runEnd = dashes + run;
            int glyphEnd = -1;
            if (run >= 2 && runEnd < line.length() && line.charAt(runEnd) == '>') {
                glyphEnd = runEnd + 1;
            } else if (run >= 3) {
                glyphEnd = runEnd;
            }
            if (glyphEnd > 0) {
                final String glyph = line.substring(dashes, glyphEnd);
                final ArrowTable.ArrowMatch match = ArrowTable.classify(glyph);
                final ArrowKind kind = match != null ? match.kind() : ArrowKind.ARROW;
                final int minlen = match != null ? match.minlen() : 1;
                return new ArrowToken(kind, glyph,
                        line.substring(labelStart, k).trim(), minlen, pos,
                        glyphEnd);
            }
        }
        return null;
    }

    // -- Nodes -----------------------------------------------------------

    private static NodeToken matchNode(final String line, final int pos) {
        if (!isIdStart(line.charAt(pos))) {
            return null;
        }
        int cursor = pos + 1;
        while (cursor < line.length() && isIdPart(line.charAt(cursor))) {
            cursor++;
        }
        final String id = line.substring(pos, cursor);

        final ShapeTable.ShapeMatch shape = ShapeTable.match(line, cursor);
        if (shape != null) {
            cursor = shape.end();
        }

        String cssClass = null;
        if (line.startsWith(":::", cursor)) {
            int tagEnd = cursor + 3;
            while (tagEnd < line.length() && isIdPart(line.charAt(tagEnd))) {
                tagEnd++;
            }
            if (tagEnd > cursor + 3) {
                cssClass = line.substring(cursor + 3, tagEnd);
                cursor = tagEnd;
            }
        }
        return new NodeToken(id, pos, cursor, shape, cssClass);
    }

}
