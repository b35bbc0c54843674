package co.fanki.diagrameditor.flowchart.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source-preserving edits on flowchart text.
 *
 * <p>Every operation re-parses the given text, locates its target and
 * rewrites only the span that target owns. Lines that are not touched
 * come back byte for byte, comments and directives included.</p>
 *
 * <p>All operations are total: when the target cannot be found the input
 * text is returned unchanged.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowchartMutator {

    private static final String INDENT = "    ";

    private static final String NESTED_INDENT = "      ";

    private static final Pattern GROUP_LABEL =
            Pattern.compile("^(\\s*subgraph\\s+[^\\s\\[]+)(?:\\s*\\[.*\\])?\\s*$");

    private static final Pattern CLASS_LINE =
            Pattern.compile("^(\\s*class\\s+)(\\S+)(\\s+.*)$");

    private FlowchartMutator() {
    }

    // -- Nodes -----------------------------------------------------------

    /**
     * Returns the first id of the form {@code N1}, {@code N2}, ... that no
     * node in the text uses.
     *
     * @param code the flowchart text
     * @return a free node id
     */
    public static String generateNodeId(final String code) {
        final Set<String> taken = new HashSet<>();
        FlowchartParser.parse(code).nodes().forEach(n -> taken.add(n.id()));
        int i = 1;
        while (taken.contains("N" + i)) {
            i++;
        }
        return "N" + i;
    }

    /**
     * Declares a new node after the last content line.
     *
     * <p>Classic shapes are written with their delimiters. Extended shapes
     * get a rectangle declaration plus an annotation line carrying the
     * real shape.</p>
     *
     * @param code the flowchart text
     * @param id the node id, a fresh one is generated when blank
     * @param label the label, the id when null
     * @param shape the shape, a rectangle when null
     * @return the new text, unchanged when the id is already in use
     */
    public static String addNode(final String code, final String id,
            final String label, final ShapeKind shape) {
        final String nodeId = id == null || id.isBlank()
                ? generateNodeId(code) : id.trim();
        if (FlowchartParser.parse(code).node(nodeId).isPresent()) {
            return code;
        }
        final ShapeKind kind = shape == null ? ShapeKind.RECT : shape;
        final String text = labelText(label == null ? nodeId : label);

        final List<String> lines = SourceLines.split(code);
        final int at = SourceLines.endOfContent(lines,
                FlowchartLines::isStyleTrailer);
        final List<String> block = new ArrayList<>();
        block.add(INDENT + declaration(nodeId, text, kind));
        if (!kind.hasDelimiters()) {
            block.add(INDENT + annotationLine(nodeId, text, kind));
        }
        lines.addAll(at, block);
        return SourceLines.join(lines);
    }

    /**
     * Removes a node with every edge touching it.
     *
     * <p>On each content line the node's tokens and the connectors attached
     * to them are dropped. What remains on the line is kept as separate
     * statements when it still says something (an edge or a shaped
     * declaration); otherwise the line goes away. The node's annotation,
     * {@code style} and {@code click} lines are removed and the id is
     * stripped from {@code class} assignments.</p>
     *
     * @param code the flowchart text
     * @param nodeId the node to remove
     * @return the new text, unchanged when the node does not exist
     */
    public static String removeNode(final String code, final String nodeId) {
        if (nodeId == null || FlowchartParser.parse(code).node(nodeId).isEmpty()) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);
        final List<String> result = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i);
            final String trimmed = line.trim();
            switch (kinds.get(i)) {
                case CONTENT -> {
                    final List<FlowToken> tokens = FlowchartTokenizer.tokenize(line);
                    final boolean[] removed = new boolean[tokens.size()];
                    for (int t = 0; t < tokens.size(); t++) {
                        removed[t] = isNode(tokens.get(t), nodeId);
                    }
                    for (int t = 0; t < tokens.size(); t++) {
                        if (tokens.get(t) instanceof ArrowToken
                                && ((t > 0 && isNode(tokens.get(t - 1), nodeId))
                                || (t + 1 < tokens.size()
                                && isNode(tokens.get(t + 1), nodeId)))) {
                            removed[t] = true;
                        }
                    }
                    result.addAll(rebuild(line, tokens, removed));
                }
                case ANNOTATION -> {
                    final FlowchartLines.Annotation annotation =
                            FlowchartLines.annotation(trimmed);
                    if (!annotation.nodeId().equals(nodeId)) {
                        result.add(line);
                    }
                }
                case DIRECTIVE -> {
                    final String kept = stripFromDirective(line, nodeId);
                    if (kept != null) {
                        result.add(kept);
                    }
                }
                default -> result.add(line);
            }
        }
        return SourceLines.join(result);
    }

    /**
     * Changes the label and/or the shape of a node.
     *
     * <p>The explicit declaration span is rewritten when there is one,
     * otherwise the first bare reference; a node that only appears through
     * an annotation gets a new declaration line. Any annotation line for
     * the node is then removed, and a fresh one is added when the new
     * shape has no bracket spelling.</p>
     *
     * @param code the flowchart text
     * @param nodeId the node to update
     * @param label the new label, null to keep the current one
     * @param shape the new shape, null to keep the current one
     * @return the new text, unchanged when the node does not exist
     */
    public static String updateNode(final String code, final String nodeId,
            final String label, final ShapeKind shape) {
        final Optional<FlowchartNode> found = nodeId == null
                ? Optional.empty() : FlowchartParser.parse(code).node(nodeId);
        if (found.isEmpty()) {
            return code;
        }
        final FlowchartNode node = found.get();
        final String text = labelText(label != null ? label : node.label());
        final ShapeKind kind = shape != null ? shape : node.shape();
        final String replacement = declaration(nodeId, text, kind);

        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);

        int targetLine = -1;
        NodeToken target = null;
        for (int i = 0; i < lines.size() && (target == null || !target.isDeclaration()); i++) {
            if (kinds.get(i) != FlowchartLines.Kind.CONTENT) {
                continue;
            }
            for (final NodeToken token : FlowchartTokenizer.nodeTokens(lines.get(i), nodeId)) {
                if (token.isDeclaration()) {
                    target = token;
                    targetLine = i;
                    break;
                }
                if (target == null) {
                    target = token;
                    targetLine = i;
                }
            }
        }

        if (target != null) {
            final String line = lines.get(targetLine);
            final String tag = target.cssClass() != null
                    ? ":::" + target.cssClass() : "";
            lines.set(targetLine, line.substring(0, target.start())
                    + replacement + tag + line.substring(target.end()));
        } else {
            final int at = SourceLines.endOfContent(lines,
                    FlowchartLines::isStyleTrailer);
            lines.add(at, INDENT + replacement);
        }

        lines.removeIf(l -> isAnnotationOf(l, nodeId));
        if (!kind.hasDelimiters()) {
            final int at = SourceLines.endOfContent(lines,
                    FlowchartLines::isStyleTrailer);
            lines.add(at, INDENT + annotationLine(nodeId, text, kind));
        }
        return SourceLines.join(lines);
    }

    // -- Edges -----------------------------------------------------------

    /**
     * Appends an edge statement before the trailing style and annotation
     * lines.
     *
     * @param code the flowchart text
     * @param source the source node id
     * @param target the target node id
     * @param label the edge label, null or blank for none
     * @param kind the connector kind, a plain arrow when null
     * @return the new text, unchanged when either id is blank
     */
    public static String addEdge(final String code, final String source,
            final String target, final String label, final ArrowKind kind) {
        if (source == null || source.isBlank() || target == null
                || target.isBlank()) {
            return code;
        }
        final ArrowKind arrow = kind == null ? ArrowKind.ARROW : kind;
        final List<String> lines = SourceLines.split(code);
        final int at = SourceLines.endOfContent(lines, FlowchartLines::isTrailer);
        lines.add(at, INDENT + source.trim() + " " + arrow.glyph()
                + pipeLabel(label) + " " + target.trim());
        return SourceLines.join(lines);
    }

    /**
     * Removes every occurrence of an edge. Other edges and declarations
     * on the same lines are kept.
     *
     * @param code the flowchart text
     * @param source the source node id
     * @param target the target node id
     * @return the new text, unchanged when no such edge exists
     */
    public static String removeEdge(final String code, final String source,
            final String target) {
        if (source == null || target == null
                || !FlowchartParser.parse(code).hasEdge(source, target)) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);
        final List<String> result = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i);
            if (kinds.get(i) != FlowchartLines.Kind.CONTENT) {
                result.add(line);
                continue;
            }
            final List<FlowToken> tokens = FlowchartTokenizer.tokenize(line);
            final boolean[] removed = new boolean[tokens.size()];
            for (int t = 1; t < tokens.size() - 1; t++) {
                removed[t] = tokens.get(t) instanceof ArrowToken
                        && isNode(tokens.get(t - 1), source)
                        && isNode(tokens.get(t + 1), target);
            }
            result.addAll(rebuild(line, tokens, removed));
        }
        return SourceLines.join(result);
    }

    /**
     * Changes the label and/or connector of the first occurrence of an
     * edge. Only the span from the source reference to the target
     * reference is rewritten; the references themselves keep their
     * spelling.
     *
     * @param code the flowchart text
     * @param source the source node id
     * @param target the target node id
     * @param label the new label, null to keep, blank to drop it
     * @param kind the new connector, null to keep the current glyph
     * @return the new text, unchanged when no such edge exists
     */
    public static String updateEdge(final String code, final String source,
            final String target, final String label, final ArrowKind kind) {
        if (source == null || target == null) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);
        for (int i = 0; i < lines.size(); i++) {
            if (kinds.get(i) != FlowchartLines.Kind.CONTENT) {
                continue;
            }
            final String line = lines.get(i);
            final List<FlowToken> tokens = FlowchartTokenizer.tokenize(line);
            for (int t = 1; t < tokens.size() - 1; t++) {
                if (!(tokens.get(t) instanceof ArrowToken arrow)
                        || !isNode(tokens.get(t - 1), source)
                        || !isNode(tokens.get(t + 1), target)) {
                    continue;
                }
                final FlowToken from = tokens.get(t - 1);
                final FlowToken to = tokens.get(t + 1);
                final String glyph = kind == null || kind == arrow.kind()
                        ? arrow.glyph() : kind.glyph(arrow.minlen());
                final String newLabel = label != null ? label : arrow.label();
                final String segment = line.substring(from.start(), from.end())
                        + " " + glyph + pipeLabel(newLabel) + " "
                        + line.substring(to.start(), to.end());
                lines.set(i, line.substring(0, from.start()) + segment
                        + line.substring(to.end()));
                return SourceLines.join(lines);
            }
        }
        return code;
    }

    // -- Layout ----------------------------------------------------------

    /**
     * Sets the layout direction on the header line, adding a
     * {@code flowchart} header when the text has none.
     *
     * @param code the flowchart text
     * @param direction one of TB, TD, BT, RL or LR
     * @return the new text, unchanged for an unknown direction
     */
    public static String setDirection(final String code, final String direction) {
        if (direction == null || FlowchartLines.direction(
                "flowchart " + direction.trim()) == null) {
            return code;
        }
        final String value = direction.trim().toUpperCase(Locale.ROOT);
        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);
        for (int i = 0; i < lines.size(); i++) {
            if (kinds.get(i) == FlowchartLines.Kind.HEADER) {
                final String line = lines.get(i);
                final String indent = SourceLines.indentOf(line);
                final String keyword = line.trim().split("\\s+")[0];
                lines.set(i, indent + keyword + " " + value);
                return SourceLines.join(lines);
            }
        }
        int at = 0;
        while (at < kinds.size() && kinds.get(at) == FlowchartLines.Kind.FRONT_MATTER) {
            at++;
        }
        lines.add(at, "flowchart " + value);
        return SourceLines.join(lines);
    }

    // -- Groups ----------------------------------------------------------

    /**
     * Finds the innermost closed group that contains a node's line.
     *
     * @param code the flowchart text
     * @param nodeId the node id
     * @return the group id, empty when the node is at the top level or
     *         does not exist
     */
    public static Optional<String> findNodeSubgraph(final String code,
            final String nodeId) {
        final FlowchartModel model = FlowchartParser.parse(code);
        return model.node(nodeId)
                .flatMap(n -> model.innermostGroupAt(n.sourceLine()))
                .map(Subgraph::id);
    }

    /**
     * Moves a node's line right before the {@code end} of a group.
     *
     * @param code the flowchart text
     * @param nodeId the node to move
     * @param groupId the destination group, which must be closed
     * @return the new text, unchanged when the node or group is missing
     */
    public static String moveNodeToSubgraph(final String code,
            final String nodeId, final String groupId) {
        final FlowchartModel model = FlowchartParser.parse(code);
        final Optional<FlowchartNode> node = model.node(nodeId);
        final Optional<Subgraph> group = model.subgraph(groupId);
        if (node.isEmpty() || group.isEmpty() || !group.get().isClosed()) {
            return code;
        }
        final int from = node.get().sourceLine();
        final int end = group.get().endLine();
        final List<String> lines = SourceLines.split(code);
        final String moved = lines.remove(from).trim();
        final int at = from < end ? end - 1 : end;
        lines.add(at, INDENT + moved);
        return SourceLines.join(lines);
    }

    /**
     * Moves a node's line out of its innermost group, right after the
     * group's {@code end}.
     *
     * @param code the flowchart text
     * @param nodeId the node to move
     * @return the new text, unchanged when the node is not inside a group
     */
    public static String moveNodeOutOfSubgraph(final String code,
            final String nodeId) {
        final FlowchartModel model = FlowchartParser.parse(code);
        final Optional<FlowchartNode> node = model.node(nodeId);
        if (node.isEmpty()) {
            return code;
        }
        final int from = node.get().sourceLine();
        final Optional<Subgraph> parent = model.innermostGroupAt(from);
        if (parent.isEmpty()) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        String indent = SourceLines.indentOf(lines.get(parent.get().startLine()));
        if (indent.isEmpty()) {
            indent = INDENT;
        }
        final String moved = lines.remove(from).trim();
        lines.add(parent.get().endLine(), indent + moved);
        return SourceLines.join(lines);
    }

    /**
     * Wraps the lines of the given nodes in a new group placed where the
     * first of them was.
     *
     * @param code the flowchart text
     * @param nodeIds the nodes to group
     * @param label the group label, also the source of its id
     * @return the new text, unchanged when none of the nodes exist
     */
    public static String createSubgraph(final String code,
            final Collection<String> nodeIds, final String label) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            return code;
        }
        final FlowchartModel model = FlowchartParser.parse(code);
        final TreeSet<Integer> nodeLines = new TreeSet<>();
        for (final FlowchartNode node : model.nodes()) {
            if (nodeIds.contains(node.id())) {
                nodeLines.add(node.sourceLine());
            }
        }
        if (nodeLines.isEmpty()) {
            return code;
        }
        final String groupLabel = label == null ? "" : label.trim();
        final String groupId = groupId(groupLabel, model);

        final List<String> lines = SourceLines.split(code);
        final List<String> block = new ArrayList<>();
        block.add(INDENT + "subgraph " + groupId + " ["
                + (groupLabel.isEmpty() ? groupId : groupLabel) + "]");
        for (final int index : nodeLines) {
            block.add(NESTED_INDENT + lines.get(index).trim());
        }
        block.add(INDENT + "end");
        for (final int index : nodeLines.descendingSet()) {
            lines.remove(index);
        }
        lines.addAll(Math.min(nodeLines.first(), lines.size()), block);
        return SourceLines.join(lines);
    }

    /**
     * Removes a group's {@code subgraph} and {@code end} lines, keeping its
     * contents one indentation level shallower.
     *
     * @param code the flowchart text
     * @param groupId the group to unwrap
     * @return the new text, unchanged when the group is missing or unclosed
     */
    public static String removeSubgraph(final String code, final String groupId) {
        final Optional<Subgraph> found = FlowchartParser.parse(code).subgraph(groupId);
        if (found.isEmpty() || !found.get().isClosed()) {
            return code;
        }
        final Subgraph group = found.get();
        final List<String> lines = SourceLines.split(code);
        for (int i = group.startLine() + 1; i < group.endLine(); i++) {
            lines.set(i, dedent(lines.get(i)));
        }
        lines.remove(group.endLine());
        lines.remove(group.startLine());
        return SourceLines.join(lines);
    }

    /**
     * Changes a group's label, keeping its id.
     *
     * @param code the flowchart text
     * @param groupId the group to rename
     * @param label the new label
     * @return the new text, unchanged when the group is missing
     */
    public static String renameSubgraph(final String code, final String groupId,
            final String label) {
        final Optional<Subgraph> found = FlowchartParser.parse(code).subgraph(groupId);
        if (found.isEmpty() || label == null) {
            return code;
        }
        final int index = found.get().startLine();
        final List<String> lines = SourceLines.split(code);
        final String line = lines.get(index);
        final Matcher matcher = GROUP_LABEL.matcher(line);
        if (matcher.matches()) {
            lines.set(index, matcher.group(1) + " [" + label.trim() + "]");
        } else {
            lines.set(index, SourceLines.indentOf(line) + "subgraph " + groupId
                    + " [" + label.trim() + "]");
        }
        return SourceLines.join(lines);
    }

    // -- Helpers ---------------------------------------------------------

    private static String declaration(final String id, final String text,
            final ShapeKind kind) {
        if (kind.hasDelimiters()) {
            return id + kind.open() + "\"" + text + "\"" + kind.close();
        }
        return id + "[\"" + text + "\"]";
    }

    private static String annotationLine(final String id, final String text,
            final ShapeKind kind) {
        return id + "@{ shape: " + kind.annotationName() + ", label: \""
                + text + "\" }";
    }

    /** Double quotes would end the quoted label early. */
    private static String labelText(final String label) {
        return label.replace("\"", "#quot;");
    }

    private static String pipeLabel(final String label) {
        return label == null || label.isBlank() ? "" : "|" + label.trim() + "|";
    }

    private static boolean isNode(final FlowToken token, final String id) {
        return token instanceof NodeToken node && node.id().equals(id);
    }

    private static boolean isAnnotationOf(final String line, final String id) {
        final FlowchartLines.Annotation annotation =
                FlowchartLines.annotation(line.trim());
        return annotation != null && annotation.nodeId().equals(id);
    }

    /**
     * Rebuilds a content line after dropping some of its tokens.
     *
     * <p>The surviving tokens are split into runs at every dropped token.
     * Each run loses dangling connectors at both ends and is kept only if
     * it still holds a connector or a declaration. Kept runs are copied
     * verbatim from the line, one per output line, with the original
     * indentation.</p>
     *
     * @return the replacement lines: the line itself when nothing was
     *         dropped, possibly none
     */
    private static List<String> rebuild(final String line,
            final List<FlowToken> tokens, final boolean[] removed) {
        boolean any = false;
        for (final boolean r : removed) {
            any |= r;
        }
        if (!any) {
            return List.of(line);
        }
        final String indent = SourceLines.indentOf(line);
        final List<String> result = new ArrayList<>();
        List<FlowToken> run = new ArrayList<>();
        for (int t = 0; t <= tokens.size(); t++) {
            if (t < tokens.size() && !removed[t]) {
                run.add(tokens.get(t));
                continue;
            }
            final String segment = segment(line, run);
            if (segment != null) {
                result.add(indent + segment);
            }
            run = new ArrayList<>();
        }
        return result;
    }

    private static String segment(final String line, final List<FlowToken> run) {
        int first = 0;
        int last = run.size() - 1;
        while (first <= last && run.get(first) instanceof ArrowToken) {
            first++;
        }
        while (last >= first && run.get(last) instanceof ArrowToken) {
            last--;
        }
        if (first > last) {
            return null;
        }
        boolean meaningful = false;
        for (int i = first; i <= last; i++) {
            final FlowToken token = run.get(i);
            if (token instanceof ArrowToken
                    || (token instanceof NodeToken node
                    && (node.isDeclaration() || node.cssClass() != null))) {
                meaningful = true;
            }
        }
        if (!meaningful) {
            return null;
        }
        return line.substring(run.get(first).start(), run.get(last).end());
    }

    /**
     * Drops a node from a {@code style}, {@code click} or {@code class}
     * line.
     *
     * @return the line to keep, or null when it must go
     */
    private static String stripFromDirective(final String line, final String id) {
        final String trimmed = line.trim();
        final String[] words = trimmed.split("\\s+");
        if (words.length >= 2 && (words[0].equals("style") || words[0].equals("click"))) {
            return words[1].equals(id) ? null : line;
        }
        if (!words[0].equals("class")) {
            return line;
        }
        final Matcher matcher = CLASS_LINE.matcher(line);
        if (!matcher.matches()) {
            return line;
        }
        final List<String> ids = new ArrayList<>();
        boolean changed = false;
        for (final String candidate : matcher.group(2).split(",")) {
            if (candidate.trim().equals(id)) {
                changed = true;
            } else if (!candidate.isBlank()) {
                ids.add(candidate.trim());
            }
        }
        if (!changed) {
            return line;
        }
        if (ids.isEmpty()) {
            return null;
        }
        return matcher.group(1) + String.join(",", ids) + matcher.group(3);
    }

    private static String groupId(final String label, final FlowchartModel model) {
        final Set<String> taken = new HashSet<>();
        model.subgraphs().forEach(s -> taken.add(s.id()));
        final String base = label.replaceAll("[^a-zA-Z0-9_]", "_")
                .toLowerCase(Locale.ROOT);
        String candidate = base.isEmpty() ? "group" : base;
        final String stem = candidate;
        int counter = 2;
        while (taken.contains(candidate)) {
            candidate = stem + counter;
            counter++;
        }
        return candidate;
    }

    private static String dedent(final String line) {
        if (line.startsWith(INDENT)) {
            return line.substring(INDENT.length());
        }
        if (line.startsWith("\t")) {
            return line.substring(1);
        }
        return line;
    }

}
