package co.fanki.diagrameditor.dialect.domain.classdiagram;

import co.fanki.diagrameditor.dialect.domain.DiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import co.fanki.diagrameditor.shared.SourceLines;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and edits class diagrams.
 *
 * <p>Understands class declarations with or without a member block,
 * {@code <<stereotype>>} annotations and relationship lines. Classes
 * named only by a relationship are reported with line index -1.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ClassDiagramAdapter implements DiagramAdapter<ClassDiagram> {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClassDiagramAdapter.class);

    private static final String INDENT = "    ";

    private static final String MEMBER_INDENT = "        ";

    private static final String DEFAULT_TYPE = "-->";

    private static final Pattern CLASS_DECLARATION = Pattern.compile(
            "^class\\s+(\\w+)\\s*(?:\\[\"([^\"]+)\"\\])?\\s*(\\{)?\\s*$");

    private static final Pattern RELATIONSHIP = Pattern.compile(
            "^(\\w+)\\s+(<?(?:--|\\.\\.)>?|<\\|--|\\*--|o--|-->|--\\*|--o"
                    + "|<\\|\\.\\.|\\.\\.\\|>|--)\\s+(\\w+)(?:\\s*:\\s*(.+))?$");

    private static final Pattern ANNOTATION =
            Pattern.compile("^<<(\\w+)>>\\s+(\\w+)");

    @Override
    public DiagramType type() {
        return DiagramType.CLASS;
    }

    @Override
    public ClassDiagram parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final Map<String, ClassBuilder> classes = new LinkedHashMap<>();
        final Map<String, List<String>> annotations = new LinkedHashMap<>();
        final List<ClassDiagram.Relationship> relationships = new ArrayList<>();

        ClassBuilder open = null;
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (open != null) {
                if (trimmed.equals("}")) {
                    open.endLine = i;
                    open = null;
                } else if (!trimmed.isEmpty() && !trimmed.startsWith("%%")) {
                    open.members.add(trimmed);
                }
                continue;
            }
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            Matcher matcher = CLASS_DECLARATION.matcher(trimmed);
            if (matcher.matches()) {
                final String id = matcher.group(1);
                final ClassBuilder builder = new ClassBuilder(id,
                        matcher.group(2) == null ? id : matcher.group(2), i);
                classes.putIfAbsent(id, builder);
                if (matcher.group(3) != null) {
                    open = builder;
                }
                continue;
            }
            matcher = ANNOTATION.matcher(trimmed);
            if (matcher.find()) {
                annotations.computeIfAbsent(matcher.group(2),
                        k -> new ArrayList<>()).add(matcher.group(1));
                continue;
            }
            matcher = RELATIONSHIP.matcher(trimmed);
            if (matcher.matches()) {
                relationships.add(new ClassDiagram.Relationship(
                        matcher.group(1), matcher.group(3), matcher.group(2),
                        matcher.group(4) == null ? "" : matcher.group(4).trim(),
                        i));
            }
        }

        for (final ClassDiagram.Relationship relationship : relationships) {
            classes.putIfAbsent(relationship.source(),
                    new ClassBuilder(relationship.source(),
                            relationship.source(), -1));
            classes.putIfAbsent(relationship.target(),
                    new ClassBuilder(relationship.target(),
                            relationship.target(), -1));
        }

        final List<ClassDiagram.ClassEntry> entries = new ArrayList<>();
        for (final ClassBuilder builder : classes.values()) {
            entries.add(builder.build(annotations.getOrDefault(builder.id,
                    List.of())));
        }
        return new ClassDiagram(List.copyOf(entries),
                List.copyOf(relationships));
    }

    @Override
    public String addNode(final String code, final NodeDraft draft) {
        if (draft == null || draft.id() == null || draft.id().isBlank()) {
            return code;
        }
        final String id = draft.id().trim();
        if (parse(code).find(id).filter(ClassDiagram.ClassEntry::isDeclared)
                .isPresent()) {
            return code;
        }
        LOG.debug("Adding class {}", id);
        final String header = INDENT + "class " + id + alias(id, draft.label());
        if (!draft.hasMembers()) {
            return SourceLines.append(code, header);
        }
        String result = SourceLines.append(code, header + " {");
        for (final String member : draft.members()) {
            result = SourceLines.append(result, MEMBER_INDENT + member.trim());
        }
        return SourceLines.append(result, INDENT + "}");
    }

    @Override
    public String updateNode(final String code, final String id,
            final NodeDraft draft) {
        if (draft == null) {
            return code;
        }
        final Optional<ClassDiagram.ClassEntry> found = parse(code).find(id);
        if (found.isEmpty()) {
            return code;
        }
        final ClassDiagram.ClassEntry entry = found.get();
        final String label = draft.label() == null ? entry.label() : draft.label();
        if (!entry.isDeclared()) {
            return addNode(code, new NodeDraft(id, label, null, null,
                    draft.members()));
        }

        final List<String> lines = SourceLines.split(code);
        final String indent = SourceLines.indentOf(lines.get(entry.lineIndex()));
        final boolean hasBlock = entry.endLine() > entry.lineIndex();
        final List<String> members = draft.hasMembers()
                ? draft.members() : entry.members();

        final List<String> replacement = new ArrayList<>();
        if (members.isEmpty()) {
            replacement.add(indent + "class " + id + alias(id, label)
                    + (hasBlock ? " {" : ""));
            if (hasBlock) {
                replacement.add(indent + "}");
            }
        } else {
            replacement.add(indent + "class " + id + alias(id, label) + " {");
            final String memberIndent = indent + INDENT;
            for (final String member : members) {
                replacement.add(memberIndent + member.trim());
            }
            replacement.add(indent + "}");
        }

        final int end = hasBlock ? entry.endLine() : entry.lineIndex();
        final List<String> result = new ArrayList<>(
                lines.subList(0, entry.lineIndex()));
        result.addAll(replacement);
        result.addAll(lines.subList(end + 1, lines.size()));
        return SourceLines.join(result);
    }

    @Override
    public String removeNode(final String code, final String id) {
        final ClassDiagram diagram = parse(code);
        final Set<Integer> drop = new HashSet<>();
        diagram.find(id).filter(ClassDiagram.ClassEntry::isDeclared)
                .ifPresent(entry -> {
                    for (int i = entry.lineIndex(); i <= entry.endLine(); i++) {
                        drop.add(i);
                    }
                });
        for (final ClassDiagram.Relationship relationship
                : diagram.relationships()) {
            if (relationship.source().equals(id)
                    || relationship.target().equals(id)) {
                drop.add(relationship.lineIndex());
            }
        }
        final List<String> lines = SourceLines.split(code);
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final Matcher matcher = ANNOTATION.matcher(lines.get(i).trim());
            if (matcher.find() && matcher.group(2).equals(id)) {
                drop.add(i);
            }
        }
        LOG.debug("Removing class {} ({} lines)", id, drop.size());
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String addEdge(final String code, final EdgeDraft draft) {
        if (draft == null || isBlank(draft.source()) || isBlank(draft.target())) {
            return code;
        }
        return SourceLines.append(code, INDENT + line(draft.source(),
                draft.target(), draft.type(), draft.label()));
    }

    @Override
    public String updateEdge(final String code, final String source,
            final String target, final EdgeDraft draft) {
        for (final ClassDiagram.Relationship relationship
                : parse(code).relationships()) {
            if (relationship.source().equals(source)
                    && relationship.target().equals(target)) {
                final List<String> lines = SourceLines.split(code);
                final String indent = SourceLines.indentOf(
                        lines.get(relationship.lineIndex()));
                final String type = draft == null || draft.type() == null
                        ? relationship.type() : draft.type();
                final String label = draft == null || draft.label() == null
                        ? relationship.label() : draft.label();
                lines.set(relationship.lineIndex(),
                        indent + line(source, target, type, label));
                return SourceLines.join(lines);
            }
        }
        return code;
    }

    /** Removes the relationship in either direction. */
    @Override
    public String removeEdge(final String code, final String source,
            final String target) {
        final Set<Integer> drop = new HashSet<>();
        for (final ClassDiagram.Relationship relationship
                : parse(code).relationships()) {
            final boolean forward = relationship.source().equals(source)
                    && relationship.target().equals(target);
            final boolean backward = relationship.source().equals(target)
                    && relationship.target().equals(source);
            if (forward || backward) {
                drop.add(relationship.lineIndex());
            }
        }
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String nodeNoun() {
        return "class";
    }

    @Override
    public String edgeNoun() {
        return "relationship";
    }

    private static String line(final String source, final String target,
            final String type, final String label) {
        final String connector = isBlank(type) ? DEFAULT_TYPE : type.trim();
        final StringBuilder line = new StringBuilder()
                .append(source).append(' ').append(connector).append(' ')
                .append(target);
        if (!isBlank(label)) {
            line.append(" : ").append(label.trim());
        }
        return line.toString();
    }

    private static String alias(final String id, final String label) {
        if (isBlank(label) || label.equals(id)) {
            return "";
        }
        return "[\"" + label.replace("\"", "'") + "\"]";
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    private static final class ClassBuilder {

        private final String id;
        private final String label;
        private final int lineIndex;
        private final List<String> members = new ArrayList<>();
        private int endLine;

        private ClassBuilder(final String theId, final String theLabel,
                final int theLineIndex) {
            id = theId;
            label = theLabel;
            lineIndex = theLineIndex;
            endLine = theLineIndex;
        }

        private ClassDiagram.ClassEntry build(final List<String> annotations) {
            return new ClassDiagram.ClassEntry(id, label, List.copyOf(members),
                    List.copyOf(annotations), lineIndex, endLine);
        }
    }

}
