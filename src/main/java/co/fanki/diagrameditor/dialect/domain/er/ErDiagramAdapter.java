package co.fanki.diagrameditor.dialect.domain.er;

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
 * Reads and edits entity relationship diagrams.
 *
 * <p>Entities are <code>NAME {</code> blocks holding one attribute per line.
 * Renaming an entity also renames it in every relationship.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ErDiagramAdapter implements DiagramAdapter<ErDiagram> {

    private static final Logger LOG = LoggerFactory.getLogger(
            ErDiagramAdapter.class);

    private static final String INDENT = "    ";

    private static final String ATTRIBUTE_INDENT = "        ";

    private static final String DEFAULT_CONNECTOR = "||--o{";

    private static final String DEFAULT_LABEL = "relates";

    private static final Pattern ENTITY_OPEN =
            Pattern.compile("^(\\w+)\\s*\\{\\s*$");

    private static final Pattern RELATIONSHIP = Pattern.compile(
            "^(\\w+)\\s+([|o{}\\s]+(?:--|\\.\\.)[|o{}\\s]+?)\\s+(\\w+)"
                    + "(?:\\s*:\\s*(.+))?$");

    @Override
    public DiagramType type() {
        return DiagramType.ER;
    }

    @Override
    public ErDiagram parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final Map<String, ErDiagram.Entity> entities = new LinkedHashMap<>();
        final List<ErDiagram.Relationship> relationships = new ArrayList<>();

        String openId = null;
        int openLine = -1;
        List<ErDiagram.Attribute> attributes = new ArrayList<>();

        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (openId != null) {
                if (trimmed.equals("}")) {
                    entities.putIfAbsent(openId, new ErDiagram.Entity(openId,
                            List.copyOf(attributes), openLine, i));
                    openId = null;
                } else if (!trimmed.isEmpty() && !trimmed.startsWith("%%")) {
                    attributes.add(ErDiagram.Attribute.parse(trimmed));
                }
                continue;
            }
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            final Matcher open = ENTITY_OPEN.matcher(trimmed);
            if (open.matches()) {
                openId = open.group(1);
                openLine = i;
                attributes = new ArrayList<>();
                continue;
            }
            final Matcher relationship = RELATIONSHIP.matcher(trimmed);
            if (relationship.matches()) {
                final String connector = relationship.group(2).trim();
                relationships.add(new ErDiagram.Relationship(
                        relationship.group(1), relationship.group(3), connector,
                        ErDiagram.Cardinality.parse(connector),
                        unquote(relationship.group(4)), i));
            }
        }
        if (openId != null) {
            LOG.debug("Entity {} has no closing brace", openId);
            entities.putIfAbsent(openId, new ErDiagram.Entity(openId,
                    List.copyOf(attributes), openLine, lines.size() - 1));
        }

        for (final ErDiagram.Relationship relationship : relationships) {
            entities.putIfAbsent(relationship.source(), new ErDiagram.Entity(
                    relationship.source(), List.of(), -1, -1));
            entities.putIfAbsent(relationship.target(), new ErDiagram.Entity(
                    relationship.target(), List.of(), -1, -1));
        }
        return new ErDiagram(List.copyOf(entities.values()),
                List.copyOf(relationships));
    }

    @Override
    public String addNode(final String code, final NodeDraft draft) {
        if (draft == null || isBlank(draft.id())) {
            return code;
        }
        final String id = draft.id().trim();
        if (parse(code).find(id).filter(ErDiagram.Entity::isDeclared)
                .isPresent()) {
            return code;
        }
        LOG.debug("Adding entity {}", id);
        return appendBlock(code, id, draft.hasMembers()
                ? draft.members() : List.of());
    }

    /**
     * Renames an entity and/or replaces its attributes.
     *
     * <p>The draft label is the new name. Attributes are replaced only when
     * the draft carries members.</p>
     */
    @Override
    public String updateNode(final String code, final String id,
            final NodeDraft draft) {
        if (draft == null) {
            return code;
        }
        final ErDiagram diagram = parse(code);
        final Optional<ErDiagram.Entity> found = diagram.find(id);
        if (found.isEmpty()) {
            return code;
        }
        final String name = isBlank(draft.label()) ? id : draft.label().trim();
        final List<String> lines = SourceLines.split(code);

        if (!name.equals(id)) {
            for (final ErDiagram.Relationship relationship
                    : diagram.relationships()) {
                lines.set(relationship.lineIndex(), renameEnds(
                        lines.get(relationship.lineIndex()), id, name));
            }
        }

        final ErDiagram.Entity entity = found.get();
        if (!entity.isDeclared()) {
            final String renamed = SourceLines.join(lines);
            return draft.hasMembers()
                    ? appendBlock(renamed, name, draft.members()) : renamed;
        }

        final String indent = SourceLines.indentOf(lines.get(entity.lineIndex()));
        final List<String> block = new ArrayList<>();
        block.add(indent + name + " {");
        if (draft.hasMembers()) {
            for (final String attribute : draft.members()) {
                block.add(indent + INDENT + attribute.trim());
            }
        } else {
            block.addAll(lines.subList(entity.lineIndex() + 1, entity.endLine()));
        }
        block.add(lines.get(entity.endLine()));

        final List<String> result = new ArrayList<>(
                lines.subList(0, entity.lineIndex()));
        result.addAll(block);
        result.addAll(lines.subList(entity.endLine() + 1, lines.size()));
        return SourceLines.join(result);
    }

    @Override
    public String removeNode(final String code, final String id) {
        final ErDiagram diagram = parse(code);
        final Set<Integer> drop = new HashSet<>();
        diagram.find(id).filter(ErDiagram.Entity::isDeclared)
                .ifPresent(entity -> {
                    for (int i = entity.lineIndex(); i <= entity.endLine(); i++) {
                        drop.add(i);
                    }
                });
        for (final ErDiagram.Relationship relationship : diagram.relationships()) {
            if (relationship.source().equals(id)
                    || relationship.target().equals(id)) {
                drop.add(relationship.lineIndex());
            }
        }
        LOG.debug("Removing entity {} ({} lines)", id, drop.size());
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
        final Optional<ErDiagram.Relationship> found = find(code, source, target);
        if (found.isEmpty()) {
            return code;
        }
        final ErDiagram.Relationship relationship = found.get();
        final List<String> lines = SourceLines.split(code);
        final String indent = SourceLines.indentOf(
                lines.get(relationship.lineIndex()));
        final String connector = draft == null || draft.type() == null
                ? relationship.connector() : draft.type();
        final String label = draft == null || draft.label() == null
                ? relationship.label() : draft.label();
        lines.set(relationship.lineIndex(),
                indent + line(source, target, connector, label));
        return SourceLines.join(lines);
    }

    /** Removes the relationship written in exactly this direction. */
    @Override
    public String removeEdge(final String code, final String source,
            final String target) {
        final Set<Integer> drop = new HashSet<>();
        for (final ErDiagram.Relationship relationship
                : parse(code).relationships()) {
            if (relationship.source().equals(source)
                    && relationship.target().equals(target)) {
                drop.add(relationship.lineIndex());
            }
        }
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String nodeNoun() {
        return "entity";
    }

    @Override
    public String edgeNoun() {
        return "relationship";
    }

    private Optional<ErDiagram.Relationship> find(final String code,
            final String source, final String target) {
        return parse(code).relationships().stream()
                .filter(r -> r.source().equals(source)
                        && r.target().equals(target))
                .findFirst();
    }

    private static String appendBlock(final String code, final String name,
            final List<String> attributes) {
        String result = SourceLines.append(code, INDENT + name + " {");
        for (final String attribute : attributes) {
            result = SourceLines.append(result, ATTRIBUTE_INDENT + attribute.trim());
        }
        return SourceLines.append(result, INDENT + "}");
    }

    /** Renames the entity ends of a relationship line, never its label. */
    private static String renameEnds(final String line, final String from,
            final String to) {
        final String indent = SourceLines.indentOf(line);
        final Matcher matcher = RELATIONSHIP.matcher(line.trim());
        if (!matcher.matches()) {
            return line;
        }
        final String body = line.trim();
        final StringBuilder renamed = new StringBuilder(indent);
        renamed.append(matcher.group(1).equals(from) ? to : matcher.group(1));
        renamed.append(body, matcher.end(1), matcher.start(3));
        renamed.append(matcher.group(3).equals(from) ? to : matcher.group(3));
        renamed.append(body.substring(matcher.end(3)));
        return renamed.toString();
    }

    private static String line(final String source, final String target,
            final String connector, final String label) {
        final String text = isBlank(label) ? DEFAULT_LABEL : label.trim();
        return source + " " + (isBlank(connector) ? DEFAULT_CONNECTOR
                : connector.trim()) + " " + target + " : " + quoteIfNeeded(text);
    }

    private static String quoteIfNeeded(final String label) {
        if (label.startsWith("\"") || !label.matches(".*\\s.*")) {
            return label;
        }
        return "\"" + label.replace("\"", "'") + "\"";
    }

    private static String unquote(final String label) {
        if (label == null) {
            return "";
        }
        final String trimmed = label.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"")
                && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

}
