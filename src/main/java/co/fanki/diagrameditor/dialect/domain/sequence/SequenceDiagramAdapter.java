package co.fanki.diagrameditor.dialect.domain.sequence;

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
 * Reads and edits sequence diagrams.
 *
 * <p>Only lines with an arrow count as messages, so block keywords such
 * as {@code loop}, {@code alt} or {@code end} are never mistaken for
 * one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SequenceDiagramAdapter
        implements DiagramAdapter<SequenceDiagram> {

    private static final Logger LOG = LoggerFactory.getLogger(
            SequenceDiagramAdapter.class);

    private static final String INDENT = "    ";

    private static final String DEFAULT_ARROW = "->>";

    private static final Pattern PARTICIPANT = Pattern.compile(
            "^(participant|actor)\\s+(\\w+)(?:\\s+as\\s+(.+))?$");

    private static final Pattern MESSAGE = Pattern.compile(
            "^(\\w+)\\s*(-->>|->>|--x|-x|--\\)|-\\)|-->|->)\\s*[+-]?(\\w+)"
                    + "\\s*(?::\\s*(.*))?$");

    private static final Pattern ACTIVATION =
            Pattern.compile("^(?:activate|deactivate)\\s+(\\w+)\\s*$");

    @Override
    public DiagramType type() {
        return DiagramType.SEQUENCE;
    }

    @Override
    public SequenceDiagram parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final Map<String, SequenceDiagram.Participant> participants =
                new LinkedHashMap<>();
        final List<SequenceDiagram.Message> messages = new ArrayList<>();

        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            final Matcher participant = PARTICIPANT.matcher(trimmed);
            if (participant.matches()) {
                final String id = participant.group(2);
                final String label = participant.group(3) == null
                        ? id : participant.group(3).trim();
                participants.putIfAbsent(id, new SequenceDiagram.Participant(
                        id, label, participant.group(1), i));
                continue;
            }
            final Matcher message = MESSAGE.matcher(trimmed);
            if (message.matches()) {
                messages.add(new SequenceDiagram.Message(message.group(1),
                        message.group(3), message.group(2),
                        message.group(4) == null ? "" : message.group(4).trim(),
                        i));
            }
        }
        for (final SequenceDiagram.Message message : messages) {
            participants.putIfAbsent(message.source(),
                    new SequenceDiagram.Participant(message.source(),
                            message.source(), "participant", -1));
            participants.putIfAbsent(message.target(),
                    new SequenceDiagram.Participant(message.target(),
                            message.target(), "participant", -1));
        }
        return new SequenceDiagram(List.copyOf(participants.values()),
                List.copyOf(messages));
    }

    /**
     * Declares a participant below the existing declarations, or right
     * after the header when there are none. A draft kind of {@code actor}
     * declares an actor.
     */
    @Override
    public String addNode(final String code, final NodeDraft draft) {
        if (draft == null || isBlank(draft.id())) {
            return code;
        }
        final String id = draft.id().trim();
        if (parse(code).find(id).filter(p -> p.lineIndex() >= 0).isPresent()) {
            return code;
        }
        LOG.debug("Adding participant {}", id);
        final List<String> lines = SourceLines.split(code);
        lines.add(insertionPoint(lines), INDENT
                + declaration(typeOf(draft.kind()), id, draft.label()));
        return SourceLines.join(lines);
    }

    @Override
    public String updateNode(final String code, final String id,
            final NodeDraft draft) {
        if (draft == null) {
            return code;
        }
        final Optional<SequenceDiagram.Participant> found = parse(code).find(id);
        if (found.isEmpty()) {
            return code;
        }
        final SequenceDiagram.Participant participant = found.get();
        final String label = draft.label() == null
                ? participant.label() : draft.label();
        final String type = draft.kind() == null
                ? participant.type() : typeOf(draft.kind());
        if (participant.lineIndex() < 0) {
            return addNode(code, new NodeDraft(id, label, null, type, null));
        }
        final List<String> lines = SourceLines.split(code);
        lines.set(participant.lineIndex(),
                SourceLines.indentOf(lines.get(participant.lineIndex()))
                        + declaration(type, id, label));
        return SourceLines.join(lines);
    }

    /** Removes the declaration, activations and every message involved. */
    @Override
    public String removeNode(final String code, final String id) {
        final SequenceDiagram diagram = parse(code);
        final Set<Integer> drop = new HashSet<>();
        diagram.find(id).filter(p -> p.lineIndex() >= 0)
                .ifPresent(p -> drop.add(p.lineIndex()));
        for (final SequenceDiagram.Message message : diagram.messages()) {
            if (message.source().equals(id) || message.target().equals(id)) {
                drop.add(message.lineIndex());
            }
        }
        final List<String> lines = SourceLines.split(code);
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final Matcher activation = ACTIVATION.matcher(lines.get(i).trim());
            if (activation.matches() && activation.group(1).equals(id)) {
                drop.add(i);
            }
        }
        LOG.debug("Removing participant {} ({} lines)", id, drop.size());
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String addEdge(final String code, final EdgeDraft draft) {
        if (draft == null || isBlank(draft.source()) || isBlank(draft.target())) {
            return code;
        }
        return SourceLines.append(code, INDENT + message(draft.source().trim(),
                draft.target().trim(), draft.type(), draft.label()));
    }

    @Override
    public String updateEdge(final String code, final String source,
            final String target, final EdgeDraft draft) {
        for (final SequenceDiagram.Message message : parse(code).messages()) {
            if (message.source().equals(source)
                    && message.target().equals(target)) {
                final String arrow = draft == null || draft.type() == null
                        ? message.arrow() : draft.type();
                final String text = draft == null || draft.label() == null
                        ? message.text() : draft.label();
                final List<String> lines = SourceLines.split(code);
                lines.set(message.lineIndex(),
                        SourceLines.indentOf(lines.get(message.lineIndex()))
                                + message(source, target, arrow, text));
                return SourceLines.join(lines);
            }
        }
        return code;
    }

    @Override
    public String removeEdge(final String code, final String source,
            final String target) {
        final Set<Integer> drop = new HashSet<>();
        for (final SequenceDiagram.Message message : parse(code).messages()) {
            if (message.source().equals(source)
                    && message.target().equals(target)) {
                drop.add(message.lineIndex());
            }
        }
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String nodeNoun() {
        return "participant";
    }

    @Override
    public String edgeNoun() {
        return "message";
    }

    /** After the last declaration, else after the header. */
    private static int insertionPoint(final List<String> lines) {
        final int start = SourceLines.frontMatterEnd(lines);
        int header = -1;
        int last = -1;
        for (int i = start; i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (PARTICIPANT.matcher(trimmed).matches()) {
                last = i;
            } else if (header < 0 && trimmed.startsWith("sequenceDiagram")) {
                header = i;
            }
        }
        if (last >= 0) {
            return last + 1;
        }
        return header >= 0 ? header + 1 : start;
    }

    private static String declaration(final String type, final String id,
            final String label) {
        if (isBlank(label) || label.trim().equals(id)) {
            return type + " " + id;
        }
        return type + " " + id + " as " + label.trim();
    }

    private static String message(final String source, final String target,
            final String arrow, final String text) {
        final String line = source + (isBlank(arrow) ? DEFAULT_ARROW
                : arrow.trim()) + target + ":";
        return isBlank(text) ? line : line + " " + text.trim();
    }

    private static String typeOf(final String kind) {
        return "actor".equalsIgnoreCase(kind) ? "actor" : "participant";
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

}
