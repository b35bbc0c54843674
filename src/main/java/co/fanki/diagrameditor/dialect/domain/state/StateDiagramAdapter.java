package co.fanki.diagrameditor.dialect.domain.state;

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
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and edits state diagrams.
 *
 * <p>A state is declared by any of {@code state "Label" as id},
 * {@code state id}, {@code id : description} or a bare {@code id} line.
 * Composite states (<code>state id {</code>) are read as declarations; their
 * inner lines are read like top level ones.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StateDiagramAdapter implements DiagramAdapter<StateDiagram> {

    private static final Logger LOG = LoggerFactory.getLogger(
            StateDiagramAdapter.class);

    private static final String INDENT = "    ";

    private static final Pattern DIRECTION = Pattern.compile(
            "^direction\\s+(TB|TD|BT|RL|LR)\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRANSITION = Pattern.compile(
            "^(\\[\\*\\]|\\w+)\\s*-->\\s*(\\[\\*\\]|\\w+)(?:\\s*:\\s*(.*))?$");

    private static final Pattern STATE_ALIAS = Pattern.compile(
            "^state\\s+\"([^\"]*)\"\\s+as\\s+(\\w+)\\s*(\\{)?\\s*$");

    private static final Pattern STATE_PLAIN = Pattern.compile(
            "^state\\s+(\\w+)(?:\\s*<<\\w+>>)?\\s*(\\{)?\\s*$");

    private static final Pattern DESCRIPTION =
            Pattern.compile("^(\\w+)\\s*:\\s*(.+)$");

    private static final Pattern BARE = Pattern.compile("^(\\w+)$");

    private static final Pattern NOTE_BLOCK =
            Pattern.compile("^note\\s+(?:left|right)\\s+of\\s+\\w+\\s*$");

    /**
     * A declaration found on one line.
     *
     * @param id the declared state
     * @param label the label it gives, the id when none
     * @param opensBlock whether the line opens a composite state
     */
    private record Declaration(String id, String label, boolean opensBlock) {}

    @Override
    public DiagramType type() {
        return DiagramType.STATE;
    }

    @Override
    public StateDiagram parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final Map<String, StateDiagram.State> states = new LinkedHashMap<>();
        final List<StateDiagram.Transition> transitions = new ArrayList<>();
        String direction = null;

        boolean inNote = false;
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (inNote) {
                inNote = !trimmed.equals("end note");
                continue;
            }
            if (isSkipped(trimmed)) {
                continue;
            }
            if (NOTE_BLOCK.matcher(trimmed).matches()) {
                inNote = true;
                continue;
            }
            if (trimmed.startsWith("note ")) {
                continue;
            }
            final Matcher directionMatcher = DIRECTION.matcher(trimmed);
            if (directionMatcher.matches()) {
                direction = directionMatcher.group(1).toUpperCase(Locale.ROOT);
                continue;
            }
            final Matcher transition = TRANSITION.matcher(trimmed);
            if (transition.matches()) {
                transitions.add(new StateDiagram.Transition(transition.group(1),
                        transition.group(2), transition.group(3) == null
                                ? "" : transition.group(3).trim(), i));
                continue;
            }
            final Declaration declaration = declaration(trimmed);
            if (declaration != null) {
                final StateDiagram.State known = states.get(declaration.id());
                if (known == null) {
                    states.put(declaration.id(), new StateDiagram.State(
                            declaration.id(), declaration.label(), i));
                } else if (known.label().equals(known.id())
                        && !declaration.label().equals(declaration.id())) {
                    states.put(known.id(), new StateDiagram.State(known.id(),
                            declaration.label(), known.lineIndex()));
                }
            }
        }

        for (final StateDiagram.Transition transition : transitions) {
            for (final String end : List.of(transition.source(),
                    transition.target())) {
                if (!end.equals(StateDiagram.TERMINAL)) {
                    states.putIfAbsent(end, new StateDiagram.State(end, end, -1));
                }
            }
        }
        return new StateDiagram(List.copyOf(states.values()),
                List.copyOf(transitions), direction);
    }

    /**
     * Builds the rendering view of a diagram.
     *
     * @param code the diagram text
     * @return the view with explicit start and end states
     */
    public StateDiagramView view(final String code) {
        return StateDiagramView.of(parse(code));
    }

    /**
     * Returns the first free id among S1, S2, ...
     *
     * @param code the diagram text
     * @return an unused state id
     */
    public String generateStateId(final String code) {
        final StateDiagram diagram = parse(code);
        int n = 1;
        while (diagram.find("S" + n).isPresent()) {
            n++;
        }
        return "S" + n;
    }

    /**
     * Sets the layout direction, replacing an existing directive or
     * inserting one right after the header.
     *
     * @param code the diagram text
     * @param direction one of TB, TD, BT, RL, LR
     * @return the new text, the same text for an unknown direction
     */
    public String setDirection(final String code, final String direction) {
        if (direction == null || !DIRECTION.matcher("direction " + direction)
                .matches()) {
            return code;
        }
        final String value = direction.trim().toUpperCase(Locale.ROOT);
        final List<String> lines = SourceLines.split(code);
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            if (DIRECTION.matcher(lines.get(i).trim()).matches()) {
                lines.set(i, SourceLines.indentOf(lines.get(i))
                        + "direction " + value);
                return SourceLines.join(lines);
            }
        }
        lines.add(headerEnd(lines), INDENT + "direction " + value);
        return SourceLines.join(lines);
    }

    /** Adds a state; a blank id gets the first free S1, S2, ... */
    @Override
    public String addNode(final String code, final NodeDraft draft) {
        if (draft == null) {
            return code;
        }
        final String id = draft.id() == null || draft.id().isBlank()
                ? generateStateId(code) : draft.id().trim();
        if (parse(code).find(id).filter(s -> s.lineIndex() >= 0).isPresent()) {
            return code;
        }
        LOG.debug("Adding state {}", id);
        return SourceLines.append(code, INDENT + declarationLine(id,
                draft.label()));
    }

    @Override
    public String updateNode(final String code, final String id,
            final NodeDraft draft) {
        if (draft == null || draft.label() == null) {
            return code;
        }
        final StateDiagram diagram = parse(code);
        if (diagram.find(id).isEmpty()) {
            return code;
        }
        final String label = draft.label().trim();
        final List<String> lines = SourceLines.split(code);
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            final Declaration declaration = isSkipped(trimmed)
                    || TRANSITION.matcher(trimmed).matches()
                    ? null : declaration(trimmed);
            if (declaration == null || !declaration.id().equals(id)) {
                continue;
            }
            final String indent = SourceLines.indentOf(lines.get(i));
            if (DESCRIPTION.matcher(trimmed).matches()) {
                lines.set(i, indent + id + " : " + label);
            } else {
                lines.set(i, indent + declarationLine(id, label)
                        + (declaration.opensBlock() ? " {" : ""));
            }
            return SourceLines.join(lines);
        }
        lines.add(headerEnd(lines), INDENT + declarationLine(id, label));
        return SourceLines.join(lines);
    }

    @Override
    public String removeNode(final String code, final String id) {
        final List<String> lines = SourceLines.split(code);
        final Set<Integer> drop = new HashSet<>();
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            final Matcher transition = TRANSITION.matcher(trimmed);
            if (transition.matches()) {
                if (transition.group(1).equals(id)
                        || transition.group(2).equals(id)) {
                    drop.add(i);
                }
                continue;
            }
            final Declaration declaration = isSkipped(trimmed)
                    ? null : declaration(trimmed);
            if (declaration == null || !declaration.id().equals(id)) {
                continue;
            }
            drop.add(i);
            if (declaration.opensBlock()) {
                int depth = 1;
                int j = i + 1;
                while (j < lines.size() && depth > 0) {
                    final String inner = lines.get(j).trim();
                    if (inner.endsWith("{")) {
                        depth++;
                    } else if (inner.equals("}")) {
                        depth--;
                    }
                    drop.add(j);
                    j++;
                }
                i = j - 1;
            }
        }
        LOG.debug("Removing state {} ({} lines)", id, drop.size());
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String addEdge(final String code, final EdgeDraft draft) {
        if (draft == null || isBlank(draft.source()) || isBlank(draft.target())) {
            return code;
        }
        return SourceLines.append(code, INDENT + transitionLine(
                draft.source().trim(), draft.target().trim(), draft.label()));
    }

    /** Changes the event text of the first matching transition. */
    @Override
    public String updateEdge(final String code, final String source,
            final String target, final EdgeDraft draft) {
        for (final StateDiagram.Transition transition : parse(code).transitions()) {
            if (transition.source().equals(source)
                    && transition.target().equals(target)) {
                final List<String> lines = SourceLines.split(code);
                final String label = draft == null || draft.label() == null
                        ? transition.label() : draft.label();
                lines.set(transition.lineIndex(),
                        SourceLines.indentOf(lines.get(transition.lineIndex()))
                                + transitionLine(source, target, label));
                return SourceLines.join(lines);
            }
        }
        return code;
    }

    @Override
    public String removeEdge(final String code, final String source,
            final String target) {
        final Set<Integer> drop = new HashSet<>();
        for (final StateDiagram.Transition transition : parse(code).transitions()) {
            if (transition.source().equals(source)
                    && transition.target().equals(target)) {
                drop.add(transition.lineIndex());
            }
        }
        return SourceLines.removeLines(code, drop);
    }

    @Override
    public String nodeNoun() {
        return "state";
    }

    @Override
    public String edgeNoun() {
        return "transition";
    }

    private static Declaration declaration(final String trimmed) {
        Matcher matcher = STATE_ALIAS.matcher(trimmed);
        if (matcher.matches()) {
            return new Declaration(matcher.group(2), matcher.group(1),
                    matcher.group(3) != null);
        }
        matcher = STATE_PLAIN.matcher(trimmed);
        if (matcher.matches()) {
            return new Declaration(matcher.group(1), matcher.group(1),
                    matcher.group(2) != null);
        }
        matcher = DESCRIPTION.matcher(trimmed);
        if (matcher.matches()) {
            return new Declaration(matcher.group(1), matcher.group(2).trim(),
                    false);
        }
        matcher = BARE.matcher(trimmed);
        if (matcher.matches()) {
            return new Declaration(matcher.group(1), matcher.group(1), false);
        }
        return null;
    }

    private static boolean isSkipped(final String trimmed) {
        return trimmed.isEmpty()
                || trimmed.startsWith("%%")
                || trimmed.startsWith("stateDiagram")
                || trimmed.equals("}")
                || trimmed.equals("--")
                || trimmed.startsWith("classDef ")
                || trimmed.startsWith("class ")
                || trimmed.startsWith("style ");
    }

    /** Index right after the header line, or after front matter. */
    private static int headerEnd(final List<String> lines) {
        final int start = SourceLines.frontMatterEnd(lines);
        for (int i = start; i < lines.size(); i++) {
            if (lines.get(i).trim().startsWith("stateDiagram")) {
                return i + 1;
            }
        }
        return start;
    }

    private static String declarationLine(final String id, final String label) {
        if (isBlank(label) || label.trim().equals(id)) {
            return id;
        }
        return "state \"" + label.trim().replace("\"", "'") + "\" as " + id;
    }

    private static String transitionLine(final String source,
            final String target, final String label) {
        final String line = source + " --> " + target;
        return isBlank(label) ? line : line + " : " + label.trim();
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

}
