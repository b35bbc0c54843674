package co.fanki.diagrameditor.dialect.domain.state;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;
import java.util.Optional;

/**
 * A parsed state diagram.
 *
 * <p>Transitions keep {@code [*]} as written; {@link StateDiagramView}
 * turns them into explicit start and end states.</p>
 *
 * @param states the states, declared ones first
 * @param transitions the transitions in source order
 * @param direction the declared direction, null when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StateDiagram(List<State> states, List<Transition> transitions,
        String direction) implements DiagramModel {

    /** The pseudo state that marks start and end points. */
    public static final String TERMINAL = "[*]";

    /**
     * A state.
     *
     * @param id the state id
     * @param label the description, the id when none is given
     * @param lineIndex the first declaring line, -1 when only referenced
     */
    public record State(String id, String label, int lineIndex) {}

    /**
     * A transition.
     *
     * @param source the source state or {@code [*]}
     * @param target the target state or {@code [*]}
     * @param label the event text, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Transition(String source, String target, String label,
            int lineIndex) {}

    /**
     * Finds a state by id.
     *
     * @param id the state id
     * @return the state, if present
     */
    public Optional<State> find(final String id) {
        return states.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    @Override
    public List<DiagramNode> elements() {
        return states.stream()
                .map(s -> new DiagramNode(s.id(), s.label(), "state",
                        s.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return transitions.stream()
                .map(t -> new DiagramLink(t.source(), t.target(), "-->",
                        t.label(), t.lineIndex()))
                .toList();
    }

}
