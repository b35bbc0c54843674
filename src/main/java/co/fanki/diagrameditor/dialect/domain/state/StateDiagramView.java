package co.fanki.diagrameditor.dialect.domain.state;

import java.util.ArrayList;
import java.util.List;

/**
 * A state diagram ready for rendering: {@code [*]} endpoints become the
 * {@link #INITIAL} and {@link #FINAL} states and the direction is always
 * set.
 *
 * @param states the states, the pseudo states first when used
 * @param transitions the transitions with pseudo states substituted
 * @param direction the direction, {@code LR} when none is declared
 * @param hasInitial whether any transition starts at {@code [*]}
 * @param hasFinal whether any transition ends at {@code [*]}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StateDiagramView(List<StateDiagram.State> states,
        List<StateDiagram.Transition> transitions, String direction,
        boolean hasInitial, boolean hasFinal) {

    /** Id of the start pseudo state. */
    public static final String INITIAL = "__initial__";

    /** Id of the end pseudo state. */
    public static final String FINAL = "__final__";

    private static final String DEFAULT_DIRECTION = "LR";

    /**
     * Builds the view of a parsed diagram.
     *
     * @param diagram the diagram, never null
     * @return the view
     */
    public static StateDiagramView of(final StateDiagram diagram) {
        boolean initial = false;
        boolean terminal = false;
        final List<StateDiagram.Transition> transitions = new ArrayList<>();
        for (final StateDiagram.Transition t : diagram.transitions()) {
            final boolean fromStart = t.source().equals(StateDiagram.TERMINAL);
            final boolean toEnd = t.target().equals(StateDiagram.TERMINAL);
            initial |= fromStart;
            terminal |= toEnd;
            transitions.add(new StateDiagram.Transition(
                    fromStart ? INITIAL : t.source(),
                    toEnd ? FINAL : t.target(), t.label(), t.lineIndex()));
        }
        final List<StateDiagram.State> states = new ArrayList<>();
        if (initial) {
            states.add(new StateDiagram.State(INITIAL, "", -1));
        }
        if (terminal) {
            states.add(new StateDiagram.State(FINAL, "", -1));
        }
        states.addAll(diagram.states());
        return new StateDiagramView(List.copyOf(states),
                List.copyOf(transitions),
                diagram.direction() == null
                        ? DEFAULT_DIRECTION : diagram.direction(),
                initial, terminal);
    }

}
