package co.fanki.diagrameditor.dialect.domain.state;

import co.fanki.diagrameditor.shared.DomainException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts between XState machine configurations and state diagrams.
 *
 * <p>Only the flat part of a machine is carried: the initial state, each
 * state's description, its {@code on} events and the {@code final}
 * type. Nested machines, guards and actions are dropped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class XStateConverter {

    private static final Logger LOG = LoggerFactory.getLogger(
            XStateConverter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String HEADER = "stateDiagram-v2";

    private static final String INDENT = "    ";

    private XStateConverter() {
    }

    /**
     * Writes a state diagram for a machine given as JSON text.
     *
     * @param json the machine configuration
     * @return the diagram text, left to right
     * @throws DomainException when the text is not JSON
     */
    public static String toStateDiagram(final String json) {
        try {
            return toStateDiagram(MAPPER.readTree(json));
        } catch (final JsonProcessingException e) {
            throw new DomainException("Invalid XState JSON: "
                    + e.getOriginalMessage(), "INVALID_REQUEST");
        }
    }

    /**
     * Writes a state diagram for a machine.
     *
     * <p>State ids lose whitespace and punctuation. An event whose target
     * is a list uses the first entry. A machine that is not a JSON object
     * yields an empty diagram.</p>
     *
     * @param machine the machine configuration
     * @return the diagram text, left to right
     */
    public static String toStateDiagram(final JsonNode machine) {
        final List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add(INDENT + "direction LR");
        if (machine == null || !machine.isObject()) {
            LOG.debug("Machine is not an object, writing an empty diagram");
            return String.join("\n", lines);
        }
        final String initial = sanitize(machine.path("initial").asText(""));
        if (!initial.isEmpty()) {
            lines.add(INDENT + StateDiagram.TERMINAL + " --> " + initial);
        }
        final Iterator<Map.Entry<String, JsonNode>> states =
                machine.path("states").fields();
        while (states.hasNext()) {
            final Map.Entry<String, JsonNode> state = states.next();
            final String id = sanitize(state.getKey());
            if (id.isEmpty()) {
                continue;
            }
            final JsonNode definition = state.getValue();
            final String description = definition.path("description").asText("");
            if (!description.isEmpty()) {
                lines.add(INDENT + "state \"" + description.replace("\"", "'")
                        + "\" as " + id);
            }
            final Iterator<Map.Entry<String, JsonNode>> events =
                    definition.path("on").fields();
            while (events.hasNext()) {
                final Map.Entry<String, JsonNode> event = events.next();
                final String target = sanitize(targetOf(event.getValue()));
                if (!target.isEmpty()) {
                    lines.add(INDENT + id + " --> " + target + " : "
                            + event.getKey());
                }
            }
            if ("final".equals(definition.path("type").asText())) {
                lines.add(INDENT + id + " --> " + StateDiagram.TERMINAL);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Builds the machine configuration of a state diagram.
     *
     * <p>The transition from {@code [*]} sets the initial state and a
     * transition to {@code [*]} marks its source as final. Unlabelled
     * transitions get a {@code TO_<TARGET>} event.</p>
     *
     * @param diagram the parsed diagram
     * @return the machine, with id {@code machine}
     */
    public static ObjectNode toMachine(final StateDiagram diagram) {
        final ObjectNode machine = MAPPER.createObjectNode();
        machine.put("id", "machine");
        machine.put("initial", "");
        final ObjectNode states = machine.putObject("states");
        for (final StateDiagram.State state : diagram.states()) {
            stateNode(states, state.id());
        }
        for (final StateDiagram.Transition transition : diagram.transitions()) {
            final boolean fromStart =
                    StateDiagram.TERMINAL.equals(transition.source());
            final boolean toEnd =
                    StateDiagram.TERMINAL.equals(transition.target());
            if (fromStart && toEnd) {
                continue;
            }
            if (fromStart) {
                machine.put("initial", transition.target());
                stateNode(states, transition.target());
            } else if (toEnd) {
                stateNode(states, transition.source()).put("type", "final");
            } else {
                stateNode(states, transition.target());
                final String event = transition.label().isBlank()
                        ? "TO_" + transition.target().toUpperCase(Locale.ROOT)
                        : transition.label();
                ((ObjectNode) stateNode(states, transition.source()).get("on"))
                        .put(event, transition.target());
            }
        }
        return machine;
    }

    private static ObjectNode stateNode(final ObjectNode states,
            final String id) {
        if (!states.has(id)) {
            states.putObject(id).putObject("on");
        }
        return (ObjectNode) states.get(id);
    }

    private static String targetOf(final JsonNode value) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isArray()) {
            return value.size() == 0 ? "" : targetOf(value.get(0));
        }
        return value.path("target").asText("");
    }

    private static String sanitize(final String id) {
        return id.replaceAll("\\s+", "_").replaceAll("[^a-zA-Z0-9_]", "");
    }

}
