package co.fanki.diagrameditor.dialect.domain.state;

import co.fanki.diagrameditor.shared.DomainException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link XStateConverter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class XStateConverterTest {

    private static final String MACHINE = "{"
            + "\"id\": \"light\","
            + "\"initial\": \"green\","
            + "\"states\": {"
            + "  \"green\": {\"description\": \"Go ahead\","
            + "    \"on\": {\"TIMER\": \"yellow\"}},"
            + "  \"yellow\": {\"on\": {\"TIMER\": [{\"target\": \"red\"}],"
            + "    \"FAIL\": {\"target\": \"broken down\"}}},"
            + "  \"red\": {\"on\": {\"TIMER\": \"green\", \"STOP\": {}}},"
            + "  \"broken down\": {\"type\": \"final\"}"
            + "}}";

    private final StateDiagramAdapter adapter = new StateDiagramAdapter();

    @Test
    void whenImportingMachine_givenEventShapes_shouldWriteEachTransition() {
        assertEquals(String.join("\n",
                "stateDiagram-v2",
                "    direction LR",
                "    [*] --> green",
                "    state \"Go ahead\" as green",
                "    green --> yellow : TIMER",
                "    yellow --> red : TIMER",
                "    yellow --> broken_down : FAIL",
                "    red --> green : TIMER",
                "    broken_down --> [*]"),
                XStateConverter.toStateDiagram(MACHINE));
    }

    @Test
    void whenImportingMachine_givenNonObject_shouldWriteEmptyDiagram() {
        assertEquals("stateDiagram-v2\n    direction LR",
                XStateConverter.toStateDiagram("[1, 2]"));
    }

    @Test
    void whenImportingMachine_givenMalformedJson_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> XStateConverter.toStateDiagram("{\"states\": "));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenExportingMachine_givenTerminals_shouldSetInitialAndFinal() {
        final ObjectNode machine = XStateConverter.toMachine(adapter.parse(
                String.join("\n",
                        "stateDiagram-v2",
                        "    [*] --> Idle",
                        "    Idle --> Running : start",
                        "    Running --> Idle",
                        "    Running --> [*]")));

        assertEquals("machine", machine.get("id").asText());
        assertEquals("Idle", machine.get("initial").asText());
        assertEquals("Running", machine.at("/states/Idle/on/start").asText());
        assertEquals("Idle", machine.at("/states/Running/on/TO_IDLE").asText());
        assertEquals("final", machine.at("/states/Running/type").asText());
        assertFalse(machine.at("/states/Idle").has("type"));
    }

    @Test
    void whenRoundTripping_givenImportedMachine_shouldKeepTransitions() {
        final ObjectNode machine = XStateConverter.toMachine(adapter.parse(
                XStateConverter.toStateDiagram(MACHINE)));

        assertEquals("green", machine.get("initial").asText());
        assertEquals("red", machine.at("/states/yellow/on/TIMER").asText());
        assertEquals("final", machine.at("/states/broken_down/type").asText());
    }

}
