package co.fanki.diagrameditor.dialect.domain.state;

import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link StateDiagramAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StateDiagramAdapterTest {

    private static final String CODE = String.join("\n",
            "stateDiagram-v2",
            "    direction TB",
            "    [*] --> Idle",
            "    state \"Running fast\" as Running",
            "    Idle --> Running : start",
            "    Running --> [*]",
            "    note right of Idle",
            "        waiting",
            "    end note");

    private final StateDiagramAdapter adapter = new StateDiagramAdapter();

    @Test
    void whenParsing_givenAliasAndNote_shouldSkipNoteBody() {
        final StateDiagram diagram = adapter.parse(CODE);

        assertEquals("TB", diagram.direction());
        assertEquals(List.of("Running", "Idle"), diagram.states().stream()
                .map(StateDiagram.State::id).toList());
        assertEquals("Running fast", diagram.find("Running").get().label());
        assertEquals(-1, diagram.find("Idle").get().lineIndex());
        assertEquals(3, diagram.transitions().size());
        assertEquals("start", diagram.transitions().get(1).label());
    }

    @Test
    void whenBuildingView_givenTerminals_shouldSplitIntoStartAndEnd() {
        final StateDiagramView view = adapter.view(CODE);

        assertTrue(view.hasInitial());
        assertTrue(view.hasFinal());
        assertEquals(StateDiagramView.INITIAL, view.states().get(0).id());
        assertEquals(StateDiagramView.FINAL, view.states().get(1).id());
        assertEquals(StateDiagramView.INITIAL,
                view.transitions().get(0).source());
        assertEquals(StateDiagramView.FINAL,
                view.transitions().get(2).target());
        assertEquals("TB", view.direction());
    }

    @Test
    void whenBuildingView_givenNoDirection_shouldDefaultToLeftToRight() {
        final StateDiagramView view = adapter.view("stateDiagram-v2\n    A --> B");

        assertEquals("LR", view.direction());
        assertFalse(view.hasInitial());
    }

    @Test
    void whenAddingNode_givenBlankId_shouldGenerateOne() {
        final String result = adapter.addNode(CODE,
                NodeDraft.of(null, "Waiting"));

        assertEquals(CODE + "\n    state \"Waiting\" as S1", result);
    }

    @Test
    void whenUpdatingNode_givenAliasDeclaration_shouldRewriteIt() {
        final String result = adapter.updateNode(CODE, "Running",
                NodeDraft.of("Running", "Sprinting"));

        assertTrue(result.contains("\n    state \"Sprinting\" as Running\n"));
    }

    @Test
    void whenUpdatingNode_givenImplicitState_shouldDeclareAfterHeader() {
        final String result = adapter.updateNode(CODE, "Idle",
                NodeDraft.of("Idle", "Resting"));

        assertTrue(result.startsWith(
                "stateDiagram-v2\n    state \"Resting\" as Idle\n"));
        assertEquals("Resting", adapter.parse(result).find("Idle").get().label());
    }

    @Test
    void whenRemovingNode_shouldDropDeclarationAndTransitions() {
        final String result = adapter.removeNode(CODE, "Running");

        assertEquals(String.join("\n",
                "stateDiagram-v2",
                "    direction TB",
                "    [*] --> Idle",
                "    note right of Idle",
                "        waiting",
                "    end note"), result);
    }

    @Test
    void whenRemovingNode_givenCompositeState_shouldDropItsBlock() {
        final String code = String.join("\n",
                "stateDiagram-v2",
                "    state Busy {",
                "        A --> B",
                "    }",
                "    Busy --> Done");

        assertEquals("stateDiagram-v2", adapter.removeNode(code, "Busy"));
    }

    @Test
    void whenSettingDirection_givenExistingLine_shouldReplaceIt() {
        final String result = adapter.setDirection(CODE, "lr");

        assertTrue(result.contains("\n    direction LR\n"));
        assertFalse(result.contains("direction TB"));
    }

    @Test
    void whenSettingDirection_givenNoLine_shouldInsertAfterHeader() {
        assertEquals("stateDiagram-v2\n    direction BT\n    A --> B",
                adapter.setDirection("stateDiagram-v2\n    A --> B", "BT"));
    }

    @Test
    void whenSettingDirection_givenInvalidValue_shouldReturnInput() {
        assertSame(CODE, adapter.setDirection(CODE, "up"));
    }

    @Test
    void whenUpdatingEdge_givenLabel_shouldRewriteTransition() {
        final String result = adapter.updateEdge(CODE, "Idle", "Running",
                new EdgeDraft(null, null, null, "go"));

        assertTrue(result.contains("\n    Idle --> Running : go\n"));
    }

    @Test
    void whenAddingThenRemovingEdge_shouldRestoreText() {
        final String added = adapter.addEdge(CODE,
                new EdgeDraft("Running", "Idle", null, "pause"));

        assertTrue(added.endsWith("\n    Running --> Idle : pause"));
        assertEquals(CODE, adapter.removeEdge(added, "Running", "Idle"));
    }

}
