package co.fanki.diagrameditor.dialect.domain.sequence;

import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests for {@link SequenceDiagramAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SequenceDiagramAdapterTest {

    private static final String CODE = String.join("\n",
            "sequenceDiagram",
            "    participant A as Alice",
            "    actor B",
            "    A->>B: Hello",
            "    loop Every minute",
            "        B-->>A: Ping",
            "    end",
            "    activate A",
            "    A-)C: async");

    private final SequenceDiagramAdapter adapter = new SequenceDiagramAdapter();

    @Test
    void whenParsing_givenDeclaredAndImplicitParticipants_shouldListAll() {
        final SequenceDiagram diagram = adapter.parse(CODE);

        assertEquals(List.of("A", "B", "C"), diagram.participants().stream()
                .map(SequenceDiagram.Participant::id).toList());
        assertEquals("Alice", diagram.find("A").get().label());
        assertEquals("actor", diagram.find("B").get().type());
        assertEquals(-1, diagram.find("C").get().lineIndex());
    }

    @Test
    void whenParsing_givenArrowVariants_shouldReadEachMessage() {
        final List<SequenceDiagram.Message> messages =
                adapter.parse(CODE).messages();

        assertEquals(3, messages.size());
        assertEquals("->>", messages.get(0).arrow());
        assertEquals("Hello", messages.get(0).text());
        assertEquals("-->>", messages.get(1).arrow());
        assertEquals("-)", messages.get(2).arrow());
        assertEquals("C", messages.get(2).target());
    }

    @Test
    void whenAddingNode_givenActorKind_shouldInsertAfterLastDeclaration() {
        final String result = adapter.addNode(CODE,
                new NodeDraft("D", "Dave", null, "actor", null));

        assertEquals(String.join("\n",
                "sequenceDiagram",
                "    participant A as Alice",
                "    actor B",
                "    actor D as Dave",
                "    A->>B: Hello",
                "    loop Every minute",
                "        B-->>A: Ping",
                "    end",
                "    activate A",
                "    A-)C: async"), result);
    }

    @Test
    void whenUpdatingNode_givenImplicitParticipant_shouldDeclareIt() {
        final String result = adapter.updateNode(CODE, "C",
                NodeDraft.of("C", "Carol"));

        assertEquals("Carol", adapter.parse(result).find("C").get().label());
        assertEquals(3, adapter.parse(result).find("C").get().lineIndex());
    }

    @Test
    void whenRemovingNode_shouldDropMessagesAndActivations() {
        final String result = adapter.removeNode(CODE, "A");

        assertEquals(String.join("\n",
                "sequenceDiagram",
                "    actor B",
                "    loop Every minute",
                "    end"), result);
    }

    @Test
    void whenUpdatingEdge_givenArrowOnly_shouldKeepText() {
        final String result = adapter.updateEdge(CODE, "A", "B",
                new EdgeDraft(null, null, "-->>", null));

        assertEquals("A-->>B: Hello", result.split("\n")[3].trim());
    }

    @Test
    void whenAddingEdge_givenNoArrow_shouldUseSolidArrow() {
        final String result = adapter.addEdge(CODE,
                new EdgeDraft("B", "A", null, "Thanks"));

        assertEquals(CODE + "\n    B->>A: Thanks", result);
    }

    @Test
    void whenRemovingEdge_givenUnknownPair_shouldReturnInput() {
        assertSame(CODE, adapter.removeEdge(CODE, "C", "A"));
    }

}
