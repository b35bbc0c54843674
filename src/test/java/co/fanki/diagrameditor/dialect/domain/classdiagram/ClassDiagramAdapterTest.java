package co.fanki.diagrameditor.dialect.domain.classdiagram;

import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ClassDiagramAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ClassDiagramAdapterTest {

    private static final String CODE = String.join("\n",
            "classDiagram",
            "    class Animal {",
            "        +String name",
            "        +eat()",
            "    }",
            "    class Duck[\"Mallard\"]",
            "    <<interface>> Animal",
            "    Animal <|-- Duck : extends",
            "    Duck --> Pond");

    private final ClassDiagramAdapter adapter = new ClassDiagramAdapter();

    @Test
    void whenParsing_givenBlocksAndRelationships_shouldCollectClasses() {
        final ClassDiagram diagram = adapter.parse(CODE);

        assertEquals(List.of("Animal", "Duck", "Pond"), diagram.classes()
                .stream().map(ClassDiagram.ClassEntry::id).toList());

        final ClassDiagram.ClassEntry animal = diagram.find("Animal").get();
        assertEquals(List.of("+String name", "+eat()"), animal.members());
        assertEquals(List.of("interface"), animal.annotations());
        assertEquals(1, animal.lineIndex());
        assertEquals(4, animal.endLine());

        assertEquals("Mallard", diagram.find("Duck").get().label());
        assertFalse(diagram.find("Pond").get().isDeclared());
    }

    @Test
    void whenParsing_givenInheritance_shouldKeepConnectorAndLabel() {
        final ClassDiagram.Relationship first = adapter.parse(CODE)
                .relationships().get(0);

        assertEquals("Animal", first.source());
        assertEquals("Duck", first.target());
        assertEquals("<|--", first.type());
        assertEquals("extends", first.label());
    }

    @Test
    void whenAddingNode_givenMembers_shouldAppendBlock() {
        final String result = adapter.addNode(CODE, new NodeDraft("Pond", null,
                null, null, List.of("+int depth")));

        assertEquals(CODE + "\n    class Pond {\n        +int depth\n    }",
                result);
        assertTrue(adapter.parse(result).find("Pond").get().isDeclared());
    }

    @Test
    void whenAddingNode_givenDeclaredClass_shouldReturnInput() {
        assertSame(CODE, adapter.addNode(CODE, NodeDraft.of("Duck", "Other")));
    }

    @Test
    void whenUpdatingNode_givenNewLabel_shouldRewriteDeclaration() {
        final String result = adapter.updateNode(CODE, "Duck",
                NodeDraft.of("Duck", "Wild duck"));

        assertTrue(result.contains("\n    class Duck[\"Wild duck\"]\n"));
        assertEquals("Wild duck", adapter.parse(result).find("Duck").get()
                .label());
    }

    @Test
    void whenUpdatingNode_givenNewMembers_shouldReplaceBlockBody() {
        final String result = adapter.updateNode(CODE, "Animal",
                new NodeDraft("Animal", null, null, null, List.of("+sleep()")));

        assertEquals(List.of("+sleep()"),
                adapter.parse(result).find("Animal").get().members());
    }

    @Test
    void whenRemovingNode_shouldDropBlockAnnotationAndRelationships() {
        final String result = adapter.removeNode(CODE, "Animal");

        assertEquals(String.join("\n",
                "classDiagram",
                "    class Duck[\"Mallard\"]",
                "    Duck --> Pond"), result);
    }

    @Test
    void whenRemovingEdge_givenReversedEnds_shouldStillRemoveIt() {
        final String result = adapter.removeEdge(CODE, "Duck", "Animal");

        assertFalse(result.contains("<|--"));
        assertEquals(1, adapter.parse(result).relationships().size());
    }

    @Test
    void whenUpdatingEdge_givenTypeAndLabel_shouldRewriteLine() {
        final String result = adapter.updateEdge(CODE, "Duck", "Pond",
                new EdgeDraft(null, null, "..>", "lives in"));

        assertTrue(result.endsWith("\n    Duck ..> Pond : lives in"));
    }

    @Test
    void whenAddingEdge_givenNoConnector_shouldUseAssociation() {
        final String result = adapter.addEdge(CODE,
                new EdgeDraft("Pond", "Duck", null, null));

        assertEquals(CODE + "\n    Pond --> Duck", result);
    }

    @Test
    void whenAddingThenRemovingNode_shouldRestoreText() {
        final String added = adapter.addNode(CODE, NodeDraft.of("Egg", null));

        assertEquals(CODE, adapter.removeNode(added, "Egg"));
    }

}
