package co.fanki.diagrameditor.dialect.domain.er;

import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ErDiagramAdapter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ErDiagramAdapterTest {

    private static final String CODE = String.join("\n",
            "erDiagram",
            "    CUSTOMER {",
            "        string email UK \"login\"",
            "        int id PK",
            "    }",
            "    CUSTOMER ||--o{ ORDER : places",
            "    ORDER }|..|{ LINE_ITEM : \"contains many\"");

    private final ErDiagramAdapter adapter = new ErDiagramAdapter();

    @Test
    void whenParsing_givenEntityBlock_shouldReadAttributes() {
        final ErDiagram diagram = adapter.parse(CODE);

        assertEquals(List.of("CUSTOMER", "ORDER", "LINE_ITEM"),
                diagram.entities().stream().map(ErDiagram.Entity::id).toList());

        final ErDiagram.Entity customer = diagram.find("CUSTOMER").get();
        assertEquals(1, customer.lineIndex());
        assertEquals(4, customer.endLine());
        assertEquals("email", customer.attributes().get(0).name());
        assertEquals("UK", customer.attributes().get(0).constraint());
        assertEquals("PK", customer.attributes().get(1).constraint());
        assertFalse(diagram.find("ORDER").get().isDeclared());
    }

    @Test
    void whenParsing_givenConnectors_shouldSplitCardinality() {
        final List<ErDiagram.Relationship> relationships =
                adapter.parse(CODE).relationships();

        final ErDiagram.Cardinality places = relationships.get(0).cardinality();
        assertEquals("||", places.source());
        assertEquals("o{", places.target());
        assertTrue(places.identifying());

        final ErDiagram.Relationship contains = relationships.get(1);
        assertEquals("}|", contains.cardinality().source());
        assertEquals("|{", contains.cardinality().target());
        assertFalse(contains.cardinality().identifying());
        assertEquals("contains many", contains.label());
    }

    @Test
    void whenParsingAttribute_givenUnknownConstraint_shouldLeaveItNull() {
        final ErDiagram.Attribute attribute =
                ErDiagram.Attribute.parse("string name \"comment\"");

        assertEquals("string", attribute.type());
        assertEquals("name", attribute.name());
        assertNull(attribute.constraint());
    }

    @Test
    void whenUpdatingNode_givenNewName_shouldRenameRelationshipEnds() {
        final String result = adapter.updateNode(CODE, "CUSTOMER",
                NodeDraft.of("CUSTOMER", "CLIENT"));

        assertEquals(String.join("\n",
                "erDiagram",
                "    CLIENT {",
                "        string email UK \"login\"",
                "        int id PK",
                "    }",
                "    CLIENT ||--o{ ORDER : places",
                "    ORDER }|..|{ LINE_ITEM : \"contains many\""), result);
    }

    @Test
    void whenUpdatingNode_givenAttributes_shouldReplaceThem() {
        final String result = adapter.updateNode(CODE, "CUSTOMER",
                new NodeDraft("CUSTOMER", null, null, null, List.of("int id PK")));

        assertTrue(result.startsWith(
                "erDiagram\n    CUSTOMER {\n        int id PK\n    }\n"));
    }

    @Test
    void whenRemovingNode_shouldDropEveryRelationshipTouchingIt() {
        final String result = adapter.removeNode(CODE, "ORDER");

        assertEquals(String.join("\n",
                "erDiagram",
                "    CUSTOMER {",
                "        string email UK \"login\"",
                "        int id PK",
                "    }"), result);
    }

    @Test
    void whenAddingNode_givenAttributes_shouldAppendBlock() {
        final String result = adapter.addNode(CODE, new NodeDraft("PAYMENT",
                null, null, null, List.of("decimal amount")));

        assertEquals(CODE + "\n    PAYMENT {\n        decimal amount\n    }",
                result);
    }

    @Test
    void whenAddingEdge_givenMultiWordLabel_shouldQuoteIt() {
        final String result = adapter.addEdge(CODE,
                new EdgeDraft("ORDER", "PAYMENT", null, "paid by"));

        assertEquals(CODE + "\n    ORDER ||--o{ PAYMENT : \"paid by\"", result);
    }

    @Test
    void whenUpdatingEdge_givenConnector_shouldKeepLabel() {
        final String result = adapter.updateEdge(CODE, "CUSTOMER", "ORDER",
                new EdgeDraft(null, null, "||--|{", null));

        assertTrue(result.contains("\n    CUSTOMER ||--|{ ORDER : places\n"));
    }

    @Test
    void whenRemovingEdge_givenReversedEnds_shouldReturnInput() {
        assertSame(CODE, adapter.removeEdge(CODE, "ORDER", "CUSTOMER"));
    }

}
