package co.fanki.diagrameditor.dialect.application;

import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import co.fanki.diagrameditor.dialect.domain.state.StateDiagramView;
import co.fanki.diagrameditor.shared.DomainException;
import co.fanki.diagrameditor.shared.EditResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DiagramEditorService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DiagramEditorServiceTest {

    private static final String SEQUENCE = String.join("\n",
            "sequenceDiagram",
            "    participant A as Alice",
            "    A->>B: Hello");

    private final DiagramEditorService service = new DiagramEditorService();

    @Test
    void whenClassifying_givenEditableDialect_shouldFlagBoth() {
        final DiagramEditorService.Classification result =
                service.classify("erDiagram\n    A ||--o{ B : has");

        assertEquals(DiagramType.ER, result.type());
        assertTrue(result.parseable());
        assertTrue(result.editable());
    }

    @Test
    void whenClassifying_givenParseOnlyDialect_shouldNotBeEditable() {
        final DiagramEditorService.Classification pie =
                service.classify("pie\n    \"A\" : 1");
        final DiagramEditorService.Classification journey =
                service.classify("journey\n    title Day");

        assertTrue(pie.parseable());
        assertFalse(pie.editable());
        assertEquals(DiagramType.JOURNEY, journey.type());
        assertFalse(journey.parseable());
    }

    @Test
    void whenClassifying_givenNullCode_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.classify(null));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenParsing_givenNoType_shouldDetectIt() {
        final DiagramEditorService.ParsedDiagram parsed =
                service.parse(SEQUENCE, null);

        assertEquals(DiagramType.SEQUENCE, parsed.type());
        assertEquals(2, parsed.elements().size());
        assertEquals(1, parsed.connections().size());
    }

    @Test
    void whenParsing_givenExplicitType_shouldUseIt() {
        final DiagramEditorService.ParsedDiagram parsed = service.parse(
                "erDiagram\n    A ||--o{ B : has", "er");

        assertEquals(DiagramType.ER, parsed.type());
        assertEquals("has", parsed.connections().get(0).label());
    }

    @Test
    void whenParsing_givenDialectWithoutReader_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.parse("journey\n    title Day", null));

        assertEquals("UNSUPPORTED_DIALECT", e.getErrorCode());
    }

    @Test
    void whenAddingNode_givenParseOnlyDialect_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.addNode("pie\n    \"A\" : 1", null,
                        NodeDraft.of("B", "B")));

        assertEquals("UNSUPPORTED_MUTATION", e.getErrorCode());
    }

    @Test
    void whenAddingNode_givenSequence_shouldReportChange() {
        final EditResult result = service.addNode(SEQUENCE, null,
                new NodeDraft("B", "Bob", null, "actor", null));

        assertTrue(result.changed());
        assertTrue(result.code().contains("\n    actor B as Bob\n"));
    }

    @Test
    void whenRemovingEdge_givenMissingEdge_shouldReportNoChange() {
        final EditResult result = service.removeEdge(SEQUENCE, "sequence",
                "B", "A");

        assertFalse(result.changed());
        assertEquals(SEQUENCE, result.code());
    }

    @Test
    void whenAddingEdge_givenBlankSource_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.addEdge(SEQUENCE, null,
                        new EdgeDraft(" ", "A", null, null)));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenAppending_givenUnindentedStatement_shouldIndentIt() {
        final EditResult result = service.append("pie\n", "\"A\" : 1");

        assertEquals("pie\n    \"A\" : 1", result.code());
        assertTrue(result.changed());
    }

    @Test
    void whenAppending_givenBlankStatement_shouldReject() {
        assertThrows(DomainException.class, () -> service.append("pie", " "));
    }

    @Test
    void whenBuildingStateView_shouldReplaceTerminals() {
        final StateDiagramView view = service.stateView(
                "stateDiagram-v2\n    [*] --> A");

        assertTrue(view.hasInitial());
        assertEquals(StateDiagramView.INITIAL, view.transitions().get(0).source());
    }

    @Test
    void whenSettingStateDirection_shouldRewriteText() {
        final EditResult result = service.setStateDirection(
                "stateDiagram-v2\n    A --> B", "RL");

        assertEquals("stateDiagram-v2\n    direction RL\n    A --> B",
                result.code());
    }

    @Test
    void whenImportingSql_givenTable_shouldReturnErDiagram() {
        final String code = service.erFromSql(
                "CREATE TABLE users (id INT PRIMARY KEY, name TEXT);");

        assertEquals("erDiagram\n    USERS {\n        int id PK\n"
                + "        string name\n    }", code);
    }

    @Test
    void whenImportingSql_givenNoTable_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.erFromSql("DROP TABLE users;"));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
        assertThrows(DomainException.class, () -> service.erFromSql(null));
    }

    @Test
    void whenExportingSql_givenEntity_shouldWriteCreateTable() {
        assertEquals("CREATE TABLE users (\n    id INTEGER NOT NULL,\n"
                + "    PRIMARY KEY (id)\n);",
                service.erToSql("erDiagram\n    USERS {\n        int id PK\n    }"));
    }

    @Test
    void whenConvertingXState_shouldImportAndExportMachines() {
        final String code = service.stateFromXState(
                "{\"initial\": \"a\", \"states\": {\"a\": {\"on\": {\"GO\": \"b\"}}}}");

        assertEquals("stateDiagram-v2\n    direction LR\n    [*] --> a\n"
                + "    a --> b : GO", code);
        assertEquals("b", service.stateToXState(code).at("/states/a/on/GO")
                .asText());
        assertThrows(DomainException.class, () -> service.stateFromXState(" "));
    }

}
