package co.fanki.diagrameditor.dialect.application;

import co.fanki.diagrameditor.shared.DomainException;
import co.fanki.diagrameditor.shared.EditResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ChartEditorService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ChartEditorServiceTest {

    private static final String PIE = "pie title Pets\n    \"Dogs\" : 386";

    private final ChartEditorService service = new ChartEditorService();

    @Test
    void whenAddingSlice_shouldAppendIt() {
        final EditResult result = service.addSlice(PIE, "Cats", 85.5);

        assertTrue(result.changed());
        assertEquals(PIE + "\n    \"Cats\" : 85.5", result.code());
    }

    @Test
    void whenAddingSlice_givenNegativeValue_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.addSlice(PIE, "Cats", -1));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenUpdatingSlice_givenUnknownLabel_shouldReportNoChange() {
        assertFalse(service.updateSlice(PIE, "Cats", 3).changed());
    }

    @Test
    void whenRemovingSlice_shouldLeaveHeader() {
        assertEquals("pie title Pets", service.removeSlice(PIE, "Dogs").code());
    }

    @Test
    void whenAddingMindmapNode_shouldIndentIt() {
        assertEquals("mindmap\n  root((A))\n    B",
                service.addMindmapNode("mindmap\n  root((A))", " B", 2).code());
    }

    @Test
    void whenAddingTimelineEvent_givenBlankText_shouldReject() {
        assertThrows(DomainException.class,
                () -> service.addTimelineEvent("timeline", "2020", " "));
    }

    @Test
    void whenAddingC4Element_andRelationship_shouldAppendBoth() {
        final String withElement = service.addC4Element("C4Context", "Person",
                "user", "Customer", null).code();
        final String result = service.addC4Relationship(withElement, "user",
                "api", null).code();

        assertEquals("C4Context\n    Person(user, \"Customer\")"
                + "\n    Rel(user, api, \"\")", result);
    }

    @Test
    void whenAddingGitCommand_givenEachKeyword_shouldAppendIt() {
        String code = service.addGitCommand("gitGraph", "commit", null).code();
        code = service.addGitCommand(code, "BRANCH", "dev").code();
        code = service.addGitCommand(code, "checkout", "main").code();
        code = service.addGitCommand(code, "merge", "dev").code();

        assertEquals("gitGraph\n    commit\n    branch dev\n    checkout main"
                + "\n    merge dev", code);
    }

    @Test
    void whenAddingGitCommand_givenUnknownKeyword_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.addGitCommand("gitGraph", "rebase", "dev"));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenAddingQuadrantPoint_givenOutOfRange_shouldReject() {
        assertThrows(DomainException.class,
                () -> service.addQuadrantPoint("quadrantChart", "A", 1.5, 0));
    }

    @Test
    void whenAddingQuadrantPoint_shouldAppendIt() {
        assertEquals("quadrantChart\n    \"A\": [0.1, 1]",
                service.addQuadrantPoint("quadrantChart", "A", 0.1, 1).code());
    }

}
