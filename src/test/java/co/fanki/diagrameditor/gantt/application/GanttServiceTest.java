package co.fanki.diagrameditor.gantt.application;

import co.fanki.diagrameditor.gantt.domain.ResourceLoad;
import co.fanki.diagrameditor.gantt.domain.RiskFlag;
import co.fanki.diagrameditor.gantt.domain.TaskDraft;
import co.fanki.diagrameditor.shared.DomainException;
import co.fanki.diagrameditor.shared.EditResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GanttService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GanttServiceTest {

    private static final String DIAMOND = String.join("\n",
            "gantt",
            "    A :2026-01-01, 2d",
            "    B :after A, 3d",
            "    C :after A, 1d",
            "    D :after B C, 1d");

    private GanttService service;

    @BeforeEach
    void setUp() {
        service = new GanttService(3, 4, 2);
    }

    @Test
    void whenAnalyzing_givenDiamond_shouldReportCriticalPathAndNoCycles() {
        final GanttService.ScheduleAnalysis analysis = service.analyze(DIAMOND);

        assertEquals(4, analysis.chart().tasks().size());
        assertTrue(analysis.cycles().isEmpty());
        assertTrue(analysis.schedule().issues().isEmpty());
        assertEquals(List.of("a", "b", "d"),
                analysis.criticalPath().criticalPath());
        assertEquals(2, analysis.criticalPath().slackOf("c").get()
                .slackDays());
        assertTrue(analysis.conflicts().isEmpty());
    }

    @Test
    void whenAnalyzing_givenCycle_shouldReturnItAsData() {
        final GanttService.ScheduleAnalysis analysis = service.analyze(
                "gantt\n    X :after Y, 1d\n    Y :after X, 1d");

        assertEquals(1, analysis.cycles().size());
        assertEquals(2, analysis.schedule().issues().size());
    }

    @Test
    void whenAnalyzing_givenConfiguredThreshold_shouldUseIt() {
        final GanttService strict = new GanttService(2, 4, 2);

        final List<RiskFlag> risks = strict.analyze(DIAMOND).risks();

        assertEquals(1, risks.size());
        assertEquals("d", risks.get(0).taskKey());
        assertTrue(service.analyze(DIAMOND).risks().isEmpty());
    }

    @Test
    void whenFindingRelated_givenMiddleTask_shouldReturnBothDirections() {
        final GanttService.RelatedTasks related = service.related(DIAMOND, "B");

        assertEquals("b", related.key());
        assertEquals(Set.of("a"), related.upstream());
        assertEquals(Set.of("d"), related.downstream());
    }

    @Test
    void whenFindingRelated_givenUnknownTask_shouldThrow() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.related(DIAMOND, "Z"));

        assertEquals("UNKNOWN_TASK", e.getErrorCode());
    }

    @Test
    void whenShifting_givenTask_shouldReportChange() {
        final EditResult result = service.shiftTask(DIAMOND, "A", 2);

        assertTrue(result.changed());
        assertTrue(result.code().contains("A :2026-01-03, 2d"));
    }

    @Test
    void whenShifting_givenDeltaOverAHundredYears_shouldThrow() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.shiftTask(DIAMOND, "A", Long.MAX_VALUE));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
        assertThrows(DomainException.class,
                () -> service.shiftTask(DIAMOND, "A", -36_501));
    }

    @Test
    void whenShifting_givenDeltaOfAHundredYears_shouldMoveTask() {
        final EditResult result = service.shiftTask(DIAMOND, "A", 36_500);

        assertTrue(result.code().contains("A :2125-12-08, 2d"));
    }

    @Test
    void whenComputingResources_givenSharedAssignee_shouldListOverloadedWeek() {
        final List<ResourceLoad> loads = service.resourceLoad(String.join("\n",
                "gantt",
                "    A :2026-01-05, 2d",
                "    %% assignee: Ana, Bo",
                "    B :2026-01-06, 2d",
                "    %% assignee: ana"));

        assertEquals(2, loads.size());
        assertEquals("Ana", loads.get(0).name());
        assertEquals("2026-W02", loads.get(0).overloadedWeeks().get(0).weekKey());
        assertEquals("Bo", loads.get(1).name());
        assertTrue(loads.get(1).overloadedWeeks().isEmpty());
        assertThrows(DomainException.class, () -> service.resourceLoad(null));
    }

    @Test
    void whenDeleting_givenUnknownTask_shouldReportNoChange() {
        final EditResult result = service.deleteTask(DIAMOND, "Z");

        assertFalse(result.changed());
        assertEquals(DIAMOND, result.code());
    }

    @Test
    void whenChangingStatus_givenUnknownKeyword_shouldThrow() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.changeStatus(DIAMOND, "A", "finished", false));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenChangingStatus_givenClear_shouldIgnoreKeyword() {
        final String code = "gantt\n    A :done, 2026-01-01, 1d";

        assertEquals("gantt\n    A :2026-01-01, 1d",
                service.changeStatus(code, "A", null, true).code());
    }

    @Test
    void whenSettingMetadata_givenUnknownKey_shouldThrow() {
        assertThrows(DomainException.class,
                () -> service.setMetadata(DIAMOND, "A", "owner", "Ana"));
    }

    @Test
    void whenInserting_givenBlankReference_shouldAppend() {
        final EditResult result = service.insertTask(DIAMOND, " ",
                new TaskDraft("E", null, null, false, null, List.of("D"),
                        null, "2d", null));

        assertTrue(result.code().endsWith("\n    E :after D, 2d"));
    }

    @Test
    void whenAdjusting_givenNoDate_shouldThrow() {
        assertThrows(DomainException.class,
                () -> service.autoAdjust(DIAMOND, null));
    }

    @Test
    void whenAdjusting_givenDate_shouldMoveChart() {
        final EditResult result = service.autoAdjust(DIAMOND,
                LocalDate.of(2026, 6, 1));

        assertTrue(result.code().contains("A :2026-06-01, 2d"));
    }

    @Test
    void whenParsing_givenNullCode_shouldThrow() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.parse(null));

        assertEquals("INVALID_REQUEST", e.getErrorCode());
    }

    @Test
    void whenManagingSections_givenChart_shouldAddListAndRename() {
        final String added = service.addSection(DIAMOND, "Later").code();

        assertEquals(1, service.sections(added).size());
        assertTrue(service.renameSection(added, "later", "Soon").code()
                .endsWith("section Soon"));
        assertThrows(DomainException.class,
                () -> service.renameSection(added, "Later", " "));
    }

}
