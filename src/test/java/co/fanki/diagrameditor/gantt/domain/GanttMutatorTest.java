package co.fanki.diagrameditor.gantt.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GanttMutator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GanttMutatorTest {

    private static final String DIAMOND = String.join("\n",
            "gantt",
            "    A :2026-01-01, 2d",
            "    B :after A, 3d",
            "    C :after A, 1d",
            "    D :after B C, 1d");

    private static final String PROJECT = String.join("\n",
            "gantt",
            "    section Build",
            "    Design :done, des1, 2026-01-01, 3d",
            "    %% assignee: Ana",
            "    Code :active, code1, after des1, 5d",
            "    Review :2026-02-01, 2026-02-04");

    private static String line(final String code, final int index) {
        return code.split("\n", -1)[index];
    }

    @Test
    void whenUpdatingTask_givenStartDate_shouldReplaceAfterToken() {
        final String result = GanttMutator.updateTask(PROJECT, "code1", null,
                LocalDate.of(2026, 1, 10), null, null);

        assertEquals("    Code :active, code1, 2026-01-10, 5d", line(result, 4));
    }

    @Test
    void whenUpdatingTask_givenDurationOnDatedRange_shouldReplaceEndDate() {
        final String result = GanttMutator.updateTask(PROJECT, "Review", null,
                null, null, "2w");

        assertEquals("    Review :2026-02-01, 2w", line(result, 5));
    }

    @Test
    void whenUpdatingTask_givenEndDate_shouldReplaceDuration() {
        final String result = GanttMutator.updateTask(PROJECT, "des1", null,
                null, LocalDate.of(2026, 1, 8), null);

        assertEquals("    Design :done, des1, 2026-01-01, 2026-01-08",
                line(result, 2));
    }

    @Test
    void whenUpdatingTask_givenLabel_shouldOnlyTouchThatLine() {
        final String result = GanttMutator.updateTask(PROJECT, "des1",
                "Discovery", null, null, null);

        assertEquals("    Discovery :done, des1, 2026-01-01, 3d",
                line(result, 2));
        assertEquals(line(PROJECT, 3), line(result, 3));
        assertEquals(line(PROJECT, 4), line(result, 4));
    }

    @Test
    void whenUpdatingTask_givenUnknownTask_shouldReturnTextUnchanged() {
        assertEquals(PROJECT, GanttMutator.updateTask(PROJECT, "nope", "X",
                LocalDate.of(2026, 1, 1), null, "1d"));
    }

    @Test
    void whenShiftingTask_givenExplicitDates_shouldMoveBoth() {
        final String result = GanttMutator.shiftTask(PROJECT, "Review", 3);

        assertEquals("    Review :2026-02-04, 2026-02-07", line(result, 5));
    }

    @Test
    void whenShiftingTask_givenDependentTask_shouldPinItToResolvedStartPlusDelta() {
        final String result = GanttMutator.shiftTask(DIAMOND, "B", 1);

        assertEquals("    B :2026-01-04, 3d", line(result, 2));
    }

    @Test
    void whenShiftingTask_givenDeltaBeyondCalendar_shouldReturnTextUnchanged() {
        assertEquals(PROJECT, GanttMutator.shiftTask(PROJECT, "Review",
                Long.MAX_VALUE));
        assertEquals(PROJECT, GanttMutator.shiftTask(PROJECT, "Review",
                Long.MIN_VALUE));
        assertEquals(DIAMOND, GanttMutator.shiftTask(DIAMOND, "B",
                Long.MAX_VALUE));
    }

    @Test
    void whenShiftingTask_givenDeltaPastYear9999_shouldReturnTextUnchanged() {
        assertEquals(PROJECT, GanttMutator.shiftTask(PROJECT, "Review",
                3_000_000));
    }

    @Test
    void whenAutoAdjusting_givenTarget_shouldMoveEveryExplicitDate() {
        final String result = GanttMutator.autoAdjust(PROJECT,
                LocalDate.of(2026, 3, 1));

        assertEquals("    Design :done, des1, 2026-03-01, 3d", line(result, 2));
        assertEquals("    Review :2026-04-01, 2026-04-04", line(result, 5));
        assertEquals(line(PROJECT, 4), line(result, 4));
    }

    @Test
    void whenSettingDependencies_givenNewList_shouldRewriteAfterToken() {
        final String result = GanttMutator.setDependencies(DIAMOND, "B",
                List.of("C"));

        assertEquals("    B :after C, 3d", line(result, 2));
    }

    @Test
    void whenSettingDependencies_givenDatedTask_shouldReplaceTheDate() {
        final String result = GanttMutator.setDependencies(PROJECT, "Review",
                List.of("code1"));

        assertEquals("    Review :after code1, 3d", line(result, 5));
    }

    @Test
    void whenSettingDependencies_givenEmptyList_shouldPinToResolvedStart() {
        final String result = GanttMutator.setDependencies(DIAMOND, "B",
                List.of());

        assertEquals("    B :2026-01-03, 3d", line(result, 2));
    }

    @Test
    void whenDeletingTask_givenDependents_shouldPinThoseLeftWithoutDependencies() {
        final String result = GanttMutator.deleteTask(DIAMOND, "A");

        assertEquals(String.join("\n",
                "gantt",
                "    B :2026-01-03, 3d",
                "    C :2026-01-03, 1d",
                "    D :after B C, 1d"), result);
    }

    @Test
    void whenDeletingTask_givenOneOfSeveralDependencies_shouldDropTheReference() {
        final String result = GanttMutator.deleteTask(DIAMOND, "B");

        assertEquals("    D :after C, 1d", line(result, 3));
        assertEquals(4, result.split("\n").length);
    }

    @Test
    void whenDeletingTask_givenMetadataComments_shouldRemoveThemToo() {
        final String result = GanttMutator.deleteTask(PROJECT, "Design");

        assertFalse(result.contains("Design"));
        assertFalse(result.contains("assignee"));
        assertEquals("    Code :active, code1, 2026-01-04, 5d", line(result, 2));
    }

    @Test
    void whenInsertingTask_givenReference_shouldInsertAfterItsMetadata() {
        final TaskDraft draft = new TaskDraft("QA", "qa",
                List.of(TaskStatus.CRITICAL), false, null, List.of("des1"),
                null, "2d", new TaskMetadata("Bo", null, null, null));

        final String result = GanttMutator.insertTaskAfter(PROJECT, "des1",
                draft);

        assertEquals("    QA :crit, qa, after des1, 2d", line(result, 4));
        assertEquals("    %% assignee: Bo", line(result, 5));
        assertEquals("    Code :active, code1, after des1, 5d", line(result, 6));

        final GanttTask inserted = GanttParser.parse(result).tasks().get(1);
        assertEquals("qa", inserted.key());
        assertEquals("Bo", inserted.metadata().assignee());
    }

    @Test
    void whenInsertingTask_givenEmptyDraftAndNoReference_shouldAppendDefaultTask() {
        final String result = GanttMutator.insertTaskAfter(DIAMOND, null,
                new TaskDraft(null, null, null, false, null, null, null, null,
                        null));

        assertEquals(DIAMOND + "\n    New task :1d", result);
    }

    @Test
    void whenInsertingTask_givenUnknownReference_shouldReturnTextUnchanged() {
        final TaskDraft draft = new TaskDraft("QA", null, null, false, null,
                null, null, null, null);

        assertEquals(DIAMOND, GanttMutator.insertTaskAfter(DIAMOND, "nope",
                draft));
    }

    @Test
    void whenTogglingStatus_givenPresentStatus_shouldRemoveIt() {
        final String result = GanttMutator.toggleStatus(PROJECT, "des1",
                TaskStatus.DONE);

        assertEquals("    Design :des1, 2026-01-01, 3d", line(result, 2));
    }

    @Test
    void whenTogglingStatus_givenAbsentStatus_shouldPrependIt() {
        final String result = GanttMutator.toggleStatus(PROJECT, "des1",
                TaskStatus.CRITICAL);

        assertEquals("    Design :crit, done, des1, 2026-01-01, 3d",
                line(result, 2));
    }

    @Test
    void whenClearingStatus_givenSeveralStatuses_shouldRemoveAll() {
        final String code = "gantt\n    T :crit, active, t1, 2026-01-01, 1d";

        assertEquals("gantt\n    T :t1, 2026-01-01, 1d",
                GanttMutator.clearStatus(code, "t1"));
    }

    @Test
    void whenSettingMilestone_givenStatusedTask_shouldPlaceFlagAfterStatuses() {
        final String code = "gantt\n    Launch :crit, l1, 2026-02-01, 0d";

        final String marked = GanttMutator.setMilestone(code, "l1", true);
        assertEquals("gantt\n    Launch :crit, milestone, l1, 2026-02-01, 0d",
                marked);
        assertTrue(GanttParser.parse(marked).tasks().get(0).milestone());
        assertEquals(code, GanttMutator.setMilestone(marked, "l1", false));
    }

    @Test
    void whenSettingMetadata_givenExistingKey_shouldRewriteInPlace() {
        final String result = GanttMutator.setMetadata(PROJECT, "des1",
                TaskMetadata.Key.ASSIGNEE, "Luis");

        assertEquals("    %% assignee: Luis", line(result, 3));
        assertEquals(PROJECT.split("\n").length, result.split("\n").length);
    }

    @Test
    void whenSettingMetadata_givenNewKey_shouldAddAfterExistingComments() {
        final String result = GanttMutator.setMetadata(PROJECT, "des1",
                TaskMetadata.Key.PROGRESS, "120");

        assertEquals("    %% progress: 100", line(result, 4));
        assertEquals(100, GanttParser.parse(result).tasks().get(0).metadata()
                .progress());
    }

    @Test
    void whenSettingMetadata_givenNonNumericProgress_shouldReturnTextUnchanged() {
        assertEquals(PROJECT, GanttMutator.setMetadata(PROJECT, "des1",
                TaskMetadata.Key.PROGRESS, "soon"));
    }

    @Test
    void whenSettingMetadata_givenBlankValue_shouldRemoveTheComment() {
        final String result = GanttMutator.setMetadata(PROJECT, "des1",
                TaskMetadata.Key.ASSIGNEE, " ");

        assertFalse(result.contains("assignee"));
        assertEquals("    Code :active, code1, after des1, 5d", line(result, 3));
    }

}
