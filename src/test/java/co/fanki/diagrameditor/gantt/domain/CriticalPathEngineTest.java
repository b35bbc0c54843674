package co.fanki.diagrameditor.gantt.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CriticalPathEngine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CriticalPathEngineTest {

    private static CriticalPathReport analyze(final String code) {
        final GanttChart chart = GanttParser.parse(code);
        return CriticalPathEngine.analyze(DependencyResolver.resolve(chart),
                DependencyGraph.of(chart.tasks()));
    }

    @Test
    void whenAnalyzing_givenDiamond_shouldPutShortBranchOffCriticalPath() {
        final CriticalPathReport report = analyze(String.join("\n",
                "gantt",
                "    A :2026-01-01, 2d",
                "    B :after A, 3d",
                "    C :after A, 1d",
                "    D :after B C, 1d"));

        assertEquals(List.of("a", "b", "d"), report.criticalPath());
        assertEquals(LocalDate.of(2026, 1, 7), report.projectEnd());

        final TaskSlack c = report.slackOf("c").get();
        assertEquals(2, c.slackDays());
        assertFalse(c.critical());
        assertEquals(LocalDate.of(2026, 1, 5), c.lateStart());
        assertEquals(LocalDate.of(2026, 1, 6), c.lateFinish());
        assertEquals(0, report.slackOf("a").get().slackDays());
    }

    @Test
    void whenAnalyzing_givenIndependentShortTask_shouldGiveItSlackToProjectEnd() {
        final CriticalPathReport report = analyze(String.join("\n",
                "gantt",
                "    Long :2026-01-01, 10d",
                "    Short :2026-01-01, 4d"));

        assertEquals(List.of("long"), report.criticalPath());
        assertEquals(6, report.slackOf("short").get().slackDays());
    }

    @Test
    void whenAnalyzing_givenVerticalMarker_shouldKeepItOffCriticalPath() {
        final CriticalPathReport report = analyze(String.join("\n",
                "gantt",
                "    Work :2026-01-01, 3d",
                "    Freeze :vert, 2026-01-01, 3d"));

        assertEquals(List.of("work"), report.criticalPath());
        assertTrue(report.slackOf("freeze").get().critical());
    }

    @Test
    void whenAnalyzing_givenCycle_shouldGiveCycleTasksNoLateDates() {
        final CriticalPathReport report = analyze(String.join("\n",
                "gantt",
                "    A :a, 2026-01-01, 2d",
                "    B :b, 2026-01-03, 2d, after c",
                "    C :c, after b, 1d"));

        final TaskSlack c = report.slackOf("c").get();
        assertNull(c.lateStart());
        assertNull(c.lateFinish());
        assertEquals(0, c.slackDays());
        assertFalse(c.critical());
        assertFalse(report.criticalPath().contains("b"));
        assertEquals(LocalDate.of(2026, 1, 6), report.projectEnd());
    }

    @Test
    void whenAnalyzing_givenNothingResolved_shouldReturnEmptyReport() {
        final CriticalPathReport report = analyze("gantt\n    Floating :3d");

        assertNull(report.projectEnd());
        assertTrue(report.slack().isEmpty());
        assertTrue(report.criticalPath().isEmpty());
    }

    @Test
    void whenFindingConflicts_givenStartBeforeDependencyEnds_shouldReportOverlap() {
        final GanttChart chart = GanttParser.parse(String.join("\n",
                "gantt",
                "    A :a1, 2026-01-01, 5d",
                "    B :b1, after a1, 2026-01-03, 2d",
                "    C :c1, after a1, 1d"));

        final List<ScheduleConflict> conflicts = CriticalPathEngine
                .findConflicts(DependencyResolver.resolve(chart));

        assertEquals(1, conflicts.size());
        final ScheduleConflict conflict = conflicts.get(0);
        assertEquals("b1", conflict.taskKey());
        assertEquals("A", conflict.dependencyLabel());
        assertEquals(3, conflict.overlapDays());
    }

}
