package co.fanki.diagrameditor.gantt.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DependencyResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyResolverTest {

    private static final String DIAMOND = String.join("\n",
            "gantt",
            "    dateFormat YYYY-MM-DD",
            "    A :2026-01-01, 2d",
            "    B :after A, 3d",
            "    C :after A, 1d",
            "    D :after B C, 1d");

    private static ResolvedSchedule resolve(final String code) {
        return DependencyResolver.resolve(GanttParser.parse(code));
    }

    @Test
    void whenResolving_givenAfterChains_shouldStartAtLatestDependencyEnd() {
        final ResolvedSchedule schedule = resolve(DIAMOND);

        assertTrue(schedule.issues().isEmpty());
        assertEquals(LocalDate.of(2026, 1, 3), schedule.find("b").get().start());
        assertEquals(LocalDate.of(2026, 1, 6), schedule.find("b").get().end());
        assertEquals(LocalDate.of(2026, 1, 4), schedule.find("c").get().end());
        assertEquals(LocalDate.of(2026, 1, 6), schedule.find("d").get().start());
        assertEquals(LocalDate.of(2026, 1, 7), schedule.find("d").get().end());
    }

    @Test
    void whenResolving_givenExcludedWeekends_shouldCountWorkingDays() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    excludes weekends, 2026-01-07",
                "    A :a, 2026-01-02, 2d",
                "    B :b, after a, 2d"));

        assertEquals(LocalDate.of(2026, 1, 6), schedule.find("a").get().end());
        assertEquals(LocalDate.of(2026, 1, 6), schedule.find("b").get().start());
        assertEquals(LocalDate.of(2026, 1, 9), schedule.find("b").get().end());
    }

    @Test
    void whenResolving_givenTaskListOnly_shouldCountCalendarDays() {
        final ResolvedSchedule schedule = DependencyResolver.resolve(
                GanttParser.parse("gantt\n    excludes weekends\n"
                        + "    A :2026-01-02, 2d").tasks());

        assertEquals(LocalDate.of(2026, 1, 4), schedule.tasks().get(0).end());
    }

    @Test
    void whenResolving_givenDependencyDeclaredBelow_shouldStillResolve() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    Late :after early, 2d",
                "    Early :early, 2026-05-01, 1d"));

        assertEquals(LocalDate.of(2026, 5, 2),
                schedule.find("late").get().start());
        assertEquals(LocalDate.of(2026, 5, 4),
                schedule.find("late").get().end());
    }

    @Test
    void whenResolving_givenTaskWithoutDateOrDependency_shouldFollowPreviousTask() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    First :2026-03-02, 2d",
                "    Second :4d"));

        final ScheduledTask second = schedule.find("second").get();
        assertEquals(LocalDate.of(2026, 3, 4), second.start());
        assertEquals(LocalDate.of(2026, 3, 8), second.end());
        assertEquals(4, second.days());
    }

    @Test
    void whenResolving_givenUntil_shouldEndAtReferencedTaskStart() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    Gate :g1, 2026-01-10, 1d",
                "    Fill :f1, 2026-01-03, until g1"));

        final ScheduledTask fill = schedule.find("f1").get();
        assertEquals(LocalDate.of(2026, 1, 3), fill.start());
        assertEquals(LocalDate.of(2026, 1, 10), fill.end());
        assertEquals(7, fill.days());
    }

    @Test
    void whenResolving_givenChainWithoutAnchor_shouldReportUnanchored() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    Floating :3d",
                "    Next :after Floating, 1d"));

        assertEquals(2, schedule.issues().size());
        assertTrue(schedule.issues().stream().allMatch(
                i -> i.type() == ScheduleIssue.Type.UNANCHORED));
        assertFalse(schedule.find("floating").get().isResolved());
        assertNull(schedule.find("next").get().start());
        assertTrue(schedule.resolved().isEmpty());
    }

    @Test
    void whenResolving_givenUnknownReference_shouldReportItOnce() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    Lonely :after ghost, 2d"));

        assertEquals(1, schedule.issues().size());
        final ScheduleIssue issue = schedule.issues().get(0);
        assertEquals(ScheduleIssue.Type.UNKNOWN_DEPENDENCY, issue.type());
        assertEquals("lonely", issue.taskKey());
        assertTrue(issue.detail().contains("ghost"));
    }

    @Test
    void whenResolving_givenCycle_shouldLeaveBothTasksUnresolved() {
        final ResolvedSchedule schedule = resolve(String.join("\n",
                "gantt",
                "    X :after Y, 1d",
                "    Y :after X, 1d"));

        assertEquals(List.of(), schedule.resolved());
        assertEquals(2, schedule.issues().size());
    }

}
