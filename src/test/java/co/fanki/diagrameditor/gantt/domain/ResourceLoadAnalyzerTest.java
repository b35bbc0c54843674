package co.fanki.diagrameditor.gantt.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ResourceLoadAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ResourceLoadAnalyzerTest {

    private final ResourceLoadAnalyzer analyzer = new ResourceLoadAnalyzer(2);

    private List<ResourceLoad> analyze(final String... lines) {
        return analyzer.analyze(DependencyResolver.resolve(
                GanttParser.parse(String.join("\n", lines))));
    }

    @Test
    void whenAnalyzing_givenTasksInSameWeek_shouldReportOverloadedWeek() {
        final List<ResourceLoad> loads = analyze("gantt",
                "    Design :des, 2026-01-05, 2d",
                "    %% assignee: Ana",
                "    Build :2026-01-08, 2d",
                "    %% assignee: Ana");

        assertEquals(1, loads.size());
        final ResourceLoad ana = loads.get(0);
        assertEquals(2, ana.totalTasks());
        assertEquals(List.of(new ResourceLoad.Week("2026-W02",
                LocalDate.of(2026, 1, 5), List.of("Design", "Build"))),
                ana.overloadedWeeks());
    }

    @Test
    void whenAnalyzing_givenTaskAcrossWeeks_shouldCountItInEachWeek() {
        final List<ResourceLoad> loads = analyze("gantt",
                "    Long :2026-01-09, 10d",
                "    %% assignee: Bo",
                "    Short :2026-01-14, 1d",
                "    %% assignee: Bo");

        final List<ResourceLoad.Week> weeks = loads.get(0).overloadedWeeks();
        assertEquals(1, weeks.size());
        assertEquals("2026-W03", weeks.get(0).weekKey());
        assertEquals(List.of("Long", "Short"), weeks.get(0).tasks());
    }

    @Test
    void whenAnalyzing_givenBackToBackTasksInOtherWeeks_shouldNotOverload() {
        final List<ResourceLoad> loads = analyze("gantt",
                "    One :2026-01-05, 5d",
                "    %% assignee: Cy",
                "    Two :2026-01-12, 5d",
                "    %% assignee: Cy");

        assertEquals(2, loads.get(0).totalTasks());
        assertTrue(loads.get(0).overloadedWeeks().isEmpty());
    }

    @Test
    void whenAnalyzing_givenMilestone_shouldNotCountIt() {
        final List<ResourceLoad> loads = analyze("gantt",
                "    Work :2026-01-05, 3d",
                "    %% assignee: Di",
                "    Ship :milestone, 2026-01-06, 0d",
                "    %% assignee: Di");

        assertEquals(1, loads.get(0).totalTasks());
        assertTrue(loads.get(0).overloadedWeeks().isEmpty());
    }

    @Test
    void whenAnalyzing_givenSeveralPeople_shouldSortMostOverloadedFirst() {
        final List<ResourceLoad> loads = analyze("gantt",
                "    A :2026-01-05, 1d",
                "    %% assignee: Zoe, amy",
                "    B :2026-01-06, 1d",
                "    %% assignee: zoe",
                "    C :2026-01-07, 1d",
                "    %% assignee: Bea");

        assertEquals(List.of("Zoe", "amy", "Bea"),
                loads.stream().map(ResourceLoad::name).toList());
    }

    @Test
    void whenFormattingWeekKey_givenNewYearsDay_shouldUseIsoWeekYear() {
        assertEquals("2026-W01",
                ResourceLoadAnalyzer.weekKey(LocalDate.of(2026, 1, 1)));
        assertEquals("2026-W53",
                ResourceLoadAnalyzer.weekKey(LocalDate.of(2027, 1, 1)));
    }

}
