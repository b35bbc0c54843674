package co.fanki.diagrameditor.gantt.domain;

import java.util.List;

/**
 * A parsed Gantt chart.
 *
 * @param directives the chart-wide settings
 * @param sections the section names in document order
 * @param tasks the tasks in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GanttChart(GanttDirectives directives, List<String> sections,
        List<GanttTask> tasks) {
}
