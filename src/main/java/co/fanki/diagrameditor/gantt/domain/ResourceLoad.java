package co.fanki.diagrameditor.gantt.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * The weekly workload of one assignee.
 *
 * @param name the assignee as first written
 * @param totalTasks the distinct tasks assigned to the person
 * @param overloadedWeeks the weeks with too many tasks, oldest first
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ResourceLoad(String name, int totalTasks,
        List<Week> overloadedWeeks) {

    /**
     * One ISO week of work.
     *
     * @param weekKey the ISO week, such as {@code 2026-W02}
     * @param weekStart the Monday of the week
     * @param tasks the labels of the tasks running that week
     */
    public record Week(String weekKey, LocalDate weekStart,
            List<String> tasks) {}

}
