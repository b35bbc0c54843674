package co.fanki.diagrameditor.gantt.domain;

import java.time.LocalDate;

/**
 * Critical path figures of one task.
 *
 * @param key the task key
 * @param label the task label
 * @param earlyStart the resolved start
 * @param earlyFinish the resolved end
 * @param lateStart the latest start that keeps the project end, null for
 *        tasks on a dependency cycle
 * @param lateFinish the latest end that keeps the project end, null for
 *        tasks on a dependency cycle
 * @param slackDays the days the task may slip, never negative
 * @param critical whether the task has no slack
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TaskSlack(
        String key,
        String label,
        LocalDate earlyStart,
        LocalDate earlyFinish,
        LocalDate lateStart,
        LocalDate lateFinish,
        long slackDays,
        boolean critical) {
}
