package co.fanki.diagrameditor.gantt.domain;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of resolving a chart's dependencies to dates.
 *
 * @param tasks every task in document order, resolved or not
 * @param issues the tasks that could not be resolved, and why
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ResolvedSchedule(List<ScheduledTask> tasks,
        List<ScheduleIssue> issues) {

    /**
     * Finds the first scheduled task with the given key.
     *
     * @param key the task key
     * @return the task, empty when absent
     */
    public Optional<ScheduledTask> find(final String key) {
        return tasks.stream().filter(t -> t.key().equals(key)).findFirst();
    }

    /**
     * Returns only the tasks with both dates resolved.
     *
     * @return the resolved tasks, in document order
     */
    public List<ScheduledTask> resolved() {
        return tasks.stream().filter(ScheduledTask::isResolved).toList();
    }

}
