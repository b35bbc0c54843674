package co.fanki.diagrameditor.gantt.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Result of the critical path method over a resolved schedule.
 *
 * @param projectEnd the latest resolved end, null for an empty schedule
 * @param slack the figures of every resolved task, in document order
 * @param criticalPath the keys of the critical tasks ordered by start,
 *        vertical markers excluded
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CriticalPathReport(LocalDate projectEnd, List<TaskSlack> slack,
        List<String> criticalPath) {

    /**
     * Finds the figures of one task.
     *
     * @param key the task key
     * @return the figures, empty when the task was not resolved
     */
    public Optional<TaskSlack> slackOf(final String key) {
        return slack.stream().filter(s -> s.key().equals(key)).findFirst();
    }

}
