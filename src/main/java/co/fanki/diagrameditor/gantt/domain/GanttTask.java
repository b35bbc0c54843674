package co.fanki.diagrameditor.gantt.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * A task of a Gantt chart as written in the text.
 *
 * <p>Dates here are the explicit ones only. A task scheduled through
 * {@code after} has a null start date until a {@link DependencyResolver}
 * places it.</p>
 *
 * @param lineIndex the index of the task line
 * @param lastLine the index of the last metadata comment line below the
 *        task, the task line itself when there is none
 * @param label the task label
 * @param section the enclosing section, null before the first section
 * @param id the short identifier, null when the task has none
 * @param statuses the status keywords
 * @param milestone whether the task is a milestone
 * @param vert whether the task is a vertical marker
 * @param startDate the explicit start date, or null
 * @param endDate the explicit end date, or null
 * @param durationDays the duration in days, or null when unstated
 * @param afterDeps the references the task waits for, as written
 * @param untilDep the reference bounding the task's end, or null
 * @param metadata the editor metadata from comment lines
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GanttTask(
        int lineIndex,
        int lastLine,
        String label,
        String section,
        String id,
        List<TaskStatus> statuses,
        boolean milestone,
        boolean vert,
        LocalDate startDate,
        LocalDate endDate,
        Integer durationDays,
        List<String> afterDeps,
        String untilDep,
        TaskMetadata metadata) {

    /**
     * Returns the graph key of the task: the lower-cased id, or the
     * lower-cased label when the task has no id.
     *
     * @return the key, never null
     */
    @JsonProperty("key")
    public String key() {
        return (id != null ? id : label).toLowerCase(Locale.ROOT);
    }

    /**
     * Checks whether the task carries a status keyword.
     *
     * @param status the status
     * @return true when present
     */
    public boolean has(final TaskStatus status) {
        return statuses.contains(status);
    }

    /**
     * Returns the duration, zero when unstated.
     *
     * @return the days
     */
    public int durationOrZero() {
        return durationDays == null ? 0 : durationDays;
    }

}
