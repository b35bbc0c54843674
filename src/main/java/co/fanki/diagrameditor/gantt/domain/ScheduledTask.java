package co.fanki.diagrameditor.gantt.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A task placed on the calendar.
 *
 * @param task the task as written
 * @param start the resolved start, null when it could not be resolved
 * @param end the resolved end, null when it could not be resolved
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScheduledTask(GanttTask task, LocalDate start, LocalDate end) {

    /**
     * Checks whether both dates are known.
     *
     * @return true when the task has a start and an end
     */
    public boolean isResolved() {
        return start != null && end != null;
    }

    /**
     * Returns the resolved length in days.
     *
     * @return the days between start and end, zero when unresolved
     */
    public long days() {
        return isResolved() ? ChronoUnit.DAYS.between(start, end) : 0;
    }

    /** @return the graph key of the underlying task */
    @JsonProperty("key")
    public String key() {
        return task.key();
    }

}
