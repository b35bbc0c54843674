package co.fanki.diagrameditor.gantt.domain;

/**
 * A task the resolver could not place on the calendar.
 *
 * @param taskKey the task key
 * @param label the task label
 * @param type what went wrong
 * @param detail a human readable explanation
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScheduleIssue(String taskKey, String label, Type type,
        String detail) {

    /** Kinds of resolution problems. */
    public enum Type {

        /** No explicit date is reachable through the task's dependencies. */
        UNANCHORED,

        /** A dependency names no task of the chart. */
        UNKNOWN_DEPENDENCY
    }

}
