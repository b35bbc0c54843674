package co.fanki.diagrameditor.gantt.domain;

/**
 * A schedule smell attached to a task.
 *
 * @param taskKey the task key
 * @param label the task label
 * @param type the kind of risk
 * @param reason a sentence the editor shows as is
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RiskFlag(String taskKey, String label, Type type,
        String reason) {

    /** Kinds of schedule risk. */
    public enum Type {

        /** The task waits on many others. */
        MANY_DEPENDENCIES,

        /** The task's explicit start precedes a dependency's end. */
        BROKEN_DEPENDENCY,

        /** An assignee runs too many tasks at once. */
        OVERLOADED_ASSIGNEE
    }

}
