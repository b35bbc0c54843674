package co.fanki.diagrameditor.gantt.domain;

/**
 * A task that starts before a task it depends on has finished.
 *
 * @param taskKey the dependent task key
 * @param taskLabel the dependent task label
 * @param dependencyKey the dependency key
 * @param dependencyLabel the dependency label
 * @param overlapDays how many days the two overlap
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScheduleConflict(String taskKey, String taskLabel,
        String dependencyKey, String dependencyLabel, long overlapDays) {
}
