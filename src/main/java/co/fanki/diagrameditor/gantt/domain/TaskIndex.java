package co.fanki.diagrameditor.gantt.domain;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves task references as written in {@code after} and {@code until}
 * tokens.
 *
 * <p>A reference matches a task id first and a task label second, case
 * insensitively. When several tasks share a label the first one wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TaskIndex {

    private final Map<String, GanttTask> byReference = new HashMap<>();

    /**
     * Creates an index over tasks.
     *
     * @param tasks the tasks in document order
     */
    public TaskIndex(final List<GanttTask> tasks) {
        for (final GanttTask task : tasks) {
            if (task.id() != null) {
                byReference.putIfAbsent(normalize(task.id()), task);
            }
        }
        for (final GanttTask task : tasks) {
            byReference.putIfAbsent(normalize(task.label()), task);
        }
    }

    /**
     * Finds the task a reference points at.
     *
     * @param reference the id or label, may be null
     * @return the task, empty when nothing matches
     */
    public Optional<GanttTask> find(final String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byReference.get(normalize(reference)));
    }

    private static String normalize(final String reference) {
        return reference.trim().toLowerCase(Locale.ROOT);
    }

}
