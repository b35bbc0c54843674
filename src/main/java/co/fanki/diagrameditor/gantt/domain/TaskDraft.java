package co.fanki.diagrameditor.gantt.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * A task to insert into a chart.
 *
 * <p>Every component is optional. A draft without a label becomes
 * "New task"; a draft without an end date or duration lasts one day.</p>
 *
 * @param label the task label
 * @param id the short identifier
 * @param statuses the status keywords
 * @param milestone whether the task is a milestone
 * @param startDate the explicit start, wins over {@code afterDeps}
 * @param afterDeps the references the task waits for
 * @param endDate the explicit end, wins over {@code duration}
 * @param duration a duration token such as {@code 3d}
 * @param metadata the editor metadata, written as comment lines
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TaskDraft(
        String label,
        String id,
        List<TaskStatus> statuses,
        boolean milestone,
        LocalDate startDate,
        List<String> afterDeps,
        LocalDate endDate,
        String duration,
        TaskMetadata metadata) {
}
