package co.fanki.diagrameditor.gantt.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Source preserving edits on Gantt chart text.
 *
 * <p>Every operation parses the text it receives, rewrites only the
 * lines it has to, and returns the text unchanged when the task it
 * names does not exist. Tasks are named by id or label, as in an
 * {@code after} reference.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GanttMutator {

    private static final Logger LOG = LoggerFactory.getLogger(GanttMutator.class);

    private static final String INDENT = "    ";

    /** Label given to inserted tasks that have none. */
    public static final String DEFAULT_LABEL = "New task";

    private static final String DEFAULT_DURATION = "1d";

    private static final int MAX_YEAR = 9999;

    private GanttMutator() {
    }

    /**
     * Updates a task's label, dates or duration.
     *
     * <p>A start date replaces the task's date, or its {@code after}
     * token, pinning it. An end date replaces the end date or the
     * duration; a duration replaces the duration or the end date.</p>
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param label the new label, null to keep
     * @param startDate the new start, null to keep
     * @param endDate the new end, null to keep
     * @param duration the new duration token such as {@code 3d}, null or
     *        malformed to keep
     * @return the new text
     */
    public static String updateTask(final String code, final String reference,
            final String label, final LocalDate startDate,
            final LocalDate endDate, final String duration) {
        return editLine(code, reference, line -> {
            TaskLine edited = line;
            if (label != null && !label.isBlank()) {
                edited = edited.withLabel(sanitize(label));
            }
            if (startDate != null) {
                edited = withStart(edited, startDate);
            }
            if (endDate != null) {
                edited = withEnd(edited, endDate);
            }
            if (duration != null && TaskLine.isDuration(duration)) {
                edited = withDuration(edited, duration.trim());
            }
            return edited;
        });
    }

    /**
     * Moves a task by a number of days, the way a horizontal drag does.
     *
     * <p>Explicit start and end dates move together. A task scheduled
     * through {@code after} is pinned to its resolved start plus the
     * delta; an unresolvable one is left alone.</p>
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param days the delta, negative to move earlier
     * @return the new text
     */
    public static String shiftTask(final String code, final String reference,
            final long days) {
        if (days == 0) {
            return code;
        }
        final GanttChart chart = GanttParser.parse(code);
        final Optional<GanttTask> found = new TaskIndex(chart.tasks())
                .find(reference);
        if (found.isEmpty()) {
            return code;
        }
        if (found.get().startDate() != null) {
            return editLine(code, reference, line -> shiftDates(line, days));
        }
        final int position = chart.tasks().indexOf(found.get());
        final LocalDate start = DependencyResolver.resolve(chart).tasks()
                .get(position).start();
        if (start == null) {
            LOG.debug("Task {} has no resolved start to shift", reference);
            return code;
        }
        return shift(start, days)
                .map(moved -> updateTask(code, reference, null, moved, null,
                        null))
                .orElse(code);
    }

    /**
     * Moves every explicit date so that the earliest start lands on the
     * given date. Tasks scheduled through {@code after} follow on their
     * own.
     *
     * @param code the chart text
     * @param target the new earliest start
     * @return the new text
     */
    public static String autoAdjust(final String code, final LocalDate target) {
        if (target == null) {
            return code;
        }
        final GanttChart chart = GanttParser.parse(code);
        LocalDate earliest = null;
        for (final GanttTask task : chart.tasks()) {
            if (task.startDate() != null
                    && (earliest == null || task.startDate().isBefore(earliest))) {
                earliest = task.startDate();
            }
        }
        if (earliest == null) {
            return code;
        }
        final long days = ChronoUnit.DAYS.between(earliest, target);
        if (days == 0) {
            return code;
        }
        LOG.debug("Shifting every explicit date by {} days", days);
        final List<String> lines = SourceLines.split(code);
        for (final GanttTask task : chart.tasks()) {
            if (task.startDate() != null) {
                TaskLine.parse(lines.get(task.lineIndex())).ifPresent(line ->
                        lines.set(task.lineIndex(),
                                shiftDates(line, days).render()));
            }
        }
        return SourceLines.join(lines);
    }

    /**
     * Replaces the list of tasks a task waits for.
     *
     * <p>A task with an explicit start date gives it up for the
     * {@code after} token. Clearing the list of a task without a date
     * pins it to its resolved start.</p>
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param dependencies the new references, empty to clear
     * @return the new text
     */
    public static String setDependencies(final String code,
            final String reference, final List<String> dependencies) {
        final List<String> deps = dependencies == null ? List.of()
                : dependencies.stream().filter(d -> d != null && !d.isBlank())
                        .map(String::trim).toList();
        final GanttChart chart = GanttParser.parse(code);
        final Optional<GanttTask> found = new TaskIndex(chart.tasks())
                .find(reference);
        if (found.isEmpty()) {
            return code;
        }
        final LocalDate resolvedStart = DependencyResolver.resolve(chart)
                .tasks().get(chart.tasks().indexOf(found.get())).start();
        return editLine(code, reference, line -> deps.isEmpty()
                ? withoutDependencies(line, resolvedStart)
                : withDependencies(line, deps));
    }

    /**
     * Deletes a task with its metadata comments.
     *
     * <p>Tasks that waited on it drop the reference. One that loses its
     * last dependency is pinned to the start it had, so the rest of the
     * chart does not move. An {@code until} bound on the task becomes a
     * fixed duration.</p>
     *
     * @param code the chart text
     * @param reference the task id or label
     * @return the new text
     */
    public static String deleteTask(final String code, final String reference) {
        final GanttChart chart = GanttParser.parse(code);
        final TaskIndex index = new TaskIndex(chart.tasks());
        final Optional<GanttTask> found = index.find(reference);
        if (found.isEmpty()) {
            return code;
        }
        final GanttTask deleted = found.get();
        final ResolvedSchedule schedule = DependencyResolver.resolve(chart);
        final List<String> lines = SourceLines.split(code);

        for (int i = 0; i < chart.tasks().size(); i++) {
            final GanttTask task = chart.tasks().get(i);
            if (task == deleted) {
                continue;
            }
            final List<String> remaining = new ArrayList<>();
            boolean referenced = false;
            for (final String dep : task.afterDeps()) {
                if (index.find(dep).filter(t -> t == deleted).isPresent()) {
                    referenced = true;
                } else {
                    remaining.add(dep);
                }
            }
            final boolean bounded = index.find(task.untilDep())
                    .filter(t -> t == deleted).isPresent();
            if (!referenced && !bounded) {
                continue;
            }
            final ScheduledTask scheduled = schedule.tasks().get(i);
            final Optional<TaskLine> parsed =
                    TaskLine.parse(lines.get(task.lineIndex()));
            if (parsed.isEmpty()) {
                continue;
            }
            TaskLine line = parsed.get();
            if (referenced) {
                line = remaining.isEmpty()
                        ? withoutDependencies(line, scheduled.start())
                        : withDependencies(line, remaining);
            }
            if (bounded) {
                line = withoutUntil(line, scheduled,
                        WorkingCalendar.of(chart.directives()));
            }
            lines.set(task.lineIndex(), line.render());
        }

        final List<String> result = new ArrayList<>(
                lines.subList(0, deleted.lineIndex()));
        result.addAll(lines.subList(deleted.lastLine() + 1, lines.size()));
        LOG.debug("Deleted task {} ({} lines)", reference,
                deleted.lastLine() - deleted.lineIndex() + 1);
        return SourceLines.join(result);
    }

    /**
     * Inserts a task below another one, after its metadata comments.
     *
     * @param code the chart text
     * @param reference the task to insert after, null to insert after the
     *        last content line
     * @param draft the task
     * @return the new text, unchanged when the reference names no task
     */
    public static String insertTaskAfter(final String code,
            final String reference, final TaskDraft draft) {
        if (draft == null) {
            return code;
        }
        final GanttChart chart = GanttParser.parse(code);
        final List<String> lines = SourceLines.split(code);
        final int position;
        final String indent;
        if (reference == null) {
            position = SourceLines.endOfContent(lines, t -> false);
            indent = chart.tasks().isEmpty() ? INDENT : SourceLines.indentOf(
                    lines.get(chart.tasks().get(chart.tasks().size() - 1)
                            .lineIndex()));
        } else {
            final Optional<GanttTask> found = new TaskIndex(chart.tasks())
                    .find(reference);
            if (found.isEmpty()) {
                return code;
            }
            position = found.get().lastLine() + 1;
            indent = SourceLines.indentOf(lines.get(found.get().lineIndex()));
        }

        final List<String> block = new ArrayList<>();
        block.add(new TaskLine(indent, draftLabel(draft), tokens(draft))
                .render());
        final TaskMetadata metadata = draft.metadata() == null
                ? TaskMetadata.EMPTY : draft.metadata();
        for (final TaskMetadata.Key key : TaskMetadata.Key.values()) {
            final String value = valueOf(metadata, key);
            if (value != null && !value.isBlank()) {
                block.add(metadataLine(indent, key, value));
            }
        }
        lines.addAll(position, block);
        LOG.debug("Inserted task '{}' at line {}", draftLabel(draft), position);
        return SourceLines.join(lines);
    }

    /**
     * Adds a status keyword, or removes it when present.
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param status the status
     * @return the new text
     */
    public static String toggleStatus(final String code, final String reference,
            final TaskStatus status) {
        if (status == null) {
            return code;
        }
        return editLine(code, reference, line -> {
            final List<String> tokens = new ArrayList<>(line.tokens());
            final boolean removed = tokens.removeIf(
                    t -> t.equalsIgnoreCase(status.keyword()));
            if (!removed) {
                tokens.add(0, status.keyword());
            }
            return line.withTokens(tokens);
        });
    }

    /**
     * Removes every status keyword.
     *
     * @param code the chart text
     * @param reference the task id or label
     * @return the new text
     */
    public static String clearStatus(final String code,
            final String reference) {
        return editLine(code, reference, line -> {
            final List<String> tokens = new ArrayList<>(line.tokens());
            tokens.removeIf(t -> TaskStatus.fromKeyword(t).isPresent());
            return line.withTokens(tokens);
        });
    }

    /**
     * Marks or unmarks a task as a milestone.
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param milestone the desired state
     * @return the new text
     */
    public static String setMilestone(final String code,
            final String reference, final boolean milestone) {
        return editLine(code, reference, line -> {
            final List<String> tokens = new ArrayList<>(line.tokens());
            tokens.removeIf(t -> t.equalsIgnoreCase(TaskLine.MILESTONE));
            if (milestone) {
                tokens.add(line.statuses().size(), TaskLine.MILESTONE);
            }
            return line.withTokens(tokens);
        });
    }

    /**
     * Sets or clears a metadata comment below a task.
     *
     * <p>An existing comment is rewritten in place; a new one goes after
     * the task's other comments. Progress is clamped to 0..100, and a
     * progress that is not a number leaves the text alone.</p>
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param key the metadata key
     * @param value the value, null or blank to clear
     * @return the new text
     */
    public static String setMetadata(final String code, final String reference,
            final TaskMetadata.Key key, final String value) {
        if (key == null) {
            return code;
        }
        final Optional<GanttTask> found = new TaskIndex(
                GanttParser.parse(code).tasks()).find(reference);
        if (found.isEmpty()) {
            return code;
        }
        final boolean clear = value == null || value.isBlank();
        String written = clear ? null : value.trim().replace("\n", " ");
        if (!clear && key == TaskMetadata.Key.PROGRESS) {
            final Integer progress = TaskMetadata.clampProgress(written);
            if (progress == null) {
                return code;
            }
            written = String.valueOf(progress);
        }

        final GanttTask task = found.get();
        final List<String> lines = SourceLines.split(code);
        final String indent = SourceLines.indentOf(lines.get(task.lineIndex()));
        for (int i = task.lineIndex() + 1; i <= task.lastLine(); i++) {
            if (GanttParser.metadataKey(lines.get(i)).filter(k -> k == key)
                    .isPresent()) {
                if (clear) {
                    lines.remove(i);
                } else {
                    lines.set(i, metadataLine(indent, key, written));
                }
                return SourceLines.join(lines);
            }
        }
        if (clear) {
            return code;
        }
        lines.add(task.lastLine() + 1, metadataLine(indent, key, written));
        return SourceLines.join(lines);
    }

    private static String editLine(final String code, final String reference,
            final UnaryOperator<TaskLine> edit) {
        final Optional<GanttTask> found = new TaskIndex(
                GanttParser.parse(code).tasks()).find(reference);
        if (found.isEmpty()) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        final int index = found.get().lineIndex();
        final Optional<TaskLine> line = TaskLine.parse(lines.get(index));
        if (line.isEmpty()) {
            return code;
        }
        final TaskLine edited = edit.apply(line.get());
        if (edited.equals(line.get())) {
            return code;
        }
        lines.set(index, edited.render());
        return SourceLines.join(lines);
    }

    private static TaskLine withStart(final TaskLine line, final LocalDate start) {
        final List<String> tokens = new ArrayList<>(line.tokens());
        final int date = line.dateIndex();
        final int after = line.afterIndex();
        if (date >= 0) {
            tokens.set(date, start.toString());
        } else if (after >= 0) {
            tokens.set(after, start.toString());
        } else {
            final int duration = line.durationIndex();
            tokens.add(duration >= 0 ? duration : tokens.size(),
                    start.toString());
        }
        return line.withTokens(tokens);
    }

    private static TaskLine withEnd(final TaskLine line, final LocalDate end) {
        final List<String> tokens = new ArrayList<>(line.tokens());
        final int endIndex = line.endDateIndex();
        final int duration = line.durationIndex();
        final int date = line.dateIndex();
        if (endIndex >= 0) {
            tokens.set(endIndex, end.toString());
        } else if (duration >= 0) {
            tokens.set(duration, end.toString());
        } else if (date >= 0) {
            tokens.add(date + 1, end.toString());
        } else {
            tokens.add(end.toString());
        }
        return line.withTokens(tokens);
    }

    private static TaskLine withDuration(final TaskLine line,
            final String duration) {
        final List<String> tokens = new ArrayList<>(line.tokens());
        final int index = line.durationIndex();
        final int end = line.endDateIndex();
        final int date = line.dateIndex();
        final int after = line.afterIndex();
        if (index >= 0) {
            tokens.set(index, duration);
        } else if (end >= 0) {
            tokens.set(end, duration);
        } else if (date >= 0) {
            tokens.add(date + 1, duration);
        } else if (after >= 0) {
            tokens.add(after + 1, duration);
        } else {
            tokens.add(duration);
        }
        return line.withTokens(tokens);
    }

    /** Leaves the line as it is when a date would leave the calendar. */
    private static TaskLine shiftDates(final TaskLine line, final long days) {
        final List<String> tokens = new ArrayList<>(line.tokens());
        for (final int index : new int[] {line.dateIndex(),
                line.endDateIndex()}) {
            if (index < 0) {
                continue;
            }
            final Optional<LocalDate> moved = TaskLine.toDate(tokens.get(index))
                    .flatMap(date -> shift(date, days));
            if (moved.isEmpty()) {
                return line;
            }
            tokens.set(index, moved.get().toString());
        }
        return line.withTokens(tokens);
    }

    /** Dates outside four digit years cannot be written back as tokens. */
    private static Optional<LocalDate> shift(final LocalDate date,
            final long days) {
        try {
            final LocalDate moved = date.plusDays(days);
            if (moved.getYear() < 0 || moved.getYear() > MAX_YEAR) {
                LOG.debug("Moving {} by {} days leaves four digit years",
                        date, days);
                return Optional.empty();
            }
            return Optional.of(moved);
        } catch (final DateTimeException | ArithmeticException e) {
            LOG.debug("Cannot move {} by {} days: {}", date, days,
                    e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes an {@code after} token. An explicit start date is replaced by
     * it; an explicit end date then becomes a duration so that it is not
     * read as the new start.
     */
    private static TaskLine withDependencies(final TaskLine line,
            final List<String> deps) {
        final List<String> tokens = new ArrayList<>(line.tokens());
        final String token = "after " + String.join(" ", deps);
        final int after = line.afterIndex();
        if (after >= 0) {
            tokens.set(after, token);
            return line.withTokens(tokens);
        }
        final int date = line.dateIndex();
        if (date >= 0) {
            final int end = line.endDateIndex();
            if (end >= 0) {
                final Integer days = line.durationDays();
                if (line.durationIndex() < 0 && days != null) {
                    tokens.set(end, Math.max(days, 0) + "d");
                } else {
                    tokens.remove(end);
                }
            }
            tokens.set(date, token);
            return line.withTokens(tokens);
        }
        final int duration = line.durationIndex();
        tokens.add(duration >= 0 ? duration : tokens.size(), token);
        return line.withTokens(tokens);
    }

    /** Drops the {@code after} token, pinning the task when it can. */
    private static TaskLine withoutDependencies(final TaskLine line,
            final LocalDate resolvedStart) {
        final int after = line.afterIndex();
        if (after < 0) {
            return line;
        }
        final List<String> tokens = new ArrayList<>(line.tokens());
        if (line.dateIndex() < 0 && resolvedStart != null) {
            tokens.set(after, resolvedStart.toString());
        } else {
            tokens.remove(after);
        }
        return line.withTokens(tokens);
    }

    /** The bound becomes the working days the task spanned. */
    private static TaskLine withoutUntil(final TaskLine line,
            final ScheduledTask scheduled, final WorkingCalendar calendar) {
        final int until = line.untilIndex();
        if (until < 0) {
            return line;
        }
        final List<String> tokens = new ArrayList<>(line.tokens());
        if (line.durationIndex() < 0 && line.endDateIndex() < 0
                && scheduled.isResolved()) {
            tokens.set(until, calendar.workingDaysBetween(scheduled.start(),
                    scheduled.end()) + "d");
        } else {
            tokens.remove(until);
        }
        return line.withTokens(tokens);
    }

    private static List<String> tokens(final TaskDraft draft) {
        final List<String> tokens = new ArrayList<>();
        if (draft.statuses() != null) {
            draft.statuses().forEach(s -> tokens.add(s.keyword()));
        }
        if (draft.milestone()) {
            tokens.add(TaskLine.MILESTONE);
        }
        if (draft.id() != null && !draft.id().isBlank()) {
            tokens.add(draft.id().trim());
        }
        if (draft.startDate() != null) {
            tokens.add(draft.startDate().toString());
        } else if (draft.afterDeps() != null && !draft.afterDeps().isEmpty()) {
            tokens.add("after " + String.join(" ", draft.afterDeps()));
        }
        if (draft.endDate() != null) {
            tokens.add(draft.endDate().toString());
        } else if (draft.duration() != null
                && TaskLine.isDuration(draft.duration())) {
            tokens.add(draft.duration().trim());
        } else {
            tokens.add(DEFAULT_DURATION);
        }
        return tokens;
    }

    private static String draftLabel(final TaskDraft draft) {
        return draft.label() == null || draft.label().isBlank()
                ? DEFAULT_LABEL : sanitize(draft.label());
    }

    /** Colons would end the label early. */
    private static String sanitize(final String label) {
        return label.replace(":", " ").replace("\n", " ").trim();
    }

    private static String metadataLine(final String indent,
            final TaskMetadata.Key key, final String value) {
        return indent + "%% " + key.label() + ": " + value;
    }

    private static String valueOf(final TaskMetadata metadata,
            final TaskMetadata.Key key) {
        return switch (key) {
            case ASSIGNEE -> metadata.assignee();
            case NOTES -> metadata.notes();
            case LINK -> metadata.link();
            case PROGRESS -> metadata.progress() == null
                    ? null : String.valueOf(metadata.progress());
        };
    }

}
