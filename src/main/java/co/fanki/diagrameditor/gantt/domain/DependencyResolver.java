package co.fanki.diagrameditor.gantt.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns {@code after} chains, {@code until} bounds and implicit
 * sequencing into concrete dates.
 *
 * <p>Resolution runs to a fixed point: each pass places the tasks whose
 * inputs are known, until a pass places nothing. A task starts at</p>
 * <ul>
 *   <li>its explicit date, when it has one;</li>
 *   <li>the latest end among its {@code after} dependencies;</li>
 *   <li>the end of the task above it, when it names neither.</li>
 * </ul>
 * <p>It ends at the start of its {@code until} task, at its explicit end
 * date, or after its duration. Nothing is guessed: a chain that never
 * reaches a date is reported as {@link ScheduleIssue.Type#UNANCHORED}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyResolver.class);

    private DependencyResolver() {
    }

    /**
     * Resolves every task of a chart.
     *
     * <p>Durations skip the days the chart excludes.</p>
     *
     * @param chart the parsed chart
     * @return the scheduled tasks and the resolution issues
     */
    public static ResolvedSchedule resolve(final GanttChart chart) {
        return resolve(chart.tasks(), WorkingCalendar.of(chart.directives()));
    }

    /**
     * Resolves tasks given in document order, counting every day.
     *
     * @param tasks the tasks
     * @return the scheduled tasks and the resolution issues
     */
    public static ResolvedSchedule resolve(final List<GanttTask> tasks) {
        return resolve(tasks, WorkingCalendar.ALL_DAYS);
    }

    /**
     * Resolves tasks given in document order.
     *
     * @param tasks the tasks
     * @param calendar the working days durations count
     * @return the scheduled tasks and the resolution issues
     */
    public static ResolvedSchedule resolve(final List<GanttTask> tasks,
            final WorkingCalendar calendar) {
        final TaskIndex index = new TaskIndex(tasks);
        final int size = tasks.size();
        final Map<GanttTask, Integer> positions = new HashMap<>();
        for (int i = 0; i < size; i++) {
            positions.put(tasks.get(i), i);
        }
        final LocalDate[] starts = new LocalDate[size];
        final LocalDate[] ends = new LocalDate[size];
        final List<ScheduleIssue> issues = new ArrayList<>();
        final Set<Integer> reported = new HashSet<>();

        for (int i = 0; i < size; i++) {
            final GanttTask task = tasks.get(i);
            final List<String> references = new ArrayList<>(task.afterDeps());
            if (task.untilDep() != null) {
                references.add(task.untilDep());
            }
            for (final String reference : references) {
                if (index.find(reference).isEmpty()) {
                    issues.add(new ScheduleIssue(task.key(), task.label(),
                            ScheduleIssue.Type.UNKNOWN_DEPENDENCY,
                            "Unknown dependency '" + reference + "'"));
                    reported.add(i);
                }
            }
        }

        boolean changed = true;
        int passes = 0;
        while (changed && passes <= size) {
            changed = false;
            passes++;
            for (int i = 0; i < size; i++) {
                if (starts[i] != null && ends[i] != null) {
                    continue;
                }
                final GanttTask task = tasks.get(i);
                if (starts[i] == null) {
                    starts[i] = startOf(tasks, positions, index, ends, i);
                    changed |= starts[i] != null;
                }
                if (starts[i] != null) {
                    ends[i] = endOf(task, starts[i], positions, index, starts,
                            calendar);
                    changed |= ends[i] != null;
                }
            }
        }

        final List<ScheduledTask> scheduled = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            final GanttTask task = tasks.get(i);
            final boolean resolved = starts[i] != null && ends[i] != null;
            if (!resolved && !reported.contains(i)) {
                issues.add(new ScheduleIssue(task.key(), task.label(),
                        ScheduleIssue.Type.UNANCHORED,
                        "No start date is reachable for '" + task.label()
                                + "'"));
            }
            scheduled.add(new ScheduledTask(task, starts[i],
                    resolved ? ends[i] : null));
        }
        LOG.debug("Resolved {} of {} tasks in {} passes",
                size - countUnresolved(scheduled), size, passes);
        return new ResolvedSchedule(List.copyOf(scheduled), List.copyOf(issues));
    }

    private static LocalDate startOf(final List<GanttTask> tasks,
            final Map<GanttTask, Integer> positions, final TaskIndex index,
            final LocalDate[] ends, final int position) {
        final GanttTask task = tasks.get(position);
        if (task.startDate() != null) {
            return task.startDate();
        }
        if (!task.afterDeps().isEmpty()) {
            LocalDate latest = null;
            boolean anyKnown = false;
            for (final String reference : task.afterDeps()) {
                final Optional<GanttTask> dependency = index.find(reference);
                if (dependency.isEmpty() || dependency.get() == task) {
                    continue;
                }
                anyKnown = true;
                final LocalDate end = ends[positions.get(dependency.get())];
                if (end == null) {
                    return null;
                }
                if (latest == null || end.isAfter(latest)) {
                    latest = end;
                }
            }
            return anyKnown ? latest : null;
        }
        return position == 0 ? null : ends[position - 1];
    }

    private static LocalDate endOf(final GanttTask task, final LocalDate start,
            final Map<GanttTask, Integer> positions, final TaskIndex index,
            final LocalDate[] starts, final WorkingCalendar calendar) {
        final Optional<GanttTask> until = index.find(task.untilDep());
        if (until.isPresent() && until.get() != task) {
            return starts[positions.get(until.get())];
        }
        if (task.endDate() != null) {
            return task.endDate();
        }
        try {
            return calendar.addWorkingDays(start, task.durationOrZero());
        } catch (final DateTimeException e) {
            LOG.debug("End of '{}' is past the calendar: {}", task.label(),
                    e.getMessage());
            return null;
        }
    }

    private static long countUnresolved(final List<ScheduledTask> tasks) {
        return tasks.stream().filter(t -> !t.isResolved()).count();
    }

}
