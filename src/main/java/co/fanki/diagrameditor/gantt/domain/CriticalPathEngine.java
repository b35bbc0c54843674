package co.fanki.diagrameditor.gantt.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Critical path method and dependency conflict detection.
 *
 * <p>Early dates are the resolved ones; the engine does not move tasks.
 * The backward pass walks the topological order in reverse, giving each
 * task a late finish equal to the earliest late start among its
 * successors, or the project end when it has none.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CriticalPathEngine {

    private static final Logger LOG = LoggerFactory.getLogger(
            CriticalPathEngine.class);

    private CriticalPathEngine() {
    }

    /**
     * Computes slack and the critical path.
     *
     * <p>Unresolved tasks are left out. Tasks on a dependency cycle get
     * no late dates, zero slack, and are not critical.</p>
     *
     * @param schedule the resolved schedule
     * @param graph the dependency graph of the same tasks
     * @return the report, never null
     */
    public static CriticalPathReport analyze(final ResolvedSchedule schedule,
            final DependencyGraph graph) {
        final Map<String, ScheduledTask> byKey = new LinkedHashMap<>();
        for (final ScheduledTask task : schedule.resolved()) {
            byKey.putIfAbsent(task.key(), task);
        }
        if (byKey.isEmpty()) {
            return new CriticalPathReport(null, List.of(), List.of());
        }

        LocalDate projectEnd = null;
        for (final ScheduledTask task : byKey.values()) {
            if (projectEnd == null || task.end().isAfter(projectEnd)) {
                projectEnd = task.end();
            }
        }

        final List<String> order = graph.topologicalOrder();
        final Map<String, LocalDate> lateStart = new HashMap<>();
        final Map<String, LocalDate> lateFinish = new HashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            final ScheduledTask task = byKey.get(order.get(i));
            if (task == null) {
                continue;
            }
            LocalDate finish = projectEnd;
            for (final String successor : graph.successors(task.key())) {
                final LocalDate start = lateStart.get(successor);
                if (start != null && start.isBefore(finish)) {
                    finish = start;
                }
            }
            lateFinish.put(task.key(), finish);
            lateStart.put(task.key(), finish.minusDays(task.days()));
        }

        final List<TaskSlack> slack = new ArrayList<>();
        for (final ScheduledTask task : byKey.values()) {
            final LocalDate latest = lateStart.get(task.key());
            if (latest == null) {
                slack.add(new TaskSlack(task.key(), task.task().label(),
                        task.start(), task.end(), null, null, 0, false));
                continue;
            }
            final long days = Math.max(0,
                    ChronoUnit.DAYS.between(task.start(), latest));
            slack.add(new TaskSlack(task.key(), task.task().label(),
                    task.start(), task.end(), latest,
                    lateFinish.get(task.key()), days, days <= 0));
        }

        final List<String> critical = slack.stream()
                .filter(TaskSlack::critical)
                .filter(s -> !byKey.get(s.key()).task().vert())
                .sorted(Comparator.comparing(TaskSlack::earlyStart))
                .map(TaskSlack::key)
                .toList();
        LOG.debug("Critical path over {} tasks: {}", slack.size(), critical);
        return new CriticalPathReport(projectEnd, List.copyOf(slack), critical);
    }

    /**
     * Finds tasks that start before one of their {@code after}
     * dependencies ends. A diagnostic only: nothing is moved.
     *
     * @param schedule the resolved schedule
     * @return the conflicts, in document order
     */
    public static List<ScheduleConflict> findConflicts(
            final ResolvedSchedule schedule) {
        final List<GanttTask> tasks = schedule.tasks().stream()
                .map(ScheduledTask::task).toList();
        final TaskIndex index = new TaskIndex(tasks);
        final Map<GanttTask, ScheduledTask> scheduled = new IdentityHashMap<>();
        for (final ScheduledTask task : schedule.tasks()) {
            scheduled.put(task.task(), task);
        }

        final List<ScheduleConflict> conflicts = new ArrayList<>();
        for (final ScheduledTask task : schedule.resolved()) {
            for (final String reference : task.task().afterDeps()) {
                final Optional<ScheduledTask> dependency = index.find(reference)
                        .filter(dep -> dep != task.task())
                        .map(scheduled::get)
                        .filter(ScheduledTask::isResolved);
                if (dependency.isPresent()
                        && task.start().isBefore(dependency.get().end())) {
                    conflicts.add(new ScheduleConflict(task.key(),
                            task.task().label(), dependency.get().key(),
                            dependency.get().task().label(),
                            ChronoUnit.DAYS.between(task.start(),
                                    dependency.get().end())));
                }
            }
        }
        return conflicts;
    }

}
