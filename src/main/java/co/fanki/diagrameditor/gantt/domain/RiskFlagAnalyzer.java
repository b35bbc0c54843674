package co.fanki.diagrameditor.gantt.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flags risky tasks in a resolved schedule.
 *
 * <p>Three checks run independently:</p>
 * <ul>
 *   <li>bottlenecks, tasks waiting on at least a given number of
 *   others;</li>
 *   <li>broken dependencies, explicit starts before a dependency
 *   ends;</li>
 *   <li>overloaded assignees, people running at least a given number of
 *   tasks at the same time. Milestones, markers and tasks longer than
 *   two weeks do not count as concurrent work.</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RiskFlagAnalyzer {

    /** Tasks longer than this many days are not counted for overload. */
    private static final int LONG_TASK_DAYS = 14;

    private final int manyDependenciesThreshold;

    private final int overloadThreshold;

    /**
     * Creates a new RiskFlagAnalyzer.
     *
     * @param theManyDependenciesThreshold the dependency count that makes
     *        a task a bottleneck, at least 1
     * @param theOverloadThreshold the concurrent task count that overloads
     *        an assignee, at least 1
     */
    public RiskFlagAnalyzer(final int theManyDependenciesThreshold,
            final int theOverloadThreshold) {
        this.manyDependenciesThreshold = Math.max(1, theManyDependenciesThreshold);
        this.overloadThreshold = Math.max(1, theOverloadThreshold);
    }

    /**
     * Runs every check.
     *
     * @param schedule the resolved schedule
     * @return the flags, grouped by check and in document order within each
     */
    public List<RiskFlag> analyze(final ResolvedSchedule schedule) {
        final List<RiskFlag> flags = new ArrayList<>();
        flags.addAll(bottlenecks(schedule));
        flags.addAll(brokenDependencies(schedule));
        flags.addAll(overloads(schedule));
        return flags;
    }

    private List<RiskFlag> bottlenecks(final ResolvedSchedule schedule) {
        final List<RiskFlag> flags = new ArrayList<>();
        for (final ScheduledTask scheduled : schedule.tasks()) {
            final int count = scheduled.task().afterDeps().size();
            if (count >= manyDependenciesThreshold) {
                flags.add(flag(scheduled, RiskFlag.Type.MANY_DEPENDENCIES,
                        "Bottleneck: waiting on " + count
                                + " tasks to finish before this can start"));
            }
        }
        return flags;
    }

    private List<RiskFlag> brokenDependencies(final ResolvedSchedule schedule) {
        final List<GanttTask> tasks = schedule.tasks().stream()
                .map(ScheduledTask::task).toList();
        final TaskIndex index = new TaskIndex(tasks);
        final Map<GanttTask, ScheduledTask> byTask = new IdentityHashMap<>();
        schedule.tasks().forEach(t -> byTask.put(t.task(), t));

        final List<RiskFlag> flags = new ArrayList<>();
        for (final ScheduledTask scheduled : schedule.tasks()) {
            final LocalDate start = scheduled.task().startDate();
            if (start == null) {
                continue;
            }
            for (final String reference : scheduled.task().afterDeps()) {
                final Optional<ScheduledTask> dependency = index.find(reference)
                        .filter(dep -> dep != scheduled.task())
                        .map(byTask::get)
                        .filter(ScheduledTask::isResolved);
                if (dependency.isPresent()
                        && start.isBefore(dependency.get().end())) {
                    flags.add(flag(scheduled, RiskFlag.Type.BROKEN_DEPENDENCY,
                            "Broken dependency: this task starts before '"
                                    + dependency.get().task().label()
                                    + "' finishes"));
                    break;
                }
            }
        }
        return flags;
    }

    private List<RiskFlag> overloads(final ResolvedSchedule schedule) {
        final Map<String, String> names = new LinkedHashMap<>();
        final Map<String, List<ScheduledTask>> byPerson = new LinkedHashMap<>();
        for (final ScheduledTask scheduled : schedule.resolved()) {
            final GanttTask task = scheduled.task();
            final String assignee = task.metadata().assignee();
            if (assignee == null || task.milestone() || task.vert()
                    || scheduled.days() <= 0
                    || scheduled.days() > LONG_TASK_DAYS) {
                continue;
            }
            for (final String raw : assignee.split(",")) {
                final String name = raw.trim();
                if (name.isEmpty()) {
                    continue;
                }
                final String person = name.toLowerCase(Locale.ROOT);
                names.putIfAbsent(person, name);
                byPerson.computeIfAbsent(person, k -> new ArrayList<>())
                        .add(scheduled);
            }
        }

        final Map<ScheduledTask, Set<String>> overloaded = new LinkedHashMap<>();
        final Map<String, Integer> peaks = new HashMap<>();
        for (final Map.Entry<String, List<ScheduledTask>> entry
                : byPerson.entrySet()) {
            if (entry.getValue().size() < overloadThreshold) {
                continue;
            }
            sweep(entry.getKey(), entry.getValue(), overloaded, peaks);
        }

        final List<RiskFlag> flags = new ArrayList<>();
        for (final ScheduledTask scheduled : schedule.resolved()) {
            for (final String person : overloaded.getOrDefault(scheduled,
                    Set.of())) {
                flags.add(flag(scheduled, RiskFlag.Type.OVERLOADED_ASSIGNEE,
                        "Overloaded: " + names.get(person) + " has "
                                + peaks.get(person)
                                + " tasks at the same time"));
            }
        }
        return flags;
    }

    /**
     * Sweeps a person's tasks in time order. Ends sort before starts on
     * the same day, so back to back tasks never overlap.
     */
    private void sweep(final String person, final List<ScheduledTask> tasks,
            final Map<ScheduledTask, Set<String>> overloaded,
            final Map<String, Integer> peaks) {
        final List<Event> events = new ArrayList<>();
        for (final ScheduledTask task : tasks) {
            events.add(new Event(task.start(), true, task));
            events.add(new Event(task.end(), false, task));
        }
        events.sort(Comparator.comparing(Event::time)
                .thenComparing(Event::start));

        final Set<ScheduledTask> active = new LinkedHashSet<>();
        for (final Event event : events) {
            if (!event.start()) {
                active.remove(event.task());
                continue;
            }
            active.add(event.task());
            if (active.size() >= overloadThreshold) {
                peaks.merge(person, active.size(), Math::max);
                for (final ScheduledTask task : active) {
                    overloaded.computeIfAbsent(task,
                            k -> new LinkedHashSet<>()).add(person);
                }
            }
        }
    }

    private static RiskFlag flag(final ScheduledTask task,
            final RiskFlag.Type type, final String reason) {
        return new RiskFlag(task.key(), task.task().label(), type, reason);
    }

    private record Event(LocalDate time, boolean start, ScheduledTask task) {}

}
