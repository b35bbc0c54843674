package co.fanki.diagrameditor.gantt.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Buckets each assignee's tasks into ISO weeks and reports the weeks
 * where a person runs too many of them.
 *
 * <p>A task counts in every week it runs, from its start up to the day
 * before its end. Milestones and unresolved tasks run in no week.
 * Assignees match case-insensitively. People with the most overloaded
 * weeks come first, ties by name.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ResourceLoadAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ResourceLoadAnalyzer.class);

    /** A task spanning more weeks than this is only counted for these. */
    static final int MAX_WEEKS = 1040;

    private final int weeklyThreshold;

    /**
     * Creates a new ResourceLoadAnalyzer.
     *
     * @param theWeeklyThreshold the task count that overloads a week, at
     *        least 1
     */
    public ResourceLoadAnalyzer(final int theWeeklyThreshold) {
        this.weeklyThreshold = Math.max(1, theWeeklyThreshold);
    }

    /**
     * Computes the load of every assignee.
     *
     * @param schedule the resolved schedule
     * @return one entry per assignee
     */
    public List<ResourceLoad> analyze(final ResolvedSchedule schedule) {
        final Map<String, String> names = new LinkedHashMap<>();
        final Map<String, Set<String>> taskKeys = new LinkedHashMap<>();
        final Map<String, TreeMap<LocalDate, Set<String>>> weeks =
                new LinkedHashMap<>();

        for (final ScheduledTask scheduled : schedule.resolved()) {
            final String assignee = scheduled.task().metadata().assignee();
            if (assignee == null) {
                continue;
            }
            final List<LocalDate> running = weeksOf(scheduled);
            for (final String raw : assignee.split(",")) {
                final String name = raw.trim();
                if (name.isEmpty()) {
                    continue;
                }
                final String person = name.toLowerCase(Locale.ROOT);
                names.putIfAbsent(person, name);
                final TreeMap<LocalDate, Set<String>> byWeek =
                        weeks.computeIfAbsent(person, k -> new TreeMap<>());
                for (final LocalDate monday : running) {
                    byWeek.computeIfAbsent(monday, k -> new LinkedHashSet<>())
                            .add(scheduled.task().label());
                    taskKeys.computeIfAbsent(person, k -> new LinkedHashSet<>())
                            .add(scheduled.key());
                }
            }
        }

        final List<ResourceLoad> loads = new ArrayList<>();
        for (final Map.Entry<String, String> entry : names.entrySet()) {
            final String person = entry.getKey();
            final List<ResourceLoad.Week> overloaded = new ArrayList<>();
            weeks.get(person).forEach((monday, labels) -> {
                if (labels.size() >= weeklyThreshold) {
                    overloaded.add(new ResourceLoad.Week(weekKey(monday),
                            monday, List.copyOf(labels)));
                }
            });
            loads.add(new ResourceLoad(entry.getValue(),
                    taskKeys.getOrDefault(person, Set.of()).size(),
                    List.copyOf(overloaded)));
        }
        loads.sort(Comparator.comparing(
                (ResourceLoad load) -> load.overloadedWeeks().size())
                .reversed()
                .thenComparing(ResourceLoad::name, String.CASE_INSENSITIVE_ORDER));
        return List.copyOf(loads);
    }

    /**
     * Formats the ISO week of a day.
     *
     * @param date the day
     * @return the key, such as {@code 2026-W02}
     */
    public static String weekKey(final LocalDate date) {
        return String.format(Locale.ROOT, "%d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private static List<LocalDate> weeksOf(final ScheduledTask scheduled) {
        final List<LocalDate> mondays = new ArrayList<>();
        if (!scheduled.end().isAfter(scheduled.start())) {
            return mondays;
        }
        LocalDate monday = scheduled.start().with(
                TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        while (monday.isBefore(scheduled.end())) {
            if (mondays.size() == MAX_WEEKS) {
                LOG.debug("Counting only {} weeks of '{}'", MAX_WEEKS,
                        scheduled.task().label());
                break;
            }
            mondays.add(monday);
            monday = monday.plusWeeks(1);
        }
        return mondays;
    }

}
