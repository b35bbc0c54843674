package co.fanki.diagrameditor.gantt.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * The days a chart works on, from its {@code excludes} and
 * {@code weekend} directives.
 *
 * <p>An exclusion is {@code weekends}, a day name such as
 * {@code monday}, or an ISO date. Weekends are Saturday and Sunday, or
 * Friday and Saturday when the chart declares {@code weekend friday}.
 * Durations count working days only: a task of 2 days starting on a
 * Friday ends on Tuesday when weekends are excluded.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WorkingCalendar {

    private static final Logger LOG = LoggerFactory.getLogger(
            WorkingCalendar.class);

    /** A calendar where every day is a working day. */
    public static final WorkingCalendar ALL_DAYS =
            new WorkingCalendar(EnumSet.noneOf(DayOfWeek.class), new TreeSet<>());

    private final Set<DayOfWeek> excludedDays;

    private final TreeSet<LocalDate> excludedDates;

    private WorkingCalendar(final Set<DayOfWeek> theExcludedDays,
            final TreeSet<LocalDate> theExcludedDates) {
        excludedDays = theExcludedDays;
        excludedDates = theExcludedDates;
    }

    /**
     * Builds the calendar a chart declares.
     *
     * <p>Unknown exclusions are ignored. A chart excluding all seven days
     * of the week would never finish a task, so it falls back to
     * counting every day.</p>
     *
     * @param directives the chart directives
     * @return the calendar
     */
    public static WorkingCalendar of(final GanttDirectives directives) {
        if (directives == null || directives.excludes().isEmpty()) {
            return ALL_DAYS;
        }
        final Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        final TreeSet<LocalDate> dates = new TreeSet<>();
        for (final String raw : directives.excludes()) {
            final String exclusion = raw.trim().toLowerCase(Locale.ROOT);
            if (exclusion.equals("weekends")) {
                days.addAll(weekend(directives.weekend()));
            } else if (dayOf(exclusion) != null) {
                days.add(dayOf(exclusion));
            } else {
                TaskLine.toDate(exclusion).ifPresentOrElse(dates::add,
                        () -> LOG.debug("Ignoring exclusion '{}'", exclusion));
            }
        }
        if (days.size() == DayOfWeek.values().length) {
            LOG.debug("Every weekday is excluded, counting calendar days");
            return ALL_DAYS;
        }
        return new WorkingCalendar(days, dates);
    }

    /**
     * Checks whether a day is excluded from work.
     *
     * @param date the day
     * @return true for excluded weekdays and excluded dates
     */
    public boolean isExcluded(final LocalDate date) {
        return excludedDays.contains(date.getDayOfWeek())
                || excludedDates.contains(date);
    }

    /**
     * Returns the day a task ends when it starts on a date and lasts a
     * number of working days. Each day after the start that is not
     * excluded counts as one.
     *
     * @param start the start day
     * @param workingDays the duration, zero or less returns the start
     * @return the end day
     */
    public LocalDate addWorkingDays(final LocalDate start,
            final int workingDays) {
        if (workingDays <= 0) {
            return start;
        }
        if (excludedDays.isEmpty() && excludedDates.isEmpty()) {
            return start.plusDays(workingDays);
        }
        final int perWeek = DayOfWeek.values().length - excludedDays.size();
        final long weeks = (workingDays - 1) / perWeek;
        LocalDate current = start.plusWeeks(weeks);
        long remaining = workingDays - weeks * perWeek
                + excludedDatesOnWorkingDays(start, current);
        while (remaining > 0) {
            current = current.plusDays(1);
            if (!isExcluded(current)) {
                remaining--;
            }
        }
        return current;
    }

    /**
     * Counts the working days after a start, up to and including an end.
     *
     * @param start the start day
     * @param end the end day
     * @return the working days, zero when the end is not after the start
     */
    public long workingDaysBetween(final LocalDate start, final LocalDate end) {
        if (!end.isAfter(start)) {
            return 0;
        }
        final long weeks = ChronoUnit.WEEKS.between(start, end);
        LocalDate current = start.plusWeeks(weeks);
        long count = weeks * (DayOfWeek.values().length - excludedDays.size())
                - excludedDatesOnWorkingDays(start, current);
        while (current.isBefore(end)) {
            current = current.plusDays(1);
            if (!isExcluded(current)) {
                count++;
            }
        }
        return count;
    }

    /** Counts the excluded dates in (from, to] that fall on working weekdays. */
    private long excludedDatesOnWorkingDays(final LocalDate from,
            final LocalDate to) {
        return excludedDates.subSet(from, false, to, true).stream()
                .filter(date -> !excludedDays.contains(date.getDayOfWeek()))
                .count();
    }

    private static Set<DayOfWeek> weekend(final String firstDay) {
        if ("friday".equals(firstDay)) {
            return EnumSet.of(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);
        }
        return EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
    }

    private static DayOfWeek dayOf(final String name) {
        for (final DayOfWeek day : DayOfWeek.values()) {
            if (day.name().toLowerCase(Locale.ROOT).equals(name)) {
                return day;
            }
        }
        return null;
    }

    /** @return the excluded days of the week */
    public Set<DayOfWeek> excludedDays() {
        return Set.copyOf(excludedDays);
    }

    /** @return the excluded dates, in order */
    public List<LocalDate> excludedDates() {
        return List.copyOf(excludedDates);
    }

}
