package co.fanki.diagrameditor.gantt.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The raw pieces of a task line: indentation, label and the comma
 * separated tokens after the colon.
 *
 * <p>Token positions are derived, never stored, so a mutator can edit
 * the token list and ask again. A task line reads
 * {@code label : [status, ...] [id,] start|after ..., [end|duration]}.</p>
 *
 * @param indent the leading whitespace of the line
 * @param label the task label, trimmed
 * @param tokens the trimmed, non-empty tokens
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TaskLine(String indent, String label, List<String> tokens) {

    private static final Logger LOG = LoggerFactory.getLogger(TaskLine.class);

    private static final Pattern LINE =
            Pattern.compile("^(\\s*)([^:\\n][^:]*?)\\s*:\\s*(.+?)\\s*$");

    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    /** Five digits at most, so that a year count still fits in days. */
    private static final Pattern DURATION =
            Pattern.compile("^(\\d{1,5})([dwmy])$");

    private static final String AFTER = "after ";

    private static final String UNTIL = "until ";

    /** Flag token for milestones. */
    public static final String MILESTONE = "milestone";

    /** Flag token for vertical markers. */
    public static final String VERT = "vert";

    /**
     * Splits a line into its task pieces.
     *
     * <p>Callers are expected to rule out directive and section lines
     * first: a directive such as {@code title a: b} also looks like a
     * task.</p>
     *
     * @param line the raw line
     * @return the pieces, empty when the line has no {@code label : tokens}
     *         shape
     */
    public static Optional<TaskLine> parse(final String line) {
        if (line == null) {
            return Optional.empty();
        }
        final Matcher matcher = LINE.matcher(line);
        if (!matcher.matches() || matcher.group(2).isBlank()) {
            return Optional.empty();
        }
        final List<String> tokens = new ArrayList<>();
        for (final String token : matcher.group(3).split(",")) {
            if (!token.isBlank()) {
                tokens.add(token.trim());
            }
        }
        return Optional.of(new TaskLine(matcher.group(1),
                matcher.group(2).trim(), tokens));
    }

    /**
     * Renders the line back, tokens joined with a comma and a space.
     *
     * @return the line text
     */
    public String render() {
        return indent + label + " :" + String.join(", ", tokens);
    }

    /**
     * Returns a copy with other tokens.
     *
     * @param theTokens the new tokens
     * @return the new line
     */
    public TaskLine withTokens(final List<String> theTokens) {
        return new TaskLine(indent, label, List.copyOf(theTokens));
    }

    /**
     * Returns a copy with another label.
     *
     * @param theLabel the new label
     * @return the new line
     */
    public TaskLine withLabel(final String theLabel) {
        return new TaskLine(indent, theLabel.trim(), tokens);
    }

    /** @return the index of the first {@code after} token, or -1 */
    public int afterIndex() {
        return indexOfPrefix(AFTER);
    }

    /** @return the index of the first {@code until} token, or -1 */
    public int untilIndex() {
        return indexOfPrefix(UNTIL);
    }

    /** @return the index of the first ISO date token, or -1 */
    public int dateIndex() {
        for (int i = 0; i < tokens.size(); i++) {
            if (isDate(tokens.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /** @return the index of a second ISO date after the start, or -1 */
    public int endDateIndex() {
        final int start = dateIndex();
        if (start < 0) {
            return -1;
        }
        for (int i = start + 1; i < tokens.size(); i++) {
            if (isDate(tokens.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds the duration token.
     *
     * <p>It is the token right after the start date, or right after the
     * {@code after} token, or, when the task has neither, the last
     * token.</p>
     *
     * @return the index, or -1
     */
    public int durationIndex() {
        final int date = dateIndex();
        if (date >= 0 && isDurationAt(date + 1)) {
            return date + 1;
        }
        final int after = afterIndex();
        if (after >= 0 && isDurationAt(after + 1)) {
            return after + 1;
        }
        final int until = untilIndex();
        if (date < 0 && after < 0 && until < 0 && !tokens.isEmpty()
                && isDurationAt(tokens.size() - 1)) {
            return tokens.size() - 1;
        }
        return -1;
    }

    /**
     * Finds the id token: the token right before the start date, or
     * right before the {@code after} or {@code until} token, provided it
     * is not itself a date, duration, status or flag.
     *
     * @return the index, or -1
     */
    public int idIndex() {
        for (final int anchor : new int[] {dateIndex(), afterIndex(),
                untilIndex()}) {
            if (anchor > 0 && isIdentifier(tokens.get(anchor - 1))) {
                return anchor - 1;
            }
        }
        return -1;
    }

    /** @return the id token, or null */
    public String id() {
        final int index = idIndex();
        return index < 0 ? null : tokens.get(index);
    }

    /** @return the status keywords in the order written */
    public List<TaskStatus> statuses() {
        final List<TaskStatus> statuses = new ArrayList<>();
        for (final String token : tokens) {
            TaskStatus.fromKeyword(token).ifPresent(statuses::add);
        }
        return statuses;
    }

    /** @return whether the line carries the given flag token */
    public boolean hasFlag(final String flag) {
        return tokens.stream().anyMatch(t -> t.equalsIgnoreCase(flag));
    }

    /** @return the references listed after {@code after}, as written */
    public List<String> afterDeps() {
        final int index = afterIndex();
        if (index < 0) {
            return List.of();
        }
        final String rest = tokens.get(index).substring(AFTER.length()).trim();
        if (rest.isEmpty()) {
            return List.of();
        }
        return List.copyOf(Arrays.asList(rest.split("\\s+")));
    }

    /** @return the reference after {@code until}, or null */
    public String untilDep() {
        final int index = untilIndex();
        if (index < 0) {
            return null;
        }
        final String rest = tokens.get(index).substring(UNTIL.length()).trim();
        return rest.isEmpty() ? null : rest.split("\\s+")[0];
    }

    /** @return the explicit start date, or null */
    public LocalDate startDate() {
        final int index = dateIndex();
        return index < 0 ? null : toDate(tokens.get(index)).orElse(null);
    }

    /** @return the explicit end date, or null */
    public LocalDate endDate() {
        final int index = endDateIndex();
        return index < 0 ? null : toDate(tokens.get(index)).orElse(null);
    }

    /**
     * Returns the duration in days: the duration token when present,
     * otherwise the distance between an explicit start and end date.
     *
     * @return the days, or null when the line states neither
     */
    public Integer durationDays() {
        final int index = durationIndex();
        if (index >= 0) {
            return toDays(tokens.get(index));
        }
        final LocalDate start = startDate();
        final LocalDate end = endDate();
        if (start != null && end != null) {
            return (int) (end.toEpochDay() - start.toEpochDay());
        }
        return null;
    }

    /**
     * Checks whether a token is an ISO date.
     *
     * @param token the token
     * @return true for {@code yyyy-MM-dd} tokens
     */
    public static boolean isDate(final String token) {
        return token != null && DATE.matcher(token.trim()).matches();
    }

    /**
     * Checks whether a token is a duration such as {@code 3d} or
     * {@code 2w}. Amounts of more than five digits are not durations.
     *
     * @param token the token
     * @return true for duration tokens
     */
    public static boolean isDuration(final String token) {
        return token != null && DURATION.matcher(token.trim()).matches();
    }

    /**
     * Converts a duration token to days. Months count 30 days and years
     * 365.
     *
     * @param token the duration token
     * @return the days, null when the token is not a duration
     */
    public static Integer toDays(final String token) {
        final Matcher matcher = DURATION.matcher(token == null ? "" : token.trim());
        if (!matcher.matches()) {
            return null;
        }
        final int amount = Integer.parseInt(matcher.group(1));
        return switch (matcher.group(2)) {
            case "w" -> amount * 7;
            case "m" -> amount * 30;
            case "y" -> amount * 365;
            default -> amount;
        };
    }

    /**
     * Reads an ISO date token. Tokens shaped like a date that name no
     * calendar day, such as {@code 2026-02-30}, are not dates.
     *
     * @param token the token
     * @return the date, empty when the token is not a valid date
     */
    public static Optional<LocalDate> toDate(final String token) {
        if (!isDate(token)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(token.trim()));
        } catch (final DateTimeParseException e) {
            LOG.debug("Ignoring invalid date {}: {}", token, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isDurationAt(final int index) {
        return index >= 0 && index < tokens.size()
                && index != endDateIndex() && isDuration(tokens.get(index));
    }

    private boolean isIdentifier(final String token) {
        return !isDate(token) && !isDuration(token)
                && TaskStatus.fromKeyword(token).isEmpty()
                && !token.equalsIgnoreCase(MILESTONE)
                && !token.equalsIgnoreCase(VERT)
                && !token.toLowerCase(Locale.ROOT).startsWith(AFTER)
                && !token.toLowerCase(Locale.ROOT).startsWith(UNTIL);
    }

    private int indexOfPrefix(final String prefix) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).toLowerCase(Locale.ROOT).startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }

}
