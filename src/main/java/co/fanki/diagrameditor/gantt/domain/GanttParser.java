package co.fanki.diagrameditor.gantt.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers directives, sections and tasks from Gantt chart text.
 *
 * <p>Never fails: lines that are neither directives, sections nor
 * {@code label : tokens} task lines are ignored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GanttParser {

    private static final Logger LOG = LoggerFactory.getLogger(GanttParser.class);

    /** Keywords that open a line which is never a task. */
    private static final List<String> DIRECTIVES = List.of("gantt", "title",
            "dateformat", "axisformat", "tickinterval", "todaymarker",
            "excludes", "includes", "weekend", "weekday", "displaymode",
            "inclusiveenddates", "topaxis", "acctitle", "accdescr", "click");

    private static final Pattern DIRECTIVE =
            Pattern.compile("^(\\w+)\\s*:?\\s*(.*?)\\s*$");

    static final Pattern SECTION =
            Pattern.compile("^(\\s*)section\\s+(.+?)\\s*$");

    private static final Pattern METADATA = Pattern.compile(
            "^%%\\s*(assignee|notes|link|progress)\\s*:\\s*(.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private GanttParser() {
    }

    /**
     * Parses a chart.
     *
     * @param code the chart text, may be null
     * @return the chart, never null
     */
    public static GanttChart parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final DirectiveBuilder directives = new DirectiveBuilder();
        final List<String> sections = new ArrayList<>();
        final List<GanttTask> tasks = new ArrayList<>();
        String section = null;

        int i = SourceLines.frontMatterEnd(lines);
        while (i < lines.size()) {
            final String line = lines.get(i);
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                i++;
                continue;
            }
            final Matcher sectionMatcher = SECTION.matcher(line);
            if (sectionMatcher.matches()) {
                section = sectionMatcher.group(2);
                sections.add(section);
                i++;
                continue;
            }
            if (isDirective(trimmed)) {
                directives.accept(trimmed);
                i++;
                continue;
            }
            final Optional<TaskLine> taskLine = TaskLine.parse(line);
            if (taskLine.isEmpty()) {
                i++;
                continue;
            }
            final int last = metadataEnd(lines, i);
            tasks.add(toTask(taskLine.get(), i, last, section,
                    readMetadata(lines, i, last)));
            i = last + 1;
        }
        LOG.debug("Parsed gantt chart with {} sections and {} tasks",
                sections.size(), tasks.size());
        return new GanttChart(directives.build(), List.copyOf(sections),
                List.copyOf(tasks));
    }

    /**
     * Checks whether a trimmed line is a directive.
     *
     * @param trimmed the trimmed line
     * @return true for chart settings and the header
     */
    static boolean isDirective(final String trimmed) {
        final String first = trimmed.split("[\\s:]", 2)[0]
                .toLowerCase(Locale.ROOT);
        return DIRECTIVES.contains(first);
    }

    /**
     * Returns the index of the last metadata comment line below a task.
     *
     * @param lines the chart lines
     * @param taskLine the task line index
     * @return the last metadata line, the task line when there is none
     */
    static int metadataEnd(final List<String> lines, final int taskLine) {
        int last = taskLine;
        while (last + 1 < lines.size()
                && METADATA.matcher(lines.get(last + 1).trim()).matches()) {
            last++;
        }
        return last;
    }

    /**
     * Reads a metadata comment line.
     *
     * @param line the raw line
     * @return the key, empty when the line is not a metadata comment
     */
    static Optional<TaskMetadata.Key> metadataKey(final String line) {
        final Matcher matcher = METADATA.matcher(line.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return TaskMetadata.Key.fromLabel(matcher.group(1));
    }

    private static TaskMetadata readMetadata(final List<String> lines,
            final int taskLine, final int last) {
        TaskMetadata metadata = TaskMetadata.EMPTY;
        for (int i = taskLine + 1; i <= last; i++) {
            final Matcher matcher = METADATA.matcher(lines.get(i).trim());
            if (matcher.matches()) {
                final Optional<TaskMetadata.Key> key =
                        TaskMetadata.Key.fromLabel(matcher.group(1));
                if (key.isPresent()) {
                    metadata = metadata.with(key.get(), matcher.group(2));
                }
            }
        }
        return metadata;
    }

    private static GanttTask toTask(final TaskLine line, final int index,
            final int last, final String section, final TaskMetadata metadata) {
        return new GanttTask(index, last, line.label(), section, line.id(),
                List.copyOf(line.statuses()),
                line.hasFlag(TaskLine.MILESTONE), line.hasFlag(TaskLine.VERT),
                line.startDate(), line.endDate(), line.durationDays(),
                line.afterDeps(), line.untilDep(), metadata);
    }

    private static final class DirectiveBuilder {

        private String title = "";
        private String dateFormat = GanttDirectives.DEFAULT_DATE_FORMAT;
        private String axisFormat;
        private String tickInterval;
        private String todayMarker = "on";
        private List<String> excludes = List.of();
        private String weekend;
        private String displayMode;

        private void accept(final String trimmed) {
            final Matcher matcher = DIRECTIVE.matcher(trimmed);
            if (!matcher.matches() || matcher.group(2).isEmpty()) {
                return;
            }
            final String value = matcher.group(2);
            switch (matcher.group(1).toLowerCase(Locale.ROOT)) {
                case "title" -> title = value;
                case "dateformat" -> dateFormat = value;
                case "axisformat" -> axisFormat = value;
                case "tickinterval" -> tickInterval = value;
                case "todaymarker" -> todayMarker = value;
                case "excludes" -> excludes = Arrays.stream(value.split(","))
                        .map(s -> s.trim().toLowerCase(Locale.ROOT))
                        .filter(s -> !s.isEmpty())
                        .toList();
                case "weekend", "weekday" ->
                        weekend = value.toLowerCase(Locale.ROOT);
                case "displaymode" -> displayMode = value;
                default -> LOG.trace("Ignoring directive {}", trimmed);
            }
        }

        private GanttDirectives build() {
            return new GanttDirectives(title, dateFormat, axisFormat,
                    tickInterval, todayMarker, excludes, weekend, displayMode);
        }
    }

}
