package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads timelines.
 *
 * <p>A {@code period : event} line may carry more events separated by
 * further colons. A line starting with a colon adds events to the last
 * period.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TimelineReader implements DiagramReader<Timeline> {

    private static final Pattern TITLE = Pattern.compile("^title\\s+(.+)$");

    private static final Pattern SECTION = Pattern.compile("^section\\s+(.+)$");

    private static final Pattern PERIOD = Pattern.compile("^([^:]+?)\\s*:\\s*(.+)$");

    @Override
    public DiagramType type() {
        return DiagramType.TIMELINE;
    }

    @Override
    public Timeline parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<Timeline.Event> events = new ArrayList<>();
        String title = "";
        String section = "";
        String period = "";
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")
                    || trimmed.equals("timeline")) {
                continue;
            }
            Matcher matcher = TITLE.matcher(trimmed);
            if (matcher.matches()) {
                title = matcher.group(1).trim();
                continue;
            }
            matcher = SECTION.matcher(trimmed);
            if (matcher.matches()) {
                section = matcher.group(1).trim();
                continue;
            }
            if (trimmed.startsWith(":")) {
                addEvents(events, section, period, trimmed.substring(1), i);
                continue;
            }
            matcher = PERIOD.matcher(trimmed);
            if (matcher.matches()) {
                period = matcher.group(1).trim();
                addEvents(events, section, period, matcher.group(2), i);
            }
        }
        return new Timeline(title, List.copyOf(events));
    }

    /**
     * Appends a period with one event.
     *
     * @param code the timeline text
     * @param period the period
     * @param text the event text
     * @return the new text
     */
    public String addEvent(final String code, final String period,
            final String text) {
        return SourceLines.append(code, "    " + period.trim() + " : "
                + text.trim());
    }

    private static void addEvents(final List<Timeline.Event> events,
            final String section, final String period, final String text,
            final int lineIndex) {
        for (final String part : text.split(":")) {
            if (!part.isBlank()) {
                events.add(new Timeline.Event(section, period, part.trim(),
                        lineIndex));
            }
        }
    }

}
