package co.fanki.diagrameditor.gantt.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Edits on the {@code section} structure of a Gantt chart.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GanttSections {

    private GanttSections() {
    }

    /**
     * A section header.
     *
     * @param name the section name
     * @param lineIndex the index of the header line
     */
    public record Section(String name, int lineIndex) {}

    /**
     * Lists the section headers.
     *
     * @param code the chart text
     * @return the sections in document order
     */
    public static List<Section> list(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<Section> sections = new ArrayList<>();
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final Matcher matcher = GanttParser.SECTION.matcher(lines.get(i));
            if (matcher.matches()) {
                sections.add(new Section(matcher.group(2), i));
            }
        }
        return sections;
    }

    /**
     * Renames the first section with the given name, ignoring case.
     *
     * @param code the chart text
     * @param from the current name
     * @param to the new name
     * @return the new text
     */
    public static String rename(final String code, final String from,
            final String to) {
        if (to == null || to.isBlank()) {
            return code;
        }
        final Optional<Section> section = find(code, from);
        if (section.isEmpty()) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        final int index = section.get().lineIndex();
        lines.set(index, SourceLines.indentOf(lines.get(index)) + "section "
                + to.trim());
        return SourceLines.join(lines);
    }

    /**
     * Appends an empty section, preceded by a blank line. Nothing happens
     * when a section with that name exists.
     *
     * @param code the chart text
     * @param name the section name
     * @return the new text
     */
    public static String add(final String code, final String name) {
        if (name == null || name.isBlank() || find(code, name).isPresent()) {
            return code;
        }
        final List<String> lines = SourceLines.split(code);
        final int end = SourceLines.endOfContent(lines, t -> false);
        final List<String> result = new ArrayList<>(lines.subList(0, end));
        result.add("");
        result.add(sectionIndent(code) + "section " + name.trim());
        result.addAll(lines.subList(end, lines.size()));
        return SourceLines.join(result);
    }

    /**
     * Moves a task, with its metadata comments, to the end of a section.
     *
     * <p>A blank section name moves the task above the first section. A
     * section that does not exist is created at the end of the chart.</p>
     *
     * @param code the chart text
     * @param reference the task id or label
     * @param sectionName the destination section
     * @return the new text
     */
    public static String moveTask(final String code, final String reference,
            final String sectionName) {
        final Optional<GanttTask> found = new TaskIndex(
                GanttParser.parse(code).tasks()).find(reference);
        if (found.isEmpty()) {
            return code;
        }
        final GanttTask task = found.get();
        final boolean toTop = sectionName == null || sectionName.isBlank();
        if (!toTop && task.section() != null
                && task.section().equalsIgnoreCase(sectionName.trim())) {
            return code;
        }
        final String indent = sectionIndent(code);

        final List<String> lines = SourceLines.split(code);
        final List<String> block = new ArrayList<>(
                lines.subList(task.lineIndex(), task.lastLine() + 1));
        final List<String> rest = new ArrayList<>(lines.subList(0,
                task.lineIndex()));
        rest.addAll(lines.subList(task.lastLine() + 1, lines.size()));
        final String remaining = SourceLines.join(rest);

        final List<Section> sections = list(remaining);
        if (toTop) {
            if (sections.isEmpty()) {
                return code;
            }
            final int first = sections.get(0).lineIndex();
            final int at = SourceLines.endOfContent(rest.subList(0, first),
                    t -> false);
            rest.addAll(at, block);
            return SourceLines.join(rest);
        }

        final Optional<Section> target = sections.stream()
                .filter(s -> s.name().equalsIgnoreCase(sectionName.trim()))
                .findFirst();
        if (target.isEmpty()) {
            final int end = SourceLines.endOfContent(rest, t -> false);
            final List<String> added = new ArrayList<>();
            added.add("");
            added.add(indent + "section " + sectionName.trim());
            added.addAll(block);
            rest.addAll(end, added);
            return SourceLines.join(rest);
        }

        int limit = rest.size();
        for (final Section section : sections) {
            if (section.lineIndex() > target.get().lineIndex()) {
                limit = section.lineIndex();
                break;
            }
        }
        final int at = SourceLines.endOfContent(rest.subList(0, limit),
                t -> false);
        rest.addAll(at, block);
        return SourceLines.join(rest);
    }

    private static Optional<Section> find(final String code, final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return list(code).stream()
                .filter(s -> s.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    /** The indentation of existing headers, four spaces by default. */
    private static String sectionIndent(final String code) {
        final List<Section> sections = list(code);
        if (sections.isEmpty()) {
            return "    ";
        }
        return SourceLines.indentOf(SourceLines.split(code)
                .get(sections.get(0).lineIndex()));
    }

}
