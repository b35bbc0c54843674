package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.shared.SourceLines;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads pie charts and edits their slices by label.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PieChartReader implements DiagramReader<PieChart> {

    private static final Pattern HEADER = Pattern.compile(
            "^pie(\\s+showData)?(?:\\s+title\\s+(.+))?$");

    private static final Pattern TITLE = Pattern.compile("^title\\s+(.+)$");

    private static final Pattern SLICE = Pattern.compile(
            "^\"([^\"]+)\"\\s*:\\s*(\\d+(?:\\.\\d+)?)$");

    private static final Pattern VALUE = Pattern.compile(":\\s*\\d+(?:\\.\\d+)?");

    @Override
    public DiagramType type() {
        return DiagramType.PIE;
    }

    @Override
    public PieChart parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<PieChart.Slice> slices = new ArrayList<>();
        String title = "";
        boolean showData = false;
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            final Matcher header = HEADER.matcher(trimmed);
            if (header.matches()) {
                showData = header.group(1) != null;
                if (header.group(2) != null) {
                    title = header.group(2).trim();
                }
                continue;
            }
            final Matcher titleLine = TITLE.matcher(trimmed);
            if (titleLine.matches()) {
                title = titleLine.group(1).trim();
                continue;
            }
            final Matcher slice = SLICE.matcher(trimmed);
            if (slice.matches()) {
                slices.add(new PieChart.Slice(slice.group(1),
                        Double.parseDouble(slice.group(2)), i));
            }
        }
        return new PieChart(title, showData, List.copyOf(slices));
    }

    /**
     * Appends a slice.
     *
     * @param code the chart text
     * @param label the slice label
     * @param value the slice value
     * @return the new text
     */
    public String addSlice(final String code, final String label,
            final double value) {
        return SourceLines.append(code, "    \"" + label.replace("\"", "'")
                + "\" : " + format(value));
    }

    /**
     * Changes the value of the first slice with the given label.
     *
     * @param code the chart text
     * @param label the slice label
     * @param value the new value
     * @return the new text, unchanged when no slice has that label
     */
    public String updateSlice(final String code, final String label,
            final double value) {
        for (final PieChart.Slice slice : parse(code).slices()) {
            if (slice.label().equals(label)) {
                final List<String> lines = SourceLines.split(code);
                lines.set(slice.lineIndex(), VALUE.matcher(
                        lines.get(slice.lineIndex())).replaceFirst(
                                Matcher.quoteReplacement(": " + format(value))));
                return SourceLines.join(lines);
            }
        }
        return code;
    }

    /**
     * Removes every slice with the given label.
     *
     * @param code the chart text
     * @param label the slice label
     * @return the new text
     */
    public String removeSlice(final String code, final String label) {
        final Set<Integer> drop = new HashSet<>();
        for (final PieChart.Slice slice : parse(code).slices()) {
            if (slice.label().equals(label)) {
                drop.add(slice.lineIndex());
            }
        }
        return SourceLines.removeLines(code, drop);
    }

    private static String format(final double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

}
