package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.shared.SourceLines;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads quadrant charts.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class QuadrantChartReader implements DiagramReader<QuadrantChart> {

    private static final Pattern TITLE = Pattern.compile("^title\\s+(.+)$");

    private static final Pattern QUADRANT =
            Pattern.compile("^quadrant-([1-4])\\s+(.+)$");

    private static final Pattern POINT = Pattern.compile(
            "^\"?([^\":]+?)\"?\\s*:\\s*\\[\\s*(\\d+(?:\\.\\d+)?)\\s*,"
                    + "\\s*(\\d+(?:\\.\\d+)?)\\s*\\]");

    @Override
    public DiagramType type() {
        return DiagramType.QUADRANT;
    }

    @Override
    public QuadrantChart parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final Map<Integer, String> quadrants = new TreeMap<>();
        final List<QuadrantChart.Point> points = new ArrayList<>();
        String title = "";
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")
                    || trimmed.equals("quadrantChart")) {
                continue;
            }
            Matcher matcher = TITLE.matcher(trimmed);
            if (matcher.matches()) {
                title = matcher.group(1).trim();
                continue;
            }
            matcher = QUADRANT.matcher(trimmed);
            if (matcher.matches()) {
                quadrants.put(Integer.parseInt(matcher.group(1)),
                        matcher.group(2).trim());
                continue;
            }
            matcher = POINT.matcher(trimmed);
            if (matcher.find()) {
                points.add(new QuadrantChart.Point(matcher.group(1).trim(),
                        Double.parseDouble(matcher.group(2)),
                        Double.parseDouble(matcher.group(3)), i));
            }
        }
        return new QuadrantChart(title, quadrants, List.copyOf(points));
    }

    /**
     * Appends a point.
     *
     * @param code the chart text
     * @param label the point label
     * @param x the horizontal position
     * @param y the vertical position
     * @return the new text
     */
    public String addPoint(final String code, final String label,
            final double x, final double y) {
        return SourceLines.append(code, "    \"" + label.replace("\"", "'")
                + "\": [" + format(x) + ", " + format(y) + "]");
    }

    private static String format(final double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

}
