package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;
import java.util.Map;

/**
 * A parsed quadrant chart.
 *
 * @param title the title, empty when absent
 * @param quadrants the quadrant labels by number, 1 to 4
 * @param points the plotted points
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record QuadrantChart(String title, Map<Integer, String> quadrants,
        List<Point> points) implements DiagramModel {

    /**
     * A point, {@code "Campaign A": [0.3, 0.6]}.
     *
     * @param label the point label
     * @param x the horizontal position, 0 to 1
     * @param y the vertical position, 0 to 1
     * @param lineIndex the line it was found on
     */
    public record Point(String label, double x, double y, int lineIndex) {}

    @Override
    public List<DiagramNode> elements() {
        return points.stream()
                .map(p -> new DiagramNode(p.label(), p.label(), "point",
                        p.lineIndex()))
                .toList();
    }

}
