package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;

/**
 * A parsed pie chart.
 *
 * @param title the chart title, empty when absent
 * @param showData whether values are printed next to the slices
 * @param slices the slices in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PieChart(String title, boolean showData, List<Slice> slices)
        implements DiagramModel {

    /**
     * A slice line, {@code "Dogs" : 386}.
     *
     * @param label the slice label
     * @param value the slice value
     * @param lineIndex the line it was found on
     */
    public record Slice(String label, double value, int lineIndex) {}

    @Override
    public List<DiagramNode> elements() {
        return slices.stream()
                .map(s -> new DiagramNode(s.label(), s.label(), "slice",
                        s.lineIndex()))
                .toList();
    }

}
