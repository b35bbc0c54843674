package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;

/**
 * A parsed timeline.
 *
 * @param title the title, empty when absent
 * @param events the events in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Timeline(String title, List<Event> events)
        implements DiagramModel {

    /**
     * One event of a period.
     *
     * @param section the enclosing section, empty when none
     * @param period the time period it belongs to
     * @param text the event text
     * @param lineIndex the line it was found on
     */
    public record Event(String section, String period, String text,
            int lineIndex) {}

    @Override
    public List<DiagramNode> elements() {
        return events.stream()
                .map(e -> new DiagramNode(e.period() + ":" + e.text(),
                        e.text(), "event", e.lineIndex()))
                .toList();
    }

}
