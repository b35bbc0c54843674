package co.fanki.diagrameditor.dialect.domain.flowchart;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;
import co.fanki.diagrameditor.flowchart.domain.FlowchartModel;

import java.util.List;

/**
 * A flowchart seen through the common dialect contract.
 *
 * @param model the full flowchart model
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowchartDiagram(FlowchartModel model) implements DiagramModel {

    @Override
    public List<DiagramNode> elements() {
        return model.nodes().stream()
                .map(n -> new DiagramNode(n.id(), n.label(), n.shape().id(),
                        n.declared() ? n.sourceLine() : -1))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return model.edges().stream()
                .map(e -> new DiagramLink(e.source(), e.target(),
                        e.arrowKind().glyph(e.minlen()), e.label(),
                        e.sourceLine()))
                .toList();
    }

}
