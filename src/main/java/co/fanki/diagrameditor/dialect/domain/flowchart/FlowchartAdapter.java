package co.fanki.diagrameditor.dialect.domain.flowchart;

import co.fanki.diagrameditor.dialect.domain.DiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import co.fanki.diagrameditor.flowchart.domain.ArrowKind;
import co.fanki.diagrameditor.flowchart.domain.FlowchartMutator;
import co.fanki.diagrameditor.flowchart.domain.FlowchartParser;
import co.fanki.diagrameditor.flowchart.domain.ShapeKind;

/**
 * Exposes the flowchart parser and mutator through the common dialect
 * contract. Shapes and arrows travel as their names and glyphs.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowchartAdapter implements DiagramAdapter<FlowchartDiagram> {

    @Override
    public DiagramType type() {
        return DiagramType.FLOWCHART;
    }

    @Override
    public FlowchartDiagram parse(final String code) {
        return new FlowchartDiagram(FlowchartParser.parse(code));
    }

    @Override
    public String addNode(final String code, final NodeDraft draft) {
        if (draft == null) {
            return code;
        }
        return FlowchartMutator.addNode(code, draft.id(), draft.label(),
                shape(draft.shape()));
    }

    @Override
    public String updateNode(final String code, final String id,
            final NodeDraft draft) {
        if (draft == null) {
            return code;
        }
        return FlowchartMutator.updateNode(code, id, draft.label(),
                shape(draft.shape()));
    }

    @Override
    public String removeNode(final String code, final String id) {
        return FlowchartMutator.removeNode(code, id);
    }

    @Override
    public String addEdge(final String code, final EdgeDraft draft) {
        if (draft == null) {
            return code;
        }
        return FlowchartMutator.addEdge(code, draft.source(), draft.target(),
                draft.label(), ArrowKind.fromGlyph(draft.type()));
    }

    @Override
    public String updateEdge(final String code, final String source,
            final String target, final EdgeDraft draft) {
        if (draft == null) {
            return code;
        }
        return FlowchartMutator.updateEdge(code, source, target, draft.label(),
                draft.type() == null ? null : ArrowKind.fromGlyph(draft.type()));
    }

    @Override
    public String removeEdge(final String code, final String source,
            final String target) {
        return FlowchartMutator.removeEdge(code, source, target);
    }

    @Override
    public String nodeNoun() {
        return "node";
    }

    @Override
    public String edgeNoun() {
        return "edge";
    }

    private static ShapeKind shape(final String name) {
        return name == null ? null : ShapeKind.fromName(name);
    }

}
