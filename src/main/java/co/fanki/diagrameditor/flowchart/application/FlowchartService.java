package co.fanki.diagrameditor.flowchart.application;

import co.fanki.diagrameditor.flowchart.domain.ArrowKind;
import co.fanki.diagrameditor.flowchart.domain.FlowchartModel;
import co.fanki.diagrameditor.flowchart.domain.FlowchartMutator;
import co.fanki.diagrameditor.flowchart.domain.FlowchartParser;
import co.fanki.diagrameditor.flowchart.domain.FlowchartStyleSheet;
import co.fanki.diagrameditor.flowchart.domain.ShapeKind;
import co.fanki.diagrameditor.shared.EditResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

import static co.fanki.diagrameditor.shared.Preconditions.requireDomain;

/**
 * Application entry point for flowchart parsing and editing.
 *
 * <p>Validates request payloads, delegates to the stateless domain
 * parser and mutator, and reports whether each edit changed the text.
 * Nothing is kept between calls: every request carries the whole
 * document.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FlowchartService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowchartService.class);

    /**
     * A parsed flowchart with its style overlays.
     *
     * @param model the structure
     * @param styles the style overlays
     */
    public record FlowchartDocument(FlowchartModel model,
            FlowchartStyleSheet styles) {}

    /**
     * Parses a flowchart.
     *
     * @param code the flowchart text
     * @return the structure and style overlays
     */
    public FlowchartDocument parse(final String code) {
        requireCode(code);
        final FlowchartModel model = FlowchartParser.parse(code);
        LOG.info("Parsed flowchart with {} nodes and {} edges",
                model.nodes().size(), model.edges().size());
        return new FlowchartDocument(model, FlowchartStyleSheet.parse(code));
    }

    /**
     * Adds a node.
     *
     * @param code the flowchart text
     * @param id the node id, generated when blank
     * @param label the label, the id when null
     * @param shape the shape name or alias, a rectangle when null
     * @return the edit result
     */
    public EditResult addNode(final String code, final String id,
            final String label, final String shape) {
        requireCode(code);
        LOG.info("Adding flowchart node {}", id);
        return EditResult.of(code, FlowchartMutator.addNode(code, id, label,
                shape == null ? null : ShapeKind.fromName(shape)));
    }

    /**
     * Updates a node's label and/or shape.
     *
     * @param code the flowchart text
     * @param id the node id
     * @param label the new label, null to keep
     * @param shape the new shape name, null to keep
     * @return the edit result
     */
    public EditResult updateNode(final String code, final String id,
            final String label, final String shape) {
        requireCode(code);
        requireId(id, "Node id");
        LOG.info("Updating flowchart node {}", id);
        return EditResult.of(code, FlowchartMutator.updateNode(code, id, label,
                shape == null ? null : ShapeKind.fromName(shape)));
    }

    /**
     * Removes a node and its edges.
     *
     * @param code the flowchart text
     * @param id the node id
     * @return the edit result
     */
    public EditResult removeNode(final String code, final String id) {
        requireCode(code);
        requireId(id, "Node id");
        LOG.info("Removing flowchart node {}", id);
        return EditResult.of(code, FlowchartMutator.removeNode(code, id));
    }

    /**
     * Adds an edge.
     *
     * @param code the flowchart text
     * @param source the source id
     * @param target the target id
     * @param label the label, may be null
     * @param arrow the connector glyph, a plain arrow when null
     * @return the edit result
     */
    public EditResult addEdge(final String code, final String source,
            final String target, final String label, final String arrow) {
        requireCode(code);
        requireId(source, "Edge source");
        requireId(target, "Edge target");
        LOG.info("Adding flowchart edge {} -> {}", source, target);
        return EditResult.of(code, FlowchartMutator.addEdge(code, source,
                target, label, ArrowKind.fromGlyph(arrow)));
    }

    /**
     * Updates an edge's label and/or connector.
     *
     * @param code the flowchart text
     * @param source the source id
     * @param target the target id
     * @param label the new label, null to keep
     * @param arrow the new connector glyph, null to keep
     * @return the edit result
     */
    public EditResult updateEdge(final String code, final String source,
            final String target, final String label, final String arrow) {
        requireCode(code);
        requireId(source, "Edge source");
        requireId(target, "Edge target");
        LOG.info("Updating flowchart edge {} -> {}", source, target);
        return EditResult.of(code, FlowchartMutator.updateEdge(code, source,
                target, label, arrow == null ? null : ArrowKind.fromGlyph(arrow)));
    }

    /**
     * Removes an edge.
     *
     * @param code the flowchart text
     * @param source the source id
     * @param target the target id
     * @return the edit result
     */
    public EditResult removeEdge(final String code, final String source,
            final String target) {
        requireCode(code);
        LOG.info("Removing flowchart edge {} -> {}", source, target);
        return EditResult.of(code,
                FlowchartMutator.removeEdge(code, source, target));
    }

    /**
     * Sets the layout direction.
     *
     * @param code the flowchart text
     * @param direction the direction
     * @return the edit result
     */
    public EditResult setDirection(final String code, final String direction) {
        requireCode(code);
        requireId(direction, "Direction");
        return EditResult.of(code,
                FlowchartMutator.setDirection(code, direction));
    }

    /**
     * Returns the group that contains a node.
     *
     * @param code the flowchart text
     * @param nodeId the node id
     * @return the group id, or null when the node is at the top level
     */
    public String findSubgraph(final String code, final String nodeId) {
        requireCode(code);
        return FlowchartMutator.findNodeSubgraph(code, nodeId).orElse(null);
    }

    /**
     * Moves a node into a group, or out of its group when no group id is
     * given.
     *
     * @param code the flowchart text
     * @param nodeId the node id
     * @param groupId the destination group, null to move out
     * @return the edit result
     */
    public EditResult moveNode(final String code, final String nodeId,
            final String groupId) {
        requireCode(code);
        requireId(nodeId, "Node id");
        LOG.info("Moving flowchart node {} to group {}", nodeId, groupId);
        if (groupId == null || groupId.isBlank()) {
            return EditResult.of(code,
                    FlowchartMutator.moveNodeOutOfSubgraph(code, nodeId));
        }
        return EditResult.of(code,
                FlowchartMutator.moveNodeToSubgraph(code, nodeId, groupId));
    }

    /**
     * Creates a group around nodes.
     *
     * @param code the flowchart text
     * @param nodeIds the nodes to wrap
     * @param label the group label
     * @return the edit result
     */
    public EditResult createSubgraph(final String code,
            final List<String> nodeIds, final String label) {
        requireCode(code);
        requireDomain(nodeIds != null && !nodeIds.isEmpty(),
                "At least one node id is required", "INVALID_REQUEST");
        LOG.info("Creating flowchart group '{}' with {}", label, nodeIds);
        return EditResult.of(code,
                FlowchartMutator.createSubgraph(code, nodeIds, label));
    }

    /**
     * Unwraps a group.
     *
     * @param code the flowchart text
     * @param groupId the group id
     * @return the edit result
     */
    public EditResult removeSubgraph(final String code, final String groupId) {
        requireCode(code);
        requireId(groupId, "Group id");
        return EditResult.of(code,
                FlowchartMutator.removeSubgraph(code, groupId));
    }

    /**
     * Renames a group.
     *
     * @param code the flowchart text
     * @param groupId the group id
     * @param label the new label
     * @return the edit result
     */
    public EditResult renameSubgraph(final String code, final String groupId,
            final String label) {
        requireCode(code);
        requireId(groupId, "Group id");
        return EditResult.of(code,
                FlowchartMutator.renameSubgraph(code, groupId, label));
    }

    private static void requireCode(final String code) {
        requireDomain(code != null, "Diagram code is required",
                "INVALID_REQUEST");
    }

    private static void requireId(final String id, final String what) {
        requireDomain(id != null && !id.isBlank(), what + " is required",
                "INVALID_REQUEST");
    }

}
