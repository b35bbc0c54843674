package co.fanki.diagrameditor.flowchart.application;

import co.fanki.diagrameditor.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for flowchart parsing and editing.
 *
 * <p>Every request carries the full flowchart text; every edit answers
 * with the new text. Nothing is stored server side.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/flowchart")
@Tag(name = "Flowchart",
        description = "Parse flowcharts and apply source-preserving edits")
public class FlowchartController {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowchartController.class);

    private final FlowchartService flowchartService;

    /**
     * Creates a new FlowchartController.
     *
     * @param theFlowchartService the flowchart service
     */
    public FlowchartController(final FlowchartService theFlowchartService) {
        this.flowchartService = theFlowchartService;
    }

    /**
     * Parses a flowchart into nodes, edges, groups and style overlays.
     *
     * @param request the document
     * @return the parsed document
     */
    @PostMapping("/parse")
    @Operation(summary = "Parse a flowchart",
            description = "Returns direction, nodes, edges, subgraphs and"
                    + " style overlays recovered from the text")
    public ResponseEntity<?> parse(@RequestBody final CodeRequest request) {
        return handle(() -> flowchartService.parse(request.code()));
    }

    /**
     * Adds a node.
     *
     * @param request the node to add
     * @return the edit result
     */
    @PostMapping("/nodes")
    @Operation(summary = "Add a node",
            description = "Declares a node after the last content line."
                    + " A blank id gets the first free N1, N2, ...")
    public ResponseEntity<?> addNode(@RequestBody final NodeRequest request) {
        return handle(() -> flowchartService.addNode(request.code(),
                request.id(), request.label(), request.shape()));
    }

    /**
     * Updates a node's label and/or shape.
     *
     * @param id the node id
     * @param request the changes
     * @return the edit result
     */
    @PutMapping("/nodes/{id}")
    @Operation(summary = "Update a node",
            description = "Rewrites only the node's declaration span")
    public ResponseEntity<?> updateNode(@PathVariable final String id,
            @RequestBody final NodeRequest request) {
        return handle(() -> flowchartService.updateNode(request.code(), id,
                request.label(), request.shape()));
    }

    /**
     * Removes a node and its edges.
     *
     * @param id the node id
     * @param request the document
     * @return the edit result
     */
    @PostMapping("/nodes/{id}/remove")
    @Operation(summary = "Remove a node",
            description = "Removes the node, every edge touching it, and its"
                    + " annotation and style lines")
    public ResponseEntity<?> removeNode(@PathVariable final String id,
            @RequestBody final CodeRequest request) {
        return handle(() -> flowchartService.removeNode(request.code(), id));
    }

    /**
     * Moves a node into a group, or out of its group when no group id is
     * given.
     *
     * @param id the node id
     * @param request the destination
     * @return the edit result
     */
    @PostMapping("/nodes/{id}/move")
    @Operation(summary = "Move a node between groups")
    public ResponseEntity<?> moveNode(@PathVariable final String id,
            @RequestBody final MoveRequest request) {
        return handle(() -> flowchartService.moveNode(request.code(), id,
                request.subgraphId()));
    }

    /**
     * Returns the group that contains a node.
     *
     * @param id the node id
     * @param request the document
     * @return the group id, null at the top level
     */
    @PostMapping("/nodes/{id}/subgraph")
    @Operation(summary = "Find the group of a node")
    public ResponseEntity<?> findSubgraph(@PathVariable final String id,
            @RequestBody final CodeRequest request) {
        return handle(() -> {
            final Map<String, Object> body = new HashMap<>();
            body.put("nodeId", id);
            body.put("subgraphId",
                    flowchartService.findSubgraph(request.code(), id));
            return body;
        });
    }

    /**
     * Adds an edge.
     *
     * @param request the edge to add
     * @return the edit result
     */
    @PostMapping("/edges")
    @Operation(summary = "Add an edge")
    public ResponseEntity<?> addEdge(@RequestBody final EdgeRequest request) {
        return handle(() -> flowchartService.addEdge(request.code(),
                request.source(), request.target(), request.label(),
                request.arrow()));
    }

    /**
     * Updates the first occurrence of an edge.
     *
     * @param request the edge and its changes
     * @return the edit result
     */
    @PostMapping("/edges/update")
    @Operation(summary = "Update an edge",
            description = "Changes label and/or connector of the first"
                    + " matching edge")
    public ResponseEntity<?> updateEdge(@RequestBody final EdgeRequest request) {
        return handle(() -> flowchartService.updateEdge(request.code(),
                request.source(), request.target(), request.label(),
                request.arrow()));
    }

    /**
     * Removes every occurrence of an edge.
     *
     * @param request the edge to remove
     * @return the edit result
     */
    @PostMapping("/edges/remove")
    @Operation(summary = "Remove an edge")
    public ResponseEntity<?> removeEdge(@RequestBody final EdgeRequest request) {
        return handle(() -> flowchartService.removeEdge(request.code(),
                request.source(), request.target()));
    }

    /**
     * Sets the layout direction.
     *
     * @param request the direction
     * @return the edit result
     */
    @PostMapping("/direction")
    @Operation(summary = "Set the layout direction")
    public ResponseEntity<?> setDirection(
            @RequestBody final DirectionRequest request) {
        return handle(() -> flowchartService.setDirection(request.code(),
                request.direction()));
    }

    /**
     * Wraps nodes in a new group.
     *
     * @param request the nodes and label
     * @return the edit result
     */
    @PostMapping("/subgraphs")
    @Operation(summary = "Create a group around nodes")
    public ResponseEntity<?> createSubgraph(
            @RequestBody final SubgraphRequest request) {
        return handle(() -> flowchartService.createSubgraph(request.code(),
                request.nodeIds(), request.label()));
    }

    /**
     * Renames a group.
     *
     * @param id the group id
     * @param request the new label
     * @return the edit result
     */
    @PostMapping("/subgraphs/{id}/rename")
    @Operation(summary = "Rename a group")
    public ResponseEntity<?> renameSubgraph(@PathVariable final String id,
            @RequestBody final SubgraphRequest request) {
        return handle(() -> flowchartService.renameSubgraph(request.code(), id,
                request.label()));
    }

    /**
     * Unwraps a group, keeping its contents.
     *
     * @param id the group id
     * @param request the document
     * @return the edit result
     */
    @PostMapping("/subgraphs/{id}/remove")
    @Operation(summary = "Unwrap a group")
    public ResponseEntity<?> removeSubgraph(@PathVariable final String id,
            @RequestBody final CodeRequest request) {
        return handle(() -> flowchartService.removeSubgraph(request.code(), id));
    }

    private ResponseEntity<?> handle(final Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (final DomainException e) {
            LOG.warn("Flowchart request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body carrying only the document.
     *
     * @param code the flowchart text
     */
    public record CodeRequest(String code) {}

    /**
     * Request body for node edits.
     *
     * @param code the flowchart text
     * @param id the node id
     * @param label the label
     * @param shape the shape name or alias
     */
    public record NodeRequest(String code, String id, String label,
            String shape) {}

    /**
     * Request body for edge edits.
     *
     * @param code the flowchart text
     * @param source the source node id
     * @param target the target node id
     * @param label the edge label
     * @param arrow the connector glyph, e.g. {@code -.->}
     */
    public record EdgeRequest(String code, String source, String target,
            String label, String arrow) {}

    /**
     * Request body for moving a node between groups.
     *
     * @param code the flowchart text
     * @param subgraphId the destination group, null to move out
     */
    public record MoveRequest(String code, String subgraphId) {}

    /**
     * Request body for group edits.
     *
     * @param code the flowchart text
     * @param nodeIds the nodes to wrap
     * @param label the group label
     */
    public record SubgraphRequest(String code, List<String> nodeIds,
            String label) {}

    /**
     * Request body for direction changes.
     *
     * @param code the flowchart text
     * @param direction the direction
     */
    public record DirectionRequest(String code, String direction) {}
}
