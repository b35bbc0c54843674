package co.fanki.diagrameditor.dialect.application;

import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import co.fanki.diagrameditor.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for every non-Gantt dialect.
 *
 * <p>Requests may name the dialect with {@code type}; otherwise it is
 * detected from the first meaningful line of the text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/diagrams")
@Tag(name = "Diagrams",
        description = "Classify, parse and edit diagrams of any dialect")
public class DiagramController {

    private static final Logger LOG = LoggerFactory.getLogger(
            DiagramController.class);

    private final DiagramEditorService editorService;

    /**
     * Creates a new DiagramController.
     *
     * @param theEditorService the editor service
     */
    public DiagramController(final DiagramEditorService theEditorService) {
        this.editorService = theEditorService;
    }

    /**
     * Classifies a document.
     *
     * @param request the document
     * @return the type and what can be done with it
     */
    @PostMapping("/classify")
    @Operation(summary = "Classify a diagram",
            description = "Detects the dialect from the first meaningful line")
    public ResponseEntity<?> classify(@RequestBody final DiagramRequest request) {
        return handle(() -> editorService.classify(request.code()));
    }

    /**
     * Parses a document.
     *
     * @param request the document
     * @return the parsed model
     */
    @PostMapping("/parse")
    @Operation(summary = "Parse a diagram",
            description = "Returns the dialect model plus its elements and"
                    + " connections in a common shape")
    public ResponseEntity<?> parse(@RequestBody final DiagramRequest request) {
        return handle(() -> editorService.parse(request.code(), request.type()));
    }

    /**
     * Adds a node.
     *
     * @param request the node
     * @return the edit result
     */
    @PostMapping("/nodes")
    @Operation(summary = "Add a node")
    public ResponseEntity<?> addNode(@RequestBody final NodeRequest request) {
        return handle(() -> editorService.addNode(request.code(),
                request.type(), request.draft()));
    }

    /**
     * Updates a node.
     *
     * @param request the node and its changes
     * @return the edit result
     */
    @PostMapping("/nodes/update")
    @Operation(summary = "Update a node")
    public ResponseEntity<?> updateNode(@RequestBody final NodeRequest request) {
        return handle(() -> editorService.updateNode(request.code(),
                request.type(), request.id(), request.draft()));
    }

    /**
     * Removes a node.
     *
     * @param request the node
     * @return the edit result
     */
    @PostMapping("/nodes/remove")
    @Operation(summary = "Remove a node and its connections")
    public ResponseEntity<?> removeNode(@RequestBody final NodeRequest request) {
        return handle(() -> editorService.removeNode(request.code(),
                request.type(), request.id()));
    }

    /**
     * Adds a connection.
     *
     * @param request the connection
     * @return the edit result
     */
    @PostMapping("/edges")
    @Operation(summary = "Add a connection")
    public ResponseEntity<?> addEdge(@RequestBody final EdgeRequest request) {
        return handle(() -> editorService.addEdge(request.code(),
                request.type(), request.draft()));
    }

    /**
     * Updates a connection.
     *
     * @param request the connection and its changes
     * @return the edit result
     */
    @PostMapping("/edges/update")
    @Operation(summary = "Update a connection")
    public ResponseEntity<?> updateEdge(@RequestBody final EdgeRequest request) {
        return handle(() -> editorService.updateEdge(request.code(),
                request.type(), request.source(), request.target(),
                request.draft()));
    }

    /**
     * Removes a connection.
     *
     * @param request the connection
     * @return the edit result
     */
    @PostMapping("/edges/remove")
    @Operation(summary = "Remove a connection")
    public ResponseEntity<?> removeEdge(@RequestBody final EdgeRequest request) {
        return handle(() -> editorService.removeEdge(request.code(),
                request.type(), request.source(), request.target()));
    }

    /**
     * Appends a raw statement.
     *
     * @param request the statement
     * @return the edit result
     */
    @PostMapping("/append")
    @Operation(summary = "Append a statement",
            description = "Available for every dialect, including parse-only"
                    + " ones")
    public ResponseEntity<?> append(@RequestBody final AppendRequest request) {
        return handle(() -> editorService.append(request.code(),
                request.statement()));
    }

    /**
     * Builds the rendering view of a state diagram.
     *
     * @param request the document
     * @return the view
     */
    @PostMapping("/state/view")
    @Operation(summary = "State diagram view",
            description = "Start and end markers become distinct states")
    public ResponseEntity<?> stateView(@RequestBody final DiagramRequest request) {
        return handle(() -> editorService.stateView(request.code()));
    }

    /**
     * Sets the direction of a state diagram.
     *
     * @param request the direction
     * @return the edit result
     */
    @PostMapping("/state/direction")
    @Operation(summary = "Set a state diagram's direction")
    public ResponseEntity<?> stateDirection(
            @RequestBody final DirectionRequest request) {
        return handle(() -> editorService.setStateDirection(request.code(),
                request.direction()));
    }

    /**
     * Imports SQL DDL as an ER diagram.
     *
     * @param request the DDL
     * @return the diagram text
     */
    @PostMapping("/er/from-sql")
    @Operation(summary = "Import SQL tables as an ER diagram")
    public ResponseEntity<?> erFromSql(@RequestBody final ImportRequest request) {
        return handle(() -> Map.of("code",
                editorService.erFromSql(request.source())));
    }

    /**
     * Exports an ER diagram as SQL DDL.
     *
     * @param request the document
     * @return the DDL
     */
    @PostMapping("/er/to-sql")
    @Operation(summary = "Export an ER diagram as PostgreSQL DDL")
    public ResponseEntity<?> erToSql(@RequestBody final DiagramRequest request) {
        return handle(() -> Map.of("sql",
                editorService.erToSql(request.code())));
    }

    /**
     * Imports an XState machine as a state diagram.
     *
     * @param request the machine JSON
     * @return the diagram text
     */
    @PostMapping("/state/from-xstate")
    @Operation(summary = "Import an XState machine as a state diagram")
    public ResponseEntity<?> stateFromXState(
            @RequestBody final ImportRequest request) {
        return handle(() -> Map.of("code",
                editorService.stateFromXState(request.source())));
    }

    /**
     * Exports a state diagram as an XState machine.
     *
     * @param request the document
     * @return the machine configuration
     */
    @PostMapping("/state/to-xstate")
    @Operation(summary = "Export a state diagram as an XState machine")
    public ResponseEntity<?> stateToXState(
            @RequestBody final DiagramRequest request) {
        return handle(() -> editorService.stateToXState(request.code()));
    }

    private ResponseEntity<?> handle(final Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (final DomainException e) {
            LOG.warn("Diagram request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body carrying a document.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     */
    public record DiagramRequest(String code, String type) {}

    /**
     * Request body for node edits.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param id the node id
     * @param label the label
     * @param shape the shape, for dialects that have shapes
     * @param kind a dialect-specific kind such as {@code actor}
     * @param members member or attribute lines
     */
    public record NodeRequest(String code, String type, String id,
            String label, String shape, String kind, List<String> members) {

        NodeDraft draft() {
            return new NodeDraft(id, label, shape, kind, members);
        }
    }

    /**
     * Request body for connection edits.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param source the source id
     * @param target the target id
     * @param connector the connector as written in the dialect
     * @param label the label or message text
     */
    public record EdgeRequest(String code, String type, String source,
            String target, String connector, String label) {

        EdgeDraft draft() {
            return new EdgeDraft(source, target, connector, label);
        }
    }

    /**
     * Request body for raw appends.
     *
     * @param code the diagram text
     * @param statement the statement to append
     */
    public record AppendRequest(String code, String statement) {}

    /**
     * Request body for direction changes.
     *
     * @param code the diagram text
     * @param direction the direction
     */
    public record DirectionRequest(String code, String direction) {}

    /**
     * Request body for imports from another format.
     *
     * @param source the SQL or JSON text
     */
    public record ImportRequest(String source) {}
}
