package co.fanki.diagrameditor.dialect.application;

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

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for the append helpers of parse-only dialects.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/charts")
@Tag(name = "Charts",
        description = "Append statements to pie, mindmap, timeline, C4,"
                + " git graph and quadrant charts")
public class ChartController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChartController.class);

    private final ChartEditorService chartService;

    /**
     * Creates a new ChartController.
     *
     * @param theChartService the chart editing service
     */
    public ChartController(final ChartEditorService theChartService) {
        this.chartService = theChartService;
    }

    @PostMapping("/pie/slices")
    @Operation(summary = "Add a pie slice")
    public ResponseEntity<?> addSlice(@RequestBody final SliceRequest request) {
        return handle(() -> chartService.addSlice(request.code(),
                request.label(), request.value()));
    }

    @PostMapping("/pie/slices/update")
    @Operation(summary = "Change a pie slice's value")
    public ResponseEntity<?> updateSlice(
            @RequestBody final SliceRequest request) {
        return handle(() -> chartService.updateSlice(request.code(),
                request.label(), request.value()));
    }

    @PostMapping("/pie/slices/remove")
    @Operation(summary = "Remove pie slices by label")
    public ResponseEntity<?> removeSlice(
            @RequestBody final SliceRequest request) {
        return handle(() -> chartService.removeSlice(request.code(),
                request.label()));
    }

    @PostMapping("/mindmap/nodes")
    @Operation(summary = "Add a mindmap node")
    public ResponseEntity<?> addMindmapNode(
            @RequestBody final MindmapNodeRequest request) {
        return handle(() -> chartService.addMindmapNode(request.code(),
                request.label(), request.level()));
    }

    @PostMapping("/timeline/events")
    @Operation(summary = "Add a timeline event")
    public ResponseEntity<?> addTimelineEvent(
            @RequestBody final EventRequest request) {
        return handle(() -> chartService.addTimelineEvent(request.code(),
                request.period(), request.text()));
    }

    @PostMapping("/c4/elements")
    @Operation(summary = "Add a C4 element")
    public ResponseEntity<?> addC4Element(
            @RequestBody final C4ElementRequest request) {
        return handle(() -> chartService.addC4Element(request.code(),
                request.macro(), request.id(), request.label(),
                request.description()));
    }

    @PostMapping("/c4/relationships")
    @Operation(summary = "Add a C4 relationship")
    public ResponseEntity<?> addC4Relationship(
            @RequestBody final C4RelationshipRequest request) {
        return handle(() -> chartService.addC4Relationship(request.code(),
                request.source(), request.target(), request.label()));
    }

    @PostMapping("/git")
    @Operation(summary = "Append a git graph command",
            description = "commit, branch, checkout or merge")
    public ResponseEntity<?> addGitCommand(
            @RequestBody final GitCommandRequest request) {
        return handle(() -> chartService.addGitCommand(request.code(),
                request.command(), request.name()));
    }

    @PostMapping("/quadrant/points")
    @Operation(summary = "Add a quadrant chart point")
    public ResponseEntity<?> addQuadrantPoint(
            @RequestBody final PointRequest request) {
        return handle(() -> chartService.addQuadrantPoint(request.code(),
                request.label(), request.x(), request.y()));
    }

    private ResponseEntity<?> handle(final Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (final DomainException e) {
            LOG.warn("Chart request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    public record SliceRequest(String code, String label, double value) {}

    public record MindmapNodeRequest(String code, String label, int level) {}

    public record EventRequest(String code, String period, String text) {}

    public record C4ElementRequest(String code, String macro, String id,
            String label, String description) {}

    public record C4RelationshipRequest(String code, String source,
            String target, String label) {}

    public record GitCommandRequest(String code, String command, String name) {}

    public record PointRequest(String code, String label, double x, double y) {}
}
