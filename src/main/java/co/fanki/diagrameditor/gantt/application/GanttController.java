package co.fanki.diagrameditor.gantt.application;

import co.fanki.diagrameditor.gantt.domain.TaskDraft;
import co.fanki.diagrameditor.gantt.domain.TaskMetadata;
import co.fanki.diagrameditor.gantt.domain.TaskStatus;
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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for Gantt charts.
 *
 * <p>Tasks are named by id or label, the way {@code after} references
 * name them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/gantt")
@Tag(name = "Gantt",
        description = "Parse, analyze and edit Gantt charts")
public class GanttController {

    private static final Logger LOG = LoggerFactory.getLogger(
            GanttController.class);

    private final GanttService ganttService;

    /**
     * Creates a new GanttController.
     *
     * @param theGanttService the gantt service
     */
    public GanttController(final GanttService theGanttService) {
        this.ganttService = theGanttService;
    }

    /**
     * Parses a chart.
     *
     * @param request the document
     * @return directives, sections and tasks
     */
    @PostMapping("/parse")
    @Operation(summary = "Parse a Gantt chart")
    public ResponseEntity<?> parse(@RequestBody final CodeRequest request) {
        return handle(() -> ganttService.parse(request.code()));
    }

    /**
     * Analyzes a chart's schedule.
     *
     * @param request the document
     * @return the analysis
     */
    @PostMapping("/analyze")
    @Operation(summary = "Analyze a schedule",
            description = "Resolves dependencies to dates and reports cycles,"
                    + " slack, the critical path, conflicts and risk flags")
    public ResponseEntity<?> analyze(@RequestBody final CodeRequest request) {
        return handle(() -> ganttService.analyze(request.code()));
    }

    /**
     * Reports each assignee's weekly load.
     *
     * @param request the document
     * @return the loads, most overloaded assignee first
     */
    @PostMapping("/resources")
    @Operation(summary = "Compute resource load",
            description = "Buckets each assignee's tasks into ISO weeks and"
                    + " lists the overloaded weeks")
    public ResponseEntity<?> resources(@RequestBody final CodeRequest request) {
        return handle(() -> ganttService.resourceLoad(request.code()));
    }

    /**
     * Lists the tasks linked to a task.
     *
     * @param request the document and task
     * @return upstream and downstream keys
     */
    @PostMapping("/tasks/related")
    @Operation(summary = "Find upstream and downstream tasks")
    public ResponseEntity<?> related(@RequestBody final TaskRequest request) {
        return handle(() -> ganttService.related(request.code(),
                request.task()));
    }

    /**
     * Moves a task by a number of days.
     *
     * @param request the task and delta
     * @return the edit result
     */
    @PostMapping("/tasks/shift")
    @Operation(summary = "Shift a task",
            description = "Moves explicit dates, or pins a dependent task to"
                    + " its resolved start plus the delta")
    public ResponseEntity<?> shift(@RequestBody final ShiftRequest request) {
        return handle(() -> ganttService.shiftTask(request.code(),
                request.task(), request.days()));
    }

    /**
     * Updates a task.
     *
     * @param request the task and its changes
     * @return the edit result
     */
    @PostMapping("/tasks/update")
    @Operation(summary = "Update a task's label, dates or duration")
    public ResponseEntity<?> update(@RequestBody final UpdateRequest request) {
        return handle(() -> ganttService.updateTask(request.code(),
                request.task(), request.label(), request.startDate(),
                request.endDate(), request.duration()));
    }

    /**
     * Replaces a task's dependencies.
     *
     * @param request the task and its dependencies
     * @return the edit result
     */
    @PostMapping("/tasks/dependencies")
    @Operation(summary = "Replace a task's dependencies")
    public ResponseEntity<?> dependencies(
            @RequestBody final DependenciesRequest request) {
        return handle(() -> ganttService.setDependencies(request.code(),
                request.task(), request.dependencies()));
    }

    /**
     * Deletes a task.
     *
     * @param request the document and task
     * @return the edit result
     */
    @PostMapping("/tasks/delete")
    @Operation(summary = "Delete a task",
            description = "Removes the task and its metadata comments, and"
                    + " rewrites the tasks that depended on it")
    public ResponseEntity<?> delete(@RequestBody final TaskRequest request) {
        return handle(() -> ganttService.deleteTask(request.code(),
                request.task()));
    }

    /**
     * Inserts a task.
     *
     * @param request the task to insert
     * @return the edit result
     */
    @PostMapping("/tasks/insert")
    @Operation(summary = "Insert a task after another one")
    public ResponseEntity<?> insert(@RequestBody final InsertRequest request) {
        return handle(() -> ganttService.insertTask(request.code(),
                request.after(), request.draft()));
    }

    /**
     * Toggles or clears status keywords.
     *
     * @param request the task and status
     * @return the edit result
     */
    @PostMapping("/tasks/status")
    @Operation(summary = "Toggle or clear a task status",
            description = "Status is one of done, active or crit")
    public ResponseEntity<?> status(@RequestBody final StatusRequest request) {
        return handle(() -> ganttService.changeStatus(request.code(),
                request.task(), request.status(), request.clear()));
    }

    /**
     * Marks or unmarks a milestone.
     *
     * @param request the task and flag
     * @return the edit result
     */
    @PostMapping("/tasks/milestone")
    @Operation(summary = "Mark or unmark a milestone")
    public ResponseEntity<?> milestone(
            @RequestBody final MilestoneRequest request) {
        return handle(() -> ganttService.setMilestone(request.code(),
                request.task(), request.milestone()));
    }

    /**
     * Sets or clears task metadata.
     *
     * @param request the task, key and value
     * @return the edit result
     */
    @PostMapping("/tasks/metadata")
    @Operation(summary = "Set or clear task metadata",
            description = "Key is one of assignee, notes, link or progress;"
                    + " a blank value clears it")
    public ResponseEntity<?> metadata(
            @RequestBody final MetadataRequest request) {
        return handle(() -> ganttService.setMetadata(request.code(),
                request.task(), request.key(), request.value()));
    }

    /**
     * Moves a task to another section.
     *
     * @param request the task and section
     * @return the edit result
     */
    @PostMapping("/tasks/move")
    @Operation(summary = "Move a task to a section")
    public ResponseEntity<?> move(@RequestBody final MoveRequest request) {
        return handle(() -> ganttService.moveTask(request.code(),
                request.task(), request.section()));
    }

    /**
     * Moves every explicit date so that the chart starts on a date.
     *
     * @param request the new start
     * @return the edit result
     */
    @PostMapping("/adjust")
    @Operation(summary = "Move the chart to a new start date")
    public ResponseEntity<?> adjust(@RequestBody final AdjustRequest request) {
        return handle(() -> ganttService.autoAdjust(request.code(),
                request.startDate()));
    }

    /**
     * Lists the sections.
     *
     * @param request the document
     * @return the section headers
     */
    @PostMapping("/sections")
    @Operation(summary = "List sections")
    public ResponseEntity<?> sections(@RequestBody final CodeRequest request) {
        return handle(() -> ganttService.sections(request.code()));
    }

    /**
     * Adds a section.
     *
     * @param request the section name
     * @return the edit result
     */
    @PostMapping("/sections/add")
    @Operation(summary = "Add a section")
    public ResponseEntity<?> addSection(
            @RequestBody final SectionRequest request) {
        return handle(() -> ganttService.addSection(request.code(),
                request.name()));
    }

    /**
     * Renames a section.
     *
     * @param request the current and new names
     * @return the edit result
     */
    @PostMapping("/sections/rename")
    @Operation(summary = "Rename a section")
    public ResponseEntity<?> renameSection(
            @RequestBody final SectionRequest request) {
        return handle(() -> ganttService.renameSection(request.code(),
                request.name(), request.newName()));
    }

    private ResponseEntity<?> handle(final Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (final DomainException e) {
            LOG.warn("Gantt request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body carrying only the document.
     *
     * @param code the chart text
     */
    public record CodeRequest(String code) {}

    /**
     * Request body naming a task.
     *
     * @param code the chart text
     * @param task the task id or label
     */
    public record TaskRequest(String code, String task) {}

    /**
     * Request body for shifting a task.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param days the delta in days
     */
    public record ShiftRequest(String code, String task, long days) {}

    /**
     * Request body for task updates.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param label the new label
     * @param startDate the new start
     * @param endDate the new end
     * @param duration the new duration token
     */
    public record UpdateRequest(String code, String task, String label,
            LocalDate startDate, LocalDate endDate, String duration) {}

    /**
     * Request body for dependency changes.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param dependencies the new references
     */
    public record DependenciesRequest(String code, String task,
            List<String> dependencies) {}

    /**
     * Request body for inserting a task.
     *
     * @param code the chart text
     * @param after the task to insert after, null for the end
     * @param label the label
     * @param id the id
     * @param statuses the status keywords
     * @param milestone whether it is a milestone
     * @param startDate the start
     * @param afterDeps the dependencies
     * @param endDate the end
     * @param duration the duration token
     * @param assignee the assignee
     * @param notes the notes
     * @param link the link
     * @param progress the progress percentage
     */
    public record InsertRequest(String code, String after, String label,
            String id, List<String> statuses, boolean milestone,
            LocalDate startDate, List<String> afterDeps, LocalDate endDate,
            String duration, String assignee, String notes, String link,
            Integer progress) {

        TaskDraft draft() {
            final List<TaskStatus> parsed = new ArrayList<>();
            if (statuses != null) {
                for (final String status : statuses) {
                    parsed.add(TaskStatus.fromKeyword(status).orElseThrow(
                            () -> new DomainException(
                                    "Unknown status: " + status,
                                    "INVALID_REQUEST")));
                }
            }
            return new TaskDraft(label, id, parsed, milestone, startDate,
                    afterDeps, endDate, duration, new TaskMetadata(assignee,
                            notes, link, progress));
        }
    }

    /**
     * Request body for status changes.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param status the keyword to toggle
     * @param clear whether to remove every keyword
     */
    public record StatusRequest(String code, String task, String status,
            boolean clear) {}

    /**
     * Request body for milestone changes.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param milestone the desired state
     */
    public record MilestoneRequest(String code, String task,
            boolean milestone) {}

    /**
     * Request body for metadata changes.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param key the metadata key
     * @param value the value, blank to clear
     */
    public record MetadataRequest(String code, String task, String key,
            String value) {}

    /**
     * Request body for moving a task between sections.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param section the destination section
     */
    public record MoveRequest(String code, String task, String section) {}

    /**
     * Request body for section edits.
     *
     * @param code the chart text
     * @param name the section name
     * @param newName the new name when renaming
     */
    public record SectionRequest(String code, String name, String newName) {}

    /**
     * Request body for moving the chart start.
     *
     * @param code the chart text
     * @param startDate the new first start
     */
    public record AdjustRequest(String code, LocalDate startDate) {}
}
