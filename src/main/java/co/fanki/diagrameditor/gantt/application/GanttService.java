package co.fanki.diagrameditor.gantt.application;

import co.fanki.diagrameditor.gantt.domain.CriticalPathEngine;
import co.fanki.diagrameditor.gantt.domain.CriticalPathReport;
import co.fanki.diagrameditor.gantt.domain.DependencyGraph;
import co.fanki.diagrameditor.gantt.domain.DependencyResolver;
import co.fanki.diagrameditor.gantt.domain.GanttChart;
import co.fanki.diagrameditor.gantt.domain.GanttMutator;
import co.fanki.diagrameditor.gantt.domain.GanttParser;
import co.fanki.diagrameditor.gantt.domain.GanttSections;
import co.fanki.diagrameditor.gantt.domain.GanttTask;
import co.fanki.diagrameditor.gantt.domain.ResolvedSchedule;
import co.fanki.diagrameditor.gantt.domain.ResourceLoad;
import co.fanki.diagrameditor.gantt.domain.ResourceLoadAnalyzer;
import co.fanki.diagrameditor.gantt.domain.RiskFlag;
import co.fanki.diagrameditor.gantt.domain.RiskFlagAnalyzer;
import co.fanki.diagrameditor.gantt.domain.ScheduleConflict;
import co.fanki.diagrameditor.gantt.domain.TaskDraft;
import co.fanki.diagrameditor.gantt.domain.TaskIndex;
import co.fanki.diagrameditor.gantt.domain.TaskMetadata;
import co.fanki.diagrameditor.gantt.domain.TaskStatus;
import co.fanki.diagrameditor.shared.EditResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static co.fanki.diagrameditor.shared.Preconditions.requireDomain;

/**
 * Application entry point for Gantt charts: parsing, schedule analysis
 * and task edits.
 *
 * <p>Schedule structure problems, such as cycles, conflicts or tasks
 * that cannot be placed, come back as data in the analysis. Only
 * malformed requests are rejected.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class GanttService {

    private static final Logger LOG = LoggerFactory.getLogger(
            GanttService.class);

    /** The largest move accepted, a hundred years either way. */
    static final long MAX_SHIFT_DAYS = 36_500;

    private final RiskFlagAnalyzer riskFlagAnalyzer;

    private final ResourceLoadAnalyzer resourceLoadAnalyzer;

    /**
     * Everything the editor shows about a schedule.
     *
     * @param chart the parsed chart
     * @param schedule the resolved dates and resolution issues
     * @param cycles the dependency cycles, as key lists
     * @param criticalPath slack figures and the critical path
     * @param conflicts tasks starting before a dependency ends
     * @param risks the risk flags
     */
    public record ScheduleAnalysis(
            GanttChart chart,
            ResolvedSchedule schedule,
            List<List<String>> cycles,
            CriticalPathReport criticalPath,
            List<ScheduleConflict> conflicts,
            List<RiskFlag> risks) {}

    /**
     * The tasks linked to one task through dependencies.
     *
     * @param key the task key
     * @param upstream the keys the task transitively waits on
     * @param downstream the keys transitively waiting on the task
     */
    public record RelatedTasks(String key, Set<String> upstream,
            Set<String> downstream) {}

    /**
     * Creates a new GanttService.
     *
     * @param theManyDependenciesThreshold the dependency count that flags
     *        a bottleneck
     * @param theOverloadThreshold the concurrent task count that flags an
     *        overloaded assignee
     * @param theWeeklyOverloadThreshold the tasks in one week that
     *        overload an assignee's week
     */
    public GanttService(
            @Value("${editor.gantt.risk.many-dependencies-threshold:3}")
            final int theManyDependenciesThreshold,
            @Value("${editor.gantt.risk.overload-threshold:4}")
            final int theOverloadThreshold,
            @Value("${editor.gantt.resource.weekly-overload-threshold:2}")
            final int theWeeklyOverloadThreshold) {
        this.riskFlagAnalyzer = new RiskFlagAnalyzer(
                theManyDependenciesThreshold, theOverloadThreshold);
        this.resourceLoadAnalyzer = new ResourceLoadAnalyzer(
                theWeeklyOverloadThreshold);
    }

    /**
     * Parses a chart.
     *
     * @param code the chart text
     * @return the directives, sections and tasks
     */
    public GanttChart parse(final String code) {
        requireCode(code);
        final GanttChart chart = GanttParser.parse(code);
        LOG.info("Parsed gantt chart with {} tasks", chart.tasks().size());
        return chart;
    }

    /**
     * Resolves the schedule and runs every diagnostic on it.
     *
     * @param code the chart text
     * @return the analysis
     */
    public ScheduleAnalysis analyze(final String code) {
        requireCode(code);
        final GanttChart chart = GanttParser.parse(code);
        final ResolvedSchedule schedule = DependencyResolver.resolve(chart);
        final DependencyGraph graph = DependencyGraph.of(chart.tasks());
        final List<List<String>> cycles = graph.detectCycles();
        final CriticalPathReport report =
                CriticalPathEngine.analyze(schedule, graph);
        final List<ScheduleConflict> conflicts =
                CriticalPathEngine.findConflicts(schedule);
        final List<RiskFlag> risks = riskFlagAnalyzer.analyze(schedule);
        LOG.info("Analyzed gantt chart: {} tasks, {} issues, {} cycles,"
                + " {} conflicts, {} risks", chart.tasks().size(),
                schedule.issues().size(), cycles.size(), conflicts.size(),
                risks.size());
        return new ScheduleAnalysis(chart, schedule, cycles, report,
                conflicts, risks);
    }

    /**
     * Computes each assignee's weekly load on the resolved schedule.
     *
     * @param code the chart text
     * @return one entry per assignee, most overloaded first
     */
    public List<ResourceLoad> resourceLoad(final String code) {
        requireCode(code);
        final List<ResourceLoad> loads = resourceLoadAnalyzer.analyze(
                DependencyResolver.resolve(GanttParser.parse(code)));
        LOG.info("Computed resource load for {} assignees", loads.size());
        return loads;
    }

    /**
     * Returns the tasks upstream and downstream of a task.
     *
     * @param code the chart text
     * @param task the task id or label
     * @return the related keys
     */
    public RelatedTasks related(final String code, final String task) {
        requireCode(code);
        requireTask(task);
        final GanttChart chart = GanttParser.parse(code);
        final Optional<GanttTask> found =
                new TaskIndex(chart.tasks()).find(task);
        requireDomain(found.isPresent(), "Unknown task: " + task,
                "UNKNOWN_TASK");
        final DependencyGraph graph = DependencyGraph.of(chart.tasks());
        final String key = found.get().key();
        return new RelatedTasks(key, graph.upstream(key),
                graph.downstream(key));
    }

    /**
     * Updates a task's label, dates or duration.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param label the new label, null to keep
     * @param startDate the new start, null to keep
     * @param endDate the new end, null to keep
     * @param duration the new duration token, null to keep
     * @return the edit result
     */
    public EditResult updateTask(final String code, final String task,
            final String label, final LocalDate startDate,
            final LocalDate endDate, final String duration) {
        requireCode(code);
        requireTask(task);
        LOG.info("Updating gantt task {}", task);
        return EditResult.of(code, GanttMutator.updateTask(code, task, label,
                startDate, endDate, duration));
    }

    /**
     * Moves a task by a number of days.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param days the delta, at most a hundred years either way
     * @return the edit result
     */
    public EditResult shiftTask(final String code, final String task,
            final long days) {
        requireCode(code);
        requireTask(task);
        requireDomain(days >= -MAX_SHIFT_DAYS && days <= MAX_SHIFT_DAYS,
                "Shift must be within " + MAX_SHIFT_DAYS + " days",
                "INVALID_REQUEST");
        LOG.info("Shifting gantt task {} by {} days", task, days);
        return EditResult.of(code, GanttMutator.shiftTask(code, task, days));
    }

    /**
     * Moves every explicit date so that the chart starts on a date.
     *
     * @param code the chart text
     * @param startDate the new first start
     * @return the edit result
     */
    public EditResult autoAdjust(final String code, final LocalDate startDate) {
        requireCode(code);
        requireDomain(startDate != null, "Start date is required",
                "INVALID_REQUEST");
        LOG.info("Moving gantt chart start to {}", startDate);
        return EditResult.of(code, GanttMutator.autoAdjust(code, startDate));
    }

    /**
     * Replaces the dependencies of a task.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param dependencies the new references, empty to clear
     * @return the edit result
     */
    public EditResult setDependencies(final String code, final String task,
            final List<String> dependencies) {
        requireCode(code);
        requireTask(task);
        LOG.info("Setting dependencies of gantt task {} to {}", task,
                dependencies);
        return EditResult.of(code, GanttMutator.setDependencies(code, task,
                dependencies == null ? List.of() : dependencies));
    }

    /**
     * Deletes a task and rewrites the tasks that depended on it.
     *
     * @param code the chart text
     * @param task the task id or label
     * @return the edit result
     */
    public EditResult deleteTask(final String code, final String task) {
        requireCode(code);
        requireTask(task);
        LOG.info("Deleting gantt task {}", task);
        return EditResult.of(code, GanttMutator.deleteTask(code, task));
    }

    /**
     * Inserts a task after another one, or at the end.
     *
     * @param code the chart text
     * @param after the task to insert after, null for the end
     * @param draft the task to insert
     * @return the edit result
     */
    public EditResult insertTask(final String code, final String after,
            final TaskDraft draft) {
        requireCode(code);
        requireDomain(draft != null, "Task is required", "INVALID_REQUEST");
        LOG.info("Inserting gantt task '{}' after {}", draft.label(), after);
        return EditResult.of(code, GanttMutator.insertTaskAfter(code,
                after == null || after.isBlank() ? null : after, draft));
    }

    /**
     * Toggles one status keyword, or clears them all.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param status the keyword to toggle, ignored when clearing
     * @param clear whether to remove every status keyword
     * @return the edit result
     */
    public EditResult changeStatus(final String code, final String task,
            final String status, final boolean clear) {
        requireCode(code);
        requireTask(task);
        if (clear) {
            return EditResult.of(code, GanttMutator.clearStatus(code, task));
        }
        return EditResult.of(code, GanttMutator.toggleStatus(code, task,
                status(status)));
    }

    /**
     * Marks or unmarks a task as a milestone.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param milestone the desired state
     * @return the edit result
     */
    public EditResult setMilestone(final String code, final String task,
            final boolean milestone) {
        requireCode(code);
        requireTask(task);
        return EditResult.of(code,
                GanttMutator.setMilestone(code, task, milestone));
    }

    /**
     * Sets or clears a metadata comment.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param key one of assignee, notes, link or progress
     * @param value the value, blank to clear
     * @return the edit result
     */
    public EditResult setMetadata(final String code, final String task,
            final String key, final String value) {
        requireCode(code);
        requireTask(task);
        final Optional<TaskMetadata.Key> metadataKey =
                TaskMetadata.Key.fromLabel(key);
        requireDomain(metadataKey.isPresent(), "Unknown metadata key: " + key,
                "INVALID_REQUEST");
        return EditResult.of(code, GanttMutator.setMetadata(code, task,
                metadataKey.get(), value));
    }

    /**
     * Lists the sections.
     *
     * @param code the chart text
     * @return the section headers
     */
    public List<GanttSections.Section> sections(final String code) {
        requireCode(code);
        return GanttSections.list(code);
    }

    /**
     * Renames a section.
     *
     * @param code the chart text
     * @param name the current name
     * @param newName the new name
     * @return the edit result
     */
    public EditResult renameSection(final String code, final String name,
            final String newName) {
        requireCode(code);
        requireDomain(newName != null && !newName.isBlank(),
                "New section name is required", "INVALID_REQUEST");
        return EditResult.of(code, GanttSections.rename(code, name, newName));
    }

    /**
     * Adds a section at the end of the chart.
     *
     * @param code the chart text
     * @param name the section name
     * @return the edit result
     */
    public EditResult addSection(final String code, final String name) {
        requireCode(code);
        requireDomain(name != null && !name.isBlank(),
                "Section name is required", "INVALID_REQUEST");
        return EditResult.of(code, GanttSections.add(code, name));
    }

    /**
     * Moves a task to another section.
     *
     * @param code the chart text
     * @param task the task id or label
     * @param section the destination, blank for above the first section
     * @return the edit result
     */
    public EditResult moveTask(final String code, final String task,
            final String section) {
        requireCode(code);
        requireTask(task);
        LOG.info("Moving gantt task {} to section '{}'", task, section);
        return EditResult.of(code, GanttSections.moveTask(code, task, section));
    }

    private static TaskStatus status(final String status) {
        final Optional<TaskStatus> found = TaskStatus.fromKeyword(status);
        requireDomain(found.isPresent(), "Unknown status: " + status,
                "INVALID_REQUEST");
        return found.get();
    }

    private static void requireCode(final String code) {
        requireDomain(code != null, "Diagram code is required",
                "INVALID_REQUEST");
    }

    private static void requireTask(final String task) {
        requireDomain(task != null && !task.isBlank(), "Task is required",
                "INVALID_REQUEST");
    }

}
