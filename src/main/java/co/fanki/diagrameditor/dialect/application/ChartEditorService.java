package co.fanki.diagrameditor.dialect.application;

import co.fanki.diagrameditor.dialect.domain.DiagramAdapterRegistry;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.dialect.domain.basic.C4DiagramReader;
import co.fanki.diagrameditor.dialect.domain.basic.GitGraphReader;
import co.fanki.diagrameditor.dialect.domain.basic.MindmapReader;
import co.fanki.diagrameditor.dialect.domain.basic.PieChartReader;
import co.fanki.diagrameditor.dialect.domain.basic.QuadrantChartReader;
import co.fanki.diagrameditor.dialect.domain.basic.TimelineReader;
import co.fanki.diagrameditor.shared.DomainException;
import co.fanki.diagrameditor.shared.EditResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import static co.fanki.diagrameditor.shared.Preconditions.requireDomain;

/**
 * Append helpers for the parse-only dialects.
 *
 * <p>These dialects have no structural adapter. Each helper writes one
 * well-formed statement at the end of the text, except for pie slices
 * which can also be updated and removed by label.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ChartEditorService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChartEditorService.class);

    /**
     * Appends a pie slice.
     *
     * @param code the chart text
     * @param label the slice label
     * @param value the slice value, not negative
     * @return the edit result
     */
    public EditResult addSlice(final String code, final String label,
            final double value) {
        requireCode(code);
        requireText(label, "Slice label");
        requireDomain(value >= 0, "Slice value must not be negative",
                "INVALID_REQUEST");
        LOG.info("Adding pie slice {}", label);
        return EditResult.of(code, reader(DiagramType.PIE, PieChartReader.class)
                .addSlice(code, label, value));
    }

    /**
     * Changes the value of a pie slice.
     *
     * @param code the chart text
     * @param label the slice label
     * @param value the new value, not negative
     * @return the edit result, unchanged when no slice has that label
     */
    public EditResult updateSlice(final String code, final String label,
            final double value) {
        requireCode(code);
        requireText(label, "Slice label");
        requireDomain(value >= 0, "Slice value must not be negative",
                "INVALID_REQUEST");
        return EditResult.of(code, reader(DiagramType.PIE, PieChartReader.class)
                .updateSlice(code, label, value));
    }

    /**
     * Removes the pie slices with a label.
     *
     * @param code the chart text
     * @param label the slice label
     * @return the edit result
     */
    public EditResult removeSlice(final String code, final String label) {
        requireCode(code);
        requireText(label, "Slice label");
        return EditResult.of(code, reader(DiagramType.PIE, PieChartReader.class)
                .removeSlice(code, label));
    }

    /**
     * Appends a mindmap node.
     *
     * @param code the mindmap text
     * @param label the node text, shape markers included
     * @param level the indentation level, at least 1
     * @return the edit result
     */
    public EditResult addMindmapNode(final String code, final String label,
            final int level) {
        requireCode(code);
        requireText(label, "Node label");
        return EditResult.of(code,
                reader(DiagramType.MINDMAP, MindmapReader.class)
                        .addNode(code, label.trim(), level));
    }

    /**
     * Appends a timeline event.
     *
     * @param code the timeline text
     * @param period the period the event belongs to
     * @param text the event text
     * @return the edit result
     */
    public EditResult addTimelineEvent(final String code, final String period,
            final String text) {
        requireCode(code);
        requireText(period, "Period");
        requireText(text, "Event");
        return EditResult.of(code,
                reader(DiagramType.TIMELINE, TimelineReader.class)
                        .addEvent(code, period, text));
    }

    /**
     * Appends a C4 element.
     *
     * @param code the C4 text
     * @param macro the element macro, System when blank
     * @param id the element id
     * @param label the element label
     * @param description the description, may be blank
     * @return the edit result
     */
    public EditResult addC4Element(final String code, final String macro,
            final String id, final String label, final String description) {
        requireCode(code);
        requireText(id, "Element id");
        requireText(label, "Element label");
        return EditResult.of(code, reader(DiagramType.C4, C4DiagramReader.class)
                .addElement(code, macro, id.trim(), label, description));
    }

    /**
     * Appends a C4 relationship.
     *
     * @param code the C4 text
     * @param source the source element id
     * @param target the target element id
     * @param label the relationship label
     * @return the edit result
     */
    public EditResult addC4Relationship(final String code, final String source,
            final String target, final String label) {
        requireCode(code);
        requireText(source, "Relationship source");
        requireText(target, "Relationship target");
        return EditResult.of(code, reader(DiagramType.C4, C4DiagramReader.class)
                .addRelationship(code, source.trim(), target.trim(),
                        label == null ? "" : label));
    }

    /**
     * Appends a git graph command.
     *
     * @param code the git graph text
     * @param command one of commit, branch, checkout or merge
     * @param name the commit id (optional) or the branch name
     * @return the edit result
     */
    public EditResult addGitCommand(final String code, final String command,
            final String name) {
        requireCode(code);
        requireText(command, "Command");
        final GitGraphReader reader = reader(DiagramType.GIT_GRAPH,
                GitGraphReader.class);
        final String keyword = command.trim().toLowerCase();
        if (keyword.equals("commit")) {
            return EditResult.of(code, reader.addCommit(code, name));
        }
        requireText(name, "Branch name");
        final String edited = switch (keyword) {
            case "branch" -> reader.addBranch(code, name);
            case "checkout" -> reader.checkout(code, name);
            case "merge" -> reader.merge(code, name);
            default -> throw new DomainException(
                    "Unknown git command: " + command, "INVALID_REQUEST");
        };
        return EditResult.of(code, edited);
    }

    /**
     * Appends a quadrant chart point.
     *
     * @param code the chart text
     * @param label the point label
     * @param x the x coordinate, between 0 and 1
     * @param y the y coordinate, between 0 and 1
     * @return the edit result
     */
    public EditResult addQuadrantPoint(final String code, final String label,
            final double x, final double y) {
        requireCode(code);
        requireText(label, "Point label");
        requireDomain(x >= 0 && x <= 1 && y >= 0 && y <= 1,
                "Point coordinates must be between 0 and 1", "INVALID_REQUEST");
        return EditResult.of(code,
                reader(DiagramType.QUADRANT, QuadrantChartReader.class)
                        .addPoint(code, label, x, y));
    }

    private static <T> T reader(final DiagramType type,
            final Class<T> readerType) {
        return DiagramAdapterRegistry.reader(type)
                .filter(readerType::isInstance)
                .map(readerType::cast)
                .orElseThrow(() -> new DomainException(
                        "No parser for diagram type " + type,
                        "UNSUPPORTED_DIALECT"));
    }

    private static void requireCode(final String code) {
        requireDomain(code != null, "Diagram code is required",
                "INVALID_REQUEST");
    }

    private static void requireText(final String value, final String what) {
        requireDomain(value != null && !value.isBlank(), what + " is required",
                "INVALID_REQUEST");
    }

}
