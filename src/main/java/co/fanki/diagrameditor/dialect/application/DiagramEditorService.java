package co.fanki.diagrameditor.dialect.application;

import co.fanki.diagrameditor.dialect.domain.DiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.DiagramAdapterRegistry;
import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;
import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.dialect.domain.EdgeDraft;
import co.fanki.diagrameditor.dialect.domain.NodeDraft;
import co.fanki.diagrameditor.dialect.domain.er.ErDiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.er.ErSqlConverter;
import co.fanki.diagrameditor.dialect.domain.state.StateDiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.state.StateDiagramView;
import co.fanki.diagrameditor.dialect.domain.state.XStateConverter;
import co.fanki.diagrameditor.shared.DomainException;
import co.fanki.diagrameditor.shared.EditResult;
import co.fanki.diagrameditor.shared.SourceLines;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

import static co.fanki.diagrameditor.shared.Preconditions.requireDomain;

/**
 * Dialect-agnostic parsing and editing.
 *
 * <p>Resolves the diagram type (given explicitly or detected from the
 * text), finds its reader or adapter in the registry and delegates.
 * Structural edits on parse-only dialects are rejected; raw statements can
 * be appended to any dialect.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DiagramEditorService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DiagramEditorService.class);

    private static final String INDENT = "    ";

    /**
     * The outcome of classifying a document.
     *
     * @param type the detected type
     * @param parseable whether the type has a reader
     * @param editable whether the type supports structural edits
     */
    public record Classification(DiagramType type, boolean parseable,
            boolean editable) {}

    /**
     * A parsed document.
     *
     * @param type the diagram type
     * @param model the dialect-specific model
     * @param elements the model's elements in the common shape
     * @param connections the model's connections in the common shape
     */
    public record ParsedDiagram(DiagramType type, DiagramModel model,
            List<DiagramNode> elements, List<DiagramLink> connections) {}

    /**
     * Classifies a document by its first meaningful line.
     *
     * @param code the diagram text
     * @return the classification
     */
    public Classification classify(final String code) {
        requireCode(code);
        final DiagramType type = DiagramType.detect(code);
        return new Classification(type,
                DiagramAdapterRegistry.reader(type).isPresent(),
                DiagramAdapterRegistry.isEditable(type));
    }

    /**
     * Parses a document.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected from the text when blank
     * @return the parsed document
     */
    public ParsedDiagram parse(final String code, final String type) {
        requireCode(code);
        final DiagramType resolved = resolve(code, type);
        final DiagramReader<?> reader = DiagramAdapterRegistry.reader(resolved)
                .orElseThrow(() -> new DomainException(
                        "No parser for diagram type " + resolved,
                        "UNSUPPORTED_DIALECT"));
        final DiagramModel model = reader.parse(code);
        LOG.info("Parsed {} diagram with {} elements", resolved,
                model.elements().size());
        return new ParsedDiagram(resolved, model, model.elements(),
                model.connections());
    }

    /**
     * Adds a node.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param draft the node
     * @return the edit result
     */
    public EditResult addNode(final String code, final String type,
            final NodeDraft draft) {
        requireCode(code);
        requireDomain(draft != null, "Node is required", "INVALID_REQUEST");
        final DiagramAdapter<?> adapter = adapter(code, type);
        LOG.info("Adding {} {}", adapter.nodeNoun(), draft.id());
        return EditResult.of(code, adapter.addNode(code, draft));
    }

    /**
     * Updates a node.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param id the node id
     * @param draft the changes
     * @return the edit result
     */
    public EditResult updateNode(final String code, final String type,
            final String id, final NodeDraft draft) {
        requireCode(code);
        requireId(id, "Node id");
        requireDomain(draft != null, "Node is required", "INVALID_REQUEST");
        final DiagramAdapter<?> adapter = adapter(code, type);
        LOG.info("Updating {} {}", adapter.nodeNoun(), id);
        return EditResult.of(code, adapter.updateNode(code, id, draft));
    }

    /**
     * Removes a node and its connections.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param id the node id
     * @return the edit result
     */
    public EditResult removeNode(final String code, final String type,
            final String id) {
        requireCode(code);
        requireId(id, "Node id");
        final DiagramAdapter<?> adapter = adapter(code, type);
        LOG.info("Removing {} {}", adapter.nodeNoun(), id);
        return EditResult.of(code, adapter.removeNode(code, id));
    }

    /**
     * Adds a connection.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param draft the connection
     * @return the edit result
     */
    public EditResult addEdge(final String code, final String type,
            final EdgeDraft draft) {
        requireCode(code);
        requireDomain(draft != null, "Edge is required", "INVALID_REQUEST");
        requireId(draft.source(), "Edge source");
        requireId(draft.target(), "Edge target");
        final DiagramAdapter<?> adapter = adapter(code, type);
        LOG.info("Adding {} {} -> {}", adapter.edgeNoun(), draft.source(),
                draft.target());
        return EditResult.of(code, adapter.addEdge(code, draft));
    }

    /**
     * Updates the first matching connection.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param source the source id
     * @param target the target id
     * @param draft the changes; null fields keep the current value
     * @return the edit result
     */
    public EditResult updateEdge(final String code, final String type,
            final String source, final String target, final EdgeDraft draft) {
        requireCode(code);
        requireId(source, "Edge source");
        requireId(target, "Edge target");
        final DiagramAdapter<?> adapter = adapter(code, type);
        LOG.info("Updating {} {} -> {}", adapter.edgeNoun(), source, target);
        return EditResult.of(code,
                adapter.updateEdge(code, source, target, draft));
    }

    /**
     * Removes a connection.
     *
     * @param code the diagram text
     * @param type the dialect keyword, detected when blank
     * @param source the source id
     * @param target the target id
     * @return the edit result
     */
    public EditResult removeEdge(final String code, final String type,
            final String source, final String target) {
        requireCode(code);
        requireId(source, "Edge source");
        requireId(target, "Edge target");
        final DiagramAdapter<?> adapter = adapter(code, type);
        LOG.info("Removing {} {} -> {}", adapter.edgeNoun(), source, target);
        return EditResult.of(code, adapter.removeEdge(code, source, target));
    }

    /**
     * Appends a raw statement. Works for every dialect, editable or not.
     *
     * @param code the diagram text
     * @param statement the statement; indented by one level when it has
     *        no indentation of its own
     * @return the edit result
     */
    public EditResult append(final String code, final String statement) {
        requireCode(code);
        requireDomain(statement != null && !statement.isBlank(),
                "Statement is required", "INVALID_REQUEST");
        final String line = SourceLines.indentOf(statement).isEmpty()
                ? INDENT + statement : statement;
        return EditResult.of(code, SourceLines.append(code, line));
    }

    /**
     * Builds the rendering view of a state diagram.
     *
     * @param code the diagram text
     * @return the view with explicit start and end states
     */
    public StateDiagramView stateView(final String code) {
        requireCode(code);
        return stateAdapter().view(code);
    }

    /**
     * Sets the direction of a state diagram.
     *
     * @param code the diagram text
     * @param direction TB, TD, BT, RL or LR
     * @return the edit result
     */
    public EditResult setStateDirection(final String code,
            final String direction) {
        requireCode(code);
        requireId(direction, "Direction");
        return EditResult.of(code, stateAdapter().setDirection(code, direction));
    }

    /**
     * Builds an ER diagram from SQL {@code CREATE TABLE} statements.
     *
     * @param sql the DDL
     * @return the diagram text
     */
    public String erFromSql(final String sql) {
        requireDomain(sql != null, "SQL is required", "INVALID_REQUEST");
        final String code = ErSqlConverter.toErDiagram(sql);
        requireDomain(!code.isEmpty(), "No CREATE TABLE statement found",
                "INVALID_REQUEST");
        LOG.info("Imported {} lines of ER diagram from SQL",
                SourceLines.split(code).size());
        return code;
    }

    /**
     * Writes PostgreSQL DDL for an ER diagram.
     *
     * @param code the diagram text
     * @return the statements, empty when no entity has attributes
     */
    public String erToSql(final String code) {
        requireCode(code);
        return ErSqlConverter.toSql(new ErDiagramAdapter().parse(code));
    }

    /**
     * Builds a state diagram from an XState machine configuration.
     *
     * @param json the machine as JSON text
     * @return the diagram text
     */
    public String stateFromXState(final String json) {
        requireDomain(json != null && !json.isBlank(),
                "Machine JSON is required", "INVALID_REQUEST");
        return XStateConverter.toStateDiagram(json);
    }

    /**
     * Builds the XState machine configuration of a state diagram.
     *
     * @param code the diagram text
     * @return the machine
     */
    public JsonNode stateToXState(final String code) {
        requireCode(code);
        return XStateConverter.toMachine(stateAdapter().parse(code));
    }

    private static StateDiagramAdapter stateAdapter() {
        return DiagramAdapterRegistry.adapter(DiagramType.STATE)
                .filter(StateDiagramAdapter.class::isInstance)
                .map(StateDiagramAdapter.class::cast)
                .orElseThrow(() -> new DomainException(
                        "State diagrams are not registered",
                        "UNSUPPORTED_DIALECT"));
    }

    private static DiagramAdapter<?> adapter(final String code,
            final String type) {
        final DiagramType resolved = resolve(code, type);
        return DiagramAdapterRegistry.adapter(resolved)
                .orElseThrow(() -> new DomainException(
                        "Diagram type " + resolved
                                + " does not support structural edits",
                        "UNSUPPORTED_MUTATION"));
    }

    private static DiagramType resolve(final String code, final String type) {
        if (type == null || type.isBlank()) {
            return DiagramType.detect(code);
        }
        return DiagramType.classify(type);
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
