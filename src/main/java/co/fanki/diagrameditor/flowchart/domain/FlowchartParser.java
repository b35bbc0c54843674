package co.fanki.diagrameditor.flowchart.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers a {@link FlowchartModel} from flowchart text.
 *
 * <p>The parser is error tolerant: lines it does not understand are left
 * out of the model and never cause an exception. Line indices in the
 * model are indices into the text as given, front matter included.</p>
 *
 * <p>When a node appears more than once, the first declaration with
 * shape delimiters wins over bare references. Annotation lines
 * ({@code id@{ shape: ..., label: "..." }}) override shape and label
 * wherever they appear.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowchartParser {

    private static final Logger LOG = LoggerFactory.getLogger(FlowchartParser.class);

    /** Layout direction used when the header declares none. */
    public static final String DEFAULT_DIRECTION = "TD";

    private FlowchartParser() {
    }

    /**
     * Parses flowchart text.
     *
     * @param code the flowchart text, may be null
     * @return the model, never null
     */
    public static FlowchartModel parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);

        String direction = DEFAULT_DIRECTION;
        final Map<String, FlowchartNode> nodes = new LinkedHashMap<>();
        final List<FlowchartEdge> edges = new ArrayList<>();
        final List<FlowchartLines.Annotation> annotations = new ArrayList<>();
        final List<Integer> annotationLines = new ArrayList<>();
        final List<GroupBuilder> groups = new ArrayList<>();
        final Deque<GroupBuilder> open = new ArrayDeque<>();

        for (int i = 0; i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            switch (kinds.get(i)) {
                case HEADER -> {
                    final String declared = FlowchartLines.direction(trimmed);
                    if (declared != null) {
                        direction = declared;
                    }
                }
                case SUBGRAPH_OPEN -> {
                    final FlowchartLines.GroupHeader header =
                            FlowchartLines.groupHeader(trimmed);
                    final GroupBuilder group =
                            new GroupBuilder(header.id(), header.label(), i);
                    groups.add(group);
                    open.push(group);
                }
                case SUBGRAPH_CLOSE -> {
                    if (!open.isEmpty()) {
                        open.pop().endLine = i;
                    }
                }
                case ANNOTATION -> {
                    annotations.add(FlowchartLines.annotation(trimmed));
                    annotationLines.add(i);
                }
                case CONTENT -> parseContent(lines.get(i), i, nodes, edges);
                default -> {
                    // pass-through: blank, comment, front matter, directives
                }
            }
        }

        for (int a = 0; a < annotations.size(); a++) {
            applyAnnotation(annotations.get(a), annotationLines.get(a), nodes);
        }

        final List<Subgraph> subgraphs = new ArrayList<>();
        for (final GroupBuilder group : groups) {
            subgraphs.add(new Subgraph(group.id, group.label, group.startLine,
                    group.endLine));
        }

        LOG.debug("Parsed flowchart: {} nodes, {} edges, {} subgraphs",
                nodes.size(), edges.size(), subgraphs.size());

        return new FlowchartModel(direction, new ArrayList<>(nodes.values()),
                edges, subgraphs);
    }

    private static void parseContent(final String line, final int lineIndex,
            final Map<String, FlowchartNode> nodes,
            final List<FlowchartEdge> edges) {
        final List<FlowToken> tokens = FlowchartTokenizer.tokenize(line);

        for (final FlowToken token : tokens) {
            if (!(token instanceof NodeToken node)) {
                continue;
            }
            final FlowchartNode existing = nodes.get(node.id());
            if (node.isDeclaration()) {
                if (existing == null || existing.shapeOpen() == null) {
                    final ShapeTable.ShapeMatch shape = node.shape();
                    nodes.put(node.id(), new FlowchartNode(node.id(),
                            shape.label(), shape.kind(), shape.open(),
                            shape.close(), lineIndex, true));
                }
            } else if (existing == null) {
                nodes.put(node.id(), new FlowchartNode(node.id(), node.id(),
                        ShapeKind.RECT, null, null, lineIndex, false));
            }
        }

        for (int t = 1; t < tokens.size() - 1; t++) {
            if (tokens.get(t) instanceof ArrowToken arrow
                    && tokens.get(t - 1) instanceof NodeToken source
                    && tokens.get(t + 1) instanceof NodeToken target) {
                edges.add(new FlowchartEdge(source.id(), target.id(),
                        arrow.label() == null ? "" : arrow.label(),
                        arrow.kind(), Math.max(1, arrow.minlen()), lineIndex));
            }
        }
    }

    private static void applyAnnotation(
            final FlowchartLines.Annotation annotation, final int lineIndex,
            final Map<String, FlowchartNode> nodes) {
        final FlowchartNode existing = nodes.get(annotation.nodeId());
        if (existing == null) {
            nodes.put(annotation.nodeId(), new FlowchartNode(
                    annotation.nodeId(),
                    annotation.label() != null
                            ? annotation.label() : annotation.nodeId(),
                    ShapeKind.fromName(annotation.shape()),
                    null, null, lineIndex, true));
            return;
        }
        final ShapeKind shape = annotation.shape() != null
                ? ShapeKind.fromName(annotation.shape()) : existing.shape();
        final String label = annotation.label() != null
                ? annotation.label() : existing.label();
        nodes.put(existing.id(), existing.withShapeAndLabel(shape, label));
    }

    /** Mutable group state while its {@code end} is pending. */
    private static final class GroupBuilder {
        private final String id;
        private final String label;
        private final int startLine;
        private int endLine = Subgraph.UNCLOSED;

        private GroupBuilder(final String theId, final String theLabel,
                final int theStartLine) {
            id = theId;
            label = theLabel;
            startLine = theStartLine;
        }
    }

}
