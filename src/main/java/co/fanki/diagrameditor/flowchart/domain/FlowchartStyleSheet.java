package co.fanki.diagrameditor.flowchart.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Style overlays of a flowchart: class definitions, per-node style
 * overrides and node to class assignments.
 *
 * <p>These are metadata on top of the structure; they never create nodes
 * nor take part in node identity.</p>
 *
 * @param classDefs the class definitions, in source order
 * @param nodeStyles per-node overrides from {@code style} lines, by node id
 * @param classAssignments the assigned class name, by node id
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowchartStyleSheet(List<ClassDef> classDefs,
        Map<String, Map<String, String>> nodeStyles,
        Map<String, String> classAssignments) {

    /**
     * A {@code classDef} line.
     *
     * @param name the class name
     * @param properties the style properties, in source order
     * @param raw the property text as written
     * @param lineIndex the line of the definition
     */
    public record ClassDef(String name, Map<String, String> properties,
            String raw, int lineIndex) {}

    private static final Pattern CLASS_DEF =
            Pattern.compile("^classDef\\s+(\\S+)\\s+(.+)$");

    private static final Pattern STYLE =
            Pattern.compile("^style\\s+(\\S+)\\s+(.+)$");

    private static final Pattern CLASS_ASSIGNMENT =
            Pattern.compile("^class\\s+(\\S+)\\s+(\\S+?);?$");

    /**
     * Reads every style overlay from flowchart text.
     *
     * @param code the flowchart text, may be null
     * @return the style sheet, never null
     */
    public static FlowchartStyleSheet parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<FlowchartLines.Kind> kinds = FlowchartLines.classify(lines);

        final List<ClassDef> classDefs = new ArrayList<>();
        final Map<String, Map<String, String>> nodeStyles = new LinkedHashMap<>();
        final Map<String, String> assignments = new LinkedHashMap<>();

        for (int i = 0; i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (kinds.get(i) == FlowchartLines.Kind.CONTENT) {
                for (final FlowToken token : FlowchartTokenizer.tokenize(lines.get(i))) {
                    if (token instanceof NodeToken node && node.cssClass() != null) {
                        assignments.put(node.id(), node.cssClass());
                    }
                }
                continue;
            }
            if (kinds.get(i) != FlowchartLines.Kind.DIRECTIVE) {
                continue;
            }
            Matcher matcher = CLASS_DEF.matcher(trimmed);
            if (matcher.matches()) {
                final String raw = matcher.group(2);
                for (final String name : matcher.group(1).split(",")) {
                    if (!name.isBlank()) {
                        classDefs.add(new ClassDef(name.trim(),
                                properties(raw), raw, i));
                    }
                }
                continue;
            }
            matcher = STYLE.matcher(trimmed);
            if (matcher.matches()) {
                nodeStyles.put(matcher.group(1), properties(matcher.group(2)));
                continue;
            }
            matcher = CLASS_ASSIGNMENT.matcher(trimmed);
            if (matcher.matches()) {
                for (final String id : matcher.group(1).split(",")) {
                    if (!id.isBlank()) {
                        assignments.put(id.trim(), matcher.group(2));
                    }
                }
            }
        }
        return new FlowchartStyleSheet(List.copyOf(classDefs),
                nodeStyles, assignments);
    }

    /**
     * Finds a class definition by name.
     *
     * @param name the class name
     * @return the definition, or null when not defined
     */
    public ClassDef classDef(final String name) {
        for (final ClassDef def : classDefs) {
            if (def.name().equals(name)) {
                return def;
            }
        }
        return null;
    }

    /**
     * Computes the effective style of a node: its class properties
     * overridden by its own {@code style} line.
     *
     * @param nodeId the node id
     * @return the merged properties, empty when the node has no styling
     */
    public Map<String, String> effectiveStyle(final String nodeId) {
        final Map<String, String> result = new LinkedHashMap<>();
        final String className = classAssignments.get(nodeId);
        if (className != null) {
            final ClassDef def = classDef(className);
            if (def != null) {
                result.putAll(def.properties());
            }
        }
        final Map<String, String> own = nodeStyles.get(nodeId);
        if (own != null) {
            result.putAll(own);
        }
        return result;
    }

    /** Splits {@code fill:#f9f,stroke:#333;} into an ordered map. */
    static Map<String, String> properties(final String raw) {
        final Map<String, String> properties = new LinkedHashMap<>();
        String text = raw.trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1);
        }
        for (final String pair : text.split("[,;]")) {
            final int colon = pair.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            final String key = pair.substring(0, colon).trim();
            final String value = pair.substring(colon + 1).trim();
            if (!key.isEmpty()) {
                properties.put(key, value);
            }
        }
        return properties;
    }

}
