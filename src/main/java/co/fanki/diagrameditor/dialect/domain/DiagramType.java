package co.fanki.diagrameditor.dialect.domain;

import co.fanki.diagrameditor.shared.SourceLines;

import java.util.List;
import java.util.Locale;

/**
 * The diagram dialects the editor knows about.
 *
 * <p>Classification works on the dialect keyword that opens a document
 * (for example {@code stateDiagram-v2} or {@code graph}). Rules are tried
 * in declaration order and the first match wins, so more specific
 * keywords must stay above the ones they contain. Anything unrecognized
 * is {@link #UNSUPPORTED}, never null.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DiagramType {

    FLOWCHART("flowchart"),
    SEQUENCE("sequenceDiagram"),
    GANTT("gantt"),
    REQUIREMENT("requirementDiagram"),
    ER("erDiagram"),
    CLASS("classDiagram"),
    STATE("stateDiagram-v2"),
    MINDMAP("mindmap"),
    PIE("pie"),
    TIMELINE("timeline"),
    JOURNEY("journey"),
    GIT_GRAPH("gitGraph"),
    C4("C4Context"),
    SANKEY("sankey-beta"),
    QUADRANT("quadrantChart"),
    XY_CHART("xychart-beta"),
    BLOCK("block-beta"),
    ARCHITECTURE("architecture-beta"),
    TREEMAP("treemap"),
    PACKET("packet-beta"),
    RADAR("radar-beta"),
    UNSUPPORTED("");

    private final String keyword;

    DiagramType(final String theKeyword) {
        this.keyword = theKeyword;
    }

    /**
     * Returns the keyword used to open a new document of this type.
     *
     * @return the header keyword, empty for {@link #UNSUPPORTED}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Classifies a dialect keyword.
     *
     * @param raw the keyword, e.g. {@code erDiagram}, may be null
     * @return the type, {@link #UNSUPPORTED} when nothing matches
     */
    public static DiagramType classify(final String raw) {
        final String name = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return UNSUPPORTED;
        }
        if (name.contains("flow") || name.equals("graph")) {
            return FLOWCHART;
        }
        if (name.contains("sequence") || name.contains("zenuml")) {
            return SEQUENCE;
        }
        if (name.contains("gantt")) {
            return GANTT;
        }
        if (name.contains("requirement")) {
            return REQUIREMENT;
        }
        if (name.contains("erdiagram") || name.equals("er")) {
            return ER;
        }
        for (final DiagramType type : CONTAINS_RULES) {
            if (name.contains(type.fragment())) {
                return type;
            }
        }
        return UNSUPPORTED;
    }

    /**
     * Detects the type of a document from its first meaningful line,
     * skipping front matter, blank lines and {@code %%} comments.
     *
     * @param code the diagram text, may be null
     * @return the type, {@link #UNSUPPORTED} for empty or unknown text
     */
    public static DiagramType detect(final String code) {
        final List<String> lines = SourceLines.split(code);
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            return classify(trimmed.split("\\s+")[0]);
        }
        return UNSUPPORTED;
    }

    private static final List<DiagramType> CONTAINS_RULES = List.of(
            CLASS, STATE, MINDMAP, PIE, TIMELINE, JOURNEY, GIT_GRAPH, C4,
            SANKEY, QUADRANT, XY_CHART, BLOCK, ARCHITECTURE, TREEMAP, PACKET,
            RADAR);

    private String fragment() {
        return switch (this) {
            case CLASS -> "class";
            case STATE -> "state";
            case GIT_GRAPH -> "git";
            case C4 -> "c4";
            case XY_CHART -> "xy";
            default -> name().toLowerCase(Locale.ROOT);
        };
    }

}
