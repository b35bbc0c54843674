package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads mindmaps. Two spaces of indentation make one level.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MindmapReader implements DiagramReader<Mindmap> {

    private static final Pattern ROOT = Pattern.compile("^root\\(\\((.+?)\\)\\)$");

    private static final Pattern SHAPED = Pattern.compile(
            "^([\\w-]+)?(\\(\\(|\\)\\)|\\{\\{|\\[|\\(|\\))(.+?)"
                    + "(\\)\\)|\\(\\(|\\}\\}|\\]|\\)|\\()$");

    @Override
    public DiagramType type() {
        return DiagramType.MINDMAP;
    }

    @Override
    public Mindmap parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<Mindmap.Node> nodes = new ArrayList<>();
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String line = lines.get(i);
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")
                    || trimmed.equals("mindmap") || trimmed.startsWith("::")) {
                continue;
            }
            final Matcher root = ROOT.matcher(trimmed);
            if (root.matches()) {
                nodes.add(new Mindmap.Node("root", root.group(1), "((", 0, i));
                continue;
            }
            final int level = SourceLines.indentOf(line).length() / 2;
            final Matcher shaped = SHAPED.matcher(trimmed);
            if (shaped.matches()) {
                nodes.add(new Mindmap.Node(shaped.group(1), shaped.group(3),
                        shaped.group(2), level, i));
            } else {
                nodes.add(new Mindmap.Node(null, trimmed, null, level, i));
            }
        }
        return new Mindmap(List.copyOf(nodes));
    }

    /**
     * Appends a node at the given depth.
     *
     * @param code the mindmap text
     * @param label the node text
     * @param level the depth, values below one are written at level one
     * @return the new text
     */
    public String addNode(final String code, final String label,
            final int level) {
        return SourceLines.append(code, "  ".repeat(Math.max(1, level)) + label);
    }

}
