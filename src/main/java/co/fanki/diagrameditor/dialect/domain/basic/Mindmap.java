package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed mindmap. The tree is implied by indentation: a node's parent is
 * the closest earlier node with a lower level.
 *
 * @param nodes the nodes in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Mindmap(List<Node> nodes) implements DiagramModel {

    /**
     * A mindmap node.
     *
     * @param id the explicit id before the shape, null when none
     * @param label the text, without shape delimiters
     * @param shape the opening delimiter such as {@code ((}, null for plain
     *        text
     * @param level the depth, zero for the root
     * @param lineIndex the line it was found on
     */
    public record Node(String id, String label, String shape, int level,
            int lineIndex) {

        /** @return the explicit id, or a line-based one */
        public String key() {
            return id != null ? id : "L" + lineIndex;
        }
    }

    @Override
    public List<DiagramNode> elements() {
        return nodes.stream()
                .map(n -> new DiagramNode(n.key(), n.label(),
                        n.level() == 0 ? "root" : "node", n.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        final List<DiagramLink> links = new ArrayList<>();
        for (int i = 1; i < nodes.size(); i++) {
            final Node child = nodes.get(i);
            for (int j = i - 1; j >= 0; j--) {
                if (nodes.get(j).level() < child.level()) {
                    links.add(new DiagramLink(nodes.get(j).key(), child.key(),
                            "child", "", child.lineIndex()));
                    break;
                }
            }
        }
        return links;
    }

}
