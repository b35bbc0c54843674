package co.fanki.diagrameditor.dialect.domain.classdiagram;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;
import java.util.Optional;

/**
 * A parsed class diagram.
 *
 * @param classes the classes, declared ones first, then the ones only
 *        referenced by relationships
 * @param relationships the relationships in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassDiagram(List<ClassEntry> classes,
        List<Relationship> relationships) implements DiagramModel {

    /**
     * A class.
     *
     * @param id the class name
     * @param label the display label, the id when no alias is given
     * @param members the member lines of its block
     * @param annotations stereotypes such as {@code interface}
     * @param lineIndex the declaring line, -1 when only referenced
     * @param endLine the closing brace line, the declaring line for
     *        classes without a block, -1 when only referenced
     */
    public record ClassEntry(String id, String label, List<String> members,
            List<String> annotations, int lineIndex, int endLine) {

        /**
         * Checks whether the class has its own declaration line.
         *
         * @return true when declared
         */
        public boolean isDeclared() {
            return lineIndex >= 0;
        }
    }

    /**
     * A relationship line such as {@code Animal <|-- Duck : extends}.
     *
     * @param source the left class
     * @param target the right class
     * @param type the connector as written
     * @param label the text after the colon, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Relationship(String source, String target, String type,
            String label, int lineIndex) {}

    /**
     * Finds a class by name.
     *
     * @param id the class name
     * @return the class, if present
     */
    public Optional<ClassEntry> find(final String id) {
        return classes.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    @Override
    public List<DiagramNode> elements() {
        return classes.stream()
                .map(c -> new DiagramNode(c.id(), c.label(), "class",
                        c.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return relationships.stream()
                .map(r -> new DiagramLink(r.source(), r.target(), r.type(),
                        r.label(), r.lineIndex()))
                .toList();
    }

}
