package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;

/**
 * A parsed context or container diagram.
 *
 * @param title the title, empty when absent
 * @param members the people, systems, containers and components
 * @param relationships the {@code Rel} lines
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record C4Diagram(String title, List<Element> members,
        List<Relationship> relationships) implements DiagramModel {

    /**
     * An element such as {@code Person(user, "User", "A customer")}.
     *
     * @param type the macro name, e.g. {@code System_Ext}
     * @param id the alias
     * @param label the display name
     * @param description the description, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Element(String type, String id, String label,
            String description, int lineIndex) {}

    /**
     * A relationship such as {@code Rel(user, web, "Uses", "HTTPS")}.
     *
     * @param source the source alias
     * @param target the target alias
     * @param label the label
     * @param technology the technology, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Relationship(String source, String target, String label,
            String technology, int lineIndex) {}

    @Override
    public List<DiagramNode> elements() {
        return members.stream()
                .map(e -> new DiagramNode(e.id(), e.label(), e.type(),
                        e.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return relationships.stream()
                .map(r -> new DiagramLink(r.source(), r.target(), "Rel",
                        r.label(), r.lineIndex()))
                .toList();
    }

}
