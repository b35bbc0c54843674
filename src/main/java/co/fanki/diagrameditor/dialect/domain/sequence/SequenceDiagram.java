package co.fanki.diagrameditor.dialect.domain.sequence;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;
import java.util.Optional;

/**
 * A parsed sequence diagram.
 *
 * @param participants the participants, declared ones first
 * @param messages the messages in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SequenceDiagram(List<Participant> participants,
        List<Message> messages) implements DiagramModel {

    /**
     * A participant or actor.
     *
     * @param id the participant id
     * @param label the alias, the id when none is given
     * @param type {@code participant} or {@code actor}
     * @param lineIndex the declaring line, -1 when only used by messages
     */
    public record Participant(String id, String label, String type,
            int lineIndex) {}

    /**
     * A message line such as {@code Alice->>Bob: Hello}.
     *
     * @param source the sender
     * @param target the receiver
     * @param arrow the arrow as written
     * @param text the message text, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Message(String source, String target, String arrow,
            String text, int lineIndex) {}

    /**
     * Finds a participant by id.
     *
     * @param id the participant id
     * @return the participant, if present
     */
    public Optional<Participant> find(final String id) {
        return participants.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    @Override
    public List<DiagramNode> elements() {
        return participants.stream()
                .map(p -> new DiagramNode(p.id(), p.label(), p.type(),
                        p.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return messages.stream()
                .map(m -> new DiagramLink(m.source(), m.target(), m.arrow(),
                        m.text(), m.lineIndex()))
                .toList();
    }

}
