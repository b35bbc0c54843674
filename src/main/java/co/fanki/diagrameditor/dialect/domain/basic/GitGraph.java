package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;

/**
 * A parsed version-control graph.
 *
 * @param commits the commits in source order
 * @param branches the created branches
 * @param checkouts the branch switches
 * @param merges the merges
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GitGraph(List<Commit> commits, List<Branch> branches,
        List<Checkout> checkouts, List<Merge> merges) implements DiagramModel {

    /** The branch that is current before any branch command. */
    public static final String MAIN = "main";

    /**
     * A commit.
     *
     * @param id the explicit id, empty when none is given
     * @param branch the branch it was made on
     * @param type NORMAL, REVERSE or HIGHLIGHT
     * @param tag the tag, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Commit(String id, String branch, String type, String tag,
            int lineIndex) {}

    /**
     * A created branch.
     *
     * @param name the branch name
     * @param from the branch that was current when it was created
     * @param lineIndex the line it was found on
     */
    public record Branch(String name, String from, int lineIndex) {}

    /**
     * A switch to another branch.
     *
     * @param name the branch switched to
     * @param lineIndex the line it was found on
     */
    public record Checkout(String name, int lineIndex) {}

    /**
     * A merge into the current branch.
     *
     * @param from the merged branch
     * @param into the current branch
     * @param lineIndex the line it was found on
     */
    public record Merge(String from, String into, int lineIndex) {}

    @Override
    public List<DiagramNode> elements() {
        return branches.stream()
                .map(b -> new DiagramNode(b.name(), b.name(), "branch",
                        b.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return merges.stream()
                .map(m -> new DiagramLink(m.from(), m.into(), "merge", "",
                        m.lineIndex()))
                .toList();
    }

}
