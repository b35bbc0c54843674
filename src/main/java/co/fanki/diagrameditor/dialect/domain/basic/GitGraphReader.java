package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads version-control graphs, following the current branch through
 * {@code branch}, {@code checkout} and {@code switch} lines.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GitGraphReader implements DiagramReader<GitGraph> {

    private static final Pattern COMMIT = Pattern.compile("^commit(?:\\s+(.*))?$");

    private static final Pattern COMMIT_ID = Pattern.compile("id:\\s*\"([^\"]+)\"");

    private static final Pattern COMMIT_TYPE =
            Pattern.compile("type:\\s*(NORMAL|REVERSE|HIGHLIGHT)");

    private static final Pattern COMMIT_TAG = Pattern.compile("tag:\\s*\"([^\"]+)\"");

    private static final Pattern BRANCH = Pattern.compile("^branch\\s+(\\S+)");

    private static final Pattern CHECKOUT =
            Pattern.compile("^(?:checkout|switch)\\s+(\\S+)");

    private static final Pattern MERGE = Pattern.compile("^merge\\s+(\\S+)");

    @Override
    public DiagramType type() {
        return DiagramType.GIT_GRAPH;
    }

    @Override
    public GitGraph parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<GitGraph.Commit> commits = new ArrayList<>();
        final List<GitGraph.Branch> branches = new ArrayList<>();
        final List<GitGraph.Checkout> checkouts = new ArrayList<>();
        final List<GitGraph.Merge> merges = new ArrayList<>();
        String current = GitGraph.MAIN;

        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")
                    || trimmed.startsWith("gitGraph")) {
                continue;
            }
            Matcher matcher = COMMIT.matcher(trimmed);
            if (matcher.matches()) {
                final String attributes = matcher.group(1) == null
                        ? "" : matcher.group(1);
                commits.add(new GitGraph.Commit(
                        attribute(COMMIT_ID, attributes, ""), current,
                        attribute(COMMIT_TYPE, attributes, "NORMAL"),
                        attribute(COMMIT_TAG, attributes, ""), i));
                continue;
            }
            matcher = BRANCH.matcher(trimmed);
            if (matcher.find()) {
                branches.add(new GitGraph.Branch(matcher.group(1), current, i));
                current = matcher.group(1);
                continue;
            }
            matcher = CHECKOUT.matcher(trimmed);
            if (matcher.find()) {
                checkouts.add(new GitGraph.Checkout(matcher.group(1), i));
                current = matcher.group(1);
                continue;
            }
            matcher = MERGE.matcher(trimmed);
            if (matcher.find()) {
                merges.add(new GitGraph.Merge(matcher.group(1), current, i));
            }
        }
        return new GitGraph(List.copyOf(commits), List.copyOf(branches),
                List.copyOf(checkouts), List.copyOf(merges));
    }

    /**
     * Appends a commit on the current branch.
     *
     * @param code the graph text
     * @param id the commit id, none is written when blank
     * @return the new text
     */
    public String addCommit(final String code, final String id) {
        if (id == null || id.isBlank()) {
            return SourceLines.append(code, "    commit");
        }
        return SourceLines.append(code, "    commit id: \""
                + id.trim().replace("\"", "'") + "\"");
    }

    /**
     * Appends a branch creation.
     *
     * @param code the graph text
     * @param name the branch name
     * @return the new text
     */
    public String addBranch(final String code, final String name) {
        return SourceLines.append(code, "    branch " + name.trim());
    }

    /**
     * Appends a switch to another branch.
     *
     * @param code the graph text
     * @param name the branch name
     * @return the new text
     */
    public String checkout(final String code, final String name) {
        return SourceLines.append(code, "    checkout " + name.trim());
    }

    /**
     * Appends a merge of a branch into the current one.
     *
     * @param code the graph text
     * @param name the branch to merge
     * @return the new text
     */
    public String merge(final String code, final String name) {
        return SourceLines.append(code, "    merge " + name.trim());
    }

    private static String attribute(final Pattern pattern,
            final String attributes, final String fallback) {
        final Matcher matcher = pattern.matcher(attributes);
        return matcher.find() ? matcher.group(1) : fallback;
    }

}
