package co.fanki.diagrameditor.flowchart.domain;

/**
 * A named group of lines delimited by {@code subgraph} and {@code end}.
 *
 * @param id the group id
 * @param label the display label
 * @param startLine the line of the {@code subgraph} keyword
 * @param endLine the line of the matching {@code end}, or
 *        {@link #UNCLOSED} when the group never closes
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Subgraph(String id, String label, int startLine, int endLine) {

    /** Marks a group without a matching {@code end}. */
    public static final int UNCLOSED = -1;

    /**
     * Checks whether the group has a matching {@code end}.
     *
     * @return true when closed
     */
    public boolean isClosed() {
        return endLine != UNCLOSED;
    }

    /**
     * Checks whether a line lies strictly inside this group. Unclosed
     * groups contain nothing.
     *
     * @param line the line index
     * @return true when the line is between the open and close lines
     */
    public boolean contains(final int line) {
        return isClosed() && line > startLine && line < endLine;
    }

    /**
     * Checks whether another group lies inside this one.
     *
     * @param other the other group
     * @return true when this group contains the other's opening line
     */
    public boolean encloses(final Subgraph other) {
        return contains(other.startLine());
    }

}
