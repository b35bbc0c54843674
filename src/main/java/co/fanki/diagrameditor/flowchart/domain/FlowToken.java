package co.fanki.diagrameditor.flowchart.domain;

/**
 * A token produced by {@link FlowchartTokenizer}, carrying its character
 * span within the scanned line.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FlowToken {

    /**
     * Offset of the first character of the token.
     *
     * @return the inclusive start offset
     */
    int start();

    /**
     * Offset right after the last character of the token.
     *
     * @return the exclusive end offset
     */
    int end();

}
