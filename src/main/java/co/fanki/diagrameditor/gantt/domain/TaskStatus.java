package co.fanki.diagrameditor.gantt.domain;

import java.util.Optional;

/**
 * Status keywords a task line may carry before its scheduling tokens.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TaskStatus {

    /** Finished work. */
    DONE("done"),

    /** Work in progress. */
    ACTIVE("active"),

    /** Work flagged as critical by the author. */
    CRITICAL("crit");

    private final String keyword;

    TaskStatus(final String theKeyword) {
        this.keyword = theKeyword;
    }

    /**
     * Returns the keyword as written in the chart.
     *
     * @return the keyword, never null
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Finds the status for a token.
     *
     * @param token the token, trimmed, may be null
     * @return the status, empty when the token is not a status keyword
     */
    public static Optional<TaskStatus> fromKeyword(final String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (final TaskStatus status : values()) {
            if (status.keyword.equalsIgnoreCase(token.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

}
