package co.fanki.diagrameditor.shared;

/**
 * Raised when an editor request cannot be honored.
 *
 * <p>Malformed diagram text never produces this exception: parsers and
 * mutators degrade gracefully. It is reserved for request-level
 * problems, such as asking for a structural mutation on a dialect that
 * only supports parsing.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new domain exception with the generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, "EDITOR_ERROR");
    }

    /**
     * Creates a new domain exception with a specific error code.
     *
     * @param message the error message
     * @param theErrorCode the machine readable error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the machine readable error code.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
