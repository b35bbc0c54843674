package co.fanki.diagrameditor.shared;

/**
 * Argument checks for the application layer.
 *
 * <p>Only request payloads are validated with these helpers. Diagram
 * text itself is free-form user input and is never rejected.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition holds, raising a {@link DomainException}
     * with the given code otherwise.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @param errorCode the error code carried by the exception
     * @throws DomainException if condition is false
     */
    public static void requireDomain(final boolean condition,
            final String message, final String errorCode) {
        if (!condition) {
            throw new DomainException(message, errorCode);
        }
    }

}
