package org.ansimark.markup.api;

/**
 * An exception that is thrown when markup cannot be styled.
 * <p>
 * It is part of the public API and carries a {@link MarkupErrorCode} so callers and tests
 * can tell failures apart without parsing messages.
 */
public class MarkupException extends Exception {

    private final MarkupErrorCode errorCode;

    /**
     * Constructs a new markup exception with the specified error code and detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public MarkupException(MarkupErrorCode errorCode, String message) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new markup exception with the specified error code, detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public MarkupException(MarkupErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The code identifying the kind of failure.
     */
    public MarkupErrorCode getErrorCode() {
        return errorCode;
    }
}
