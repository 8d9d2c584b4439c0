package org.ansimark.markup.api;

/**
 * Raised while building style tables when a flag or flag combination is invalid.
 */
public class FlagException extends MarkupException {

    public FlagException(MarkupErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public FlagException(MarkupErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
