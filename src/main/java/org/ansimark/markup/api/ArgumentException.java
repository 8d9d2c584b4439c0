package org.ansimark.markup.api;

/**
 * Raised when a phrase asks for a positional style that was not supplied, either through
 * an out-of-range argument index or because the sequential supply ran out.
 */
public class ArgumentException extends MarkupException {

    public ArgumentException(MarkupErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
