package org.ansimark.markup.api;

/**
 * Raised when the markup is ill-formed, e.g. an opening tag is never closed.
 */
public class ParseException extends MarkupException {

    public ParseException(String message) {
        super(MarkupErrorCode.MISSING_CLOSING_TAG, message);
    }
}
