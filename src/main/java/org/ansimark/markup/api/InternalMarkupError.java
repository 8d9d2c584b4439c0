package org.ansimark.markup.api;

/**
 * Signals a broken invariant inside the styler itself rather than bad input.
 * Never expected in correct operation.
 */
public class InternalMarkupError extends IllegalStateException {

    public InternalMarkupError(String message) {
        super(message);
    }
}
