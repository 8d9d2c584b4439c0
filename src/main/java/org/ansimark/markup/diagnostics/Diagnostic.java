package org.ansimark.markup.diagnostics;

/**
 * Represents a single diagnostic message that occurs while
 * rendering markup without stopping it.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param position The position in the markup, as produced by {@link Positions#describe(CharSequence, int)}.
 */
public record Diagnostic(
        Type type,
        String message,
        String position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** Something suspicious that does not prevent rendering. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s at position %s", type, message, position);
    }
}
