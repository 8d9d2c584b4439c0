package org.ansimark.markup.frontend.scanner;

/**
 * Represents the types of markers the {@link TagScanner} can find.
 */
public enum MarkerType {
    /** Starts a phrase: {@code <}. */
    OPEN('<'),
    /** Ends a phrase or an argument specifier: {@code >}. */
    CLOSE('>');

    private final char symbol;

    MarkerType(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * @param c A character.
     * @return The marker type for the character, or {@code null} if it is no marker.
     */
    public static MarkerType of(char c) {
        if (c == OPEN.symbol) return OPEN;
        if (c == CLOSE.symbol) return CLOSE;
        return null;
    }
}
