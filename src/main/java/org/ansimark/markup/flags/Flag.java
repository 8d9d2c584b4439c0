package org.ansimark.markup.flags;

/**
 * A single named style flag.
 *
 * @param name The flag name, e.g. "BOLD".
 * @param bit The single bit identifying the flag inside a flag combination.
 * @param code The numeric SGR code written to the terminal.
 */
public record Flag(String name, long bit, int code) {

    /**
     * @param combination A flag combination.
     * @return {@code true} if this flag is set in the combination.
     */
    public boolean isSetIn(long combination) {
        return (combination & bit) != 0;
    }
}
