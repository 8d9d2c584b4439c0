package org.ansimark.markup.frontend.scanner;

/**
 * A structurally active marker found by the {@link TagScanner}.
 *
 * @param type Whether the marker opens or closes.
 * @param index The position of the marker in the escape-resolved working buffer.
 */
public record Marker(MarkerType type, int index) {
}
