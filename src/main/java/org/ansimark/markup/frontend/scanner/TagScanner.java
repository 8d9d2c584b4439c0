package org.ansimark.markup.frontend.scanner;

import java.util.Optional;

/**
 * Finds the next unescaped marker in a working buffer, resolving escapes as it goes.
 * <p>
 * A run of backslashes in front of a marker is consumed pairwise: every pair collapses to one
 * literal backslash, and an odd backslash left over turns the marker into a literal character.
 * So {@code \<} is a plain {@code <} and {@code \\<} is a backslash followed by a real marker.
 * Backslashes not followed by a marker are left alone. The removed characters are deleted from
 * the buffer, which shifts every later index; callers must only keep indices that lie before the
 * position they resume scanning from.
 */
public class TagScanner {

    /** The escape character. */
    public static final char ESCAPE = '\\';

    /**
     * Scans for the next structurally active marker.
     *
     * @param buffer The working buffer. Escape characters in front of markers are removed from it.
     * @param from The index to start scanning at. Backslashes before this index are never consumed.
     * @return The marker, or empty if the buffer holds no further active marker.
     */
    public Optional<Marker> next(StringBuilder buffer, int from) {
        int current = Math.max(0, from);
        while (current < buffer.length()) {
            MarkerType type = MarkerType.of(buffer.charAt(current));
            if (type == null) {
                current++;
                continue;
            }

            int runStart = current;
            while (runStart > from && buffer.charAt(runStart - 1) == ESCAPE) runStart--;
            int run = current - runStart;
            if (run == 0) {
                return Optional.of(new Marker(type, current));
            }

            // Keep one backslash per pair, drop the rest.
            int removed = (run + 1) / 2;
            buffer.delete(runStart, runStart + removed);
            int markerIndex = current - removed;

            if (run % 2 == 1) {
                // Escaped: the marker is text now, resume right after it.
                current = markerIndex + 1;
                continue;
            }
            return Optional.of(new Marker(type, markerIndex));
        }
        return Optional.empty();
    }
}
