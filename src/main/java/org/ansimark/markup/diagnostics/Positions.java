package org.ansimark.markup.diagnostics;

import org.ansimark.markup.api.InternalMarkupError;

/**
 * Turns absolute character indices into positions a human can find in the markup.
 */
public final class Positions {

    private Positions() {}

    /**
     * Describes the position of a character.
     * <p>
     * For single-line text the bare 0-based index is returned, since "line:column" would
     * add nothing. For multi-line text the result is {@code line:column}, both 1-based.
     *
     * @param text The text the index refers to.
     * @param index The 0-based index of the character in question.
     * @return The position description.
     * @throws InternalMarkupError if the index does not lie within the text.
     */
    public static String describe(CharSequence text, int index) {
        if (text == null || index < 0 || index >= text.length()) {
            throw new InternalMarkupError("Out-of-range index " + index + " passed to Positions.describe");
        }

        int line = 1;
        int lineStart = 0;
        boolean multiLine = false;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != '\n') continue;
            multiLine = true;
            if (i < index) {
                line++;
                lineStart = i + 1;
            } else {
                break;
            }
        }

        if (!multiLine) {
            return Integer.toString(index);
        }
        return line + ":" + (index - lineStart + 1);
    }
}
