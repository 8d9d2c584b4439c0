package org.ansimark.markup.backend.emit;

import org.ansimark.markup.frontend.parser.ast.Phrase;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Writes resolved phrases back into their text as ANSI escape sequences.
 * <p>
 * Each phrase becomes {@code ESC[<code>m content ESC[0;<parent code>m}. The reset falls back to
 * the enclosing phrase's style, so closing a nested phrase does not end the outer one.
 */
public class Renderer {

    /** The escape character starting every control sequence. */
    public static final char ESC = '\u001B';

    /**
     * Renders a phrase forest.
     *
     * @param text The escape-resolved text the phrases were parsed from.
     * @param phrases The top-level phrases with resolved styles.
     * @return The styled text, or {@code text} itself if there are no phrases.
     */
    public String render(String text, List<Phrase> phrases) {
        if (phrases.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + phrases.size() * 16);

        // One frame per phrase being written, the root frame covers the whole text.
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(0, text.length(), phrases, ""));
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (frame.next < frame.phrases.size()) {
                Phrase phrase = frame.phrases.get(frame.next++);
                out.append(text, frame.cursor, phrase.getOpenIndex());
                out.append(start(phrase.getStyleCode()));
                frame.cursor = phrase.getCloseIndex() + 1;
                frames.push(new Frame(phrase.getOpenIndex() + 1, phrase.getCloseIndex(), phrase.getChildren(), phrase.getStyleCode()));
                continue;
            }
            out.append(text, frame.cursor, frame.end);
            frames.pop();
            if (!frames.isEmpty()) {
                out.append(reset(frames.peek().code));
            }
        }
        return out.toString();
    }

    /**
     * @param code A style code string.
     * @return The sequence activating the style.
     */
    public static String start(String code) {
        return ESC + "[" + code + "m";
    }

    /**
     * @param parentCode The code of the enclosing style, empty at the root.
     * @return The sequence resetting to the enclosing style.
     */
    public static String reset(String parentCode) {
        return ESC + "[0;" + parentCode + "m";
    }

    private static final class Frame {
        private int cursor;
        private final int end;
        private final List<Phrase> phrases;
        private final String code;
        private int next = 0;

        Frame(int cursor, int end, List<Phrase> phrases, String code) {
            this.cursor = cursor;
            this.end = end;
            this.phrases = phrases;
            this.code = code;
        }
    }
}
