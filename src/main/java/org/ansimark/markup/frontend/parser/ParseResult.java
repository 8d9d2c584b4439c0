package org.ansimark.markup.frontend.parser;

import org.ansimark.markup.frontend.parser.ast.Phrase;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The outcome of building the phrase tree.
 *
 * @param text The escape-resolved working text all phrase indices refer to.
 * @param phrases The top-level phrases in document order.
 */
public record ParseResult(String text, List<Phrase> phrases) {

    public ParseResult {
        phrases = List.copyOf(phrases);
    }

    /**
     * @return The number of phrases in the whole forest.
     */
    public int phraseCount() {
        int total = 0;
        Deque<Phrase> pending = new ArrayDeque<>(phrases);
        while (!pending.isEmpty()) {
            Phrase phrase = pending.pop();
            total++;
            phrase.getChildren().forEach(pending::push);
        }
        return total;
    }
}
