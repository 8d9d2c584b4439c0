package org.ansimark.markup.frontend.parser;

import org.ansimark.markup.api.ParseException;
import org.ansimark.markup.diagnostics.DiagnosticsEngine;
import org.ansimark.markup.diagnostics.Positions;
import org.ansimark.markup.frontend.parser.ast.Phrase;
import org.ansimark.markup.frontend.scanner.Marker;
import org.ansimark.markup.frontend.scanner.MarkerType;
import org.ansimark.markup.frontend.scanner.TagScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds the forest of phrases from the markers found by the {@link TagScanner}.
 * <p>
 * Open phrases are kept on an explicit stack rather than on the call stack, so the nesting
 * depth is only limited by memory. With an empty stack the builder is scanning top-level text,
 * otherwise it is scanning the content of the phrase on top of the stack.
 * <p>
 * A closing marker is classified against the content since the innermost opening marker:
 * <ol>
 *   <li>a nested tag whose whole content is an argument specifier ({@code <0,1!>}) configures
 *       the enclosing phrase and is removed from the text; the enclosing phrase stays open;</li>
 *   <li>escaped closing markers never get here, the scanner already turned them into text;</li>
 *   <li>anything else closes the phrase.</li>
 * </ol>
 * A closing marker with nothing open is reported as a warning and left in the text.
 */
public class PhraseTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(PhraseTreeBuilder.class);
    private static final int CONTEXT_LENGTH = 20;

    private final TagScanner scanner;
    private final DiagnosticsEngine diagnostics;

    /**
     * Creates a new builder.
     * @param diagnostics The engine for reporting warnings.
     */
    public PhraseTreeBuilder(DiagnosticsEngine diagnostics) {
        this(new TagScanner(), diagnostics);
    }

    /**
     * Creates a new builder with an explicit scanner.
     * @param scanner The scanner locating markers.
     * @param diagnostics The engine for reporting warnings.
     */
    public PhraseTreeBuilder(TagScanner scanner, DiagnosticsEngine diagnostics) {
        this.scanner = scanner;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the markup into a phrase forest.
     *
     * @param markup The markup.
     * @return The escape-resolved text and its top-level phrases.
     * @throws ParseException if an opening marker is never closed.
     */
    public ParseResult build(String markup) throws ParseException {
        StringBuilder buffer = new StringBuilder(markup);
        List<Phrase> roots = new ArrayList<>();
        Deque<Phrase> open = new ArrayDeque<>();

        int position = 0;
        Optional<Marker> next;
        while ((next = scanner.next(buffer, position)).isPresent()) {
            Marker marker = next.get();

            if (marker.type() == MarkerType.OPEN) {
                open.push(new Phrase(marker.index()));
                position = marker.index() + 1;
                continue;
            }

            if (open.isEmpty()) {
                diagnostics.reportWarning("Un-escaped '" + MarkerType.CLOSE.symbol() + "' character",
                        Positions.describe(buffer, marker.index()));
                position = marker.index() + 1;
                continue;
            }

            Phrase phrase = open.peek();
            String content = buffer.substring(phrase.getOpenIndex() + 1, marker.index());

            Optional<ArgumentSpecifier> specifier = open.size() > 1 && phrase.getChildren().isEmpty()
                    ? ArgumentSpecifier.parse(content)
                    : Optional.empty();
            if (specifier.isPresent()) {
                open.pop();
                Phrase owner = open.peek();
                owner.setArgumentIndices(specifier.get().indices());
                owner.setOverrideAlways(specifier.get().override());
                buffer.delete(phrase.getOpenIndex(), marker.index() + 1);
                position = phrase.getOpenIndex();
                continue;
            }

            open.pop();
            phrase.close(marker.index(), content);
            if (open.isEmpty()) {
                roots.add(phrase);
            } else {
                open.peek().addChild(phrase);
            }
            position = marker.index() + 1;
        }

        if (!open.isEmpty()) {
            Phrase unclosed = open.peek();
            throw new ParseException(String.format(
                    "No closing tag found for opening tag at position %s after expression '%s'!",
                    Positions.describe(buffer, unclosed.getOpenIndex()),
                    contextAfter(buffer, unclosed.getOpenIndex())));
        }

        ParseResult result = new ParseResult(buffer.toString(), roots);
        LOG.debug("Parsed {} phrases ({} top-level)", result.phraseCount(), roots.size());
        return result;
    }

    private static String contextAfter(CharSequence buffer, int openIndex) {
        int end = Math.min(buffer.length(), openIndex + 1 + CONTEXT_LENGTH);
        return buffer.subSequence(openIndex + 1, end).toString();
    }
}
