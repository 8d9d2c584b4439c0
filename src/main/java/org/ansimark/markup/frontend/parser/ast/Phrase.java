package org.ansimark.markup.frontend.parser.ast;

import org.ansimark.markup.api.InternalMarkupError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed tagged region of the markup.
 * <p>
 * Indices refer to the escape-resolved working buffer the phrase was parsed from. The text
 * is the content between the two markers, including the markup of nested phrases.
 */
public final class Phrase {

    /** Value of {@link #getCloseIndex()} while the phrase is still open. */
    public static final int NOT_CLOSED = -1;

    private final int openIndex;
    private int closeIndex = NOT_CLOSED;
    private String text;
    private String styleCode;
    private final List<Phrase> children = new ArrayList<>();
    private List<Integer> argumentIndices = List.of();
    private boolean overrideAlways;

    /**
     * @param openIndex The index of the opening marker.
     */
    public Phrase(int openIndex) {
        this.openIndex = openIndex;
    }

    /**
     * Closes the phrase.
     *
     * @param closeIndex The index of the closing marker.
     * @param text The content between the markers.
     */
    public void close(int closeIndex, String text) {
        if (isClosed()) {
            throw new InternalMarkupError("Phrase opened at " + openIndex + " closed twice");
        }
        this.closeIndex = closeIndex;
        this.text = text;
    }

    public boolean isClosed() {
        return closeIndex != NOT_CLOSED;
    }

    public int getOpenIndex() {
        return openIndex;
    }

    public int getCloseIndex() {
        return closeIndex;
    }

    /**
     * @return The content between the markers, or {@code null} while the phrase is open.
     */
    public String getText() {
        return text;
    }

    /**
     * @return The resolved code string, or {@code null} before style resolution.
     */
    public String getStyleCode() {
        return styleCode;
    }

    /**
     * Sets the resolved code string. May only happen once.
     * @param styleCode The code string, e.g. "1;31".
     */
    public void setStyleCode(String styleCode) {
        if (this.styleCode != null) {
            throw new InternalMarkupError("Style of phrase at " + openIndex + " resolved twice");
        }
        this.styleCode = styleCode;
    }

    public List<Phrase> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(Phrase child) {
        children.add(child);
    }

    public List<Integer> getArgumentIndices() {
        return argumentIndices;
    }

    public void setArgumentIndices(List<Integer> argumentIndices) {
        this.argumentIndices = List.copyOf(argumentIndices);
    }

    public boolean hasArguments() {
        return !argumentIndices.isEmpty();
    }

    public boolean isOverrideAlways() {
        return overrideAlways;
    }

    public void setOverrideAlways(boolean overrideAlways) {
        this.overrideAlways = overrideAlways;
    }

    @Override
    public String toString() {
        return "Phrase[" + openIndex + ".." + closeIndex + ", '" + text + "', args=" + argumentIndices
                + (overrideAlways ? "!" : "") + ", children=" + children.size() + "]";
    }
}
