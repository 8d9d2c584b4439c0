package org.ansimark.markup.backend.resolve;

import org.ansimark.markup.config.StyleTables;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The state of a single render call: the style tables and the cursor into the positional styles
 * handed out in order of appearance. A fresh context is created for every call, so calls never
 * see each other's progress. Not thread-safe.
 */
public final class RenderContext {

    private final List<Long> positionalStyles;
    private final Map<String, Long> alwaysStyles;
    private int sequentialCounter = 0;

    /**
     * @param tables The tables to draw styles from.
     */
    public RenderContext(StyleTables tables) {
        this.positionalStyles = tables.positional();
        this.alwaysStyles = tables.always();
    }

    public int positionalCount() {
        return positionalStyles.size();
    }

    /**
     * @param index An index into the positional styles.
     * @return {@code true} if a positional style exists at the index.
     */
    public boolean hasPositional(int index) {
        return index >= 0 && index < positionalStyles.size();
    }

    public long positional(int index) {
        return positionalStyles.get(index);
    }

    /**
     * @param text A phrase text.
     * @return The always-style bound to the text, if any.
     */
    public Optional<Long> always(String text) {
        return Optional.ofNullable(alwaysStyles.get(text));
    }

    /**
     * @return The number of positional styles handed out in order of appearance so far.
     */
    public int getSequentialCounter() {
        return sequentialCounter;
    }

    /**
     * @return {@code true} if another positional style can be handed out in order.
     */
    public boolean hasNextSequential() {
        return sequentialCounter < positionalStyles.size();
    }

    /**
     * Hands out the next positional style. Check {@link #hasNextSequential()} first.
     * @return The style.
     */
    public long nextSequential() {
        return positionalStyles.get(sequentialCounter++);
    }
}
