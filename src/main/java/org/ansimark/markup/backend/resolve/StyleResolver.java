package org.ansimark.markup.backend.resolve;

import org.ansimark.markup.api.ArgumentException;
import org.ansimark.markup.api.MarkupErrorCode;
import org.ansimark.markup.diagnostics.Ordinals;
import org.ansimark.markup.flags.Flag;
import org.ansimark.markup.flags.FlagCategory;
import org.ansimark.markup.flags.FlagTable;
import org.ansimark.markup.frontend.parser.ast.Phrase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Decides the style of every phrase and encodes it as an SGR code string.
 * <p>
 * Phrases are visited in document order, parents before their children, so positional styles
 * handed out in order of appearance follow the opening markers from left to right.
 */
public class StyleResolver {

    private static final Logger LOG = LoggerFactory.getLogger(StyleResolver.class);

    /** Separator between codes of one style. */
    public static final String CODE_SEPARATOR = ";";

    private final FlagTable flagTable;

    public StyleResolver(FlagTable flagTable) {
        this.flagTable = flagTable;
    }

    /**
     * Resolves the style of all phrases of a forest.
     *
     * @param phrases The top-level phrases.
     * @param context The context of the current render call.
     * @throws ArgumentException if a phrase asks for a positional style that does not exist.
     */
    public void resolveAll(List<Phrase> phrases, RenderContext context) throws ArgumentException {
        Deque<Phrase> pending = new ArrayDeque<>();
        pushReversed(phrases, pending);
        while (!pending.isEmpty()) {
            Phrase phrase = pending.pop();
            resolve(phrase, context);
            pushReversed(phrase.getChildren(), pending);
        }
    }

    private static void pushReversed(List<Phrase> phrases, Deque<Phrase> pending) {
        for (int i = phrases.size() - 1; i >= 0; i--) {
            pending.push(phrases.get(i));
        }
    }

    /**
     * Resolves the style of a single phrase, without its children.
     * <ol>
     *   <li>With arguments, the named positional styles are combined, plus the always-style of
     *       the text unless the phrase overrides it.</li>
     *   <li>Otherwise an always-style for the text is used as is.</li>
     *   <li>Otherwise the next positional style in order of appearance is consumed.</li>
     * </ol>
     *
     * @param phrase The phrase.
     * @param context The context of the current render call.
     * @throws ArgumentException if a phrase asks for a positional style that does not exist.
     */
    public void resolve(Phrase phrase, RenderContext context) throws ArgumentException {
        long combination;
        Optional<Long> always = context.always(phrase.getText());

        if (phrase.hasArguments()) {
            combination = 0;
            List<Integer> arguments = phrase.getArgumentIndices();
            for (int n = 0; n < arguments.size(); n++) {
                int index = arguments.get(n);
                if (!context.hasPositional(index)) {
                    throw new ArgumentException(MarkupErrorCode.ARGUMENT_OUT_OF_RANGE, String.format(
                            "Positional argument '%d' (argument %d of '%s') is out of range, only %d were supplied!",
                            index, n + 1, phrase.getText(), context.positionalCount()));
                }
                combination |= context.positional(index);
            }
            if (always.isPresent() && !phrase.isOverrideAlways()) {
                combination |= always.get();
            }
        } else if (always.isPresent()) {
            combination = always.get();
        } else {
            if (!context.hasNextSequential()) {
                throw new ArgumentException(MarkupErrorCode.POSITIONAL_STYLES_EXHAUSTED, String.format(
                        "Requested %s formatting argument for '%s' but only %d were supplied!",
                        Ordinals.withArticle(context.getSequentialCounter() + 1),
                        phrase.getText(), context.positionalCount()));
            }
            combination = context.nextSequential();
        }

        phrase.setStyleCode(codify(combination));
        LOG.trace("Resolved style of '{}' to '{}'", phrase.getText(), phrase.getStyleCode());
    }

    /**
     * Encodes a flag combination: the codes of all set flags, category by category in the
     * order of the flag table, joined by {@value #CODE_SEPARATOR}.
     *
     * @param combination A flag combination.
     * @return The code string, empty if no flag is set.
     */
    public String codify(long combination) {
        List<String> codes = new ArrayList<>();
        for (FlagCategory category : flagTable.categories()) {
            for (Flag flag : category.flags()) {
                if (flag.isSetIn(combination)) {
                    codes.add(Integer.toString(flag.code()));
                }
            }
        }
        return String.join(CODE_SEPARATOR, codes);
    }
}
