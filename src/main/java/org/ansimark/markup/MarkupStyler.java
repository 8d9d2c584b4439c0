package org.ansimark.markup;

import com.typesafe.config.Config;
import org.ansimark.markup.api.FlagException;
import org.ansimark.markup.api.IMarkupStyler;
import org.ansimark.markup.api.MarkupException;
import org.ansimark.markup.backend.emit.Renderer;
import org.ansimark.markup.backend.resolve.RenderContext;
import org.ansimark.markup.backend.resolve.StyleResolver;
import org.ansimark.markup.config.StyleConfigLoader;
import org.ansimark.markup.config.StyleSpec;
import org.ansimark.markup.config.StyleTables;
import org.ansimark.markup.diagnostics.DiagnosticsEngine;
import org.ansimark.markup.flags.FlagTable;
import org.ansimark.markup.frontend.parser.ParseResult;
import org.ansimark.markup.frontend.parser.PhraseTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * The main styler implementation. This class orchestrates the pipeline from markup to styled
 * text: phrase tree building, style resolution and rendering.
 * <p>
 * The style tables are fixed at construction; everything that changes during a render call lives
 * in a {@link RenderContext} created for that call, so one instance can be reused freely.
 */
public class MarkupStyler implements IMarkupStyler {

    private static final Logger LOG = LoggerFactory.getLogger(MarkupStyler.class);

    private final StyleTables styleTables;
    private final StyleResolver resolver;
    private final Renderer renderer = new Renderer();

    /**
     * Creates a styler.
     *
     * @param flagTable The flags that can be rendered.
     * @param styleTables The validated positional and always-styles.
     */
    public MarkupStyler(FlagTable flagTable, StyleTables styleTables) {
        this.styleTables = styleTables;
        this.resolver = new StyleResolver(flagTable);
    }

    /**
     * Creates a styler for the standard ANSI flags.
     *
     * @param specs The style specs, flattened in order.
     * @return The styler.
     * @throws FlagException if a combination is out of range.
     */
    public static MarkupStyler of(StyleSpec... specs) throws FlagException {
        return new MarkupStyler(FlagTable.ansi(), StyleTables.flatten(FlagTable.ansi(), Arrays.asList(specs)));
    }

    /**
     * Creates a styler for the standard ANSI flags from the {@code styles} section of a configuration.
     *
     * @param config The configuration.
     * @return The styler.
     * @throws FlagException if a flag name is unknown or a combination out of range.
     */
    public static MarkupStyler fromConfig(Config config) throws FlagException {
        return new MarkupStyler(FlagTable.ansi(), StyleConfigLoader.loadTables(config, FlagTable.ansi()));
    }

    /**
     * Styles markup in one step.
     *
     * @param markup The markup.
     * @param specs The style specs.
     * @return The styled text.
     * @throws MarkupException if the specs are invalid or the markup cannot be rendered with them.
     */
    public static String beautify(String markup, StyleSpec... specs) throws MarkupException {
        return of(specs).render(markup);
    }

    @Override
    public String render(String markup) throws MarkupException {
        return render(markup, new DiagnosticsEngine());
    }

    @Override
    public String render(String markup, DiagnosticsEngine diagnostics) throws MarkupException {
        PhraseTreeBuilder builder = new PhraseTreeBuilder(diagnostics);
        ParseResult parsed = builder.build(markup);
        if (parsed.phrases().isEmpty()) {
            return parsed.text();
        }

        RenderContext context = new RenderContext(styleTables);
        resolver.resolveAll(parsed.phrases(), context);
        LOG.debug("Resolved {} phrases, {} of {} positional styles consumed in order",
                parsed.phraseCount(), context.getSequentialCounter(), context.positionalCount());

        return renderer.render(parsed.text(), parsed.phrases());
    }
}
