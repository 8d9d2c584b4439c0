package org.ansimark.markup.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import org.ansimark.markup.api.FlagException;
import org.ansimark.markup.api.MarkupErrorCode;
import org.ansimark.markup.flags.Flag;
import org.ansimark.markup.flags.FlagTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads style tables from HOCON configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * styles {
 *   # Strings are '|'-separated flag names, numbers raw combinations, lists nested sequences.
 *   positional = [ "BOLD|RED", [ "GREEN", "UNDERLINE" ], 5 ]
 *   always {
 *     "error" = "RED|BOLD"
 *     "ok|done" = "GREEN"   # one style for both "ok" and "done"
 *   }
 * }
 * </pre>
 */
public final class StyleConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(StyleConfigLoader.class);
    private static final String STYLES_PATH = "styles";
    private static final String POSITIONAL_KEY = "positional";
    private static final String ALWAYS_KEY = "always";
    private static final String SEPARATOR = "|";

    private StyleConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the style specs under {@code styles}. Missing sections yield no specs.
     *
     * @param config The application configuration.
     * @param table The flag table used to resolve flag names.
     * @return The specs, positional styles first, then the always-styles.
     * @throws FlagException if a flag name is unknown to the table.
     * @throws ConfigException.BadValue if a value has a type that cannot describe a style.
     */
    public static List<StyleSpec> load(final Config config, final FlagTable table) throws FlagException {
        final List<StyleSpec> specs = new ArrayList<>();
        if (!config.hasPath(STYLES_PATH)) {
            LOG.debug("No styles configured.");
            return specs;
        }

        final Config styles = config.getConfig(STYLES_PATH);
        if (styles.hasPath(POSITIONAL_KEY)) {
            final ConfigList positional = styles.getList(POSITIONAL_KEY);
            for (final ConfigValue value : positional) {
                specs.add(toSpec(value, table, STYLES_PATH + "." + POSITIONAL_KEY));
            }
        }
        if (styles.hasPath(ALWAYS_KEY)) {
            specs.add(toNamed(styles.getObject(ALWAYS_KEY), table, STYLES_PATH + "." + ALWAYS_KEY));
        }

        LOG.debug("Loaded {} style specs from configuration.", specs.size());
        return specs;
    }

    /**
     * Loads and flattens the styles under {@code styles} in one step.
     *
     * @param config The application configuration.
     * @param table The flag table.
     * @return The validated style tables.
     * @throws FlagException if a flag name is unknown or a combination out of range.
     */
    public static StyleTables loadTables(final Config config, final FlagTable table) throws FlagException {
        return StyleTables.flatten(table, load(config, table));
    }

    private static StyleSpec toSpec(final ConfigValue value, final FlagTable table, final String path) throws FlagException {
        switch (value.valueType()) {
            case STRING:
                return new StyleSpec.Combination(parseFlags((String) value.unwrapped(), table));
            case NUMBER:
                return new StyleSpec.Combination(toWholeNumber(value, path));
            case LIST:
                final List<StyleSpec> elements = new ArrayList<>();
                for (final ConfigValue element : (ConfigList) value) {
                    elements.add(toSpec(element, table, path));
                }
                return new StyleSpec.Sequence(elements);
            case OBJECT:
                return toNamed((ConfigObject) value, table, path);
            default:
                throw new ConfigException.BadValue(value.origin(), path,
                        "Expected a flag name, a flag combination, a list or an object but got " + value.valueType());
        }
    }

    private static long toWholeNumber(final ConfigValue value, final String path) {
        final Object number = value.unwrapped();
        if (number instanceof Integer || number instanceof Long) {
            return ((Number) number).longValue();
        }
        throw new ConfigException.BadValue(value.origin(), path,
                "Expected a whole flag combination but got " + number);
    }

    private static StyleSpec.Named toNamed(final ConfigObject object, final FlagTable table, final String path) throws FlagException {
        final Map<List<String>, Long> entries = new LinkedHashMap<>();
        for (final Map.Entry<String, ConfigValue> entry : object.entrySet()) {
            final List<String> texts = Arrays.asList(entry.getKey().split("\\|", -1));
            entries.put(texts, toCombination(entry.getValue(), table, path + "." + entry.getKey()));
        }
        return new StyleSpec.Named(entries);
    }

    private static long toCombination(final ConfigValue value, final FlagTable table, final String path) throws FlagException {
        switch (value.valueType()) {
            case STRING:
                return parseFlags((String) value.unwrapped(), table);
            case NUMBER:
                return toWholeNumber(value, path);
            case LIST:
                long combination = 0;
                for (final ConfigValue element : (ConfigList) value) {
                    combination |= toCombination(element, table, path);
                }
                return combination;
            default:
                throw new ConfigException.BadValue(value.origin(), path,
                        "Expected a flag name, a flag combination or a list of them but got " + value.valueType());
        }
    }

    private static long parseFlags(final String names, final FlagTable table) throws FlagException {
        long combination = 0;
        for (final String name : names.split(java.util.regex.Pattern.quote(SEPARATOR))) {
            if (name.isBlank()) continue;
            final Flag flag = table.find(name).orElseThrow(() -> new FlagException(MarkupErrorCode.UNKNOWN_FLAG,
                    "Unknown flag '" + name.trim() + "' in '" + names + "'"));
            combination |= flag.bit();
        }
        return combination;
    }
}
