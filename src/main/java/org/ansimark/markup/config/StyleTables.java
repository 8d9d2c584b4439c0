package org.ansimark.markup.config;

import org.ansimark.markup.api.FlagException;
import org.ansimark.markup.api.MarkupErrorCode;
import org.ansimark.markup.flags.FlagTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The two validated tables every render call draws its styles from.
 *
 * @param positional Styles consumed by argument index or in order of appearance.
 * @param always Styles bound to literal phrase texts.
 */
public record StyleTables(List<Long> positional, Map<String, Long> always) {

    public StyleTables {
        positional = List.copyOf(positional);
        always = Collections.unmodifiableMap(new HashMap<>(always));
    }

    /**
     * Validates and flattens style specs.
     *
     * @param table The flag table defining the valid range.
     * @param specs The positional specs, possibly nested and possibly containing always-styles.
     * @return The flattened tables.
     * @throws FlagException if a combination lies outside the table's range.
     */
    public static StyleTables flatten(FlagTable table, List<StyleSpec> specs) throws FlagException {
        return flatten(table, specs, Map.of());
    }

    /**
     * Validates and flattens style specs plus a map of always-styles. Entries of the map are
     * applied after the specs, so they win over always-styles given inside the specs.
     *
     * @param table The flag table defining the valid range.
     * @param specs The positional specs.
     * @param always Additional always-styles by phrase text.
     * @return The flattened tables.
     * @throws FlagException if a combination lies outside the table's range.
     */
    public static StyleTables flatten(FlagTable table, List<StyleSpec> specs, Map<String, Long> always) throws FlagException {
        List<Long> positional = new ArrayList<>();
        Map<String, Long> alwaysTable = new HashMap<>();
        for (StyleSpec spec : specs) {
            collect(table, spec, positional, alwaysTable);
        }
        for (Map.Entry<String, Long> entry : always.entrySet()) {
            alwaysTable.put(entry.getKey(), checkRange(table, entry.getValue()));
        }
        return new StyleTables(positional, alwaysTable);
    }

    private static void collect(FlagTable table, StyleSpec spec, List<Long> positional, Map<String, Long> always) throws FlagException {
        if (spec instanceof StyleSpec.Single single) {
            positional.add(checkRange(table, single.flag().bit()));
        } else if (spec instanceof StyleSpec.Combination combination) {
            positional.add(checkRange(table, combination.value()));
        } else if (spec instanceof StyleSpec.Named named) {
            for (Map.Entry<List<String>, Long> entry : named.entries().entrySet()) {
                long value = checkRange(table, entry.getValue());
                for (String text : entry.getKey()) {
                    always.put(text, value);
                }
            }
        } else if (spec instanceof StyleSpec.Sequence sequence) {
            for (StyleSpec element : sequence.elements()) {
                collect(table, element, positional, always);
            }
        }
    }

    private static long checkRange(FlagTable table, long combination) throws FlagException {
        if (!table.isInRange(combination)) {
            throw new FlagException(MarkupErrorCode.FLAG_OUT_OF_RANGE,
                    String.format("Flag value '%d' is out of range [0, %s)!", combination, Long.toUnsignedString(table.limit())));
        }
        return combination;
    }
}
