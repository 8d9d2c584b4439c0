package org.ansimark.markup.flags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The universe of style flags a styler can render: an ordered list of categories, each holding
 * flags with unique bits and unique codes. The declared order is the order in which codes
 * are written, so it is part of the output format.
 */
public final class FlagTable {

    private static final FlagTable ANSI = createAnsi();

    private final List<FlagCategory> categories;
    private final Map<String, Flag> flagsByName = new HashMap<>();
    private final long limit;

    /**
     * Creates a flag table.
     *
     * @param categories The categories in rendering order.
     * @throws IllegalArgumentException if a bit is not a single bit, or a bit, code or name is used twice.
     */
    public FlagTable(List<FlagCategory> categories) {
        this.categories = List.copyOf(categories);

        Set<Long> bits = new HashSet<>();
        Set<Integer> codes = new HashSet<>();
        long highest = 0;
        for (FlagCategory category : this.categories) {
            for (Flag flag : category.flags()) {
                if (Long.bitCount(flag.bit()) != 1 || flag.bit() < 0) {
                    throw new IllegalArgumentException("Flag '" + flag.name() + "' must own exactly one non-sign bit");
                }
                if (!bits.add(flag.bit())) {
                    throw new IllegalArgumentException("Duplicate bit for flag '" + flag.name() + "'");
                }
                if (!codes.add(flag.code())) {
                    throw new IllegalArgumentException("Duplicate code " + flag.code() + " for flag '" + flag.name() + "'");
                }
                if (flagsByName.put(normalize(flag.name()), flag) != null) {
                    throw new IllegalArgumentException("Duplicate flag name '" + flag.name() + "'");
                }
                highest = Math.max(highest, flag.bit());
            }
        }
        this.limit = highest << 1;
    }

    /**
     * @return The table of standard ANSI styles built from {@link AnsiFlag}.
     */
    public static FlagTable ansi() {
        return ANSI;
    }

    private static FlagTable createAnsi() {
        List<FlagCategory> categories = new ArrayList<>();
        for (AnsiFlag.Category category : AnsiFlag.Category.values()) {
            List<Flag> flags = new ArrayList<>();
            for (AnsiFlag flag : AnsiFlag.values()) {
                if (flag.category() == category) {
                    flags.add(flag.toFlag());
                }
            }
            categories.add(new FlagCategory(category.name(), flags));
        }
        return new FlagTable(categories);
    }

    /**
     * @return The categories in rendering order.
     */
    public List<FlagCategory> categories() {
        return Collections.unmodifiableList(categories);
    }

    /**
     * @return The exclusive upper bound of valid flag combinations, to be read as unsigned:
     *         a table owning bit 62 has the bound 2^63.
     */
    public long limit() {
        return limit;
    }

    /**
     * @param combination A flag combination.
     * @return {@code true} if the combination lies within {@code [0, limit)}.
     */
    public boolean isInRange(long combination) {
        return combination >= 0 && Long.compareUnsigned(combination, limit) < 0;
    }

    /**
     * Looks up a flag by name, ignoring case and treating '-' like '_'.
     *
     * @param name The flag name.
     * @return The flag, if the table has one with this name.
     */
    public Optional<Flag> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(flagsByName.get(normalize(name)));
    }

    private static String normalize(String name) {
        return name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
