package org.ansimark.markup.flags;

/**
 * The standard ANSI text styles. Each constant owns one bit, so styles combine with
 * {@code |}: {@code AnsiFlag.BOLD.bit() | AnsiFlag.RED.bit()}.
 */
public enum AnsiFlag {
    // region Format
    BOLD(Category.FORMAT, 1),
    DIM(Category.FORMAT, 2),
    UNDERLINE(Category.FORMAT, 4),
    BLINK(Category.FORMAT, 5),
    INVERT(Category.FORMAT, 7),
    HIDDEN(Category.FORMAT, 8),
    // endregion

    // region Color
    DEFAULT(Category.COLOR, 39),
    BLACK(Category.COLOR, 30),
    RED(Category.COLOR, 31),
    GREEN(Category.COLOR, 32),
    YELLOW(Category.COLOR, 33),
    BLUE(Category.COLOR, 34),
    MAGENTA(Category.COLOR, 35),
    CYAN(Category.COLOR, 36),
    LIGHT_GRAY(Category.COLOR, 37),
    DARK_GRAY(Category.COLOR, 90),
    LIGHT_RED(Category.COLOR, 91),
    LIGHT_GREEN(Category.COLOR, 92),
    LIGHT_YELLOW(Category.COLOR, 93),
    LIGHT_BLUE(Category.COLOR, 94),
    LIGHT_MAGENTA(Category.COLOR, 95),
    LIGHT_CYAN(Category.COLOR, 96),
    WHITE(Category.COLOR, 97),
    // endregion

    // region Fill
    FILL_DEFAULT(Category.FILL, 49),
    FILL_BLACK(Category.FILL, 40),
    FILL_RED(Category.FILL, 41),
    FILL_GREEN(Category.FILL, 42),
    FILL_YELLOW(Category.FILL, 43),
    FILL_BLUE(Category.FILL, 44),
    FILL_MAGENTA(Category.FILL, 45),
    FILL_CYAN(Category.FILL, 46),
    FILL_LIGHT_GRAY(Category.FILL, 47),
    FILL_DARK_GRAY(Category.FILL, 100),
    FILL_LIGHT_RED(Category.FILL, 101),
    FILL_LIGHT_GREEN(Category.FILL, 102),
    FILL_LIGHT_YELLOW(Category.FILL, 103),
    FILL_LIGHT_BLUE(Category.FILL, 104),
    FILL_LIGHT_MAGENTA(Category.FILL, 105),
    FILL_LIGHT_CYAN(Category.FILL, 106),
    FILL_WHITE(Category.FILL, 107);
    // endregion

    /**
     * The categories of the standard table, in rendering order.
     */
    public enum Category {
        FORMAT,
        COLOR,
        FILL
    }

    private final Category category;
    private final int code;

    AnsiFlag(Category category, int code) {
        this.category = category;
        this.code = code;
    }

    public Category category() {
        return category;
    }

    public int code() {
        return code;
    }

    /**
     * @return The bit of this flag, unique across all categories.
     */
    public long bit() {
        return 1L << ordinal();
    }

    /**
     * @return This flag as an entry of a {@link FlagTable}.
     */
    public Flag toFlag() {
        return new Flag(name(), bit(), code);
    }
}
