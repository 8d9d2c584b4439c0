package org.ansimark.markup.flags;

import java.util.List;

/**
 * An ordered group of flags, e.g. all foreground colors.
 *
 * @param name The category name.
 * @param flags The flags in rendering order.
 */
public record FlagCategory(String name, List<Flag> flags) {

    public FlagCategory {
        flags = List.copyOf(flags);
    }
}
