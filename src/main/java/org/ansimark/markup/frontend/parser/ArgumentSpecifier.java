package org.ansimark.markup.frontend.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A positional-argument specifier such as {@code 0,2!}: comma-separated indices with an
 * optional trailing override marker.
 *
 * @param indices The positional style indices, in the order given.
 * @param override Whether the indices replace, rather than merge with, an always-style.
 */
public record ArgumentSpecifier(List<Integer> indices, boolean override) {

    /** The override marker. */
    public static final char OVERRIDE = '!';

    // Negative indices are accepted here and rejected during style resolution.
    private static final Pattern PATTERN = Pattern.compile("^-?\\d+(,-?\\d+)*!?$");

    public ArgumentSpecifier {
        indices = List.copyOf(indices);
    }

    /**
     * Parses the content of a tag as an argument specifier.
     *
     * @param content The text between an opening and a closing marker.
     * @return The specifier, or empty if the content is ordinary text.
     */
    public static Optional<ArgumentSpecifier> parse(String content) {
        if (!PATTERN.matcher(content).matches()) {
            return Optional.empty();
        }
        boolean override = content.charAt(content.length() - 1) == OVERRIDE;
        String list = override ? content.substring(0, content.length() - 1) : content;
        List<Integer> indices = new ArrayList<>();
        for (String part : list.split(",")) {
            try {
                indices.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                // Too many digits for an int: no style table is that large, treat it as text.
                return Optional.empty();
            }
        }
        return Optional.of(new ArgumentSpecifier(indices, override));
    }
}
