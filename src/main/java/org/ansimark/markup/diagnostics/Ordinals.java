package org.ansimark.markup.diagnostics;

/**
 * Spoken-word ordinals for error messages, e.g. 1 -> "a 1st", 11 -> "an 11th".
 */
public final class Ordinals {

    private Ordinals() {}

    /**
     * Gets the ordinal of a number, including the indefinite article.
     *
     * @param number A non-negative number.
     * @return The ordinal with article, e.g. "a 2nd", "an 8th", "an 18th".
     */
    public static String withArticle(int number) {
        return article(number) + " " + ordinal(number);
    }

    /**
     * Gets the ordinal of a number without an article, e.g. "3rd" or "112th".
     *
     * @param number A non-negative number.
     * @return The ordinal.
     */
    public static String ordinal(int number) {
        int lastTwo = number % 100;
        String suffix;
        if (lastTwo >= 11 && lastTwo <= 13) {
            suffix = "th";
        } else {
            suffix = switch (number % 10) {
                case 1 -> "st";
                case 2 -> "nd";
                case 3 -> "rd";
                default -> "th";
            };
        }
        return number + suffix;
    }

    // "an" when the spoken number starts with a vowel sound: eight..., eleven..., eighteen...
    private static String article(int number) {
        String digits = Integer.toString(number);
        if (digits.startsWith("8")) {
            return "an";
        }
        int leadingGroup = digits.length() % 3;
        if (leadingGroup == 2 && digits.startsWith("11")) {
            return "an";
        }
        if (leadingGroup == 2 && digits.startsWith("18")) {
            return "an";
        }
        return "a";
    }
}
