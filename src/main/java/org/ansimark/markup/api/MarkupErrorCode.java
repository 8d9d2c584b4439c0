package org.ansimark.markup.api;

/**
 * Defines unique, testable error codes for all errors that can occur while styling markup.
 * This decouples the test logic from the wording of error messages.
 */
public enum MarkupErrorCode {
    // region Configuration Errors
    /** A flag or flag combination lies outside the range of the flag table. */
    FLAG_OUT_OF_RANGE,
    /** A flag name in a configuration file does not exist in the flag table. */
    UNKNOWN_FLAG,
    // endregion

    // region Parser Errors
    /** An opening tag was never closed before the end of the input. */
    MISSING_CLOSING_TAG,
    // endregion

    // region Style Resolution Errors
    /** An index in an argument specifier does not name a positional style. */
    ARGUMENT_OUT_OF_RANGE,
    /** A phrase requested the next positional style but all were already consumed. */
    POSITIONAL_STYLES_EXHAUSTED
    // endregion
}
