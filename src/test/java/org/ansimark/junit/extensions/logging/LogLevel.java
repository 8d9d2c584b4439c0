package org.ansimark.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can watch.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
