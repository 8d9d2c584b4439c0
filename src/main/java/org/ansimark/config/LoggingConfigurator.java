package org.ansimark.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"          # "PLAIN" or "JSON", defaults to PLAIN
 *   default-level = "WARN"    # level of the root logger
 *   levels {
 *     "org.ansimark.markup.diagnostics.DiagnosticsEngine" = "ERROR"   # e.g. silence markup warnings
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String FORMAT_PROPERTY = "ansimark.logging.format";
    static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    static final String JSON_APPENDER = "STDOUT";
    private static final String PLAIN_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Private constructor to prevent instantiation
    }

    /**
     * Configures Logback from the given configuration. Only the first call has an effect
     * until {@link #reset()} is called.
     *
     * @param config The application configuration containing logging settings.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        final boolean json = logging.hasPath("format") && "JSON".equalsIgnoreCase(logging.getString("format"));
        installConsoleAppender(context, root, json);

        if (logging.hasPath("default-level")) {
            root.setLevel(Level.toLevel(logging.getString("default-level"), Level.WARN));
        }

        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
        LOGGER.debug("Logging configured: format={}, root level={}", json ? "JSON" : "PLAIN", root.getLevel());
    }

    private static void installConsoleAppender(final LoggerContext context, final Logger root, final boolean json) {
        final String name = json ? JSON_APPENDER : PLAIN_APPENDER;
        context.putProperty(FORMAT_PROPERTY, name);
        if (root.getAppender(name) != null) {
            return;
        }

        final Encoder<ILoggingEvent> encoder;
        if (json) {
            final JsonEncoder jsonEncoder = new JsonEncoder();
            jsonEncoder.setContext(context);
            jsonEncoder.start();
            encoder = jsonEncoder;
        } else {
            final PatternLayoutEncoder patternEncoder = new PatternLayoutEncoder();
            patternEncoder.setContext(context);
            patternEncoder.setPattern(PLAIN_PATTERN);
            patternEncoder.start();
            encoder = patternEncoder;
        }

        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setName(name);
        appender.setContext(context);
        appender.setEncoder(encoder);
        appender.start();

        root.detachAppender(json ? PLAIN_APPENDER : JSON_APPENDER);
        root.addAppender(appender);
    }

    /**
     * Forgets that logging was configured, so the next {@link #configure(Config)} applies again.
     * Meant for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
