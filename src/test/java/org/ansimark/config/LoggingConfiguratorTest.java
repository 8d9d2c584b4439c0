package org.ansimark.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.ansimark.junit.extensions.logging.ExpectLog;
import org.ansimark.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.ansimark.junit.extensions.logging.LogLevel.WARN;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class. The root logger's level and appenders are restored
 * after every test, since Logback state is shared across the whole test run.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    private final List<Appender<ILoggingEvent>> savedAppenders = new ArrayList<>();
    private Level savedRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        savedRootLevel = root.getLevel();
        root.iteratorForAppenders().forEachRemaining(savedAppenders::add);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        root.setLevel(savedRootLevel);
        final Iterator<Appender<ILoggingEvent>> iterator = root.iteratorForAppenders();
        final List<Appender<ILoggingEvent>> current = new ArrayList<>();
        iterator.forEachRemaining(current::add);
        for (final Appender<ILoggingEvent> appender : current) {
            if (!savedAppenders.contains(appender)) {
                root.detachAppender(appender);
                appender.stop();
            }
        }
        for (final Appender<ILoggingEvent> appender : savedAppenders) {
            if (root.getAppender(appender.getName()) == null) {
                root.addAppender(appender);
            }
        }
        context.getLogger("org.ansimark.test").setLevel(null);
    }

    @Test
    void configure_withPlainFormat_shouldUsePlainConsoleAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(LoggingConfigurator.PLAIN_APPENDER, context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertInstanceOf(ConsoleAppender.class, root.getAppender(LoggingConfigurator.PLAIN_APPENDER));
        assertNull(root.getAppender(LoggingConfigurator.JSON_APPENDER));
        assertEquals(Level.INFO, root.getLevel());
    }

    @Test
    void configure_withJsonFormat_shouldSwapToJsonAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "json"
              default-level = "INFO"
            }
            """);
        final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        final PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));

        try {
            // When
            LoggingConfigurator.configure(config);
            LoggerFactory.getLogger("test.json.format").info("Json test message");

            // Then
            assertEquals(LoggingConfigurator.JSON_APPENDER, context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
            assertNotNull(root.getAppender(LoggingConfigurator.JSON_APPENDER));
            assertNull(root.getAppender(LoggingConfigurator.PLAIN_APPENDER));

            final String output = outputStream.toString(StandardCharsets.UTF_8);
            assertTrue(output.contains("\"message\""), "Output should contain the JSON message field");
            assertTrue(output.contains("Json test message"), "Output should contain the test message");
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    void configure_withSpecificLoggerLevels_shouldSetLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.ansimark.test" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, root.getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.ansimark.test").getLevel());
        assertTrue(LoggerFactory.getLogger("org.ansimark.test.Child").isDebugEnabled());
    }

    @Test
    @ExpectLog(level = WARN,
               loggerPattern = "org.ansimark.config.LoggingConfigurator",
               messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.ansimark.test'")
    void configure_withUnknownLevel_shouldWarnAndSkipLogger() {
        final Config config = ConfigFactory.parseString("""
            logging.levels { "org.ansimark.test" = "LOUD" }
            """);

        LoggingConfigurator.configure(config);

        assertNull(context.getLogger("org.ansimark.test").getLevel());
    }

    @Test
    void configure_withoutLoggingConfig_shouldKeepLogbackDefaults() {
        final Config config = ConfigFactory.parseString("other.some-value = \"test\"");

        LoggingConfigurator.configure(config);

        assertEquals(savedRootLevel, root.getLevel());
    }

    @Test
    void configure_calledMultipleTimes_shouldOnlyApplyTheFirst() {
        // Given
        final Config first = ConfigFactory.parseString("logging.default-level = \"INFO\"");
        final Config second = ConfigFactory.parseString("logging.default-level = \"ERROR\"");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.INFO, root.getLevel());
    }
}
