package org.ansimark.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above without declaring it, or when a log declared with
 * {@link ExpectLog} does not show up. Logs matched by {@link AllowLog} or {@link ExpectLog} are
 * swallowed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.of(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : filter.events) {
                if (event.level.isGreaterOrEqual(rules.failLevel) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long seen = filter.events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (seen < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), seen));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.logger)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private static final class Rules {
        final Level failLevel;
        final boolean disabled;
        final List<AllowLog> allows = new ArrayList<>();
        final List<ExpectLog> expects = new ArrayList<>();

        private Rules(FailOnLog failOnLog) {
            this.failLevel = toLogback(failOnLog != null ? failOnLog.level() : LogLevel.WARN);
            this.disabled = failOnLog != null && failOnLog.disabled();
        }

        static Rules of(ExtensionContext context) {
            FailOnLog fail = context.getTestMethod().map(m -> m.getAnnotation(FailOnLog.class))
                    .orElseGet(() -> context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            Rules rules = new Rules(fail);
            context.getTestClass().ifPresent(rules::collect);
            context.getTestMethod().ifPresent(rules::collect);
            return rules;
        }

        private void collect(AnnotatedElement element) {
            allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
        }

        boolean permits(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        final Rules rules;
        final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // format is null for isXxxEnabled() probes, which are not log events
            if (format == null || level == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message);
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
