package org.stagecraft.junit.logging;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is declared with {@link ExpectLog}.
 * Declared events that never occur fail the test as well.
 * <p>
 * Events are captured with a Logback turbo filter, so log calls on pool threads are seen too.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(expectations(context));
        filter.start();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        ((LoggerContext) LoggerFactory.getILoggerFactory()).getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (filter.expected(event) == null) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expectation : filter.expectations) {
            long count = filter.events.stream().filter(e -> matches(e, expectation)).count();
            if (count < expectation.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expectation.occurrences(), expectation.level(), expectation.loggerPattern(),
                        expectation.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static List<ExpectLog> expectations(ExtensionContext context) {
        List<ExpectLog> result = new ArrayList<>();
        context.getTestClass().ifPresent(c -> result.addAll(List.of(c.getAnnotationsByType(ExpectLog.class))));
        context.getTestMethod().ifPresent(m -> result.addAll(List.of(m.getAnnotationsByType(ExpectLog.class))));
        return result;
    }

    private static boolean matches(CapturedEvent event, ExpectLog expectation) {
        return event.level.isGreaterOrEqual(toLogback(expectation.level()))
                && Pattern.matches(expectation.loggerPattern(), event.loggerName)
                && Pattern.matches(expectation.messagePattern(), event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<ExpectLog> expectations;
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        CapturingFilter(List<ExpectLog> expectations) {
            this.expectations = expectations;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.WARN)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return expected(event) != null ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        ExpectLog expected(CapturedEvent event) {
            for (ExpectLog expectation : expectations) {
                if (matches(event, expectation)) {
                    return expectation;
                }
            }
            return null;
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
