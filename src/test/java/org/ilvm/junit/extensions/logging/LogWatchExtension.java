package org.ilvm.junit.extensions.logging;

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
 * Fails a test on WARN or ERROR logs it did not declare, and on declared
 * {@link ExpectLog} events that never happened. Declared events are kept off the console.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = resolveRules(context);
        CapturingTurboFilter filter = new CapturingTurboFilter(rules);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingTurboFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (!filter.rules.isDeclared(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expect : filter.rules.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        context.getTestMethod().ifPresent(m -> {
            allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(m.getAnnotationsByType(ExpectLog.class)));
        });
        return new Rules(allows, expects);
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rules(List<AllowLog> allows, List<ExpectLog> expects) {
        boolean isDeclared(CapturedEvent event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static class CapturingTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private final Rules rules;

        CapturingTurboFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.WARN)) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            CapturedEvent event = new CapturedEvent(logger.getName(), level, message != null ? message : "");
            events.add(event);
            return rules.isDeclared(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
