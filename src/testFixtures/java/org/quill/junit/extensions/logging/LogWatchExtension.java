package org.quill.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is allowed by {@link AllowLog}
 * or expected by {@link ExpectLog}; fails it as well if an expected event never shows up.
 * <p>
 * Class-level annotations apply to every test and are combined with method-level ones.
 * Allowed and expected events are kept out of the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = filter(context);
        if (filter != null) {
            filter.clearEvents();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = filter.capturedEvents();
        filter.clearEvents();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled()) {
            for (CapturedEvent event : events) {
                if (event.level().isGreaterOrEqual(rules.failLevel()) && !rules.permits(event)) {
                    unexpected.add(event.toString());
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (LogRule expected : rules.expected()) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences()) {
                missing.add(String.format("Expected %d x %s, but found %d.", expected.occurrences(), expected, count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            appendSection(sb, "Unexpected logs:", unexpected);
            appendSection(sb, "Missing expected logs:", missing);
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, WatchFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static void appendSection(StringBuilder sb, String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        sb.append(title).append('\n');
        lines.forEach(line -> sb.append("  ").append(line).append('\n'));
    }

    private static WatchFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, WatchFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        Optional<Class<?>> testClass = context.getTestClass();
        Optional<AnnotatedElement> element = context.getElement();

        FailOnLog fail = element.map(el -> el.getAnnotation(FailOnLog.class))
                .or(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)))
                .orElse(null);

        List<LogRule> allowed = new ArrayList<>();
        List<LogRule> expected = new ArrayList<>();
        List<AnnotatedElement> sources = new ArrayList<>();
        testClass.ifPresent(sources::add);
        element.filter(el -> !testClass.map(el::equals).orElse(false)).ifPresent(sources::add);
        for (AnnotatedElement source : sources) {
            for (AllowLog allow : source.getAnnotationsByType(AllowLog.class)) {
                allowed.add(new LogRule(toLogback(allow.level()), allow.loggerPattern(), allow.messagePattern(), 0));
            }
            for (ExpectLog expect : source.getAnnotationsByType(ExpectLog.class)) {
                expected.add(new LogRule(toLogback(expect.level()), expect.loggerPattern(), expect.messagePattern(), expect.occurrences()));
            }
        }

        Level failLevel = toLogback(fail != null ? fail.level() : LogLevel.WARN);
        return new Rules(failLevel, fail != null && fail.disabled(), List.copyOf(allowed), List.copyOf(expected));
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record LogRule(Level level, String loggerPattern, String messagePattern, int occurrences) {

        boolean matches(CapturedEvent event) {
            return event.level().isGreaterOrEqual(level)
                    && Pattern.matches(loggerPattern, event.loggerName())
                    && Pattern.matches(messagePattern, event.message());
        }

        @Override
        public String toString() {
            return "[" + level + "] logger=\"" + loggerPattern + "\" message=\"" + messagePattern + "\"";
        }
    }

    private record Rules(Level failLevel, boolean disabled, List<LogRule> allowed, List<LogRule> expected) {

        Level captureLevel() {
            Level lowest = failLevel;
            for (LogRule rule : expected) {
                if (!rule.level().isGreaterOrEqual(lowest)) {
                    lowest = rule.level();
                }
            }
            return lowest;
        }

        boolean permits(CapturedEvent event) {
            return allowed.stream().anyMatch(rule -> rule.matches(event))
                    || expected.stream().anyMatch(rule -> rule.matches(event));
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class WatchFilter extends TurboFilter {

        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Called with a null format for isXxxEnabled() checks; those are not events.
            if (format == null) {
                return FilterReply.NEUTRAL;
            }
            Rules current = rules;
            if (!level.isGreaterOrEqual(current.captureLevel())) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> capturedEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }
}
