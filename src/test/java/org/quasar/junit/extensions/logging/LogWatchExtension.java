package org.quasar.junit.extensions.logging;

import ch.qos.logback.classic.Level;
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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test that logs at or above WARN (configurable through {@link FailOnLog}) unless the
 * event is announced with {@link AllowLog} or {@link ExpectLog}. Expected events that never
 * occur fail the test as well. Announced events are kept out of the console output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            events.stream()
                    .filter(e -> e.level.isGreaterOrEqual(rules.minLevel))
                    .filter(e -> rules.allows.stream().noneMatch(m -> m.matches(e))
                            && rules.expects.stream().noneMatch(m -> m.matches(e)))
                    .forEach(e -> problems.add("Unexpected log: " + e));
        }
        for (Matcher expected : rules.expects) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add(String.format("Expected %d x %s, but found %d.", expected.occurrences, expected, count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    /**
     * Method-level annotations are combined with the class-level ones; a method-level
     * {@link FailOnLog} replaces the class-level one.
     */
    private static Rules resolveRules(ExtensionContext context) {
        List<AnnotatedElement> scopes = new ArrayList<>();
        context.getTestClass().ifPresent(scopes::add);
        context.getTestMethod().ifPresent(scopes::add);

        FailOnLog fail = null;
        List<Matcher> allows = new ArrayList<>();
        List<Matcher> expects = new ArrayList<>();
        for (AnnotatedElement scope : scopes) {
            FailOnLog scoped = scope.getAnnotation(FailOnLog.class);
            if (scoped != null) {
                fail = scoped;
            }
            Arrays.stream(scope.getAnnotationsByType(AllowLog.class))
                    .map(a -> new Matcher(toLogback(a.level()), a.loggerPattern(), a.messagePattern(), 0))
                    .forEach(allows::add);
            Arrays.stream(scope.getAnnotationsByType(ExpectLog.class))
                    .map(e -> new Matcher(toLogback(e.level()), e.loggerPattern(), e.messagePattern(), e.occurrences()))
                    .forEach(expects::add);
        }
        Level minLevel = toLogback(fail != null ? fail.level() : LogLevel.WARN);
        return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Matcher(Level level, String loggerPattern, String messagePattern, int occurrences) {
        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                    && Pattern.matches(loggerPattern, event.loggerName)
                    && Pattern.matches(messagePattern, event.message);
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, loggerPattern, messagePattern);
        }
    }

    private record Rules(Level minLevel, boolean disabled, List<Matcher> allows, List<Matcher> expects) {
        Stream<Matcher> announced() {
            return Stream.concat(allows.stream(), expects.stream());
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(current.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.announced().anyMatch(m -> m.matches(event)) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
