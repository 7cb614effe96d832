package org.pragmatica.ebnf.testsupport;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Log4j2 appender that captures the events of one logger for assertions.
 *
 * <pre>{@code
 * try (var appender = LogCaptorAppender.create(GrammarValidator.class, Level.DEBUG)) {
 *     GrammarValidator.validate(grammar);
 *     assertThat(appender.messages()).anyMatch(msg -> msg.contains("valid"));
 * }
 * }</pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

    private final LoggerContext context;
    private final LoggerConfig loggerConfig;
    private final Level previousLevel;
    private final List<LogEvent> events = new CopyOnWriteArrayList<>();

    private LogCaptorAppender(String name, LoggerContext context, LoggerConfig loggerConfig, Level previousLevel) {
        super(name,
              null,
              PatternLayout.newBuilder()
                           .withPattern(PatternLayout.SIMPLE_CONVERSION_PATTERN)
                           .build(),
              false,
              Property.EMPTY_ARRAY);
        this.context = context;
        this.loggerConfig = loggerConfig;
        this.previousLevel = previousLevel;
    }

    public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
        var loggerName = loggerClass.getName();
        var context = (LoggerContext) LogManager.getContext(false);
        var configuration = context.getConfiguration();
        var loggerConfig = configuration.getLoggerConfig(loggerName);

        if (!loggerConfig.getName()
                         .equals(loggerName)) {
            var childConfig = new LoggerConfig(loggerName, level, true);
            configuration.addLogger(loggerName, childConfig);
            loggerConfig = childConfig;
        }

        var previousLevel = loggerConfig.getLevel();
        loggerConfig.setLevel(level);

        var appender = new LogCaptorAppender("LogCaptor-" + System.nanoTime(), context, loggerConfig, previousLevel);
        appender.start();
        loggerConfig.addAppender(appender, level, null);
        context.updateLoggers();
        return appender;
    }

    @Override
    public void append(LogEvent event) {
        events.add(event.toImmutable());
    }

    public List<String> messages() {
        return events.stream()
                     .map(event -> event.getMessage()
                                        .getFormattedMessage())
                     .toList();
    }

    public List<Level> levels() {
        return events.stream()
                     .map(LogEvent::getLevel)
                     .toList();
    }

    @Override
    public void close() {
        stop();
        loggerConfig.removeAppender(getName());
        loggerConfig.setLevel(previousLevel);
        context.updateLoggers();
        events.clear();
    }
}
