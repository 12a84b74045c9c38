package org.javai.contextplatform.testsupport;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Log4j2 appender that records the events of one logger for assertions.
 *
 * <pre>
 * try (LogCapture logs = LogCapture.of(QueueingTelemetryCollector.class)) {
 *     collector.record(...);
 *     assertThat(logs.warnings()).anyMatch(msg -> msg.contains("dropped"));
 * }
 * </pre>
 */
public final class LogCapture extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final boolean addedLoggerConfig;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCapture(LoggerContext context, LoggerConfig loggerConfig, Level previousLevel, boolean addedLoggerConfig,
			Layout<? extends Serializable> layout) {
		super("LogCapture-" + System.nanoTime(), null, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
		this.addedLoggerConfig = addedLoggerConfig;
	}

	public static LogCapture of(Class<?> loggerClass) {
		return of(loggerClass, Level.DEBUG);
	}

	public static LogCapture of(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);
		boolean added = false;
		if (!loggerConfig.getName().equals(loggerName)) {
			LoggerConfig own = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, own);
			loggerConfig = own;
			added = true;
		}
		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCapture capture = new LogCapture(context, loggerConfig, previousLevel, added,
				PatternLayout.newBuilder().withPattern(PatternLayout.SIMPLE_CONVERSION_PATTERN).build());
		capture.start();
		loggerConfig.addAppender(capture, level, null);
		context.updateLoggers();
		return capture;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	public List<String> warnings() {
		return events.stream()
				.filter(e -> e.getLevel().isMoreSpecificThan(Level.WARN))
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedLoggerConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		} else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
