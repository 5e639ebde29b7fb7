package org.javai.sparql.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Log4j2 appender that records the events of one logger while open.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender captor = LogCaptorAppender.capture(LexicalRulesParser.class)) {
 *     parser.parseString(yaml);
 *     assertThat(captor.messagesAt(Level.DEBUG)).anyMatch(m -&gt; m.contains("Parsed"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final boolean addedLoggerConfig;
	private final Level previousLevel;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig loggerConfig, boolean addedLoggerConfig,
			Level previousLevel) {
		super("captor-" + loggerConfig.getName() + "-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.addedLoggerConfig = addedLoggerConfig;
		this.previousLevel = previousLevel;
	}

	/**
	 * Captures everything the logger of {@code loggerClass} logs at DEBUG and above.
	 */
	public static LogCaptorAppender capture(Class<?> loggerClass) {
		return capture(loggerClass, Level.DEBUG);
	}

	public static LogCaptorAppender capture(Class<?> loggerClass, Level level) {
		String name = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();

		LoggerConfig config = configuration.getLoggerConfig(name);
		boolean added = !config.getName().equals(name);
		if (added) {
			config = new LoggerConfig(name, level, true);
			configuration.addLogger(name, config);
		}
		Level previous = config.getLevel();
		config.setLevel(level);

		LogCaptorAppender captor = new LogCaptorAppender(context, config, added, previous);
		captor.start();
		config.addAppender(captor, level, null);
		context.updateLoggers();
		return captor;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<String> messages() {
		return events.stream()
				.map(event -> event.getMessage().getFormattedMessage())
				.toList();
	}

	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(event -> event.getLevel().equals(level))
				.map(event -> event.getMessage().getFormattedMessage())
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
	}
}
