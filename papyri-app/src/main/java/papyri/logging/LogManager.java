/*-
 * #%L
 * This file is part of Papyri.
 * %%
 * Copyright (C) 2023 - 2024 Papyri developers
 * %%
 * Papyri is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Papyri is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Papyri.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package papyri.logging;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Control the root log level, and optionally log to a file.
 * <p>
 * This requires Logback to be the SLF4J backend; otherwise requests are logged and ignored.
 *
 * @author Papyri developers
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	/**
	 * Log levels that may be requested.
	 */
	public static enum LogLevel {
		TRACE,
		DEBUG,
		INFO,
		WARN,
		ERROR,
		ALL,
		OFF;
	}

	private static LogLevel rootLevel = LogLevel.INFO;

	private LogManager() {
		throw new AssertionError();
	}

	static Level getLevel(LogLevel logLevel) {
		switch(logLevel) {
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case INFO:
			return Level.INFO;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		default:
			return Level.INFO;
		}
	}

	/**
	 * Set the level of the root logger.
	 * @param level
	 */
	public static synchronized void setRootLogLevel(LogLevel level) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot set log level without logback!");
			return;
		}
		root.setLevel(getLevel(level));
		rootLevel = level;
	}

	/**
	 * Get the last level set with {@link #setRootLogLevel(LogLevel)}.
	 * @return
	 */
	public static synchronized LogLevel getRootLogLevel() {
		return rootLevel;
	}

	/**
	 * Append all log messages to a file.
	 * @param file
	 * @return true if the file appender was added
	 */
	public static boolean logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to file without logback!");
			return false;
		}
		FileAppender<ILoggingEvent> appender = new FileAppender<>();

		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] [%-5level] %logger{36} - %msg%n");
		encoder.start();

		appender.setFile(file.getAbsolutePath());
		appender.setContext(context);
		appender.setEncoder(encoder);
		appender.setName(file.getName());
		appender.start();
		context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
		return true;
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		} else
			return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
