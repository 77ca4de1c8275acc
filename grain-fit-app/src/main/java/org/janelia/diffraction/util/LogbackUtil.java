package org.janelia.diffraction.util;

import java.io.File;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tools for manipulating logback configuration from code
 * (analysis directory log files, quiet mode).
 *
 * @author Eric Trautman
 */
public class LogbackUtil {

    public static void setRootLogLevel(final Level rootLogLevel) {
        getContext().getLogger(ROOT_LOGGER_NAME).setLevel(rootLogLevel);
    }

    /**
     * Adds (or replaces) a root file appender that writes to the specified file, truncating any existing content.
     */
    public static void setRootFileAppender(final File logFile) {

        final LoggerContext loggerContext = getContext();
        final Logger rootLogger = loggerContext.getLogger(ROOT_LOGGER_NAME);

        // detach previous file appender if it already exists
        final FileAppender<ILoggingEvent> previousAppender =
                (FileAppender<ILoggingEvent>) rootLogger.getAppender(ROOT_FILE_APPENDER_NAME);
        if (previousAppender != null) {
            rootLogger.detachAppender(previousAppender);
            previousAppender.stop();
        }

        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        final FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName(ROOT_FILE_APPENDER_NAME);
        fileAppender.setFile(logFile.getAbsolutePath());
        fileAppender.setAppend(false);
        fileAppender.setEncoder(encoder);
        fileAppender.setContext(loggerContext);
        fileAppender.start();

        rootLogger.addAppender(fileAppender);
    }

    /**
     * Flushes and removes the root file appender (if one was added).
     */
    public static void removeRootFileAppender() {
        final Logger rootLogger = getContext().getLogger(ROOT_LOGGER_NAME);
        final FileAppender<ILoggingEvent> fileAppender =
                (FileAppender<ILoggingEvent>) rootLogger.getAppender(ROOT_FILE_APPENDER_NAME);
        if (fileAppender != null) {
            rootLogger.detachAppender(fileAppender);
            fileAppender.stop();
        }
    }

    private static LoggerContext getContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    public static final String ROOT_FILE_APPENDER_NAME = "analysisFileAppender";

    private static final String FILE_PATTERN = "%d{MM-dd HH:mm:ss} [%thread] %-5level %logger{36} - %msg%n";
}
