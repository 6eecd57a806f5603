package org.janelia.transients.util;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Tools for manipulating logback logging levels from code,
 * mostly used to quiet per-pixel or per-pair logging in statistical tests.
 */
public class LogbackTestTools {

    public static void setLogLevelToDebug(final String loggerName) {
        setLogLevel(loggerName, Level.DEBUG);
    }

    public static void setLogLevelToWarn(final String loggerName) {
        setLogLevel(loggerName, Level.WARN);
    }

    public static void setLogLevel(final String loggerName,
                                   final Level logLevel) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(loggerName);
        if (logger == null) {
            throw new IllegalArgumentException("logger with name '" + loggerName + "' not found");
        }
        logger.setLevel(logLevel);
    }

}
