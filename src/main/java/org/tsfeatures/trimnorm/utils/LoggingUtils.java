package org.tsfeatures.trimnorm.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.
 *
 * Tools use the {@link LogLevel} enum as the type for VERBOSITY command line arguments (each log4j level is
 * represented by a static object, so there is no built-in enum that is compatible with the command line
 * argument framework). We convert back and forth between that enum and the log4j namespace as necessary.
 * The java built in logger has a different set of level values, which we also map onto.
 */
public class LoggingUtils {

    /**
     * Verbosity levels accepted on the command line.
     */
    public enum LogLevel {
        ERROR,
        WARNING,
        INFO,
        DEBUG
    }

    private static BiMap<LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(LogLevel.class);
        loggingLevelNamespaceMap.put(LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(LogLevel.DEBUG, Level.DEBUG);
    }

    private static BiMap<LogLevel, java.util.logging.Level> javaUtilLevelNamespaceMap;
    static {
        javaUtilLevelNamespaceMap = EnumHashBiMap.create(LogLevel.class);
        javaUtilLevelNamespaceMap.put(LogLevel.ERROR, java.util.logging.Level.SEVERE);
        javaUtilLevelNamespaceMap.put(LogLevel.WARNING, java.util.logging.Level.WARNING);
        javaUtilLevelNamespaceMap.put(LogLevel.INFO, java.util.logging.Level.INFO);
        javaUtilLevelNamespaceMap.put(LogLevel.DEBUG, java.util.logging.Level.FINEST);
    }

    // Package-private for unit test access
    static LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts a verbosity level to a log4j log level.
     * @param verbosity {@link LogLevel} to convert to a Log4J {@link Level}.
     * @return The {@link Level} that corresponds to the given {@code verbosity}.
     */
    public static Level levelToLog4jLevel(final LogLevel verbosity) {
        return loggingLevelNamespaceMap.get(verbosity);
    }

    /**
     * Propagate the verbosity level to log4j and the java built in logger.
     */
    public static void setLoggingLevel(final LogLevel verbosity) {
        Utils.nonNull(verbosity, "the verbosity cannot be null");
        setLog4JLoggingLevel(verbosity);
        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(final LogLevel verbosity) {
        // Propagate the requested level to all loggers associated with our logging configuration.
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final String contextClassName = LoggingUtils.class.getName();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(contextClassName);

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }

    private static void setJavaUtilLoggingLevel(final LogLevel verbosity) {
        final Logger topLogger = java.util.logging.Logger.getLogger("");

        Handler consoleHandler = null;
        for (final Handler handler : topLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandler = handler;
                break;
            }
        }

        if (consoleHandler == null) {
            consoleHandler = new ConsoleHandler();
            topLogger.addHandler(consoleHandler);
        }
        consoleHandler.setLevel(javaUtilLevelNamespaceMap.get(verbosity));
    }
}
