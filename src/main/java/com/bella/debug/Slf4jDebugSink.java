package com.bella.debug;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes the debug hub to SLF4J. Each tag becomes a logger name, so
 * "bella.engine" can be tuned independently of "bella.interpreter".
 */
public final class Slf4jDebugSink implements DebugSink {

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger logger = loggers.computeIfAbsent(tag == null ? "bella" : tag, LoggerFactory::getLogger);
        switch (level) {
            case TRACE:
                if (logger.isTraceEnabled()) logger.trace(message, error);
                break;
            case DEBUG:
                if (logger.isDebugEnabled()) logger.debug(message, error);
                break;
            case INFO:
                logger.info(message, error);
                break;
            case WARN:
                logger.warn(message, error);
                break;
            case ERROR:
            default:
                logger.error(message, error);
                break;
        }
    }
}
