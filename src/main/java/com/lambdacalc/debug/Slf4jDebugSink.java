package com.lambdacalc.debug;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards debug hub messages to SLF4J. The hub tag becomes the logger name
 * (prefixed with "lambdacalc."), so levels can be tuned per tag in
 * simplelogger.properties.
 */
public final class Slf4jDebugSink implements DebugSink {

    private static final String PREFIX = "lambdacalc.";

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    public boolean traceEnabled(String tag) {
        return logger(tag).isTraceEnabled();
    }

    private Logger logger(String tag) {
        return loggers.computeIfAbsent(tag == null ? "root" : tag, t -> LoggerFactory.getLogger(PREFIX + t));
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger log = logger(tag);
        switch (level) {
            case TRACE: log.trace(message, error); break;
            case DEBUG: log.debug(message, error); break;
            case INFO:  log.info(message, error); break;
            case WARN:  log.warn(message, error); break;
            default:    log.error(message, error); break;
        }
    }
}
