package com.txscript.debug;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production sink that emits debug output via SLF4J. Each tag becomes a logger name,
 * so "txscript.executor" can be tuned independently of "txscript.bus".
 */
public final class Slf4jDebugSink implements DebugSink {

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger log = loggers.computeIfAbsent(tag == null ? "txscript" : tag, LoggerFactory::getLogger);
        switch (level) {
            case TRACE:
                log.trace(message, error);
                break;
            case DEBUG:
                log.debug(message, error);
                break;
            case INFO:
                log.info(message, error);
                break;
            case WARN:
                log.warn(message, error);
                break;
            default:
                log.error(message, error);
                break;
        }
    }
}
