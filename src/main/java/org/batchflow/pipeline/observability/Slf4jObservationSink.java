package org.batchflow.pipeline.observability;

import org.batchflow.pipeline.api.observation.IObservationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes observations through SLF4J as {@code event key=value key=value}.
 * <p>
 * The default logger is {@code org.batchflow.pipeline.observations}, so observation output
 * can be tuned independently of the stages' own lifecycle logging.
 */
public class Slf4jObservationSink implements IObservationSink {

    public static final String DEFAULT_LOGGER_NAME = "org.batchflow.pipeline.observations";

    private final Logger logger;

    public Slf4jObservationSink() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
    }

    public Slf4jObservationSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void info(String event, Map<String, Object> fields) {
        if (logger.isInfoEnabled()) {
            logger.info(format(event, fields));
        }
    }

    @Override
    public void warn(String event, Map<String, Object> fields) {
        if (logger.isWarnEnabled()) {
            logger.warn(format(event, fields));
        }
    }

    @Override
    public void debug(String event, Map<String, Object> fields) {
        if (logger.isDebugEnabled()) {
            logger.debug(format(event, fields));
        }
    }

    static String format(String event, Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder(event);
        if (fields != null) {
            fields.forEach((key, value) -> sb.append(' ').append(key).append('=').append(value));
        }
        return sb.toString();
    }
}
