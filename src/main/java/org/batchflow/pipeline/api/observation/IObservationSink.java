package org.batchflow.pipeline.api.observation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives structured observations from the pipeline stages: batch sizes, shutdown
 * progress, remaining item counts and dropped work.
 * <p>
 * A sink never influences pipeline behaviour. Implementations must be thread-safe, since
 * every stage thread reports to the same sink, and must not block for long.
 */
public interface IObservationSink {

    /**
     * A sink that discards every observation.
     */
    IObservationSink NOOP = new IObservationSink() {
        @Override
        public void info(String event, Map<String, Object> fields) {
        }

        @Override
        public void warn(String event, Map<String, Object> fields) {
        }

        @Override
        public void debug(String event, Map<String, Object> fields) {
        }
    };

    /**
     * Builds an insertion-ordered field map from alternating keys and values.
     *
     * @param keyValues key1, value1, key2, value2, ...
     * @return a mutable map preserving argument order
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields() requires key/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return fields;
    }

    void info(String event, Map<String, Object> fields);

    void warn(String event, Map<String, Object> fields);

    void debug(String event, Map<String, Object> fields);
}
