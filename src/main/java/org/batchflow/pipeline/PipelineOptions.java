package org.batchflow.pipeline;

import org.batchflow.pipeline.api.observation.IObservationSink;

import java.time.Duration;

/**
 * Factory methods for the recognized {@link PipelineOption}s.
 * Options that are not given keep the defaults documented on {@link PipelineConfig}.
 */
public final class PipelineOptions {

    private PipelineOptions() {
        // Static factory holder
    }

    public static PipelineOption withMaxItems(int maxItems) {
        return builder -> builder.maxItems(maxItems);
    }

    public static PipelineOption withMaxWait(Duration maxWait) {
        return builder -> builder.maxWait(maxWait);
    }

    public static PipelineOption withWorkerPoolSize(int workerPoolSize) {
        return builder -> builder.workerPoolSize(workerPoolSize);
    }

    public static PipelineOption withIngestionCapacity(int capacity) {
        return builder -> builder.ingestionCapacity(capacity);
    }

    public static PipelineOption withAssemblerCapacity(int capacity) {
        return builder -> builder.assemblerCapacity(capacity);
    }

    public static PipelineOption withStopTimeout(Duration stopTimeout) {
        return builder -> builder.stopTimeout(stopTimeout);
    }

    public static PipelineOption withObservationSink(IObservationSink sink) {
        return builder -> builder.observationSink(sink);
    }
}
