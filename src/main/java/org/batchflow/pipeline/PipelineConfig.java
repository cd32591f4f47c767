package org.batchflow.pipeline;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.batchflow.pipeline.api.observation.IObservationSink;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved pipeline configuration.
 *
 * <h3>Options</h3>
 * <ul>
 *   <li><b>maxItems</b>: a batch is flushed as soon as it holds this many items (default: 100).</li>
 *   <li><b>maxWait</b>: a non-empty batch is flushed once this much time has passed since its
 *       <em>first</em> item arrived, even if it is below {@code maxItems} (default: 5 s).</li>
 *   <li><b>workerPoolSize</b>: number of distributor workers (default: 10).</li>
 *   <li><b>ingestionCapacity</b>: bound of the queue behind {@code submit} (default: 1000).</li>
 *   <li><b>assemblerCapacity</b>: bound of the assembler inbox (default: 1000).</li>
 *   <li><b>stopTimeout</b>: how long stopping waits for a stage thread (default: 5 s).</li>
 * </ul>
 * Instances are validated on construction and are immutable; an out-of-range value raises
 * {@link PipelineConfigurationException}.
 */
public record PipelineConfig(
    int maxItems,
    Duration maxWait,
    int workerPoolSize,
    int ingestionCapacity,
    int assemblerCapacity,
    Duration stopTimeout
) {

    public static final int DEFAULT_MAX_ITEMS = 100;
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(5);
    public static final int DEFAULT_WORKER_POOL_SIZE = 10;
    public static final int DEFAULT_INGESTION_CAPACITY = 1000;
    public static final int DEFAULT_ASSEMBLER_CAPACITY = 1000;
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    public PipelineConfig {
        requirePositive("maxItems", maxItems);
        requirePositive("workerPoolSize", workerPoolSize);
        requirePositive("ingestionCapacity", ingestionCapacity);
        requirePositive("assemblerCapacity", assemblerCapacity);
        requirePositive("maxWait", maxWait);
        requirePositive("stopTimeout", stopTimeout);
    }

    /**
     * @return a configuration with every option at its default value
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_MAX_ITEMS, DEFAULT_MAX_WAIT, DEFAULT_WORKER_POOL_SIZE,
            DEFAULT_INGESTION_CAPACITY, DEFAULT_ASSEMBLER_CAPACITY, DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Reads a pipeline block such as {@code batchflow.pipeline} from HOCON configuration.
     * Missing keys fall back to the defaults. Durations are given in milliseconds
     * ({@code maxWaitMs}, {@code stopTimeoutMs}).
     *
     * @param options the pipeline block
     * @return the resolved configuration
     * @throws PipelineConfigurationException if a value has the wrong type or is out of range
     */
    public static PipelineConfig fromConfig(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "maxItems", DEFAULT_MAX_ITEMS,
            "maxWaitMs", DEFAULT_MAX_WAIT.toMillis(),
            "workerPoolSize", DEFAULT_WORKER_POOL_SIZE,
            "ingestionCapacity", DEFAULT_INGESTION_CAPACITY,
            "assemblerCapacity", DEFAULT_ASSEMBLER_CAPACITY,
            "stopTimeoutMs", DEFAULT_STOP_TIMEOUT.toMillis()
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            return new PipelineConfig(
                finalConfig.getInt("maxItems"),
                Duration.ofMillis(finalConfig.getLong("maxWaitMs")),
                finalConfig.getInt("workerPoolSize"),
                finalConfig.getInt("ingestionCapacity"),
                finalConfig.getInt("assemblerCapacity"),
                Duration.ofMillis(finalConfig.getLong("stopTimeoutMs"))
            );
        } catch (ConfigException e) {
            throw new PipelineConfigurationException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Applies option mutators on top of the defaults.
     *
     * @param options mutators, applied in order
     * @return the resolved configuration
     * @throws PipelineConfigurationException if the result is out of range
     */
    public static PipelineConfig of(PipelineOption... options) {
        Builder builder = builder();
        for (PipelineOption option : options) {
            Objects.requireNonNull(option, "options must not contain null").apply(builder);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new PipelineConfigurationException(name + " must be positive, was " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new PipelineConfigurationException(name + " must be a positive duration, was " + value);
        }
    }

    /**
     * Mutable builder the {@link PipelineOption}s operate on. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private int maxItems = DEFAULT_MAX_ITEMS;
        private Duration maxWait = DEFAULT_MAX_WAIT;
        private int workerPoolSize = DEFAULT_WORKER_POOL_SIZE;
        private int ingestionCapacity = DEFAULT_INGESTION_CAPACITY;
        private int assemblerCapacity = DEFAULT_ASSEMBLER_CAPACITY;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private IObservationSink observationSink;

        private Builder() {
        }

        public Builder maxItems(int maxItems) {
            this.maxItems = maxItems;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder workerPoolSize(int workerPoolSize) {
            this.workerPoolSize = workerPoolSize;
            return this;
        }

        public Builder ingestionCapacity(int ingestionCapacity) {
            this.ingestionCapacity = ingestionCapacity;
            return this;
        }

        public Builder assemblerCapacity(int assemblerCapacity) {
            this.assemblerCapacity = assemblerCapacity;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        /**
         * The sink is not part of the resolved configuration; {@link BatchPipeline#create} picks it up from here.
         */
        public Builder observationSink(IObservationSink observationSink) {
            this.observationSink = observationSink;
            return this;
        }

        IObservationSink observationSink() {
            return observationSink;
        }

        public PipelineConfig build() {
            return new PipelineConfig(maxItems, maxWait, workerPoolSize, ingestionCapacity, assemblerCapacity, stopTimeout);
        }
    }
}
