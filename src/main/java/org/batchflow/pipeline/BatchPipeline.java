package org.batchflow.pipeline;

import com.typesafe.config.Config;
import org.batchflow.pipeline.api.contracts.Batch;
import org.batchflow.pipeline.api.observation.IObservationSink;
import org.batchflow.pipeline.api.resources.IMonitorable;
import org.batchflow.pipeline.api.resources.OperationalError;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.batchflow.pipeline.api.services.IService;
import org.batchflow.pipeline.observability.Slf4jObservationSink;
import org.batchflow.pipeline.resources.sync.CountingSemaphore;
import org.batchflow.pipeline.services.assembler.BatchAssembler;
import org.batchflow.pipeline.services.distributor.BatchDistributor;
import org.batchflow.pipeline.services.distributor.ShutdownSignal;
import org.batchflow.pipeline.services.ingestion.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.batchflow.pipeline.api.observation.IObservationSink.fields;

/**
 * Wires ingestion, assembly and distribution into one pipeline and owns its lifecycle.
 * <p>
 * Items enter through {@link #submit(Object)}, are tagged with a unique id, grouped into batches
 * by the {@link BatchAssembler} and handed out through {@link #requestSupply()} by the
 * {@link BatchDistributor}.
 *
 * <h3>Shutdown</h3>
 * <ul>
 *   <li>{@link #close()} is graceful: no accepted item is lost. New submits are rejected, in-flight
 *       submits are fenced, queued items are batched, the partial batch is flushed and the
 *       distributor keeps serving {@link #requestSupply()} until every batch has been pulled.</li>
 *   <li>{@link #stop()} is immediate: stages are signalled to stop and the distributor quits.
 *       Work that cannot be completed is reported as dropped.</li>
 * </ul>
 * Both are safe to call concurrently and repeatedly. The pipeline never terminates the process;
 * embedding applications observe {@link #awaitTermination(Duration)} instead.
 *
 * @param <T> The payload type.
 */
public class BatchPipeline<T> implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    public static final String DEFAULT_NAME = "batch-pipeline";

    private final String name;
    private final PipelineConfig config;
    private final IObservationSink sink;
    private final PipelineCounters counters = new PipelineCounters();
    private final CountingSemaphore semaphore;

    private final IngestionService<T> ingestion;
    private final BatchAssembler<T> assembler;
    private final BatchDistributor<T> distributor;

    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.CREATED);
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public BatchPipeline(String name, PipelineConfig config, IObservationSink sink) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sink = sink != null ? sink : new Slf4jObservationSink();
        this.semaphore = new CountingSemaphore(config.maxItems());
        this.distributor = new BatchDistributor<>(name + "-distributor", config, counters, this.sink);
        this.assembler = new BatchAssembler<>(name + "-assembler", config, distributor::accept, counters, this.sink);
        this.ingestion = new IngestionService<>(name + "-ingestion", config, assembler, counters, this.sink);
    }

    /**
     * Creates a pipeline from option mutators applied on top of the defaults.
     *
     * @throws PipelineConfigurationException if an option is out of range
     */
    public static <T> BatchPipeline<T> create(PipelineOption... options) {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        for (PipelineOption option : options) {
            Objects.requireNonNull(option, "options must not contain null").apply(builder);
        }
        return new BatchPipeline<>(DEFAULT_NAME, builder.build(), builder.observationSink());
    }

    /**
     * Creates a pipeline from a HOCON block such as {@code batchflow.pipeline}.
     *
     * @throws PipelineConfigurationException if the block is invalid
     */
    public static <T> BatchPipeline<T> fromConfig(Config options) {
        return new BatchPipeline<>(DEFAULT_NAME, PipelineConfig.fromConfig(options), null);
    }

    /**
     * Starts the distributor, then the assembler, then the ingestion loop.
     *
     * @throws IllegalStateException if the pipeline was already started or closed
     */
    public void start() {
        if (!state.compareAndSet(PipelineState.CREATED, PipelineState.STARTED)) {
            throw new IllegalStateException(String.format("Cannot start pipeline '%s' in state %s", name, state.get()));
        }
        distributor.start();
        assembler.start();
        ingestion.start();
        log.info("Pipeline '{}' started: maxItems={}, maxWait={}ms, workers={}",
            name, config.maxItems(), config.maxWait().toMillis(), config.workerPoolSize());
    }

    /**
     * Submits one item, blocking while the pipeline applies backpressure.
     *
     * @param item the payload, not null
     * @throws PipelineClosedException if closing or stopping has begun
     * @throws IllegalStateException   if the pipeline has not been started
     * @throws InterruptedException    if interrupted while blocked
     */
    public void submit(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        checkAcceptingSubmits();
        semaphore.acquire();
        try {
            checkAcceptingSubmits();
            ingestion.enqueue(item);
            counters.recordSubmitted();
        } catch (QueueClosedException e) {
            throw new PipelineClosedException(name, state.get());
        } finally {
            semaphore.release();
        }
    }

    /**
     * Like {@link #submit(Object)}, but gives up after {@code timeout}.
     *
     * @return {@code true} if the item was accepted, {@code false} if backpressure lasted longer than the timeout
     * @throws PipelineClosedException if closing or stopping has begun
     * @throws IllegalStateException   if the pipeline has not been started
     * @throws InterruptedException    if interrupted while blocked
     */
    public boolean trySubmit(T item, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        checkAcceptingSubmits();
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        if (!semaphore.tryAcquire(timeout, unit)) {
            return false;
        }
        try {
            checkAcceptingSubmits();
            boolean accepted = ingestion.tryEnqueue(item, deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            if (accepted) {
                counters.recordSubmitted();
            }
            return accepted;
        } catch (QueueClosedException e) {
            throw new PipelineClosedException(name, state.get());
        } finally {
            semaphore.release();
        }
    }

    private void checkAcceptingSubmits() {
        PipelineState current = state.get();
        if (current == PipelineState.CREATED) {
            throw new IllegalStateException("Pipeline '" + name + "' has not been started");
        }
        if (current != PipelineState.STARTED || stopping.get()) {
            throw new PipelineClosedException(name, current);
        }
    }

    /**
     * Signals the assembler to stop without waiting. Items still arriving are reported as dropped.
     */
    public void stopProducer() {
        log.info("Pipeline '{}': producer stop requested", name);
        assembler.requestStop();
    }

    /**
     * Signals the distributor to cancel without waiting. Batches already accepted are still delivered.
     */
    public void stopConsumer() {
        log.info("Pipeline '{}': consumer stop requested", name);
        distributor.shutdown(ShutdownSignal.CANCEL);
    }

    /**
     * Gracefully closes the pipeline. Every item accepted by {@code submit} ends up in a batch; the
     * distributor keeps serving those batches until they have all been pulled.
     * <p>
     * Blocks until the partial batch has been handed to the distributor. With a full distributor
     * this requires a client to keep pulling.
     *
     * @return {@code true} if this call closed the pipeline, {@code false} if it was already closing or closed
     */
    public boolean close() {
        if (state.compareAndSet(PipelineState.CREATED, PipelineState.STOPPED)) {
            log.info("Pipeline '{}' closed before it was started", name);
            stopStages(ShutdownSignal.CANCEL);
            return true;
        }
        if (!state.compareAndSet(PipelineState.STARTED, PipelineState.DRAINING)) {
            log.info("Pipeline '{}' already closed (state {})", name, state.get());
            return false;
        }

        sink.info("pipeline.close", fields("pipeline", name, "remaining_items", counters.remainingItems()));
        try {
            // Closing the ingestion queue releases submits blocked on backpressure.
            ingestion.requestStop();
            semaphore.lock();
            try {
                drainIngestion();
                int drained = assembler.drainRemaining().get();
                log.debug("Pipeline '{}' drain flushed {} item(s)", name, drained);
                stopStages(ShutdownSignal.CANCEL);
            } finally {
                semaphore.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pipeline '{}' interrupted while closing, stopping stages", name);
            stopStages(ShutdownSignal.CANCEL);
        } catch (ExecutionException e) {
            log.error("Pipeline '{}' failed to drain the assembler: {}", name, e.getCause().getMessage());
            log.debug("Drain failure details:", e.getCause());
            stopStages(ShutdownSignal.CANCEL);
        }

        state.set(PipelineState.STOPPED);
        sink.info("pipeline.done", fields(
            "pipeline", name,
            "remaining_items", counters.remainingItems(),
            "batches_flushed", counters.batchesFlushed(),
            "items_dropped", counters.droppedItems()));
        return true;
    }

    /**
     * Waits for the ingestion loop to hand every queued item to the assembler. Unbounded: the loop
     * only blocks while the assembler applies backpressure.
     */
    private void drainIngestion() throws InterruptedException {
        while (!ingestion.awaitTermination(config.stopTimeout())) {
            log.debug("Pipeline '{}' still draining {} queued item(s)", name, ingestion.getQueueSize());
        }
    }

    /**
     * Stops immediately. New submits are rejected, the stages are signalled concurrently and the
     * distributor quits; this call then waits for the stage threads. A no-op once stopped.
     */
    public void stop() {
        if (state.get() == PipelineState.STOPPED || !stopping.compareAndSet(false, true)) {
            log.debug("Pipeline '{}' already stopped or stopping", name);
            return;
        }
        sink.warn("pipeline.stop", fields("pipeline", name, "remaining_items", counters.remainingItems()));
        ingestion.requestStop();
        assembler.requestStop();
        distributor.shutdown(ShutdownSignal.QUIT);
        try {
            semaphore.lock();
            try {
                stopStages(ShutdownSignal.QUIT);
            } finally {
                semaphore.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pipeline '{}' interrupted while waiting for stop", name);
        }
        state.set(PipelineState.STOPPED);
        log.info("Pipeline '{}' stopped", name);
    }

    /**
     * Stops the stage threads. Callers hold the semaphore, except for the never-started and interrupted paths.
     * On {@link ShutdownSignal#CANCEL} the distributor is only signalled, since its workers keep serving
     * {@link #requestSupply()} until every batch has been pulled.
     */
    private void stopStages(ShutdownSignal signal) {
        ingestion.stop();
        assembler.stop();
        distributor.shutdown(signal);
        if (signal == ShutdownSignal.QUIT || distributor.getCurrentState() == IService.State.CREATED) {
            distributor.stop();
        }
    }

    /**
     * Entry point for external terminate notifications such as a JVM shutdown hook. Closes gracefully.
     */
    public void onTerminateRequested() {
        log.info("Pipeline '{}' received terminate request", name);
        close();
    }

    /**
     * Blocks until a batch is available and claims it. Keeps working after {@link #close()} until
     * every batch has been pulled.
     *
     * @throws QueueClosedException once the distributor has terminated and nothing is left
     */
    public Batch<T> requestSupply() throws InterruptedException {
        return distributor.requestSupply();
    }

    /**
     * @return the claimed batch, or empty if none became available within {@code timeout}
     */
    public Optional<Batch<T>> requestSupply(Duration timeout) throws InterruptedException {
        return distributor.requestSupply(timeout);
    }

    /**
     * Waits until every distributor worker has exited.
     *
     * @return {@code true} if the pipeline terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            distributor.terminationFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.warn("Pipeline '{}' terminated abnormally: {}", name, e.getCause().getMessage());
            return true;
        }
    }

    public String getName() {
        return name;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public PipelineState getState() {
        return state.get();
    }

    public PipelineCounters getCounters() {
        return counters;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        counters.snapshot().forEach((key, value) -> metrics.put("pipeline." + key, value));
        ingestion.getMetrics().forEach((key, value) -> metrics.put("ingestion." + key, value));
        assembler.getMetrics().forEach((key, value) -> metrics.put("assembler." + key, value));
        distributor.getMetrics().forEach((key, value) -> metrics.put("distributor." + key, value));
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        List<OperationalError> errors = new ArrayList<>();
        errors.addAll(ingestion.getErrors());
        errors.addAll(assembler.getErrors());
        errors.addAll(distributor.getErrors());
        return errors;
    }

    @Override
    public void clearErrors() {
        ingestion.clearErrors();
        assembler.clearErrors();
        distributor.clearErrors();
    }

    @Override
    public boolean isHealthy() {
        return ingestion.isHealthy() && assembler.isHealthy() && distributor.isHealthy();
    }
}
