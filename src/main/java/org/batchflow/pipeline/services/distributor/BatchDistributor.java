package org.batchflow.pipeline.services.distributor;

import org.batchflow.pipeline.PipelineConfig;
import org.batchflow.pipeline.PipelineCounters;
import org.batchflow.pipeline.api.contracts.Batch;
import org.batchflow.pipeline.api.observation.IObservationSink;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.batchflow.pipeline.resources.queues.InMemoryBlockingQueue;
import org.batchflow.pipeline.services.AbstractService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.batchflow.pipeline.api.observation.IObservationSink.fields;

/**
 * Receives completed batches and hands each one to exactly one external supply caller through a
 * fixed pool of workers.
 * <p>
 * Batches travel {@code accept} -&gt; inbox (capacity 1) -&gt; routing thread -&gt; worker queue
 * (capacity {@code workerPoolSize}) -&gt; an idle worker, which advertises the batch on the
 * {@link SupplyExchange} and parks until a caller of {@link #requestSupply()} claims it.
 * <p>
 * Shutdown is driven by {@link #shutdown(ShutdownSignal)}:
 * <ul>
 *   <li>{@link ShutdownSignal#CANCEL}: the inbox is closed, the routing thread forwards what is left
 *       and closes the worker queue; workers deliver every queued batch and exit.</li>
 *   <li>{@link ShutdownSignal#QUIT}: both queues are closed at once and the routing thread stops.
 *       Batches not yet routed to the worker queue are reported as dropped. Workers still deliver
 *       every batch already in the worker queue, then exit.</li>
 * </ul>
 * {@link #terminationFuture()} completes once the last worker has exited.
 * <p>
 * Not guaranteed: with several idle workers, batches can reach the supply out of flush order. A
 * worker whose batch is never pulled stays parked; a client that stops pulling therefore keeps the
 * distributor from terminating.
 *
 * @param <T> The payload type.
 */
public class BatchDistributor<T> extends AbstractService {

    private final int workerPoolSize;
    private final InMemoryBlockingQueue<Batch<T>> inbox;
    private final InMemoryBlockingQueue<Batch<T>> workQueue;
    private final SupplyExchange<T> exchange;
    private final PipelineCounters counters;
    private final IObservationSink sink;

    private final List<Thread> workers = new ArrayList<>();
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicReference<ShutdownSignal> shutdownSignal = new AtomicReference<>();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private final AtomicLong batchesAccepted = new AtomicLong();
    private final AtomicLong batchesDelivered = new AtomicLong();
    private final AtomicLong batchesDropped = new AtomicLong();

    public BatchDistributor(String name, PipelineConfig config, PipelineCounters counters, IObservationSink sink) {
        super(name, config.stopTimeout());
        this.workerPoolSize = config.workerPoolSize();
        this.inbox = new InMemoryBlockingQueue<>(name + "-inbox", 1);
        this.workQueue = new InMemoryBlockingQueue<>(name + "-workers", workerPoolSize);
        this.exchange = new SupplyExchange<>(name + "-supply", workerPoolSize);
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    @Override
    protected void logStarted() {
        log.info("{} started with {} worker(s)", serviceName, workerPoolSize);
    }

    /**
     * Hands a completed batch to the distributor, blocking while the inbox is occupied.
     *
     * @param batch the batch
     * @return {@code true} if accepted; {@code false} if the distributor is shut down, in which case
     *         the batch has been reported as dropped
     * @throws InterruptedException if interrupted while waiting for the inbox
     */
    public boolean accept(Batch<T> batch) throws InterruptedException {
        Objects.requireNonNull(batch, "batch must not be null");
        try {
            inbox.put(batch);
        } catch (QueueClosedException e) {
            dropBatch(batch, "distributor is shut down");
            return false;
        }
        batchesAccepted.incrementAndGet();
        sink.info("distributor.accept", fields("sequence", batch.sequence(), "size", batch.size()));
        return true;
    }

    /**
     * Blocks until a batch is available and claims it.
     *
     * @return the claimed batch
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueClosedException once the distributor has terminated and every batch was delivered
     */
    public Batch<T> requestSupply() throws InterruptedException {
        return exchange.request();
    }

    /**
     * Waits up to {@code timeout} for a batch.
     *
     * @param timeout maximum wait
     * @return the claimed batch, or empty if none became available in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Batch<T>> requestSupply(Duration timeout) throws InterruptedException {
        return exchange.request(timeout);
    }

    /**
     * Signals the distributor to shut down. Only the first call has an effect.
     *
     * @param signal how queued batches are treated
     */
    public void shutdown(ShutdownSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (!shutdownSignal.compareAndSet(null, signal)) {
            log.debug("{} already shutting down with {}, ignoring {}", serviceName, shutdownSignal.get(), signal);
            return;
        }
        sink.warn("distributor.shutdown", fields(
            "signal", signal,
            "queued_batches", inbox.size() + workQueue.size()));
        requestStop();
    }

    /**
     * @return a future completing once every worker has exited
     */
    public CompletableFuture<Void> terminationFuture() {
        return termination;
    }

    @Override
    protected void onStopRequested() {
        // A plain stop() without shutdown() behaves like CANCEL.
        shutdownSignal.compareAndSet(null, ShutdownSignal.CANCEL);
        inbox.close();
        if (shutdownSignal.get() == ShutdownSignal.QUIT) {
            workQueue.close();
        }
        if (getCurrentState() == State.CREATED) {
            workQueue.close();
            exchange.close();
            termination.complete(null);
        }
    }

    @Override
    protected void run() throws InterruptedException {
        startWorkers();
        try {
            while (true) {
                Batch<T> batch;
                try {
                    batch = inbox.take();
                } catch (QueueClosedException e) {
                    break;
                }
                if (shutdownSignal.get() == ShutdownSignal.QUIT) {
                    dropBatch(batch, "distributor quit before routing");
                    continue;
                }
                try {
                    workQueue.put(batch);
                    log.debug("{} routed batch {} to workers", serviceName, batch.sequence());
                } catch (QueueClosedException e) {
                    dropBatch(batch, "worker queue closed");
                } catch (InterruptedException e) {
                    dropBatch(batch, "routing interrupted");
                    throw e;
                }
            }
        } catch (InterruptedException e) {
            dropRemaining(inbox, "routing interrupted");
            throw e;
        } finally {
            workQueue.close();
        }
    }

    private void startWorkers() {
        activeWorkers.set(workerPoolSize);
        for (int i = 0; i < workerPoolSize; i++) {
            final int index = i;
            Thread worker = new Thread(() -> runWorker(index));
            worker.setName(serviceName + "-worker-" + index);
            workers.add(worker);
            worker.start();
        }
    }

    private void runWorker(int index) {
        try {
            while (true) {
                Batch<T> batch;
                try {
                    batch = workQueue.take();
                } catch (QueueClosedException e) {
                    break;
                }
                sink.debug("worker.claim", fields("worker", index, "sequence", batch.sequence(), "size", batch.size()));
                try {
                    exchange.advertise(batch);
                } catch (InterruptedException e) {
                    dropBatch(batch, "worker interrupted before the batch was pulled");
                    Thread.currentThread().interrupt();
                    break;
                }
                batchesDelivered.incrementAndGet();
                counters.recordDelivered();
            }
        } catch (InterruptedException e) {
            log.debug("Worker {} of {} interrupted while idle", index, serviceName);
            Thread.currentThread().interrupt();
        } finally {
            if (activeWorkers.decrementAndGet() == 0) {
                onWorkersExited();
            }
        }
    }

    private void onWorkersExited() {
        dropRemaining(workQueue, "no worker left");
        exchange.close();
        log.info("{} terminated: {} batch(es) delivered, {} dropped", serviceName, batchesDelivered.get(), batchesDropped.get());
        termination.complete(null);
    }

    private void dropRemaining(InMemoryBlockingQueue<Batch<T>> queue, String reason) {
        List<Batch<T>> leftovers = new ArrayList<>();
        queue.drainTo(leftovers, Integer.MAX_VALUE);
        for (Batch<T> batch : leftovers) {
            dropBatch(batch, reason);
        }
    }

    private void dropBatch(Batch<T> batch, String reason) {
        counters.recordDroppedBatch(batch.size());
        batchesDropped.incrementAndGet();
        log.warn("{} dropped batch {} with {} item(s): {}", serviceName, batch.sequence(), batch.size(), reason);
        recordError("BATCH_DROPPED", "Batch dropped", String.format("sequence=%d, size=%d, reason=%s", batch.sequence(), batch.size(), reason));
        sink.warn("distributor.dropped", fields("sequence", batch.sequence(), "size", batch.size(), "reason", reason));
    }

    /**
     * @return the shutdown signal in effect, or empty while running
     */
    public Optional<ShutdownSignal> getShutdownSignal() {
        return Optional.ofNullable(shutdownSignal.get());
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("batches_accepted", batchesAccepted.get());
        metrics.put("batches_delivered", batchesDelivered.get());
        metrics.put("batches_dropped", batchesDropped.get());
        metrics.put("inbox_size", inbox.size());
        metrics.put("worker_queue_size", workQueue.size());
        metrics.put("workers_active", activeWorkers.get());
        metrics.put("supply_waiting", exchange.getWaitingCount());
    }
}
