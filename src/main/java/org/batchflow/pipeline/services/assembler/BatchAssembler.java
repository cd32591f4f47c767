package org.batchflow.pipeline.services.assembler;

import org.batchflow.pipeline.PipelineConfig;
import org.batchflow.pipeline.PipelineCounters;
import org.batchflow.pipeline.api.contracts.Batch;
import org.batchflow.pipeline.api.contracts.FlushTrigger;
import org.batchflow.pipeline.api.contracts.TaggedItem;
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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.batchflow.pipeline.api.observation.IObservationSink.fields;

/**
 * Accumulates tagged items into batches and hands each sealed batch to a {@link FlushHandler}.
 * <p>
 * The assembler owns exactly one open window. Two triggers race to flush it:
 * <ul>
 *   <li><b>Count</b>: the window is flushed the moment it holds {@code maxItems} items.</li>
 *   <li><b>Time</b>: the window is flushed once {@code maxWait} has elapsed since its first item
 *       arrived. The deadline is armed by the first item only, so an idle assembler never emits
 *       empty batches. If an item arrives after the deadline, the expired window is flushed first
 *       and the item opens the next window.</li>
 * </ul>
 * Since the count trigger fires synchronously while the item is added, a full window never
 * waits for the time trigger.
 * <p>
 * On {@link #requestStop()} the inbox is closed: items already queued are still batched as usual,
 * then the remaining partial window is force-flushed with {@link FlushTrigger#DRAIN} and the
 * thread exits. Items offered after that are refused by {@link #submit(TaggedItem)}.
 * <p>
 * <strong>Thread Safety:</strong> {@link #submit(TaggedItem)}, {@link #requestStop()} and
 * {@link #drainRemaining()} may be called from any thread. The window itself is only touched by
 * the assembler thread.
 *
 * @param <T> The payload type.
 */
public class BatchAssembler<T> extends AbstractService {

    private final int maxItems;
    private final long maxWaitNanos;
    private final InMemoryBlockingQueue<TaggedItem<T>> inbox;
    private final FlushHandler<T> flushHandler;
    private final PipelineCounters counters;
    private final IObservationSink sink;

    private final List<TaggedItem<T>> window = new ArrayList<>();
    private long windowOpenedNanos;
    private long deadlineNanos;
    private volatile int windowSize;

    private final CompletableFuture<Integer> drainCompletion = new CompletableFuture<>();

    private final AtomicLong batchesFlushed = new AtomicLong();
    private final AtomicLong itemsBatched = new AtomicLong();
    private final AtomicLong countFlushes = new AtomicLong();
    private final AtomicLong timeFlushes = new AtomicLong();
    private final AtomicLong drainFlushes = new AtomicLong();

    public BatchAssembler(String name, PipelineConfig config, FlushHandler<T> flushHandler,
                          PipelineCounters counters, IObservationSink sink) {
        super(name, config.stopTimeout());
        this.maxItems = config.maxItems();
        this.maxWaitNanos = config.maxWait().toNanos();
        this.inbox = new InMemoryBlockingQueue<>(name + "-inbox", config.assemblerCapacity());
        this.flushHandler = Objects.requireNonNull(flushHandler, "flushHandler must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    @Override
    protected void logStarted() {
        log.info("{} started: maxItems={}, maxWait={}ms", serviceName, maxItems, TimeUnit.NANOSECONDS.toMillis(maxWaitNanos));
    }

    /**
     * Enqueues one item into the current accumulation window, blocking while the inbox is full.
     *
     * @param item the tagged item
     * @return {@code true} if the item was accepted, {@code false} if the assembler is stopping
     * @throws InterruptedException if interrupted while waiting for inbox space
     */
    public boolean submit(TaggedItem<T> item) throws InterruptedException {
        try {
            inbox.put(item);
            return true;
        } catch (QueueClosedException e) {
            log.debug("{} refused item {}: inbox closed", serviceName, item.id());
            return false;
        }
    }

    /**
     * Reports the items that are not yet part of a batch, then stops the assembler so that they are
     * flushed.
     *
     * @return a future completing with the number of items in the forced {@link FlushTrigger#DRAIN}
     *         flush (0 if the window was empty) once that flush has been handed off
     */
    public CompletableFuture<Integer> drainRemaining() {
        int pending = inbox.size() + windowSize;
        sink.warn("assembler.drain", fields("assembler", serviceName, "remaining_items", pending));
        if (getCurrentState() == State.CREATED) {
            requestStop();
            drainCompletion.complete(0);
            return drainCompletion;
        }
        requestStop();
        return drainCompletion;
    }

    @Override
    protected void onStopRequested() {
        inbox.close();
    }

    @Override
    protected void run() throws InterruptedException {
        while (true) {
            TaggedItem<T> item;
            try {
                if (window.isEmpty()) {
                    item = inbox.take();
                } else {
                    long remaining = deadlineNanos - System.nanoTime();
                    if (remaining <= 0) {
                        flush(FlushTrigger.TIME);
                        continue;
                    }
                    Optional<TaggedItem<T>> next = inbox.poll(remaining, TimeUnit.NANOSECONDS);
                    if (next.isEmpty()) {
                        continue;
                    }
                    item = next.get();
                }
            } catch (QueueClosedException e) {
                break;
            }

            if (!window.isEmpty() && System.nanoTime() - deadlineNanos >= 0) {
                flush(FlushTrigger.TIME);
            }
            add(item);
        }

        int drained = window.size();
        if (drained > 0) {
            flush(FlushTrigger.DRAIN);
        }
        log.debug("{} drained, forced flush of {} item(s)", serviceName, drained);
        drainCompletion.complete(drained);
    }

    @Override
    protected void onTerminated() {
        if (!drainCompletion.isDone()) {
            drainCompletion.completeExceptionally(new IllegalStateException(
                "Assembler '" + serviceName + "' terminated in state " + getCurrentState() + " before draining"));
        }
    }

    private void add(TaggedItem<T> item) throws InterruptedException {
        if (window.isEmpty()) {
            windowOpenedNanos = System.nanoTime();
            deadlineNanos = windowOpenedNanos + maxWaitNanos;
        }
        window.add(item);
        windowSize = window.size();
        if (window.size() >= maxItems) {
            flush(FlushTrigger.COUNT);
        }
    }

    private void flush(FlushTrigger trigger) throws InterruptedException {
        long now = System.nanoTime();
        Batch<T> batch = new Batch<>(counters.nextBatchSequence(), window, maxItems, trigger, windowOpenedNanos, now);
        window.clear();
        windowSize = 0;

        counters.recordBatched(batch.size());
        batchesFlushed.incrementAndGet();
        itemsBatched.addAndGet(batch.size());
        switch (trigger) {
            case COUNT -> countFlushes.incrementAndGet();
            case TIME -> timeFlushes.incrementAndGet();
            case DRAIN -> drainFlushes.incrementAndGet();
        }

        sink.info("assembler.flush", fields(
            "sequence", batch.sequence(),
            "size", batch.size(),
            "trigger", trigger,
            "window_ms", batch.windowDuration().toMillis()));
        log.debug("{} flushed {}", serviceName, batch);

        flushHandler.onFlush(batch);
    }

    /**
     * @return the number of items currently waiting in the inbox
     */
    public int getInboxSize() {
        return inbox.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public Duration getMaxWait() {
        return Duration.ofNanos(maxWaitNanos);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("batches_flushed", batchesFlushed.get());
        metrics.put("items_batched", itemsBatched.get());
        metrics.put("count_flushes", countFlushes.get());
        metrics.put("time_flushes", timeFlushes.get());
        metrics.put("drain_flushes", drainFlushes.get());
        metrics.put("window_size", windowSize);
        metrics.put("inbox_size", inbox.size());
    }
}
