package org.batchflow.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters owned by one {@link BatchPipeline} instance and shared with its stages.
 * <p>
 * Holds the item id sequence and the flush sequence together with the running totals used for
 * shutdown reporting. Every field is atomic, so stages may update them from their own threads.
 */
public final class PipelineCounters {

    private final AtomicLong idSequence = new AtomicLong();
    private final AtomicLong batchSequence = new AtomicLong();
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong batched = new AtomicLong();
    private final AtomicLong droppedItems = new AtomicLong();
    private final AtomicLong droppedBatches = new AtomicLong();
    private final AtomicLong droppedBatchItems = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();

    /**
     * @return the next item id, starting at 1
     */
    public long nextItemId() {
        return idSequence.incrementAndGet();
    }

    /**
     * @return the next batch sequence number, starting at 1
     */
    public long nextBatchSequence() {
        return batchSequence.incrementAndGet();
    }

    void recordSubmitted() {
        submitted.incrementAndGet();
    }

    public void recordBatched(int items) {
        batched.addAndGet(items);
    }

    public void recordDroppedItem() {
        droppedItems.incrementAndGet();
    }

    public void recordDroppedBatch(int items) {
        droppedBatches.incrementAndGet();
        droppedBatchItems.addAndGet(items);
    }

    public void recordDelivered() {
        delivered.incrementAndGet();
    }

    public long submitted() {
        return submitted.get();
    }

    /**
     * @return number of ids handed out so far
     */
    public long tagged() {
        return idSequence.get();
    }

    public long batched() {
        return batched.get();
    }

    public long batchesFlushed() {
        return batchSequence.get();
    }

    /**
     * @return items dropped before batching plus items inside dropped batches
     */
    public long droppedItems() {
        return droppedItems.get() + droppedBatchItems.get();
    }

    public long droppedBatches() {
        return droppedBatches.get();
    }

    public long batchesDelivered() {
        return delivered.get();
    }

    /**
     * Items accepted by {@code submit} that are not yet part of a batch and were not dropped.
     *
     * @return the number of items still waiting to be batched
     */
    public long remainingItems() {
        return Math.max(0, submitted.get() - batched.get() - droppedItems.get());
    }

    public Map<String, Number> snapshot() {
        Map<String, Number> values = new LinkedHashMap<>();
        values.put("items_submitted", submitted());
        values.put("items_tagged", tagged());
        values.put("items_batched", batched());
        values.put("items_dropped", droppedItems());
        values.put("items_remaining", remainingItems());
        values.put("batches_flushed", batchesFlushed());
        values.put("batches_dropped", droppedBatches());
        values.put("batches_delivered", batchesDelivered());
        return values;
    }
}
