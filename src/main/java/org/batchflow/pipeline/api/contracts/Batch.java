package org.batchflow.pipeline.api.contracts;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sealed, ordered group of tagged items released together.
 * <p>
 * Instances are immutable. The constructor enforces the batch invariants: a batch is never
 * empty, never holds more than {@code maxItems} entries, and its ids are strictly increasing
 * (submission order). A violation means the assembly protocol is broken and is reported as
 * an {@link IllegalStateException}.
 *
 * @param <T> The payload type.
 */
public final class Batch<T> {

    private final long sequence;
    private final List<TaggedItem<T>> items;
    private final FlushTrigger trigger;
    private final long windowOpenedNanos;
    private final long flushedNanos;

    /**
     * Seals a batch.
     *
     * @param sequence          1-based flush number within the owning pipeline
     * @param items             the window contents in arrival order
     * @param maxItems          the configured upper bound for the batch size
     * @param trigger           why the window was flushed
     * @param windowOpenedNanos {@link System#nanoTime()} when the first item of the window arrived
     * @param flushedNanos      {@link System#nanoTime()} when the window was sealed
     */
    public Batch(long sequence, List<TaggedItem<T>> items, int maxItems, FlushTrigger trigger,
                 long windowOpenedNanos, long flushedNanos) {
        Objects.requireNonNull(items, "items must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        if (items.isEmpty()) {
            throw new IllegalStateException("Batch " + sequence + " is empty; empty windows must never be flushed");
        }
        if (items.size() > maxItems) {
            throw new IllegalStateException(String.format(
                "Batch %d holds %d items, exceeding maxItems=%d", sequence, items.size(), maxItems));
        }
        long previous = 0;
        for (TaggedItem<T> item : items) {
            if (item.id() <= previous) {
                throw new IllegalStateException(String.format(
                    "Batch %d has id %d after id %d; ids must be strictly increasing", sequence, item.id(), previous));
            }
            previous = item.id();
        }
        this.sequence = sequence;
        this.items = List.copyOf(items);
        this.windowOpenedNanos = windowOpenedNanos;
        this.flushedNanos = flushedNanos;
    }

    public long sequence() {
        return sequence;
    }

    public List<TaggedItem<T>> items() {
        return items;
    }

    public FlushTrigger trigger() {
        return trigger;
    }

    public int size() {
        return items.size();
    }

    /**
     * Returns the ids of the items in batch order.
     *
     * @return unmodifiable list of ids
     */
    public List<Long> ids() {
        List<Long> ids = new ArrayList<>(items.size());
        for (TaggedItem<T> item : items) {
            ids.add(item.id());
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * Returns the payloads in batch order.
     *
     * @return unmodifiable list of payloads
     */
    public List<T> payloads() {
        List<T> payloads = new ArrayList<>(items.size());
        for (TaggedItem<T> item : items) {
            payloads.add(item.payload());
        }
        return Collections.unmodifiableList(payloads);
    }

    /**
     * Time between the arrival of the window's first item and the flush.
     *
     * @return the window duration
     */
    public Duration windowDuration() {
        return Duration.ofNanos(flushedNanos - windowOpenedNanos);
    }

    public long windowOpenedNanos() {
        return windowOpenedNanos;
    }

    public long flushedNanos() {
        return flushedNanos;
    }

    @Override
    public String toString() {
        return "Batch{sequence=" + sequence + ", size=" + items.size() + ", trigger=" + trigger
            + ", ids=" + items.get(0).id() + ".." + items.get(items.size() - 1).id() + "}";
    }
}
