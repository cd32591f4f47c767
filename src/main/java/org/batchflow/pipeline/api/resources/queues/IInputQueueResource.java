package org.batchflow.pipeline.api.resources.queues;

import org.batchflow.pipeline.api.resources.IResource;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Interface for queue-based resources that a stage reads from.
 * This interface is a close analog to {@link java.util.concurrent.BlockingQueue}, extended
 * with end-of-input semantics: once the queue is closed and empty, the blocking retrieval
 * methods throw {@link QueueClosedException} instead of waiting forever.
 *
 * @param <T> The type of data this resource provides.
 */
public interface IInputQueueResource<T> extends IResource {

    /**
     * Retrieves and removes the head of this queue, or returns {@link Optional#empty()} if this queue is empty.
     * This is a non-blocking operation and never throws {@link QueueClosedException}.
     *
     * @return an {@link Optional} containing the head of this queue, or {@link Optional#empty()} if this queue is empty
     */
    Optional<T> poll();

    /**
     * Retrieves and removes the head of this queue, waiting if necessary until an element becomes available.
     *
     * @return the head of this queue
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueClosedException if the queue is closed and no elements remain
     */
    T take() throws InterruptedException;

    /**
     * Retrieves and removes the head of this queue, waiting up to the specified wait time if necessary
     * for an element to become available.
     *
     * @param timeout how long to wait before giving up, in units of {@code unit}
     * @param unit a {@code TimeUnit} determining how to interpret the timeout parameter
     * @return an {@link Optional} containing the head of this queue, or {@link Optional#empty()} if the specified
     *         waiting time elapses before an element is available
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueClosedException if the queue is closed and no elements remain
     */
    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes at most the given number of available elements from this queue and adds them into the given collection.
     * Non-blocking.
     *
     * @param collection the collection to drain elements into
     * @param maxElements the maximum number of elements to drain
     * @return the number of elements transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Returns whether {@code close()} has been called on the underlying queue.
     *
     * @return true if closed
     */
    boolean isClosed();
}
