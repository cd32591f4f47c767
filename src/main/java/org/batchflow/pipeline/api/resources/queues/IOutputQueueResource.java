package org.batchflow.pipeline.api.resources.queues;

import org.batchflow.pipeline.api.resources.IResource;

import java.util.concurrent.TimeUnit;

/**
 * Interface for queue-based resources that a stage writes to.
 * All insertion methods throw {@link QueueClosedException} once the queue has been closed.
 *
 * @param <T> The type of data this resource accepts.
 */
public interface IOutputQueueResource<T> extends IResource {

    /**
     * Inserts the specified element if it is possible to do so immediately without violating
     * capacity restrictions.
     *
     * @param element the element to add
     * @return {@code true} if the element was added, {@code false} if the queue is full
     * @throws NullPointerException if the element is null
     * @throws QueueClosedException if the queue is closed
     */
    boolean offer(T element);

    /**
     * Inserts the specified element, waiting if necessary for space to become available.
     *
     * @param element the element to add
     * @throws InterruptedException if interrupted while waiting
     * @throws NullPointerException if the element is null
     * @throws QueueClosedException if the queue is closed, including while waiting for space
     */
    void put(T element) throws InterruptedException;

    /**
     * Inserts the specified element, waiting up to the specified wait time for space to become available.
     *
     * @param element the element to add
     * @param timeout how long to wait before giving up, in units of {@code unit}
     * @param unit a {@code TimeUnit} determining how to interpret the timeout parameter
     * @return {@code true} if successful, or {@code false} if the specified waiting time elapses
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueClosedException if the queue is closed, including while waiting for space
     */
    boolean offer(T element, long timeout, TimeUnit unit) throws InterruptedException;
}
