package org.batchflow.pipeline.resources.queues;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.batchflow.pipeline.api.resources.queues.IInputQueueResource;
import org.batchflow.pipeline.api.resources.queues.IOutputQueueResource;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.batchflow.pipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A thread-safe, in-memory, bounded queue resource with a one-shot close.
 * <p>
 * The queue connects two pipeline stages. Writers block while it is full, which is the
 * pipeline's backpressure. Closing the queue is how a stage tells the next one that no more
 * input will arrive:
 * <ul>
 *   <li>After {@link #close()}, every insertion throws {@link QueueClosedException}, including
 *       writers that were already blocked waiting for space.</li>
 *   <li>Readers keep receiving the elements that were queued before the close. Once the queue is
 *       empty, {@link #take()} and {@link #poll(long, TimeUnit)} throw {@link QueueClosedException}.</li>
 *   <li>{@link #close()} returns {@code true} only for the call that actually closed the queue, so
 *       concurrent or repeated closes are harmless.</li>
 * </ul>
 * The close flag and the element storage are guarded by the same lock. No element can slip in
 * after a reader has observed "closed and empty".
 *
 * @param <T> The type of elements held in this queue.
 */
public class InMemoryBlockingQueue<T> extends AbstractResource implements IInputQueueResource<T>, IOutputQueueResource<T> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBlockingQueue.class);

    private final int capacity;
    private final ArrayDeque<T> elements;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong dequeued = new AtomicLong();

    /**
     * Constructs an InMemoryBlockingQueue with the specified name and configuration.
     *
     * @param name    The name of the resource.
     * @param options Config with the queue option "capacity" (default 1000).
     * @throws IllegalArgumentException if the configuration is invalid (e.g., non-positive capacity).
     */
    public InMemoryBlockingQueue(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of("capacity", 1000));
        Config finalConfig = options.withFallback(defaults);
        try {
            this.capacity = finalConfig.getInt("capacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryBlockingQueue '" + name + "'", e);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive for resource '" + name + "'.");
        }
        this.elements = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Convenience constructor for a queue with the given capacity.
     *
     * @param name     The name of the resource.
     * @param capacity Maximum number of queued elements.
     */
    public InMemoryBlockingQueue(String name, int capacity) {
        this(name, ConfigFactory.parseMap(Map.of("capacity", capacity)));
    }

    @Override
    public boolean offer(T element) {
        checkNotNull(element);
        lock.lock();
        try {
            ensureOpen();
            if (elements.size() == capacity) {
                return false;
            }
            enqueue(element);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(T element) throws InterruptedException {
        checkNotNull(element);
        lock.lockInterruptibly();
        try {
            ensureOpen();
            while (elements.size() == capacity) {
                notFull.await();
                ensureOpen();
            }
            enqueue(element);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean offer(T element, long timeout, TimeUnit unit) throws InterruptedException {
        checkNotNull(element);
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            ensureOpen();
            while (elements.size() == capacity) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
                ensureOpen();
            }
            enqueue(element);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> poll() {
        lock.lock();
        try {
            return elements.isEmpty() ? Optional.empty() : Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (elements.isEmpty()) {
                if (closed) {
                    throw new QueueClosedException(resourceName);
                }
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (elements.isEmpty()) {
                if (closed) {
                    throw new QueueClosedException(resourceName);
                }
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        if (collection == null) {
            throw new NullPointerException("collection cannot be null");
        }
        lock.lock();
        try {
            int count = 0;
            while (count < maxElements && !elements.isEmpty()) {
                collection.add(dequeue());
                count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue for writers and wakes up every blocked reader and writer.
     *
     * @return {@code true} if this call closed the queue, {@code false} if it was already closed
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            log.debug("Queue '{}' closed with {} element(s) remaining", resourceName, elements.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return elements.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("capacity", capacity);
        metrics.put("current_size", size());
        metrics.put("enqueued_total", enqueued.get());
        metrics.put("dequeued_total", dequeued.get());
    }

    private void enqueue(T element) {
        elements.addLast(element);
        enqueued.incrementAndGet();
        notEmpty.signal();
    }

    private T dequeue() {
        T element = elements.pollFirst();
        dequeued.incrementAndGet();
        notFull.signal();
        return element;
    }

    private void ensureOpen() {
        if (closed) {
            throw new QueueClosedException(resourceName);
        }
    }

    private static void checkNotNull(Object element) {
        if (element == null) {
            throw new NullPointerException("queue elements cannot be null");
        }
    }
}
