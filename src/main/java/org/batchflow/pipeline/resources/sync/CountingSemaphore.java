package org.batchflow.pipeline.resources.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded counting semaphore whose capacity is fixed at construction.
 * <p>
 * The pipeline sizes it from {@code maxItems} and uses {@link #lock()} / {@link #unlock()},
 * which take and return every permit, to make its drain-then-close region mutually exclusive
 * with concurrent stop requests. It is backed by a fair {@link Semaphore}, so waiters are served in
 * arrival order: a thread waiting in {@link #lock()} is not overtaken by later single-permit
 * acquirers.
 * <p>
 * The semaphore is not re-entrant: a thread holding all permits that calls {@link #lock()}
 * again blocks forever. Releasing more permits than are outstanding is a protocol violation
 * and fails with {@link IllegalStateException}; the permit count is left unchanged.
 */
public class CountingSemaphore {

    private static final Logger log = LoggerFactory.getLogger(CountingSemaphore.class);

    private final int capacity;
    private final Semaphore permits;
    // Serializes the over-release check with the release itself
    private final ReentrantLock releaseLock = new ReentrantLock();

    /**
     * @param capacity number of permits, must be positive
     * @throws IllegalArgumentException if capacity is not positive
     */
    public CountingSemaphore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Semaphore capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Blocks until the requested number of permits is available and takes them.
     *
     * @param permits number of permits, between 1 and {@link #capacity()}
     * @throws InterruptedException if interrupted while waiting
     */
    public void acquire(int permits) throws InterruptedException {
        checkPermits(permits);
        this.permits.acquire(permits);
    }

    /**
     * Takes one permit, waiting at most the given time.
     *
     * @return {@code true} if a permit was acquired
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
        return permits.tryAcquire(timeout, unit);
    }

    public void release() {
        release(1);
    }

    /**
     * Returns permits to the semaphore.
     *
     * @param permits number of permits to return
     * @throws IllegalStateException if this would raise the count above capacity
     */
    public void release(int permits) {
        checkPermits(permits);
        releaseLock.lock();
        try {
            int available = this.permits.availablePermits();
            if (available + permits > capacity) {
                log.error("Semaphore over-release: releasing {} permit(s) with {} of {} already available",
                    permits, available, capacity);
                throw new IllegalStateException(String.format(
                    "Cannot release %d permit(s): %d of %d are already available", permits, available, capacity));
            }
            this.permits.release(permits);
        } finally {
            releaseLock.unlock();
        }
    }

    /**
     * Takes every permit, excluding all other holders.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void lock() throws InterruptedException {
        acquire(capacity);
    }

    /**
     * Returns every permit taken by {@link #lock()}.
     */
    public void unlock() {
        release(capacity);
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int capacity() {
        return capacity;
    }

    private void checkPermits(int permits) {
        if (permits < 1 || permits > capacity) {
            throw new IllegalArgumentException(
                "Permit count must be between 1 and " + capacity + ", was " + permits);
        }
    }
}
