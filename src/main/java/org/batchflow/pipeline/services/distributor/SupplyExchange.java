package org.batchflow.pipeline.services.distributor;

import org.batchflow.pipeline.api.contracts.Batch;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.batchflow.pipeline.resources.queues.InMemoryBlockingQueue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rendezvous between distributor workers and external supply callers.
 * <p>
 * A worker holding a batch advertises it as an {@link Offer} on a shared queue and parks until the
 * offer is claimed. A supply caller takes the oldest advertised offer and claims it. Each offer is
 * removed from the queue by exactly one caller, and the claim itself is a compare-and-set against
 * a concurrent withdrawal. A batch therefore reaches at most one caller and is never lost between
 * the two sides. Callers are served first come, first served.
 * <p>
 * Every worker has at most one outstanding offer, so the advertisement queue is sized to the
 * worker pool and advertising never blocks.
 *
 * @param <T> The payload type.
 */
public class SupplyExchange<T> {

    private final InMemoryBlockingQueue<Offer<T>> advertisements;

    public SupplyExchange(String name, int workerPoolSize) {
        this.advertisements = new InMemoryBlockingQueue<>(name, workerPoolSize);
    }

    /**
     * Advertises a batch and waits until a supply caller has claimed it.
     *
     * @param batch the batch to hand over
     * @throws InterruptedException if interrupted before the batch was claimed; the offer is withdrawn
     *                              and the caller still owns the batch
     * @throws QueueClosedException if the exchange was closed
     */
    public void advertise(Batch<T> batch) throws InterruptedException {
        Offer<T> offer = new Offer<>(batch);
        advertisements.put(offer);
        try {
            offer.awaitClaim();
        } catch (InterruptedException e) {
            if (offer.withdraw()) {
                throw e;
            }
            // Claimed concurrently with the interrupt; the batch is delivered.
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Blocks until a batch can be claimed.
     *
     * @return the claimed batch
     * @throws InterruptedException if interrupted while waiting
     * @throws QueueClosedException if the exchange is closed and nothing is advertised
     */
    public Batch<T> request() throws InterruptedException {
        while (true) {
            Offer<T> offer = advertisements.take();
            if (offer.claim()) {
                return offer.batch;
            }
        }
    }

    /**
     * Waits up to {@code timeout} for a batch to claim.
     *
     * @param timeout maximum wait
     * @return the claimed batch, or empty if none was available in time or the exchange is closed
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Batch<T>> request(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<Offer<T>> offer;
            try {
                offer = advertisements.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            } catch (QueueClosedException e) {
                return Optional.empty();
            }
            if (offer.isEmpty()) {
                return Optional.empty();
            }
            if (offer.get().claim()) {
                return Optional.of(offer.get().batch);
            }
        }
    }

    /**
     * Closes the exchange once no worker will advertise again. Waiting callers wake up.
     */
    public void close() {
        advertisements.close();
    }

    public boolean isClosed() {
        return advertisements.isClosed();
    }

    /**
     * @return number of batches currently advertised and waiting for a caller
     */
    public int getWaitingCount() {
        return advertisements.size();
    }

    /**
     * One worker's advertised batch. Moves from OPEN to either CLAIMED or WITHDRAWN, exactly once.
     */
    static final class Offer<T> {
        private static final int OPEN = 0;
        private static final int CLAIMED = 1;
        private static final int WITHDRAWN = 2;

        private final Batch<T> batch;
        private final AtomicInteger state = new AtomicInteger(OPEN);
        private final CountDownLatch claimed = new CountDownLatch(1);

        Offer(Batch<T> batch) {
            this.batch = batch;
        }

        boolean claim() {
            if (state.compareAndSet(OPEN, CLAIMED)) {
                claimed.countDown();
                return true;
            }
            return false;
        }

        boolean withdraw() {
            return state.compareAndSet(OPEN, WITHDRAWN);
        }

        void awaitClaim() throws InterruptedException {
            claimed.await();
        }
    }
}
