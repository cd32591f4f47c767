package org.batchflow.pipeline.services.distributor;

import org.batchflow.junit.extensions.logging.ExpectLog;
import org.batchflow.junit.extensions.logging.ExpectLogs;
import org.batchflow.junit.extensions.logging.LogWatchExtension;
import org.batchflow.pipeline.PipelineConfig;
import org.batchflow.pipeline.PipelineCounters;
import org.batchflow.pipeline.api.contracts.Batch;
import org.batchflow.pipeline.api.contracts.FlushTrigger;
import org.batchflow.pipeline.api.contracts.TaggedItem;
import org.batchflow.pipeline.api.observation.IObservationSink;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.batchflow.junit.extensions.logging.LogLevel.WARN;
import static org.batchflow.pipeline.PipelineOptions.withWorkerPoolSize;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class BatchDistributorTest {

    private PipelineCounters counters;
    private IObservationSink sink;
    private BatchDistributor<String> distributor;

    @BeforeEach
    void setUp() {
        counters = new PipelineCounters();
        sink = mock(IObservationSink.class);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (distributor != null) {
            distributor.shutdown(ShutdownSignal.CANCEL);
            // Release workers still parked on unpulled batches.
            while (distributor.requestSupply(Duration.ofMillis(20)).isPresent()) {
                // discard
            }
        }
    }

    private BatchDistributor<String> createDistributor(int workers) {
        distributor = new BatchDistributor<>("test-distributor", PipelineConfig.of(withWorkerPoolSize(workers)), counters, sink);
        return distributor;
    }

    private static Batch<String> batch(long sequence) {
        return new Batch<>(sequence, List.of(new TaggedItem<>(sequence, "p" + sequence)), 10, FlushTrigger.COUNT, 0, 0);
    }

    @Test
    @Timeout(10)
    void deliversEveryAcceptedBatchThenTerminatesOnCancel() throws Exception {
        createDistributor(2).start();
        for (long i = 1; i <= 5; i++) {
            assertThat(distributor.accept(batch(i))).isTrue();
        }

        List<Long> received = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            received.add(distributor.requestSupply().sequence());
        }
        distributor.shutdown(ShutdownSignal.CANCEL);

        assertThat(received).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
        distributor.terminationFuture().get(2, TimeUnit.SECONDS);
        assertThatThrownBy(distributor::requestSupply).isInstanceOf(QueueClosedException.class);
        await().atMost(2, TimeUnit.SECONDS).until(() -> counters.batchesDelivered() == 5);
        verify(sink, times(5)).info(eq("distributor.accept"), anyMap());
    }

    @Test
    @Timeout(10)
    void cancelStillDeliversQueuedBatches() throws Exception {
        createDistributor(2).start();
        for (long i = 1; i <= 4; i++) {
            distributor.accept(batch(i));
        }

        distributor.shutdown(ShutdownSignal.CANCEL);

        List<Long> received = new ArrayList<>();
        Optional<Batch<String>> next;
        while ((next = distributor.requestSupply(Duration.ofSeconds(1))).isPresent()) {
            received.add(next.get().sequence());
        }
        assertThat(received).containsExactlyInAnyOrder(1L, 2L, 3L, 4L);
        distributor.terminationFuture().get(2, TimeUnit.SECONDS);
        assertThat(counters.droppedBatches()).isZero();
        verify(sink).warn(eq("distributor.shutdown"), anyMap());
    }

    @Test
    @Timeout(10)
    @ExpectLogs({
        @ExpectLog(level = WARN, messagePattern = "test-distributor dropped batch 3 .*"),
        @ExpectLog(level = WARN, messagePattern = "test-distributor dropped batch 4 .*")
    })
    void quitDropsUnroutedBatchesAndDeliversWorkerQueue() throws Exception {
        createDistributor(1).start();
        distributor.accept(batch(1));
        await().atMost(2, TimeUnit.SECONDS).until(() -> distributor.getMetrics().get("supply_waiting").intValue() == 1);
        distributor.accept(batch(2));
        await().atMost(2, TimeUnit.SECONDS).until(() -> distributor.getMetrics().get("worker_queue_size").intValue() == 1);
        // 3 is held by the routing thread (worker queue full), 4 waits in the inbox
        distributor.accept(batch(3));
        distributor.accept(batch(4));

        distributor.shutdown(ShutdownSignal.QUIT);

        List<Long> received = new ArrayList<>();
        Optional<Batch<String>> next;
        while ((next = distributor.requestSupply(Duration.ofMillis(500))).isPresent()) {
            received.add(next.get().sequence());
        }
        assertThat(received).containsExactlyInAnyOrder(1L, 2L);
        distributor.terminationFuture().get(2, TimeUnit.SECONDS);
        assertThat(counters.batchesDelivered()).isEqualTo(2);
        assertThat(counters.droppedBatches()).isEqualTo(2);
        assertThat(distributor.getErrors()).extracting(e -> e.errorType()).containsOnly("BATCH_DROPPED");
    }

    @Test
    @Timeout(10)
    void quitLetsWorkersDrainEveryQueuedBatch() throws Exception {
        createDistributor(2).start();
        for (long i = 1; i <= 4; i++) {
            distributor.accept(batch(i));
        }
        await().atMost(2, TimeUnit.SECONDS).until(() ->
            distributor.getMetrics().get("supply_waiting").intValue() == 2
                && distributor.getMetrics().get("worker_queue_size").intValue() == 2);

        distributor.shutdown(ShutdownSignal.QUIT);

        List<Long> received = new ArrayList<>();
        Optional<Batch<String>> next;
        while ((next = distributor.requestSupply(Duration.ofMillis(500))).isPresent()) {
            received.add(next.get().sequence());
        }
        assertThat(received).containsExactlyInAnyOrder(1L, 2L, 3L, 4L);
        distributor.terminationFuture().get(2, TimeUnit.SECONDS);
        assertThat(counters.droppedBatches()).isZero();
        assertThat(distributor.isHealthy()).isTrue();
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "test-distributor dropped batch 9 with 1 item\\(s\\): distributor is shut down")
    void acceptAfterShutdownReportsDrop() throws InterruptedException {
        createDistributor(1).start();
        distributor.shutdown(ShutdownSignal.CANCEL);

        assertThat(distributor.accept(batch(9))).isFalse();

        assertThat(counters.droppedBatches()).isEqualTo(1);
        assertThat(counters.droppedItems()).isEqualTo(1);
        assertThat(distributor.isHealthy()).isFalse();
        verify(sink).warn(eq("distributor.dropped"), anyMap());
    }

    @Test
    void secondShutdownIsIgnored() {
        createDistributor(1).start();

        distributor.shutdown(ShutdownSignal.CANCEL);
        distributor.shutdown(ShutdownSignal.QUIT);

        assertThat(distributor.getShutdownSignal()).contains(ShutdownSignal.CANCEL);
        verify(sink, times(1)).warn(eq("distributor.shutdown"), anyMap());
    }

    @Test
    void shutdownBeforeStartTerminatesImmediately() {
        createDistributor(3);

        distributor.shutdown(ShutdownSignal.CANCEL);

        assertThat(distributor.terminationFuture()).isCompleted();
    }

    @Test
    @Timeout(20)
    void concurrentPullersReceiveEachBatchAtMostOnce() throws Exception {
        int batches = 200;
        createDistributor(4).start();
        ConcurrentLinkedQueue<Long> received = new ConcurrentLinkedQueue<>();
        AtomicInteger pulled = new AtomicInteger();
        ExecutorService pullers = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < 8; p++) {
            futures.add(pullers.submit(() -> {
                while (pulled.get() < batches) {
                    Optional<Batch<String>> batch = distributor.requestSupply(Duration.ofMillis(20));
                    if (batch.isPresent()) {
                        received.add(batch.get().sequence());
                        pulled.incrementAndGet();
                    }
                }
                return null;
            }));
        }

        for (long i = 1; i <= batches; i++) {
            distributor.accept(batch(i));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pullers.shutdown();

        assertThat(received).hasSize(batches);
        assertThat(new HashSet<>(received)).hasSize(batches);
        await().atMost(2, TimeUnit.SECONDS)
            .until(() -> distributor.getMetrics().get("batches_delivered").longValue() == batches);
    }
}
