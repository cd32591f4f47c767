package org.batchflow.pipeline.services;

import org.batchflow.junit.extensions.logging.ExpectLog;
import org.batchflow.junit.extensions.logging.LogWatchExtension;
import org.batchflow.pipeline.api.services.IService;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.batchflow.junit.extensions.logging.LogLevel.ERROR;
import static org.batchflow.junit.extensions.logging.LogLevel.WARN;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AbstractServiceTest {

    /**
     * Waits on a latch until stop is requested, or ignores the request when {@code stubborn}.
     */
    private static class TestService extends AbstractService {
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final AtomicInteger stopHookCalls = new AtomicInteger();
        private final AtomicInteger terminatedCalls = new AtomicInteger();
        private final boolean stubborn;
        private final RuntimeException failure;

        TestService(boolean stubborn, RuntimeException failure) {
            super("test-service", Duration.ofMillis(100));
            this.stubborn = stubborn;
            this.failure = failure;
        }

        @Override
        protected void onStopRequested() {
            stopHookCalls.incrementAndGet();
            stopSignal.countDown();
        }

        @Override
        protected void run() throws InterruptedException {
            if (failure != null) {
                throw failure;
            }
            if (stubborn) {
                Thread.sleep(Long.MAX_VALUE);
            }
            stopSignal.await();
        }

        @Override
        protected void onTerminated() {
            terminatedCalls.incrementAndGet();
        }

        void fail(String code) {
            recordError(code, "failure", "details");
        }
    }

    @Test
    void startsAndStopsCooperatively() throws InterruptedException {
        TestService service = new TestService(false, null);
        assertThat(service.getCurrentState()).isEqualTo(IService.State.CREATED);

        service.start();
        assertThat(service.getCurrentState()).isEqualTo(IService.State.RUNNING);

        service.stop();
        assertThat(service.awaitTermination(Duration.ofSeconds(1))).isTrue();
        assertThat(service.getCurrentState()).isEqualTo(IService.State.STOPPED);
        assertThat(service.terminatedCalls.get()).isEqualTo(1);
    }

    @Test
    void secondStartIsRejected() {
        TestService service = new TestService(false, null);
        service.start();
        try {
            assertThatThrownBy(service::start).isInstanceOf(IllegalStateException.class);
        } finally {
            service.stop();
        }
    }

    @Test
    void stopHookRunsOnce() {
        TestService service = new TestService(false, null);
        service.start();

        service.requestStop();
        service.requestStop();
        service.stop();

        assertThat(service.stopHookCalls.get()).isEqualTo(1);
    }

    @Test
    void stopBeforeStartMovesToStopped() {
        TestService service = new TestService(false, null);
        service.stop();

        assertThat(service.getCurrentState()).isEqualTo(IService.State.STOPPED);
        assertThatThrownBy(service::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "test-service did not stop within 100 ms, interrupting")
    void stuckServiceIsInterrupted() {
        TestService service = new TestService(true, null);
        service.start();

        service.stop();

        assertThat(service.getCurrentState()).isEqualTo(IService.State.STOPPED);
    }

    @Test
    @ExpectLog(level = ERROR, messagePattern = "test-service stopped with ERROR due to IllegalStateException: broken invariant")
    void escapingExceptionMovesToError() {
        TestService service = new TestService(false, new IllegalStateException("broken invariant"));
        service.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> service.getCurrentState() == IService.State.ERROR);
        assertThat(service.isHealthy()).isFalse();
        assertThat(service.terminatedCalls.get()).isEqualTo(1);
    }

    @Test
    void recordedErrorsAffectHealthAndMetrics() {
        TestService service = new TestService(false, null);
        service.fail("ITEM_DROPPED");

        assertThat(service.isHealthy()).isFalse();
        assertThat(service.getErrors()).singleElement()
            .satisfies(error -> assertThat(error.errorType()).isEqualTo("ITEM_DROPPED"));
        assertThat(service.getMetrics()).containsEntry("error_count", 1);

        service.clearErrors();
        assertThat(service.isHealthy()).isTrue();
    }
}
