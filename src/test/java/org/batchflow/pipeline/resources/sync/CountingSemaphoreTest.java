package org.batchflow.pipeline.resources.sync;

import org.batchflow.junit.extensions.logging.ExpectLog;
import org.batchflow.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.batchflow.junit.extensions.logging.LogLevel.ERROR;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CountingSemaphoreTest {

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new CountingSemaphore(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquireAndReleaseTrackPermits() throws InterruptedException {
        CountingSemaphore semaphore = new CountingSemaphore(3);

        semaphore.acquire();
        semaphore.acquire(2);
        assertThat(semaphore.availablePermits()).isZero();

        semaphore.release(2);
        assertThat(semaphore.availablePermits()).isEqualTo(2);
        semaphore.release();
        assertThat(semaphore.availablePermits()).isEqualTo(semaphore.capacity());
    }

    @Test
    void tryAcquireTimesOutWhenExhausted() throws InterruptedException {
        CountingSemaphore semaphore = new CountingSemaphore(1);
        assertThat(semaphore.tryAcquire(10, TimeUnit.MILLISECONDS)).isTrue();
        assertThat(semaphore.tryAcquire(20, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    void acquireOfMoreThanCapacityIsRejected() {
        CountingSemaphore semaphore = new CountingSemaphore(2);
        assertThatThrownBy(() -> semaphore.acquire(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Timeout(5)
    void lockWaitsForEveryHolderAndExcludesAcquirers() throws Exception {
        CountingSemaphore semaphore = new CountingSemaphore(4);
        semaphore.acquire();

        CompletableFuture<Void> locker = CompletableFuture.runAsync(() -> {
            try {
                semaphore.lock();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread.sleep(50);
        assertThat(locker).isNotDone();

        semaphore.release();
        locker.get(2, TimeUnit.SECONDS);
        assertThat(semaphore.availablePermits()).isZero();
        assertThat(semaphore.tryAcquire(20, TimeUnit.MILLISECONDS)).isFalse();

        semaphore.unlock();
        assertThat(semaphore.availablePermits()).isEqualTo(4);
    }

    @Test
    @Timeout(5)
    void waitingLockIsNotOvertakenBySingleAcquirers() throws Exception {
        CountingSemaphore semaphore = new CountingSemaphore(2);
        semaphore.acquire();

        CompletableFuture<Void> locker = CompletableFuture.runAsync(() -> {
            try {
                semaphore.lock();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread.sleep(50);

        // One permit is free, but the locker arrived first
        assertThat(semaphore.availablePermits()).isEqualTo(1);
        assertThat(semaphore.tryAcquire(50, TimeUnit.MILLISECONDS)).isFalse();

        semaphore.release();
        locker.get(2, TimeUnit.SECONDS);
        assertThat(semaphore.availablePermits()).isZero();
        semaphore.unlock();
    }

    @Test
    @ExpectLog(level = ERROR, loggerPattern = ".*CountingSemaphore", messagePattern = "Semaphore over-release.*")
    void overReleaseFailsAndLeavesCountUntouched() {
        CountingSemaphore semaphore = new CountingSemaphore(2);

        assertThatThrownBy(semaphore::release).isInstanceOf(IllegalStateException.class);
        assertThat(semaphore.availablePermits()).isEqualTo(2);
    }
}
