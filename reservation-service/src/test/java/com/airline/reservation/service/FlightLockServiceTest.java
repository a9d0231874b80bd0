package com.airline.reservation.service;

import com.airline.reservation.service.lock.LockOperations.LockAcquisitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FlightLockService")
class FlightLockServiceTest {

    @Test
    @DisplayName("runs actions for one flight one at a time")
    void serializesSameFlight() throws Exception {
        FlightLockService lockService = new FlightLockService(5000);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(4);

        Runnable task = () -> lockService.executeWithLock("F-1", () -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            sleep(20);
            inside.decrementAndGet();
            return null;
        });
        for (int i = 0; i < 8; i++) {
            executor.submit(task);
        }
        executor.shutdown();

        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("fails with a retryable error when the wait times out")
    void timesOut() throws Exception {
        FlightLockService lockService = new FlightLockService(50);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<?> holder = executor.submit(() -> lockService.executeWithLock("F-1", () -> {
            locked.countDown();
            await(release);
            return null;
        }));
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> lockService.executeWithLock("F-1", () -> "never"))
                    .isInstanceOf(LockAcquisitionException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "LOCK_TIMEOUT")
                    .hasFieldOrPropertyWithValue("retryable", true);

            assertThat(lockService.executeWithLock("F-2", () -> "other flight")).isEqualTo("other flight");
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("waits for running flight actions before an exclusive action")
    void exclusiveWaitsForFlightActions() throws Exception {
        FlightLockService lockService = new FlightLockService(50);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<?> holder = executor.submit(() -> lockService.executeWithLock("F-1", () -> {
            locked.countDown();
            await(release);
            return null;
        }));
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> lockService.executeExclusive(() -> "snapshot"))
                    .isInstanceOf(LockAcquisitionException.class);
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            executor.shutdown();
        }

        assertThat(lockService.executeExclusive(() -> "snapshot")).isEqualTo("snapshot");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
