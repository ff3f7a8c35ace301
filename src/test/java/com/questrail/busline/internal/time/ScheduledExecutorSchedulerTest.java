package com.questrail.busline.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler and for a tick running on it.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void scheduleAfterRunsNoEarlierThanTheDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = System.nanoTime();
        long[] ranAfter = new long[1];

        scheduler.scheduleAfter(Duration.ofMillis(30), SystemMonotonicClock.INSTANCE, () -> {
            ranAfter[0] = System.nanoTime() - start;
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Task should execute");
        assertTrue(ranAfter[0] >= TimeUnit.MILLISECONDS.toNanos(30), "Task must not run early");
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.scheduleAfter(Duration.ofMillis(-5), SystemMonotonicClock.INSTANCE, () -> {}));
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
            () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(150);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
        Thread.sleep(20);
        assertFalse(handle.cancel(), "Cancel after execution should return false");
    }

    @Test
    void tickPulsesRepeatedlyOnRealScheduler() throws InterruptedException {
        Tick tick = new Tick(Duration.ofMillis(5), SystemMonotonicClock.INSTANCE, scheduler);
        CountDownLatch latch = new CountDownLatch(3);

        tick.start();
        tick.onNextTick(() -> {
            latch.countDown();
            tick.onNextTick(() -> {
                latch.countDown();
                tick.onNextTick(latch::countDown);
            });
        });

        try {
            assertTrue(latch.await(1, TimeUnit.SECONDS), "Three chained registrations should run");
            assertTrue(tick.pulseCount() >= 3);
        } finally {
            tick.stop();
        }
    }
}
