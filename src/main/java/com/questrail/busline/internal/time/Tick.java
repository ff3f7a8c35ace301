package com.questrail.busline.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tick
 * =============================================================================
 * Periodic scheduling pulse owned by a server.
 *
 * <p>Server-spawned clients arm their channel bundlers on the <em>next</em>
 * pulse instead of on a private timer, so the flushes of many connections
 * happen together. Each registration fires at most once; a channel that keeps
 * receiving sends registers again for the following pulse.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Registration, cancellation and pulse delivery are guarded by one lock.
 * Registered tasks run outside the lock, in registration order.</p>
 */
public final class Tick
{
    private static final Logger log = LoggerFactory.getLogger(Tick.class);

    private final Duration interval;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    private final Object lock = new Object();
    private final List<Registration> pending = new ArrayList<>();

    private boolean running;
    private Cancellable nextPulse;
    private long pulses;

    public Tick(Duration interval, MonotonicClock clock, MonotonicScheduler scheduler)
    {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("tick interval must be > 0");
        }
    }

    /**
     * Starts pulsing. Idempotent.
     */
    public void start()
    {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            armNextPulse();
        }
    }

    /**
     * Stops pulsing and discards all pending registrations.
     */
    public void stop()
    {
        synchronized (lock) {
            running = false;
            if (nextPulse != null) {
                nextPulse.cancel();
                nextPulse = null;
            }
            pending.clear();
        }
    }

    /**
     * Registers a one-shot task for the next pulse.
     *
     * @return handle that removes the registration if it has not fired yet
     */
    public Cancellable onNextTick(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        Registration registration = new Registration(task);
        synchronized (lock) {
            pending.add(registration);
        }
        return registration;
    }

    public Duration interval()
    {
        return interval;
    }

    public long pulseCount()
    {
        synchronized (lock) {
            return pulses;
        }
    }

    public int pendingCount()
    {
        synchronized (lock) {
            return pending.size();
        }
    }

    private void armNextPulse()
    {
        nextPulse = scheduler.scheduleAfter(interval, clock, this::pulse);
    }

    private void pulse()
    {
        final List<Registration> due;
        synchronized (lock) {
            if (!running) {
                return;
            }
            pulses++;
            due = new ArrayList<>(pending);
            pending.clear();
            armNextPulse();
        }

        for (Registration registration : due) {
            try {
                registration.task.run();
            } catch (RuntimeException e) {
                log.error("Tick task failed", e);
            }
        }
    }

    private final class Registration implements Cancellable
    {
        private final Runnable task;

        private Registration(Runnable task)
        {
            this.task = task;
        }

        @Override
        public boolean cancel()
        {
            synchronized (lock) {
                return pending.remove(this);
            }
        }
    }
}
