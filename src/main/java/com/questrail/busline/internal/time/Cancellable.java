package com.questrail.busline.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for an armed bundler timer or a tick registration.
 *
 * <p>
 * Implemented by the executor-backed scheduler, by {@link Tick} registrations
 * and by the deterministic test scheduler.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
