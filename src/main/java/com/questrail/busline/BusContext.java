package com.questrail.busline;

import com.questrail.busline.codec.EncoderRegistry;
import com.questrail.busline.internal.time.MonotonicClock;
import com.questrail.busline.internal.time.MonotonicScheduler;
import com.questrail.busline.internal.time.WallClock;
import com.questrail.busline.observability.BusObservabilitySink;
import com.questrail.busline.transport.AdapterRegistry;

import java.util.Objects;

/**
 * Shared collaborators for every client and server of one bus: the two
 * registries, the time sources and the observability sink.
 *
 * <p>{@code BusRuntime} builds the production context; tests build one around
 * a deterministic scheduler.</p>
 */
public record BusContext(
    AdapterRegistry adapters,
    EncoderRegistry encoders,
    MonotonicClock clock,
    MonotonicScheduler scheduler,
    WallClock wallClock,
    BusObservabilitySink observabilitySink
) {
    public BusContext {
        Objects.requireNonNull(adapters, "adapters");
        Objects.requireNonNull(encoders, "encoders");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }
}
