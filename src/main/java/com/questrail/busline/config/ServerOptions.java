package com.questrail.busline.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Server configuration: the options every server-spawned client is created
 * with, plus the tick interval that paces their bundlers.
 *
 * <p>A zero {@code tick} disables the shared pulse; server-spawned channels
 * then use their own bundler timers.</p>
 */
public record ServerOptions(
    ClientOptions client,
    Duration tick
) {
    public static final Duration DEFAULT_TICK = Duration.ofMillis(16);

    public ServerOptions {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(tick, "tick");

        if (tick.isNegative()) {
            throw new IllegalArgumentException("tick must be non-negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean tickEnabled() {
        return !tick.isZero();
    }

    public static final class Builder {
        private ClientOptions client = ClientOptions.defaults();
        private Duration tick = DEFAULT_TICK;

        public Builder withClientOptions(ClientOptions client) {
            this.client = client;
            return this;
        }

        public Builder withTick(Duration tick) {
            this.tick = tick;
            return this;
        }

        public ServerOptions build() {
            return new ServerOptions(client, tick);
        }
    }
}
