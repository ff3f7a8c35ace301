package com.questrail.busline.config;

import java.time.Duration;
import java.util.Objects;

/**
 * BundlerOptions
 * -----------------------------------------------------------------------------
 * Batching parameters for a channel.
 *
 * <ul>
 *   <li><b>every</b> is the interval between the first queued send and the flush of
 *       the whole queue as one frame.</li>
 *   <li><b>maxPackets</b> is the queue length at which a {@code send} flushes
 *       immediately instead of waiting for the interval.</li>
 * </ul>
 *
 * <p>Client-level options provide the defaults; a channel may override any
 * field through {@link Overrides} at subscription time.</p>
 */
public record BundlerOptions(
        Duration every,
        int maxPackets
) {
    public static final Duration DEFAULT_EVERY = Duration.ofMillis(16);
    public static final int DEFAULT_MAX_PACKETS = 2048;

    public BundlerOptions {
        Objects.requireNonNull(every, "every");

        if (every.isNegative()) {
            throw new IllegalArgumentException("every must be non-negative");
        }
        if (maxPackets < 1) {
            throw new IllegalArgumentException("maxPackets must be >= 1");
        }
    }

    public static BundlerOptions defaults() {
        return new BundlerOptions(DEFAULT_EVERY, DEFAULT_MAX_PACKETS);
    }

    public static BundlerOptions every(Duration every) {
        return new BundlerOptions(every, DEFAULT_MAX_PACKETS);
    }

    /**
     * Layers per-channel overrides on top of these options.
     */
    public BundlerOptions mergedWith(Overrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new BundlerOptions(
                overrides.every() != null ? overrides.every() : every,
                overrides.maxPackets() != null ? overrides.maxPackets() : maxPackets
        );
    }

    public static Overrides.Builder overrides() {
        return new Overrides.Builder();
    }

    /**
     * Per-channel overrides; {@code null} fields inherit the client default.
     */
    public record Overrides(Duration every, Integer maxPackets) {

        public static Overrides none() {
            return new Overrides(null, null);
        }

        public static final class Builder {
            private Duration every;
            private Integer maxPackets;

            public Builder every(Duration every) {
                this.every = every;
                return this;
            }

            public Builder maxPackets(int maxPackets) {
                this.maxPackets = maxPackets;
                return this;
            }

            public Overrides build() {
                return new Overrides(every, maxPackets);
            }
        }
    }
}
