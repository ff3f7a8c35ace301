package com.questrail.busline.config;

import com.questrail.busline.api.PacketHandler;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client-level configuration.
 *
 * <p>Built-in defaults are applied by {@link Builder}; per-channel bundler
 * overrides are layered on top at subscription time.</p>
 */
public record ClientOptions(
    String hostname,
    int port,
    String adapter,
    String encoder,
    BundlerOptions bundler,
    boolean stats,
    Duration socketTimeout,
    Map<String, PacketHandler> channels
) {
    public static final String DEFAULT_HOSTNAME = "0.0.0.0";
    public static final int DEFAULT_PORT = 3000;
    public static final String DEFAULT_ADAPTER = "tcp";
    public static final String DEFAULT_ENCODER = "json";
    public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(30);

    public ClientOptions {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(bundler, "bundler");
        Objects.requireNonNull(socketTimeout, "socketTimeout");
        Objects.requireNonNull(channels, "channels");

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535");
        }
        if (socketTimeout.isNegative()) {
            throw new IllegalArgumentException("socketTimeout must be non-negative");
        }
        channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    /**
     * Resolved address of {@code hostname:port}, for connect and bind.
     */
    public InetSocketAddress socketAddress() {
        return new InetSocketAddress(hostname, port);
    }

    public static ClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
            .withHostname(hostname)
            .withPort(port)
            .withAdapter(adapter)
            .withEncoder(encoder)
            .withBundler(bundler)
            .withStats(stats)
            .withSocketTimeout(socketTimeout);
        channels.forEach(b::withChannel);
        return b;
    }

    public static final class Builder {
        private String hostname = DEFAULT_HOSTNAME;
        private int port = DEFAULT_PORT;
        private String adapter = DEFAULT_ADAPTER;
        private String encoder = DEFAULT_ENCODER;
        private BundlerOptions bundler = BundlerOptions.defaults();
        private boolean stats = false;
        private Duration socketTimeout = DEFAULT_SOCKET_TIMEOUT;
        private final Map<String, PacketHandler> channels = new LinkedHashMap<>();

        public Builder withHostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withAdapter(String adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder withEncoder(String encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder withBundler(BundlerOptions bundler) {
            this.bundler = bundler;
            return this;
        }

        public Builder withStats(boolean stats) {
            this.stats = stats;
            return this;
        }

        public Builder withSocketTimeout(Duration socketTimeout) {
            this.socketTimeout = socketTimeout;
            return this;
        }

        /**
         * Subscribes {@code handler} to {@code name} when the client is created.
         */
        public Builder withChannel(String name, PacketHandler handler) {
            channels.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(hostname, port, adapter, encoder, bundler, stats, socketTimeout, channels);
        }
    }
}
