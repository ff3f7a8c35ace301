package com.questrail.busline.runtime;

import com.questrail.busline.Client;
import com.questrail.busline.Server;
import com.questrail.busline.config.ClientOptions;
import com.questrail.busline.config.ServerOptions;
import com.questrail.busline.error.ConfigurationException;
import com.questrail.busline.observability.BatchStatsEvent;
import com.questrail.busline.observability.RecordingObservabilitySink;
import com.questrail.busline.transport.RecordingAdapter;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BusRuntimeSmokeTest {

    @Test
    void defaultRegistriesAreInstalled() {
        BusRuntime runtime = BusRuntime.builder().build();
        try {
            assertEquals(Set.of("local", "tcp", "udp"), runtime.context().adapters().names());
            assertEquals(Set.of("cbor", "json"), runtime.context().encoders().names());
        } finally {
            runtime.stop();
        }
    }

    @Test
    void fullStackLifecycleOverLocalTransport() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        BusRuntime runtime = BusRuntime.builder().withObservabilitySink(sink).build();

        ClientOptions options = ClientOptions.builder()
            .withHostname("smoke")
            .withPort(0)
            .withAdapter("local")
            .withStats(true)
            .build();
        try {
            Server server = runtime.listen(ServerOptions.builder()
                .withClientOptions(options)
                .withTick(Duration.ofMillis(10))
                .build());
            int port = ((InetSocketAddress) server.localAddress()).getPort();

            CountDownLatch got = new CountDownLatch(1);
            server.subscribe("greeting", packet -> got.countDown());

            Client client = runtime.connect(options.toBuilder().withPort(port).build());
            client.send("greeting", "hello");

            assertTrue(got.await(2, TimeUnit.SECONDS), "Bundled packet should reach the server");
            // Stats are emitted once the transport has accepted the batch.
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (!sink.hasEventOfType(BatchStatsEvent.class) && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(sink.hasEventOfType(BatchStatsEvent.class));
        } finally {
            runtime.stop();
        }
    }

    @Test
    void customAdapterIsUsableAndUnknownNamesFailFast() {
        RecordingAdapter adapter = new RecordingAdapter();
        BusRuntime runtime = BusRuntime.builder().withAdapter("recording", adapter).build();
        try {
            Client client = runtime.connect(ClientOptions.builder().withAdapter("recording").build());
            assertTrue(client.isConnected());
            assertEquals(1, adapter.created().size());

            assertThrows(ConfigurationException.class,
                () -> runtime.connect(ClientOptions.builder().withAdapter("missing").build()));
            assertEquals(List.of(client), runtime.clients());
        } finally {
            runtime.stop();
        }
    }

    @Test
    void destroyedClientsAreReleasedUntilTheyReconnect() {
        RecordingAdapter adapter = new RecordingAdapter();
        BusRuntime runtime = BusRuntime.builder().withAdapter("recording", adapter).build();
        try {
            ClientOptions options = ClientOptions.builder().withAdapter("recording").build();
            Client kept = runtime.connect(options);
            Client dropped = runtime.connect(options);
            assertEquals(List.of(kept, dropped), runtime.clients());

            dropped.destroy();
            assertEquals(List.of(kept), runtime.clients());

            dropped.use();
            assertEquals(List.of(kept, dropped), runtime.clients());
        } finally {
            runtime.stop();
        }
        assertTrue(runtime.clients().isEmpty());
    }
}
