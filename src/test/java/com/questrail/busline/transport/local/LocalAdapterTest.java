package com.questrail.busline.transport.local;

import com.questrail.busline.BusContext;
import com.questrail.busline.Client;
import com.questrail.busline.Server;
import com.questrail.busline.codec.Encoder;
import com.questrail.busline.codec.EncoderRegistry;
import com.questrail.busline.codec.Frame;
import com.questrail.busline.codec.impl.JacksonEncoder;
import com.questrail.busline.config.ClientOptions;
import com.questrail.busline.config.ServerOptions;
import com.questrail.busline.observability.NullObservabilitySink;
import com.questrail.busline.time.DeterministicScheduler;
import com.questrail.busline.time.ManualMonotonicClock;
import com.questrail.busline.transport.AdapterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalAdapterTest {

    private final List<byte[]> encoded = new ArrayList<>();
    private final List<byte[]> decoded = new ArrayList<>();

    private BusContext context;

    @BeforeEach
    void setUp() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        JacksonEncoder json = JacksonEncoder.json();

        EncoderRegistry encoders = new EncoderRegistry();
        encoders.register("spy", new Encoder() {
            @Override
            public byte[] encode(Frame frame) {
                byte[] bytes = json.encode(frame);
                encoded.add(bytes);
                return bytes;
            }

            @Override
            public Optional<Frame> decode(byte[] payload) {
                decoded.add(payload);
                return json.decode(payload);
            }
        });

        AdapterRegistry adapters = new AdapterRegistry();
        adapters.register("local", new LocalAdapter());

        context = new BusContext(adapters, encoders, clock, new DeterministicScheduler(clock),
            () -> Instant.EPOCH, NullObservabilitySink.INSTANCE);
    }

    private static ClientOptions options(int port) {
        return ClientOptions.builder()
            .withHostname("bus")
            .withPort(port)
            .withAdapter("local")
            .withEncoder("spy")
            .build();
    }

    private static ServerOptions serverOptions(int port) {
        return ServerOptions.builder().withClientOptions(options(port)).withTick(Duration.ZERO).build();
    }

    @Test
    void payloadIsHandedOverWithoutCopy() {
        new Server(serverOptions(9000), context).listen().subscribe("c", packet -> {});
        Client client = new Client(options(9000), context).use();

        client.sendNow("c", "x");

        assertEquals(1, encoded.size());
        assertEquals(1, decoded.size());
        assertSame(encoded.get(0), decoded.get(0));
    }

    @Test
    void portZeroAssignsDistinctEphemeralPorts() {
        Server first = new Server(serverOptions(0), context).listen();
        Server second = new Server(serverOptions(0), context).listen();

        int firstPort = ((InetSocketAddress) first.localAddress()).getPort();
        int secondPort = ((InetSocketAddress) second.localAddress()).getPort();

        assertTrue(firstPort >= 49152);
        assertNotEquals(firstPort, secondPort);
    }

    @Test
    void connectingWithoutServerLeavesClientDisconnected() {
        Client client = new Client(options(9001), context).use();

        assertFalse(client.isConnected());
        assertSame(client, client.sendNow("c", "dropped"));
        assertTrue(decoded.isEmpty());
    }

    @Test
    void disconnectIsIdempotent() {
        new Server(serverOptions(9002), context).listen();
        Client client = new Client(options(9002), context).use();

        client.destroy();

        assertDoesNotThrow(client::destroy);
        assertFalse(client.isConnected());
    }
}
