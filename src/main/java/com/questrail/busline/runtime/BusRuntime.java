package com.questrail.busline.runtime;

import com.questrail.busline.BusContext;
import com.questrail.busline.Client;
import com.questrail.busline.Server;
import com.questrail.busline.api.ClientListener;
import com.questrail.busline.codec.Encoder;
import com.questrail.busline.codec.EncoderRegistry;
import com.questrail.busline.config.ClientOptions;
import com.questrail.busline.config.ServerOptions;
import com.questrail.busline.internal.time.MonotonicClock;
import com.questrail.busline.internal.time.MonotonicScheduler;
import com.questrail.busline.internal.time.ScheduledExecutorScheduler;
import com.questrail.busline.internal.time.SystemMonotonicClock;
import com.questrail.busline.internal.time.SystemWallClock;
import com.questrail.busline.observability.BusObservabilitySink;
import com.questrail.busline.observability.Slf4jBusObservabilitySink;
import com.questrail.busline.transport.Adapter;
import com.questrail.busline.transport.AdapterRegistry;
import com.questrail.busline.transport.TransportSocket;
import com.questrail.busline.transport.local.LocalAdapter;
import com.questrail.busline.transport.tcp.netty.NettyTcpAdapter;
import com.questrail.busline.transport.udp.netty.NettyUdpAdapter;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * BusRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production bus.
 *
 * <p>Owns the scheduler executor and the Netty event loop group, registers the
 * {@code tcp}, {@code udp} and {@code local} adapters and the {@code json} and
 * {@code cbor} encoders, and keeps track of the clients and servers it creates
 * so that {@link #stop()} can release everything in one call.</p>
 *
 * <p>No shutdown hook or signal handler is installed; the embedding process
 * decides when to call {@link #stop()}.</p>
 */
public final class BusRuntime
{
    private static final Logger log = LoggerFactory.getLogger(BusRuntime.class);

    private final BusContext context;
    private final ScheduledExecutorService schedulerExecutor;
    private final EventLoopGroup eventLoopGroup;

    private final CopyOnWriteArrayList<Client> clients = new CopyOnWriteArrayList<>();
    private final List<Server> servers = new CopyOnWriteArrayList<>();

    private BusRuntime(BusContext context, ScheduledExecutorService schedulerExecutor, EventLoopGroup eventLoopGroup)
    {
        this.context = context;
        this.schedulerExecutor = schedulerExecutor;
        this.eventLoopGroup = eventLoopGroup;
    }

    public BusContext context()
    {
        return context;
    }

    /**
     * Creates a client, registers {@code listeners} and opens its socket.
     * The runtime stops tracking the client once it is destroyed, and picks
     * it up again if it reconnects.
     *
     * @throws com.questrail.busline.error.ConfigurationException if the adapter
     *         or encoder name is not registered
     */
    public Client connect(ClientOptions options, ClientListener... listeners)
    {
        Client client = new Client(options, context);
        for (ClientListener listener : listeners) {
            client.addListener(listener);
        }
        client.addListener(new Tracking(client));
        clients.add(client);
        return client.use();
    }

    /**
     * Clients currently owned by this runtime.
     */
    public List<Client> clients()
    {
        return List.copyOf(clients);
    }

    /**
     * Creates a server and starts listening.
     */
    public Server listen(ServerOptions options)
    {
        Server server = new Server(options, context);
        server.listen();
        servers.add(server);
        return server;
    }

    /**
     * Stops every server, destroys every client, then shuts down the event
     * loop group and the scheduler executor. Blocks until both have
     * terminated or the grace period has elapsed.
     */
    public void stop()
    {
        log.info("Stopping bus runtime ({} servers, {} clients)", servers.size(), clients.size());

        for (Server server : servers) {
            server.stop();
        }
        servers.clear();
        for (Client client : clients) {
            client.destroy();
        }
        clients.clear();

        eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);

        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class Tracking implements ClientListener
    {
        private final Client client;

        private Tracking(Client client)
        {
            this.client = client;
        }

        @Override
        public void onConnect(TransportSocket socket)
        {
            clients.addIfAbsent(client);
        }

        @Override
        public void onDestroy()
        {
            clients.remove(client);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private BusObservabilitySink observabilitySink = new Slf4jBusObservabilitySink();
        private int ioThreads = 0;
        private final Map<String, Adapter> adapters = new LinkedHashMap<>();
        private final Map<String, Encoder> encoders = new LinkedHashMap<>();

        public Builder withObservabilitySink(BusObservabilitySink sink)
        {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Netty I/O threads; 0 lets Netty choose.
         */
        public Builder withIoThreads(int ioThreads)
        {
            if (ioThreads < 0) {
                throw new IllegalArgumentException("ioThreads must be >= 0");
            }
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Registers an additional adapter, or replaces a default one.
         */
        public Builder withAdapter(String name, Adapter adapter)
        {
            adapters.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(adapter, "adapter"));
            return this;
        }

        /**
         * Registers an additional encoder, or replaces a default one.
         */
        public Builder withEncoder(String name, Encoder encoder)
        {
            encoders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(encoder, "encoder"));
            return this;
        }

        public BusRuntime build()
        {
            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, r -> {
                Thread t = new Thread(r, "busline-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Transports
            EventLoopGroup group = new NioEventLoopGroup(ioThreads);
            AdapterRegistry adapterRegistry = new AdapterRegistry();
            adapterRegistry.register("tcp", new NettyTcpAdapter(group));
            adapterRegistry.register("udp", new NettyUdpAdapter(group));
            adapterRegistry.register("local", new LocalAdapter());
            adapters.forEach(adapterRegistry::register);

            // 3. Encoders
            EncoderRegistry encoderRegistry = EncoderRegistry.withDefaults();
            encoders.forEach(encoderRegistry::register);

            BusContext context = new BusContext(
                adapterRegistry,
                encoderRegistry,
                clock,
                scheduler,
                SystemWallClock.INSTANCE,
                observabilitySink
            );
            return new BusRuntime(context, schedulerExec, group);
        }
    }
}
