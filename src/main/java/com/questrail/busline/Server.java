package com.questrail.busline;

import com.questrail.busline.api.ClientListener;
import com.questrail.busline.api.PacketHandler;
import com.questrail.busline.api.ServerListener;
import com.questrail.busline.config.BundlerOptions;
import com.questrail.busline.config.ServerOptions;
import com.questrail.busline.internal.time.Tick;
import com.questrail.busline.observability.BusErrorEvent;
import com.questrail.busline.transport.Adapter;
import com.questrail.busline.transport.TransportSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server
 * =============================================================================
 * Listening side of the bus. Every accepted socket is adopted into a
 * server-spawned {@link Client} that shares this server's {@link Tick}.
 *
 * <p>Server-level subscriptions are attached to every current connection and
 * to each later one as it is accepted. A server-spawned client that loses its
 * connection is destroyed and removed; it is never reconnected.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   new Server(options, context)   → validates adapter/encoder names
 *   server.listen()                → starts the tick, binds through the adapter
 *   server.stop()                  → stops the tick, destroys connections,
 *                                    releases the listening resources
 * </pre>
 */
public final class Server
{
    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private final ServerOptions options;
    private final BusContext context;
    private final Adapter adapter;
    private final Tick tick;

    private final List<Client> connections = new CopyOnWriteArrayList<>();
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final List<ServerListener> listeners = new CopyOnWriteArrayList<>();

    private volatile SocketAddress localAddress;

    /**
     * @throws com.questrail.busline.error.ConfigurationException if the adapter
     *         or encoder name is not registered
     */
    public Server(ServerOptions options, BusContext context)
    {
        this.options = Objects.requireNonNull(options, "options");
        this.context = Objects.requireNonNull(context, "context");

        this.adapter = context.adapters().require(options.client().adapter());
        context.encoders().require(options.client().encoder());

        this.tick = options.tickEnabled()
            ? new Tick(options.tick(), context.clock(), context.scheduler())
            : null;
    }

    /**
     * Starts accepting connections.
     */
    public Server listen()
    {
        if (localAddress != null) {
            return this;
        }
        if (tick != null) {
            tick.start();
        }
        try {
            localAddress = adapter.listen(this);
        } catch (RuntimeException e) {
            if (tick != null) {
                tick.stop();
            }
            throw e;
        }
        log.info("Listening on {}://{}", options.client().adapter(), localAddress);
        return this;
    }

    /**
     * Adopts a socket accepted by the adapter.
     *
     * @return the server-spawned client bound to {@code socket}
     */
    public Client handleConnection(TransportSocket socket)
    {
        Objects.requireNonNull(socket, "socket");

        Client client = new Client(options.client(), context, tick, true);
        for (Subscription subscription : subscriptions.values()) {
            subscription.applyTo(client);
        }
        client.addListener(new ClientListener() {
            @Override
            public void onDisconnect() {
                connections.remove(client);
                client.destroy();
            }
        });

        connections.add(client);
        client.use(socket);

        for (ServerListener listener : listeners) {
            try {
                listener.onConnection(client);
            } catch (RuntimeException e) {
                log.error("Server listener failed", e);
            }
        }
        return client;
    }

    /**
     * Listening-side error signal. Never throws.
     */
    public void handleError(Throwable err)
    {
        if (err == null) {
            return;
        }
        context.observabilitySink().onError(
            new BusErrorEvent(context.wallClock().now(), "server", String.valueOf(err.getMessage()), err));
        for (ServerListener listener : listeners) {
            try {
                listener.onError(err);
            } catch (RuntimeException e) {
                log.error("Server listener failed", e);
            }
        }
    }

    public Server subscribe(String name, PacketHandler handler)
    {
        return subscribe(name, handler, null);
    }

    /**
     * Subscribes {@code handler} on every current and future connection.
     */
    public Server subscribe(String name, PacketHandler handler, BundlerOptions.Overrides overrides)
    {
        Objects.requireNonNull(name, "name");
        Subscription subscription = subscriptions.computeIfAbsent(name, n -> new Subscription(n, overrides));
        if (handler != null) {
            subscription.handlers.add(handler);
        }
        for (Client client : connections) {
            client.subscribe(name, handler, subscription.overrides);
        }
        return this;
    }

    public Server unsubscribe(String name, PacketHandler handler)
    {
        Subscription subscription = name == null ? null : subscriptions.get(name);
        if (subscription != null) {
            subscription.handlers.remove(handler);
        }
        for (Client client : connections) {
            client.unsubscribe(name, handler);
        }
        return this;
    }

    /**
     * Queues {@code payload} on the named channel of every connection.
     */
    public Server broadcast(String name, Object payload)
    {
        for (Client client : connections) {
            client.send(name, payload);
        }
        return this;
    }

    /**
     * Stops the tick, destroys every connection and releases the listening
     * resources.
     */
    public void stop()
    {
        log.info("Stopping server on {}", localAddress);
        if (tick != null) {
            tick.stop();
        }
        for (Client client : connections) {
            client.destroy();
        }
        connections.clear();
        if (localAddress != null) {
            adapter.stop(this);
            localAddress = null;
        }
    }

    public Server addListener(ServerListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public Server removeListener(ServerListener listener)
    {
        listeners.remove(listener);
        return this;
    }

    public List<Client> connections()
    {
        return new ArrayList<>(connections);
    }

    public ServerOptions options()
    {
        return options;
    }

    public Optional<Tick> tick()
    {
        return Optional.ofNullable(tick);
    }

    /**
     * @return the bound address, or {@code null} when not listening
     */
    public SocketAddress localAddress()
    {
        return localAddress;
    }

    private static final class Subscription
    {
        private final String name;
        private final BundlerOptions.Overrides overrides;
        private final List<PacketHandler> handlers = new CopyOnWriteArrayList<>();

        private Subscription(String name, BundlerOptions.Overrides overrides)
        {
            this.name = name;
            this.overrides = overrides;
        }

        private void applyTo(Client client)
        {
            client.subscribe(name, null, overrides);
            for (PacketHandler handler : handlers) {
                client.subscribe(name, handler, overrides);
            }
        }
    }
}
