package com.questrail.busline;

import com.questrail.busline.api.ClientListener;
import com.questrail.busline.api.PacketHandler;
import com.questrail.busline.codec.Encoder;
import com.questrail.busline.codec.Frame;
import com.questrail.busline.config.BundlerOptions;
import com.questrail.busline.config.ClientOptions;
import com.questrail.busline.error.HandlerException;
import com.questrail.busline.error.TransportException;
import com.questrail.busline.internal.time.Cancellable;
import com.questrail.busline.internal.time.Tick;
import com.questrail.busline.observability.BatchStatsEvent;
import com.questrail.busline.observability.BusErrorEvent;
import com.questrail.busline.observability.BusObservabilitySink;
import com.questrail.busline.observability.ConnectionEvent;
import com.questrail.busline.observability.DroppedFrameEvent;
import com.questrail.busline.transport.Adapter;
import com.questrail.busline.transport.TransportSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Client
 * -----------------------------------------------------------------------------
 * One logical connection: a socket plus the named channels multiplexed over it.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   send(name, payload)
 *        → Channel queue
 *            → bundler expiry (timer, or server tick)
 *                → Encoder.encode(Frame)
 *                    → Adapter.send
 * </pre>
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   Adapter bytes
 *        → handleRequest
 *            → Encoder.decode
 *                → Channel.handleData (fan-out to handlers)
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <p>Unknown adapter or encoder names fail construction with a
 * {@code ConfigurationException}. After that nothing is thrown to callers:
 * send-family methods always return this client, transport and encoding
 * failures go to {@link ClientListener#onError(Throwable)}, and undecodable or
 * misaddressed frames are dropped.</p>
 *
 * <h2>Threading model</h2>
 * <p>Channel creation is atomic per name. Each channel serializes its own
 * state; the socket reference is volatile and swapped by the lifecycle
 * callbacks. Listeners run on the thread reporting the transition.</p>
 */
public final class Client
{
    private static final Logger log = LoggerFactory.getLogger(Client.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String id;
    private final ClientOptions options;
    private final Adapter adapter;
    private final Encoder encoder;
    private final BusContext context;
    private final BusObservabilitySink sink;

    // Present only for server-spawned clients.
    private final Tick tick;
    private final boolean fromServer;

    private final ConcurrentMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final List<ClientListener> listeners = new CopyOnWriteArrayList<>();
    private final ChannelOwner owner = new ChannelOwner();

    private volatile TransportSocket socket;

    /**
     * Creates a self-initiated client. Call {@link #use()} to open its socket.
     *
     * @throws com.questrail.busline.error.ConfigurationException if the adapter
     *         or encoder name is not registered
     */
    public Client(ClientOptions options, BusContext context)
    {
        this(options, context, null, false);
    }

    Client(ClientOptions options, BusContext context, Tick tick, boolean fromServer)
    {
        this.options = Objects.requireNonNull(options, "options");
        this.context = Objects.requireNonNull(context, "context");

        // Resolve before any channel or socket work.
        this.adapter = context.adapters().require(options.adapter());
        this.encoder = context.encoders().require(options.encoder());

        this.sink = context.observabilitySink();
        this.tick = tick;
        this.fromServer = fromServer;

        byte[] token = new byte[20];
        RANDOM.nextBytes(token);
        this.id = HexFormat.of().formatHex(token);

        options.channels().forEach(this::subscribe);
    }

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    public Client subscribe(String name)
    {
        return subscribe(name, null, null);
    }

    public Client subscribe(String name, PacketHandler handler)
    {
        return subscribe(name, handler, null);
    }

    /**
     * Creates the named channel if absent and attaches {@code handler}.
     *
     * <p>{@code overrides} only take effect when the channel is created; a
     * later subscription to the same name reuses the existing channel.</p>
     */
    public Client subscribe(String name, PacketHandler handler, BundlerOptions.Overrides overrides)
    {
        Channel channel = channelFor(name, overrides);
        if (handler != null) {
            channel.addHandler(handler);
        }
        return this;
    }

    /**
     * Removes {@code handler} from the named channel. No-op if the channel does
     * not exist.
     */
    public Client unsubscribe(String name, PacketHandler handler)
    {
        Channel channel = name == null ? null : channels.get(name);
        if (channel != null) {
            channel.removeHandler(handler);
        }
        return this;
    }

    public Optional<Channel> channel(String name)
    {
        return Optional.ofNullable(name == null ? null : channels.get(name));
    }

    public Set<String> channelNames()
    {
        return new TreeSet<>(channels.keySet());
    }

    private Channel channelFor(String name, BundlerOptions.Overrides overrides)
    {
        Objects.requireNonNull(name, "name");
        return channels.computeIfAbsent(name, n -> {
            log.debug("new {} channel {}://{}:{}/{}",
                fromServer ? "server" : "client",
                options.adapter(), options.hostname(), options.port(), n);
            return new Channel(n, options.bundler().mergedWith(overrides), owner);
        });
    }

    // -------------------------------------------------------------------------
    // Sending
    // -------------------------------------------------------------------------

    /**
     * Queues {@code payload} on the named channel for the next batch.
     */
    public Client send(String name, Object payload)
    {
        channelFor(name, null).send(payload);
        return this;
    }

    /**
     * Replaces whatever is queued on the named channel with {@code payload}.
     */
    public Client sendOnce(String name, Object payload)
    {
        channelFor(name, null).sendOnce(payload);
        return this;
    }

    /**
     * Transmits {@code payload} immediately as a single-packet batch.
     */
    public Client sendNow(String name, Object payload)
    {
        channelFor(name, null).sendNow(payload);
        return this;
    }

    // -------------------------------------------------------------------------
    // Socket lifecycle
    // -------------------------------------------------------------------------

    /**
     * Opens a new socket through the adapter.
     */
    public Client use()
    {
        return use(null);
    }

    /**
     * Replaces the current socket. The previous one, if any, is disconnected
     * first; then {@code existing} is adopted (or a new socket opened when
     * {@code existing} is null).
     */
    public Client use(TransportSocket existing)
    {
        TransportSocket previous = socket;
        if (previous != null) {
            log.debug("disconnecting current socket of {}", id);
            adapter.disconnect(this);
        }

        TransportSocket created = adapter.createSocket(this, existing);
        // The adapter may already have reported the connect synchronously.
        TransportSocket current = socket;
        if (current == null || current == previous) {
            socket = created;
        }
        return this;
    }

    /**
     * Socket error signal. Never throws.
     */
    public void handleError(Throwable err)
    {
        if (err == null) {
            return;
        }
        log.debug("error on {}: {}", id, err.getMessage());

        sink.onError(new BusErrorEvent(context.wallClock().now(), id, String.valueOf(err.getMessage()), err));
        for (ClientListener listener : listeners) {
            try {
                listener.onError(err);
            } catch (RuntimeException e) {
                reportListenerFailure(e);
            }
        }
    }

    /**
     * Connect signal. Channels still holding queued packets restart their
     * bundlers once the listeners have been notified.
     */
    public void handleConnect(TransportSocket connected)
    {
        this.socket = Objects.requireNonNull(connected, "connected");
        log.debug("{} connection established ({})", fromServer ? "server" : "client", id);

        sink.onConnectionEvent(new ConnectionEvent(
            context.wallClock().now(), id, fromServer, ConnectionEvent.Kind.CONNECTED));
        for (ClientListener listener : listeners) {
            try {
                listener.onConnect(connected);
            } catch (RuntimeException e) {
                reportListenerFailure(e);
            }
        }

        for (Channel channel : channels.values()) {
            if (channel.pendingCount() > 0) {
                channel.startBundler();
            }
        }
    }

    /**
     * Disconnect signal. Sends keep queueing until the next connect.
     */
    public void handleDisconnect()
    {
        log.warn("{} connection lost ({})", fromServer ? "server" : "client", id);
        this.socket = null;

        sink.onConnectionEvent(new ConnectionEvent(
            context.wallClock().now(), id, fromServer, ConnectionEvent.Kind.DISCONNECTED));
        for (ClientListener listener : listeners) {
            try {
                listener.onDisconnect();
            } catch (RuntimeException e) {
                reportListenerFailure(e);
            }
        }
    }

    /**
     * Disconnect signal for a specific socket. Ignored when {@code lost} is no
     * longer the current socket (e.g. the late close of a socket replaced by
     * {@link #use(TransportSocket)}).
     */
    public void handleDisconnect(TransportSocket lost)
    {
        TransportSocket current = socket;
        if (current == null || current != lost) {
            return;
        }
        handleDisconnect();
    }

    /**
     * Inbound payload. Routed to the named channel, or dropped when it cannot
     * be decoded or names an unknown channel.
     */
    public void handleRequest(byte[] payload)
    {
        int size = payload == null ? 0 : payload.length;

        Optional<Frame> decoded;
        try {
            decoded = encoder.decode(payload);
        } catch (RuntimeException e) {
            log.debug("Encoder '{}' failed to decode {} bytes", options.encoder(), size, e);
            decoded = Optional.empty();
        }
        if (decoded.isEmpty()) {
            sink.onFrameDropped(new DroppedFrameEvent(
                context.wallClock().now(), id, size, DroppedFrameEvent.Reason.MALFORMED));
            return;
        }

        Frame frame = decoded.get();
        Channel channel = channels.get(frame.channel());
        if (channel == null) {
            sink.onFrameDropped(new DroppedFrameEvent(
                context.wallClock().now(), id, size, DroppedFrameEvent.Reason.UNKNOWN_CHANNEL));
            return;
        }
        channel.handleData(frame.packets());
    }

    /**
     * Disconnects, clears the socket and cancels every bundler, then notifies
     * {@link ClientListener#onDestroy()}. Queued packets are kept.
     */
    public void destroy()
    {
        try {
            adapter.disconnect(this);
        } catch (RuntimeException e) {
            handleError(new TransportException("Disconnect failed", e));
        }
        socket = null;
        for (Channel channel : channels.values()) {
            channel.resetBundler();
        }

        for (ClientListener listener : listeners) {
            try {
                listener.onDestroy();
            } catch (RuntimeException e) {
                reportListenerFailure(e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Listeners and accessors
    // -------------------------------------------------------------------------

    public Client addListener(ClientListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public Client removeListener(ClientListener listener)
    {
        listeners.remove(listener);
        return this;
    }

    public String id()
    {
        return id;
    }

    public ClientOptions options()
    {
        return options;
    }

    public boolean isFromServer()
    {
        return fromServer;
    }

    public Optional<Tick> tick()
    {
        return Optional.ofNullable(tick);
    }

    /**
     * @return the current socket, or {@code null} while disconnected
     */
    public TransportSocket socket()
    {
        return socket;
    }

    public boolean isConnected()
    {
        TransportSocket s = socket;
        return s != null && s.isOpen();
    }

    private void reportListenerFailure(RuntimeException failure)
    {
        log.error("Client listener failed on {}", id, failure);
        sink.onError(new BusErrorEvent(context.wallClock().now(), id, "Listener failed", failure));
    }

    // -------------------------------------------------------------------------
    // Channel owner
    // -------------------------------------------------------------------------

    private final class ChannelOwner implements Channel.Owner
    {
        @Override
        public Cancellable armBundler(Duration every, Runnable flush)
        {
            if (tick != null) {
                return tick.onNextTick(flush);
            }
            return context.scheduler().scheduleAfter(every, context.clock(), flush);
        }

        @Override
        public boolean canTransmit()
        {
            return isConnected();
        }

        @Override
        public void transmit(String channel, List<Object> packets)
        {
            final byte[] payload;
            try {
                payload = encoder.encode(new Frame(channel, packets));
            } catch (RuntimeException e) {
                handleError(e);
                return;
            }

            TransportSocket target = socket;
            boolean open = target != null && target.isOpen();
            try {
                adapter.send(target, payload);
            } catch (RuntimeException e) {
                handleError(new TransportException("Send failed on channel '" + channel + "'", e));
                return;
            }

            if (open && options.stats()) {
                sink.onBatch(new BatchStatsEvent(
                    context.wallClock().now(), id, channel, packets.size(), payload.length));
            }
        }

        @Override
        public void reportHandlerFailure(String channel, PacketHandler handler, RuntimeException failure)
        {
            HandlerException wrapped = new HandlerException(channel, failure);
            log.warn("{}", wrapped.getMessage(), failure);
            sink.onError(new BusErrorEvent(context.wallClock().now(), id, wrapped.getMessage(), wrapped));
        }
    }
}
