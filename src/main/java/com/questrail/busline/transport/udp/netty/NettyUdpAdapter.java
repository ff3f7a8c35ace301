package com.questrail.busline.transport.udp.netty;

import com.questrail.busline.Client;
import com.questrail.busline.Server;
import com.questrail.busline.error.TransportException;
import com.questrail.busline.transport.Adapter;
import com.questrail.busline.transport.TransportSocket;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpAdapter
 * =============================================================================
 * Netty-backed datagram transport. One encoded frame travels in one datagram.
 *
 * <h2>Client side</h2>
 * <p>A self-initiated client binds an ephemeral local port and addresses every
 * datagram to {@code hostname:port}. The client counts as connected as soon as
 * the local bind succeeds; UDP has no handshake.</p>
 *
 * <h2>Server side</h2>
 * <p>The listening channel keeps one session per remote sender. The first
 * datagram from an unknown sender opens a session and hands it to
 * {@link Server#handleConnection(TransportSocket)} before the datagram itself
 * is delivered. A session ends when the server disconnects it or stops, or,
 * with a positive {@code socketTimeout}, once no datagram has arrived from
 * its sender for that long. Expiry runs on the listening channel's event loop.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]} and all reference-counted buffers are released internally.
 */
public final class NettyUdpAdapter implements Adapter
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpAdapter.class);

    private final EventLoopGroup group;
    private final ConcurrentMap<Server, Listening> listening = new ConcurrentHashMap<>();

    public NettyUdpAdapter(EventLoopGroup group)
    {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public TransportSocket createSocket(Client client, TransportSocket existing)
    {
        if (existing != null) {
            Session session = (Session) existing;
            session.owner = client;
            if (session.isOpen()) {
                client.handleConnect(session);
            }
            return session;
        }

        InetSocketAddress remote = client.options().socketAddress();
        ClientSocket socket = new ClientSocket(remote, client);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new ClientInboundHandler(socket));
                    }
                });

        // Register first so the socket sees its channel before the bind completes.
        ChannelFuture registration = bootstrap.register();
        Channel channel = registration.channel();
        socket.channel = channel;

        registration.addListener((ChannelFutureListener) registered -> {
            if (!registered.isSuccess()) {
                client.handleError(new TransportException("Failed to register UDP channel", registered.cause()));
                return;
            }
            channel.bind(new InetSocketAddress(0)).addListener((ChannelFutureListener) bound -> {
                if (bound.isSuccess()) {
                    client.handleConnect(socket);
                }
                else {
                    client.handleError(new TransportException("Failed to bind UDP socket for " + remote, bound.cause()));
                }
            });
        });
        return socket;
    }

    @Override
    public void send(TransportSocket socket, byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        if (socket instanceof ClientSocket c && c.isOpen()) {
            c.channel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), c.remote));
        }
        else if (socket instanceof Session s && s.isOpen()) {
            s.channel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), s.remote));
        }
    }

    @Override
    public void disconnect(Client client)
    {
        TransportSocket socket = client.socket();
        if (socket instanceof ClientSocket c) {
            Channel ch = c.channel;
            if (ch != null) {
                ch.close();
            }
        }
        else if (socket instanceof Session s) {
            closeSession(s);
        }
    }

    @Override
    public SocketAddress listen(Server server)
    {
        Listening state = new Listening(server.options().client().socketTimeout());
        InetSocketAddress bindAddress = server.options().client().socketAddress();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new ServerInboundHandler(server, state));
                    }
                });

        ChannelFuture bound = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            throw new TransportException("Failed to bind " + bindAddress, bound.cause());
        }
        state.channel = bound.channel();
        listening.put(server, state);
        return bound.channel().localAddress();
    }

    @Override
    public void stop(Server server)
    {
        Listening state = listening.remove(server);
        if (state == null) {
            return;
        }
        for (Session session : state.sessions.values()) {
            closeSession(session);
        }
        state.channel.close().awaitUninterruptibly();
    }

    private void closeSession(Session session)
    {
        if (session.open.compareAndSet(true, false)) {
            ScheduledFuture<?> expiry = session.expiry;
            if (expiry != null) {
                expiry.cancel(false);
            }
            session.sessions.remove(session.remote, session);
            Client owner = session.owner;
            if (owner != null) {
                owner.handleDisconnect(session);
            }
        }
    }

    private static byte[] copy(ByteBuf content)
    {
        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);
        return bytes;
    }

    // -------------------------------------------------------------------------
    // Sockets
    // -------------------------------------------------------------------------

    private static final class ClientSocket implements TransportSocket
    {
        private final InetSocketAddress remote;
        private final Client client;
        private volatile Channel channel;

        private ClientSocket(InetSocketAddress remote, Client client)
        {
            this.remote = remote;
            this.client = client;
        }

        @Override
        public boolean isOpen()
        {
            Channel ch = channel;
            return ch != null && ch.isActive();
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return remote;
        }

        @Override
        public String toString()
        {
            return "udp://" + remote;
        }
    }

    /**
     * Server-side view of one remote sender on the shared listening channel.
     */
    private static final class Session implements TransportSocket
    {
        private final InetSocketAddress remote;
        private final Channel channel;
        private final Map<SocketAddress, Session> sessions;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private volatile Client owner;
        private volatile long lastReadNanos = System.nanoTime();
        private volatile ScheduledFuture<?> expiry;

        private Session(InetSocketAddress remote, Channel channel, Map<SocketAddress, Session> sessions)
        {
            this.remote = remote;
            this.channel = channel;
            this.sessions = sessions;
        }

        @Override
        public boolean isOpen()
        {
            return open.get() && channel.isActive();
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return remote;
        }

        @Override
        public String toString()
        {
            return "udp-session://" + remote;
        }
    }

    private static final class Listening
    {
        private final Map<SocketAddress, Session> sessions = new ConcurrentHashMap<>();
        private final long idleNanos;
        private volatile Channel channel;

        private Listening(Duration idleTimeout)
        {
            this.idleNanos = idleTimeout.toNanos();
        }
    }

    // -------------------------------------------------------------------------
    // Handlers
    // -------------------------------------------------------------------------

    private static final class ClientInboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final ClientSocket socket;

        private ClientInboundHandler(ClientSocket socket)
        {
            this.socket = socket;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            // Copy the payload into a plain byte[] (Netty containment rule).
            socket.client.handleRequest(copy(packet.content()));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            socket.client.handleDisconnect(socket);
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            socket.client.handleError(new TransportException("UDP socket failure", cause));
        }
    }

    /**
     * ServerInboundHandler
     * -------------------------------------------------------------------------
     * Demultiplexes datagrams on the listening channel into per-sender
     * sessions. Runs on the channel's single event loop thread, so session
     * creation needs no further coordination.
     */
    private final class ServerInboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final Server server;
        private final Listening state;

        private ServerInboundHandler(Server server, Listening state)
        {
            this.server = server;
            this.state = state;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            InetSocketAddress sender = packet.sender();
            byte[] bytes = copy(packet.content());

            Session session = state.sessions.get(sender);
            if (session == null) {
                session = new Session(sender, ctx.channel(), state.sessions);
                state.sessions.put(sender, session);
                log.debug("New UDP session from {}", sender);
                if (state.idleNanos > 0) {
                    scheduleExpiry(ctx, session, state.idleNanos);
                }
                server.handleConnection(session);
            }
            else {
                session.lastReadNanos = System.nanoTime();
            }

            Client owner = session.owner;
            if (owner != null && session.isOpen()) {
                owner.handleRequest(bytes);
            }
        }

        private void scheduleExpiry(ChannelHandlerContext ctx, Session session, long delayNanos)
        {
            session.expiry = ctx.executor().schedule(() -> {
                if (!session.open.get()) {
                    return;
                }
                long remaining = state.idleNanos - (System.nanoTime() - session.lastReadNanos);
                if (remaining <= 0) {
                    log.debug("Closing idle UDP session {}", session.remote);
                    closeSession(session);
                }
                else {
                    scheduleExpiry(ctx, session, remaining);
                }
            }, delayNanos, TimeUnit.NANOSECONDS);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            for (Session session : state.sessions.values()) {
                closeSession(session);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // A datagram socket survives per-packet failures; keep listening.
            server.handleError(new TransportException("UDP listener failure", cause));
        }
    }
}
