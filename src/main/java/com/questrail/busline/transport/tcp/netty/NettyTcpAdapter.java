package com.questrail.busline.transport.tcp.netty;

import com.questrail.busline.Client;
import com.questrail.busline.Server;
import com.questrail.busline.error.TransportException;
import com.questrail.busline.transport.Adapter;
import com.questrail.busline.transport.TransportSocket;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.AttributeKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpAdapter
 * =============================================================================
 * Netty-backed stream transport.
 *
 * <h2>Framing</h2>
 * <p>Each payload is written with a 4-byte big-endian length prefix
 * ({@link LengthFieldPrepender}); the receiving pipeline reassembles complete
 * payloads ({@link LengthFieldBasedFrameDecoder}) before they reach the
 * client. Payloads above {@link #MAX_FRAME_BYTES} close the connection.</p>
 *
 * <h2>Idle timeout</h2>
 * <p>A positive {@code socketTimeout} installs an {@link IdleStateHandler};
 * a connection with no inbound bytes for that long is closed.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; sockets are exposed only as {@link TransportSocket}.
 *
 * <h2>Event loop ownership</h2>
 * <p>The {@link EventLoopGroup} is supplied by the composition root, which
 * also shuts it down. This adapter only closes the channels it opened.</p>
 */
public final class NettyTcpAdapter implements Adapter
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpAdapter.class);

    static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MS = 5000;

    private static final AttributeKey<Client> CLIENT = AttributeKey.valueOf("busline.tcp.client");
    private static final AttributeKey<TcpSocket> SOCKET = AttributeKey.valueOf("busline.tcp.socket");

    private final EventLoopGroup group;
    private final ConcurrentMap<Server, Channel> listening = new ConcurrentHashMap<>();

    public NettyTcpAdapter(EventLoopGroup group)
    {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public TransportSocket createSocket(Client client, TransportSocket existing)
    {
        if (existing != null) {
            TcpSocket adopted = (TcpSocket) existing;
            adopted.channel.attr(CLIENT).set(client);
            if (adopted.isOpen()) {
                client.handleConnect(adopted);
            }
            return adopted;
        }

        Duration timeout = client.options().socketTimeout();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        configurePipeline(ch.pipeline(), timeout, new InboundHandler());
                    }
                });

        // Register first so the attributes are in place before connect events fire.
        ChannelFuture registration = bootstrap.register();
        Channel channel = registration.channel();
        TcpSocket socket = new TcpSocket(channel);
        channel.attr(CLIENT).set(client);
        channel.attr(SOCKET).set(socket);

        registration.addListener((ChannelFutureListener) registered -> {
            if (!registered.isSuccess()) {
                client.handleError(new TransportException("Failed to register TCP channel", registered.cause()));
                return;
            }
            channel.connect(client.options().socketAddress()).addListener((ChannelFutureListener) connected -> {
                if (!connected.isSuccess()) {
                    client.handleError(new TransportException(
                            "Failed to connect to " + client.options().socketAddress(), connected.cause()));
                    channel.close();
                }
            });
        });
        return socket;
    }

    @Override
    public void send(TransportSocket socket, byte[] payload)
    {
        if (!(socket instanceof TcpSocket tcp) || !tcp.isOpen()) {
            return;
        }
        tcp.channel.writeAndFlush(Unpooled.wrappedBuffer(payload));
    }

    @Override
    public void disconnect(Client client)
    {
        if (client.socket() instanceof TcpSocket tcp) {
            tcp.channel.close();
        }
    }

    @Override
    public SocketAddress listen(Server server)
    {
        Duration timeout = server.options().client().socketTimeout();
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        configurePipeline(ch.pipeline(), timeout, new AcceptedHandler(server));
                    }
                });

        ChannelFuture bound = bootstrap.bind(server.options().client().socketAddress()).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            throw new TransportException("Failed to bind " + server.options().client().socketAddress(), bound.cause());
        }
        listening.put(server, bound.channel());
        return bound.channel().localAddress();
    }

    @Override
    public void stop(Server server)
    {
        Channel channel = listening.remove(server);
        if (channel != null) {
            channel.close().awaitUninterruptibly();
        }
    }

    private static void configurePipeline(ChannelPipeline p, Duration timeout, ChannelHandler handler)
    {
        if (!timeout.isZero()) {
            p.addLast(new IdleStateHandler(timeout.toMillis(), 0, 0, TimeUnit.MILLISECONDS));
        }
        p.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME_BYTES, 0, 4, 0, 4));
        p.addLast(new LengthFieldPrepender(4));
        p.addLast(handler);
    }

    /**
     * TcpSocket
     * -------------------------------------------------------------------------
     * {@link TransportSocket} view of a Netty channel.
     */
    private static final class TcpSocket implements TransportSocket
    {
        private final Channel channel;

        private TcpSocket(Channel channel)
        {
            this.channel = channel;
        }

        @Override
        public boolean isOpen()
        {
            return channel.isActive();
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return channel.remoteAddress();
        }

        @Override
        public String toString()
        {
            return "tcp://" + channel.remoteAddress();
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards complete payloads and lifecycle transitions to the client bound
     * to the channel.
     */
    private static class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            Client client = ctx.channel().attr(CLIENT).get();
            if (client != null) {
                client.handleConnect(ctx.channel().attr(SOCKET).get());
            }
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            Client client = ctx.channel().attr(CLIENT).get();
            if (client == null) {
                return;
            }

            // Copy out of the reference-counted buffer (Netty containment rule).
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            client.handleRequest(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            Client client = ctx.channel().attr(CLIENT).get();
            if (client != null) {
                client.handleDisconnect(ctx.channel().attr(SOCKET).get());
            }
            super.channelInactive(ctx);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent) {
                log.debug("Closing idle connection {}", ctx.channel().remoteAddress());
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            Client client = ctx.channel().attr(CLIENT).get();
            if (client != null) {
                client.handleError(new TransportException("TCP connection failure", cause));
            } else {
                log.warn("TCP connection failure on unbound channel", cause);
            }
            ctx.close();
        }
    }

    /**
     * Server-side variant: adopts the channel into a server-spawned client as
     * soon as it becomes active.
     */
    private static final class AcceptedHandler extends InboundHandler
    {
        private final Server server;

        private AcceptedHandler(Server server)
        {
            this.server = server;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            TcpSocket socket = new TcpSocket(ctx.channel());
            ctx.channel().attr(SOCKET).set(socket);
            // Binds CLIENT and reports the connect through createSocket(client, socket).
            server.handleConnection(socket);
            ctx.fireChannelActive();
        }
    }
}
