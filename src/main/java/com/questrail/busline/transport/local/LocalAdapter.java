package com.questrail.busline.transport.local;

import com.questrail.busline.Client;
import com.questrail.busline.Server;
import com.questrail.busline.error.TransportException;
import com.questrail.busline.transport.Adapter;
import com.questrail.busline.transport.TransportSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LocalAdapter
 * =============================================================================
 * In-process transport. Servers are addressed by {@code hostname:port} within
 * one JVM; a connection is a pair of linked sockets.
 *
 * <h2>Delivery</h2>
 * <p>{@link #send(TransportSocket, byte[])} hands the very same byte array to
 * the peer client on the calling thread. There is no copy and no queue, which
 * also makes the transport fully deterministic under a manual scheduler.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Connecting to an address with no listening server reports a
 *       {@code TransportException} and leaves the client disconnected.</li>
 *   <li>Disconnecting either side closes both and notifies both clients.</li>
 * </ul>
 */
public final class LocalAdapter implements Adapter
{
    private static final Logger log = LoggerFactory.getLogger(LocalAdapter.class);
    private static final int FIRST_EPHEMERAL_PORT = 49152;

    private final ConcurrentMap<String, Server> servers = new ConcurrentHashMap<>();
    private final AtomicInteger nextEphemeral = new AtomicInteger(FIRST_EPHEMERAL_PORT);

    @Override
    public TransportSocket createSocket(Client client, TransportSocket existing)
    {
        if (existing != null) {
            LocalSocket adopted = (LocalSocket) existing;
            adopted.owner = client;
            client.handleConnect(adopted);
            return adopted;
        }

        InetSocketAddress address = InetSocketAddress.createUnresolved(
            client.options().hostname(), client.options().port());
        LocalSocket local = new LocalSocket(address);
        local.owner = client;

        Server server = servers.get(key(client.options().hostname(), client.options().port()));
        if (server == null) {
            local.open.set(false);
            client.handleError(new TransportException("No local server listening on " + address, null));
            return local;
        }

        LocalSocket remote = new LocalSocket(address);
        local.peer = remote;
        remote.peer = local;

        // The server side exists before the client can send into it.
        server.handleConnection(remote);
        client.handleConnect(local);
        return local;
    }

    @Override
    public void send(TransportSocket socket, byte[] payload)
    {
        if (!(socket instanceof LocalSocket local) || !local.isOpen()) {
            return;
        }
        LocalSocket peer = local.peer;
        if (peer == null || !peer.isOpen()) {
            return;
        }
        Client receiver = peer.owner;
        if (receiver != null) {
            receiver.handleRequest(payload);
        }
    }

    @Override
    public void disconnect(Client client)
    {
        if (!(client.socket() instanceof LocalSocket local)) {
            return;
        }
        close(local);
        LocalSocket peer = local.peer;
        if (peer != null) {
            close(peer);
        }
    }

    @Override
    public SocketAddress listen(Server server)
    {
        String hostname = server.options().client().hostname();
        int port = server.options().client().port();
        if (port == 0) {
            port = nextEphemeral.getAndIncrement();
        }

        Server previous = servers.putIfAbsent(key(hostname, port), server);
        if (previous != null && previous != server) {
            throw new TransportException("Local address already in use: " + key(hostname, port), null);
        }
        log.debug("Local server bound to {}", key(hostname, port));
        return InetSocketAddress.createUnresolved(hostname, port);
    }

    @Override
    public void stop(Server server)
    {
        servers.values().removeIf(s -> s == server);
    }

    private static void close(LocalSocket socket)
    {
        if (socket.open.compareAndSet(true, false)) {
            Client owner = socket.owner;
            if (owner != null) {
                owner.handleDisconnect(socket);
            }
        }
    }

    private static String key(String hostname, int port)
    {
        return hostname + ":" + port;
    }

    private static final class LocalSocket implements TransportSocket
    {
        private final SocketAddress address;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private volatile LocalSocket peer;
        private volatile Client owner;

        private LocalSocket(SocketAddress address)
        {
            this.address = address;
        }

        @Override
        public boolean isOpen()
        {
            return open.get();
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return address;
        }

        @Override
        public String toString()
        {
            return "local://" + address;
        }
    }
}
