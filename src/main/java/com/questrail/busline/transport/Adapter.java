package com.questrail.busline.transport;

import com.questrail.busline.Client;
import com.questrail.busline.Server;

import java.net.SocketAddress;

/**
 * Adapter
 * -----------------------------------------------------------------------------
 * Uniform transport contract. One adapter instance serves every client and
 * server that names it.
 *
 * <p>Adapters perform I/O only. They report what happens on a socket by calling
 * back into the owning client:</p>
 * <ul>
 *   <li>{@link Client#handleConnect(TransportSocket)} when a socket becomes usable</li>
 *   <li>{@link Client#handleDisconnect(TransportSocket)} when it is lost</li>
 *   <li>{@link Client#handleRequest(byte[])} for every complete inbound payload</li>
 *   <li>{@link Client#handleError(Throwable)} for socket-level failures</li>
 * </ul>
 *
 * <p>They never decode payloads, never schedule flushes and never retry.</p>
 */
public interface Adapter
{
    /**
     * Opens a socket for {@code client}, or adopts {@code existing} when the
     * socket was accepted by a server.
     *
     * @param client   the owning client
     * @param existing a server-accepted socket to bind to {@code client}; may be null
     * @return the socket handle; it may not be open yet
     */
    TransportSocket createSocket(Client client, TransportSocket existing);

    /**
     * Fire-and-forget transmission. A {@code null} or closed socket drops the payload.
     */
    void send(TransportSocket socket, byte[] payload);

    /**
     * Tears down the client's current socket. Idempotent.
     */
    void disconnect(Client client);

    /**
     * Starts accepting connections for {@code server}. Each accepted socket is
     * handed to {@link Server#handleConnection(TransportSocket)}.
     *
     * @return the bound local address
     */
    SocketAddress listen(Server server);

    /**
     * Releases the listening resources held for {@code server}. Returns once
     * they are released.
     */
    void stop(Server server);
}
