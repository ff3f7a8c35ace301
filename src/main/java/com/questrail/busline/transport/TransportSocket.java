package com.questrail.busline.transport;

import java.net.SocketAddress;

/**
 * TransportSocket
 * -----------------------------------------------------------------------------
 * Opaque handle for one live connection, created by an {@link Adapter}.
 *
 * <p>The core only asks whether the handle can currently carry bytes. Everything
 * else (framing, buffers, event loops) stays inside the adapter that created it.</p>
 */
public interface TransportSocket
{
    /**
     * @return {@code true} while the connection can transmit
     */
    boolean isOpen();

    /**
     * @return the peer address, or {@code null} if not known yet
     */
    SocketAddress remoteAddress();
}
