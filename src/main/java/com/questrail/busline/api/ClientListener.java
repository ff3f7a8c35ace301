package com.questrail.busline.api;

import com.questrail.busline.transport.TransportSocket;

/**
 * ClientListener
 * -----------------------------------------------------------------------------
 * Observer for the lifecycle signals of a {@code Client}.
 *
 * <p>Callbacks are invoked in registration order on the thread that observed
 * the transition (usually a transport event loop). A listener that throws is
 * reported and skipped; the remaining listeners still run.</p>
 */
public interface ClientListener
{
    /**
     * The socket became usable. Channels still holding queued packets restart
     * their bundlers after every listener has returned.
     */
    default void onConnect(TransportSocket socket) {}

    /**
     * The socket was lost. Sends keep queueing until the next connect.
     */
    default void onDisconnect() {}

    /**
     * A non-fatal transport or dispatch failure occurred.
     */
    default void onError(Throwable error) {}

    /**
     * {@code destroy()} has released the socket and silenced every bundler.
     * The client may still be reused through {@code use()}.
     */
    default void onDestroy() {}
}
