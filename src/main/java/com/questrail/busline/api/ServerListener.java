package com.questrail.busline.api;

import com.questrail.busline.Client;

/**
 * Observer for inbound connections accepted by a {@code Server}.
 */
public interface ServerListener
{
    /**
     * A new server-spawned client was adopted. Server-level subscriptions are
     * already attached to it.
     */
    default void onConnection(Client client) {}

    /**
     * A listening-side failure occurred.
     */
    default void onError(Throwable error) {}
}
