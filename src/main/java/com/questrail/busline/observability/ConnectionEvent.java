package com.questrail.busline.observability;

import java.time.Instant;

/**
 * Record of a client connection lifecycle transition.
 */
public record ConnectionEvent(
    Instant timestamp,
    String clientId,
    boolean fromServer,
    Kind kind
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED
    }
}
