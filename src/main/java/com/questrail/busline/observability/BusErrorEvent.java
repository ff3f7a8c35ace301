package com.questrail.busline.observability;

import java.time.Instant;

/**
 * Record representing an error reported by a client or server.
 */
public record BusErrorEvent(
    Instant timestamp,
    String clientId,
    String message,
    Throwable cause
) {
}
