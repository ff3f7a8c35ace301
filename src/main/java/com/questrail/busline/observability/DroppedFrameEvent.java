package com.questrail.busline.observability;

import java.time.Instant;

/**
 * Record of an inbound frame that was dropped instead of delivered.
 */
public record DroppedFrameEvent(
    Instant timestamp,
    String clientId,
    int bytes,
    Reason reason
) {
    public enum Reason {
        /** The encoder could not decode the bytes. */
        MALFORMED,
        /** The frame named a channel the client never created. */
        UNKNOWN_CHANNEL
    }
}
