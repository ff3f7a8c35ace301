package com.questrail.busline.observability;

import java.time.Instant;

/**
 * Telemetry for one transmitted batch.
 */
public record BatchStatsEvent(
    Instant timestamp,
    String clientId,
    String channel,
    int packets,
    int bytes
) {
}
