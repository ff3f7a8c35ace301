package com.questrail.busline.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * It MUST NOT drive bundler intervals or tick cadence.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
