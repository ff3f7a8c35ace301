package com.questrail.busline.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BusObservabilitySink that emits logs via SLF4J.
 *
 * <p>Batch telemetry goes to the dedicated {@code com.questrail.busline.stats}
 * logger so it can be routed separately from lifecycle logging.</p>
 */
public final class Slf4jBusObservabilitySink implements BusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBusObservabilitySink.class);
    private static final Logger stats = LoggerFactory.getLogger("com.questrail.busline.stats");

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        String side = event.fromServer() ? "server" : "client";
        if (event.kind() == ConnectionEvent.Kind.CONNECTED) {
            log.info("{} {} connection established", side, event.clientId());
        } else {
            log.warn("{} {} connection lost", side, event.clientId());
        }
    }

    @Override
    public void onBatch(BatchStatsEvent event) {
        stats.info("{\"packets\":{},\"bytes\":{}}", event.packets(), event.bytes());
    }

    @Override
    public void onFrameDropped(DroppedFrameEvent event) {
        log.debug("Dropped inbound frame on {}: {} ({} bytes)",
            event.clientId(), event.reason(), event.bytes());
    }

    @Override
    public void onError(BusErrorEvent event) {
        log.error("Bus error on {}: {}", event.clientId(), event.message(), event.cause());
    }
}
