package com.questrail.busline.observability;

/**
 * Main interface for receiving bus observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called from transport event loops and scheduler threads and must
 * not block.</p>
 */
public interface BusObservabilitySink {
    /**
     * Called when a client's connection is established or lost.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called for every transmitted batch when stats are enabled for the client.
     * @param event packet and byte counts of the batch
     */
    void onBatch(BatchStatsEvent event);

    /**
     * Called when inbound bytes could not be decoded or were addressed to an
     * unknown channel.
     * @param event the drop details
     */
    void onFrameDropped(DroppedFrameEvent event);

    /**
     * Called when a transport, handler or listener failure occurs.
     * @param event the error event
     */
    void onError(BusErrorEvent event);
}
