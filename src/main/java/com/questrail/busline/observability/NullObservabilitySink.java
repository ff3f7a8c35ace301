package com.questrail.busline.observability;

/**
 * No-op implementation of BusObservabilitySink.
 */
public final class NullObservabilitySink implements BusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onBatch(BatchStatsEvent event) {}

    @Override
    public void onFrameDropped(DroppedFrameEvent event) {}

    @Override
    public void onError(BusErrorEvent event) {}
}
