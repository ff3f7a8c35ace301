package com.questrail.busline.error;

/**
 * Wraps a failure thrown by a packet handler during dispatch.
 */
public final class HandlerException extends BusException
{
    private final String channel;

    public HandlerException(String channel, Throwable cause) {
        super("Handler failed on channel '" + channel + "'", cause);
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }
}
