package com.questrail.busline.error;

/**
 * Socket-level failure surfaced through the client's error signal.
 *
 * Non-fatal: the client stays usable and may be reconnected with {@code use()}.
 */
public final class TransportException extends BusException
{
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
