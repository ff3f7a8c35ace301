package com.questrail.busline.codec;

import com.questrail.busline.error.BusException;

/**
 * Indicates that an outbound frame could not be serialized by the configured
 * encoder (for example a packet type the codec cannot represent).
 */
public final class EncodeException extends BusException
{
    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
