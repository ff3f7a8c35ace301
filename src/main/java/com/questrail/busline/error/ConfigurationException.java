package com.questrail.busline.error;

/**
 * Indicates that a configured adapter or encoder name does not resolve to a
 * registered implementation.
 *
 * Raised eagerly while a client or server is constructed, before any socket
 * or channel work happens.
 */
public final class ConfigurationException extends BusException
{
    public ConfigurationException(String message) {
        super(message);
    }
}
