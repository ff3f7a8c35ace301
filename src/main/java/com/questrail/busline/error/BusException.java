package com.questrail.busline.error;

/**
 * Base type for every failure the bus reports.
 *
 * <p>Only {@link ConfigurationException} is ever thrown to callers, and only
 * at construction time. The other subtypes are delivered through listeners and
 * the observability sink.</p>
 */
public class BusException extends RuntimeException
{
    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
