package com.questrail.busline.transport;

import com.questrail.busline.internal.NamedRegistry;

/**
 * Registration table for transports, keyed by the name used in
 * {@code ClientOptions.adapter()}.
 *
 * <p>The default transports need an event loop owner and are registered by
 * {@code BusRuntime}.</p>
 */
public final class AdapterRegistry extends NamedRegistry<Adapter>
{
    public AdapterRegistry()
    {
        super("adapter");
    }
}
