package com.questrail.busline.codec;

import com.questrail.busline.codec.impl.JacksonEncoder;
import com.questrail.busline.internal.NamedRegistry;

/**
 * Registration table for encoders, keyed by the name used in
 * {@code ClientOptions.encoder()}.
 */
public final class EncoderRegistry extends NamedRegistry<Encoder>
{
    public EncoderRegistry()
    {
        super("encoder");
    }

    /**
     * Registry pre-populated with the {@code json} and {@code cbor} encoders.
     */
    public static EncoderRegistry withDefaults()
    {
        EncoderRegistry registry = new EncoderRegistry();
        registry.register("json", JacksonEncoder.json());
        registry.register("cbor", JacksonEncoder.cbor());
        return registry;
    }
}
