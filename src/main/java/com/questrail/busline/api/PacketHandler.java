package com.questrail.busline.api;

/**
 * PacketHandler
 * -----------------------------------------------------------------------------
 * Subscriber callback attached to a named channel.
 *
 * <p>Every registered handler receives every packet of a delivered batch, in
 * batch order (broadcast fan-out). A handler that throws does not prevent
 * delivery to the remaining handlers or packets.</p>
 *
 * <p>Packets are opaque values as produced by the configured encoder: for the
 * Jackson encoders these are {@code Map}, {@code List}, {@code String},
 * {@code Number}, {@code Boolean} or {@code null}.</p>
 */
@FunctionalInterface
public interface PacketHandler
{
    void handle(Object packet);
}
