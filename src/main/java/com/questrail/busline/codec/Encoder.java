package com.questrail.busline.codec;

import java.util.Optional;

/**
 * Encoder
 * -----------------------------------------------------------------------------
 * Pluggable codec between a {@link Frame} and wire bytes.
 *
 * <p>Implementations are stateless from the bus's point of view and are shared
 * by every client that names them.</p>
 */
public interface Encoder
{
    /**
     * Encode a frame into a wire-ready payload.
     *
     * @throws EncodeException if a packet cannot be represented by this codec
     */
    byte[] encode(Frame frame);

    /**
     * Decode one complete payload.
     *
     * @return the decoded frame; {@link Optional#empty()} if the bytes are
     *         malformed or do not have the frame shape. Never throws for bad input.
     */
    Optional<Frame> decode(byte[] payload);
}
