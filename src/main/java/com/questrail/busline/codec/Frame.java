package com.questrail.busline.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * Logical wire unit: a channel name and the ordered packets of one batch.
 *
 * <p>Packets may contain {@code null} elements; the list itself is an
 * unmodifiable copy.</p>
 */
public record Frame(String channel, List<Object> packets)
{
    public Frame
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(packets, "packets");
        packets = Collections.unmodifiableList(new ArrayList<>(packets));
    }

    public static Frame of(String channel, Object... packets)
    {
        List<Object> list = new ArrayList<>(packets.length);
        Collections.addAll(list, packets);
        return new Frame(channel, list);
    }
}
