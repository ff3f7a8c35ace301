package com.questrail.busline.codec.impl;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.questrail.busline.codec.EncodeException;
import com.questrail.busline.codec.Encoder;
import com.questrail.busline.codec.Frame;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JacksonEncoder
 * -----------------------------------------------------------------------------
 * {@link Encoder} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>A frame is written as the two-element array
 * {@code [channelName, [packet, packet, ...]]}. The same layout is used for
 * the textual ({@link #json()}) and binary ({@link #cbor()}) variants.</p>
 *
 * <p>Decoding validates the shape: a top-level array of exactly two elements,
 * a textual channel name and an array of packets, with nothing after the
 * array. Anything else decodes to {@link Optional#empty()}.</p>
 */
public final class JacksonEncoder implements Encoder
{
    private final ObjectMapper mapper;
    private final ObjectReader frameReader;

    public JacksonEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        // Bytes after the frame array make the whole payload malformed.
        this.frameReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public static JacksonEncoder json()
    {
        return new JacksonEncoder(new ObjectMapper(new JsonFactory()));
    }

    public static JacksonEncoder cbor()
    {
        return new JacksonEncoder(new ObjectMapper(new CBORFactory()));
    }

    @Override
    public byte[] encode(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        List<Object> wire = new ArrayList<>(2);
        wire.add(frame.channel());
        wire.add(frame.packets());
        try {
            return mapper.writeValueAsBytes(wire);
        } catch (Exception e) {
            throw new EncodeException("Failed to encode frame for channel '" + frame.channel() + "'", e);
        }
    }

    @Override
    public Optional<Frame> decode(byte[] payload)
    {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }

        try {
            JsonNode root = frameReader.readTree(payload);
            if (root == null || !root.isArray() || root.size() != 2) {
                return Optional.empty();
            }

            JsonNode channel = root.get(0);
            JsonNode packets = root.get(1);
            if (!channel.isTextual() || !packets.isArray()) {
                return Optional.empty();
            }

            List<Object> values = new ArrayList<>(packets.size());
            for (JsonNode packet : packets) {
                values.add(mapper.treeToValue(packet, Object.class));
            }
            return Optional.of(new Frame(channel.textValue(), values));
        } catch (Exception e) {
            // Malformed input is a protocol defect; the caller drops it.
            return Optional.empty();
        }
    }
}
