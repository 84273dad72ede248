package com.streambot.client.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.StreamException;

/**
 * JSON codec for stream frames and callback payloads.
 */
public class FrameCodec {

    private final ObjectMapper mapper;

    public FrameCodec() {
        this(new ObjectMapper());
    }

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true);
    }

    /**
     * Decode one downstream text frame.
     *
     * @throws FrameParseException if the text is not JSON or lacks a type,
     *                             headers or message id
     */
    public DownstreamFrame decode(String text) throws FrameParseException {
        DownstreamFrame frame;
        try {
            frame = mapper.readValue(text, DownstreamFrame.class);
        } catch (JsonProcessingException e) {
            throw new FrameParseException("malformed frame: " + e.getOriginalMessage(), e);
        }
        if (frame == null || frame.getType() == null) {
            throw new FrameParseException("frame without type");
        }
        if (frame.getHeaders() == null || frame.getHeaders().getMessageId() == null) {
            throw new FrameParseException("frame without headers.messageId");
        }
        return frame;
    }

    /**
     * Decode a callback payload into the listener's message type.
     */
    public <T> T decodePayload(String data, Class<T> type) throws FrameParseException {
        if (data == null) {
            throw new FrameParseException("payload is empty");
        }
        if (type == String.class) {
            return type.cast(data);
        }
        try {
            return mapper.readValue(data, type);
        } catch (JsonProcessingException e) {
            throw new FrameParseException("cannot decode payload as " + type.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    public String encode(Object value) throws StreamException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StreamException("cannot encode " + value.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
