package com.streambot.client.protocol;

import com.streambot.client.StreamException;

/**
 * An inbound frame or payload could not be decoded. Always recovered
 * locally: the frame is logged and dropped.
 */
public class FrameParseException extends StreamException {

    public FrameParseException(String message) {
        super(message);
    }

    public FrameParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
