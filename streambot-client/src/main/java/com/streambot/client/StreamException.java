package com.streambot.client;

/**
 * Base class of every failure the stream client reports to its caller.
 */
public class StreamException extends Exception {

    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
