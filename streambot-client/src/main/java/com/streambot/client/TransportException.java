package com.streambot.client;

/**
 * The websocket could not be opened (handshake, TLS or HTTP upgrade failure) or a write did not complete.
 */
public class TransportException extends StreamException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
