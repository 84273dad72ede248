package com.streambot.client;

/**
 * A frame was sent while no websocket session exists.
 */
public class NotConnectedException extends StreamException {

    public NotConnectedException(String message) {
        super(message);
    }

    public NotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
