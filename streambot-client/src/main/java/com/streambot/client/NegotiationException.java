package com.streambot.client;

/**
 * The gateway refused to hand out a connection endpoint, or answered with something unreadable.
 */
public class NegotiationException extends StreamException {

    public NegotiationException(String message) {
        super(message);
    }

    public NegotiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
