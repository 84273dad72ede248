package com.streambot.client;

/**
 * Access token could not be obtained: HTTP failure, unreadable body or a non-zero {@code errcode}.
 */
public class AuthException extends StreamException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
