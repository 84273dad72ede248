package com.streambot.client;

/**
 * Notified on every {@link ConnectionState} transition. Invoked on the
 * supervisor thread; implementations must not block.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChanged(ConnectionState previous, ConnectionState current);
}
