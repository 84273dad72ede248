package com.streambot.client.transport;

import com.streambot.client.TransportException;

/**
 * Opens websocket sessions.
 */
public interface TransportConnector extends AutoCloseable {

    /**
     * Connect and complete the websocket handshake.
     *
     * @throws TransportException if the TCP/TLS connection or the HTTP upgrade
     *                            fails or times out
     */
    TransportSession open(String url) throws TransportException;

    @Override
    default void close() {
    }
}
