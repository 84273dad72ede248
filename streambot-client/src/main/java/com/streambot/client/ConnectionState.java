package com.streambot.client;

/**
 * Lifecycle of the stream connection as observed by the host.
 */
public enum ConnectionState {
    /** Initial state, and the state after every epoch ends. */
    DISCONNECTED,
    /** Endpoint negotiation and websocket handshake in flight. */
    CONNECTING,
    /** Handshake succeeded; dispatcher and heartbeat are running. */
    CONNECTED
}
