package com.streambot.client.transport;

import com.streambot.client.StreamException;

/**
 * One open websocket connection (one epoch).
 * <p>
 * The send-half ({@link #send}, {@link #ping}) admits one writer at a time
 * and returns only once the write has completed. The receive-half
 * ({@link #nextEvent}) is consumed by a single dispatcher.
 */
public interface TransportSession {

    /**
     * Write one text frame.
     */
    void send(String text) throws StreamException;

    /**
     * Write a websocket ping frame.
     */
    void ping() throws StreamException;

    /**
     * Block until the next inbound event. After the connection ends a
     * {@link TransportEvent.Kind#CLOSE} or {@link TransportEvent.Kind#ERROR}
     * event is always delivered.
     */
    TransportEvent nextEvent() throws InterruptedException;

    /**
     * Tear the connection down immediately and wake the receive-half with a
     * CLOSE event. Safe to call from any thread, any number of times.
     */
    void abort(String reason);

    /**
     * Close the connection politely (close frame, then socket).
     */
    void close();

    boolean isOpen();
}
