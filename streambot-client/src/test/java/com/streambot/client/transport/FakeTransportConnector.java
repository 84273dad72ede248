package com.streambot.client.transport;

import com.streambot.client.TransportException;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Hands out {@link FakeTransportSession}s and records the URLs it was asked
 * to open.
 */
public class FakeTransportConnector implements TransportConnector {

    private final BlockingQueue<FakeTransportSession> opened = new LinkedBlockingQueue<>();
    private final List<String> urls = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failHandshakes() {
        failing = true;
    }

    @Override
    public TransportSession open(String url) throws TransportException {
        urls.add(url);
        if (failing) {
            throw new TransportException("handshake rejected: " + url);
        }
        FakeTransportSession session = new FakeTransportSession();
        opened.add(session);
        return session;
    }

    /** Sessions in the order they were opened, consumed by the caller. */
    public BlockingQueue<FakeTransportSession> opened() {
        return opened;
    }

    public List<String> urls() {
        return urls;
    }
}
