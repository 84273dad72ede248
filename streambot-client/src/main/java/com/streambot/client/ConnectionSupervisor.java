package com.streambot.client;

import com.streambot.client.credential.Credentials;
import com.streambot.client.dispatch.CallbackRegistry;
import com.streambot.client.dispatch.HeartbeatWatchdog;
import com.streambot.client.dispatch.InboundDispatcher;
import com.streambot.client.negotiate.TokenNegotiator;
import com.streambot.client.protocol.FrameCodec;
import com.streambot.client.transport.TransportConnector;
import com.streambot.client.transport.TransportSession;
import com.streambot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connect-serve-reconnect loop.
 * <p>
 * Each epoch negotiates a fresh endpoint (tickets are single-use), opens the
 * transport, runs the heartbeat watchdog next to the dispatcher and, once the
 * dispatcher returns, either waits {@code reconnectIntervalMs} and starts over
 * or returns. Negotiation and handshake failures are not retried here.
 */
@Slf4j
public class ConnectionSupervisor {

    private final Credentials credentials;
    private final TokenNegotiator negotiator;
    private final TransportConnector connector;
    private final FrameCodec codec;
    private final CallbackRegistry registry;
    private final Executor executor;

    private final AtomicBoolean alive = new AtomicBoolean(false);
    private final AtomicBoolean exited = new AtomicBoolean(false);
    private final CountDownLatch exitSignal = new CountDownLatch(1);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicReference<TransportSession> current = new AtomicReference<>();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    public ConnectionSupervisor(Credentials credentials, TokenNegotiator negotiator,
            TransportConnector connector, FrameCodec codec, CallbackRegistry registry, Executor executor) {
        this.credentials = credentials;
        this.negotiator = negotiator;
        this.connector = connector;
        this.codec = codec;
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * Run the loop on the calling thread until it stops.
     *
     * @throws StreamException the auth, negotiation or transport failure that
     *                         ended the loop
     * @throws IllegalStateException if the loop is already running
     */
    public void run() throws StreamException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("stream connection loop already running");
        }
        try {
            loop();
        } finally {
            running.set(false);
        }
    }

    private void loop() throws StreamException {
        while (!exited.get()) {
            transition(ConnectionState.CONNECTING);
            TransportSession session;
            try {
                String url = negotiator.getEndpoint();
                session = connector.open(url);
            } catch (StreamException e) {
                log.error("Stream connect failed: {}", ErrorUtils.formatCauseChain(e));
                transition(ConnectionState.DISCONNECTED);
                throw e;
            }

            current.set(session);
            alive.set(true);
            transition(ConnectionState.CONNECTED);
            if (exited.get()) {
                session.abort("exit requested");
            }
            try {
                serve(session);
            } finally {
                alive.set(false);
                current.set(null);
                transition(ConnectionState.DISCONNECTED);
            }

            long reconnectMs = credentials.getReconnectIntervalMs();
            if (reconnectMs <= 0 || exited.get()) {
                break;
            }
            log.info("Reconnecting in {}ms", reconnectMs);
            try {
                if (exitSignal.await(reconnectMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Stream connection loop stopped");
    }

    private void serve(TransportSession session) {
        AtomicBoolean liveness = new AtomicBoolean(true);
        CountDownLatch epochDone = new CountDownLatch(1);
        long heartbeatMs = credentials.getHeartbeatIntervalMs();
        try {
            if (heartbeatMs > 0) {
                executor.execute(new HeartbeatWatchdog(session, liveness, heartbeatMs, epochDone));
            }
            new InboundDispatcher(session, codec, registry, liveness).run();
        } finally {
            epochDone.countDown();
            session.close();
        }
    }

    /**
     * Stop for good: the current epoch ends now and no reconnect follows.
     * Idempotent and callable from any thread.
     */
    public void exit() {
        if (exited.compareAndSet(false, true)) {
            log.info("Stream client exit requested");
        }
        exitSignal.countDown();
        TransportSession session = current.get();
        if (session != null) {
            session.abort("exit requested");
        }
    }

    /**
     * @throws NotConnectedException if no session is open
     */
    public TransportSession currentSession() throws NotConnectedException {
        TransportSession session = current.get();
        if (session == null) {
            throw new NotConnectedException("stream not connected");
        }
        return session;
    }

    public boolean isAlive() {
        return alive.get();
    }

    public boolean isExited() {
        return exited.get();
    }

    public ConnectionState getState() {
        return state.get();
    }

    public void addStateListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state.getAndSet(next);
        if (previous == next) {
            return;
        }
        log.info("Stream connection {} -> {}", previous, next);
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                log.warn("State listener failed: {}", ErrorUtils.formatErrorMessage(e));
            }
        }
    }
}
