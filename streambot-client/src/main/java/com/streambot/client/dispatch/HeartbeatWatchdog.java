package com.streambot.client.dispatch;

import com.streambot.client.StreamException;
import com.streambot.client.transport.TransportSession;
import com.streambot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pings the peer every interval and aborts the session when the previous
 * ping went unanswered for a whole interval.
 * <p>
 * The liveness flag is cleared before each ping and set again by the
 * dispatcher when the pong arrives.
 */
@Slf4j
public class HeartbeatWatchdog implements Runnable {

    private final TransportSession session;
    private final AtomicBoolean liveness;
    private final long intervalMs;
    private final CountDownLatch epochDone;

    /**
     * @param epochDone counted down when the connection epoch ends; wakes and
     *                  stops the watchdog
     */
    public HeartbeatWatchdog(TransportSession session, AtomicBoolean liveness,
            long intervalMs, CountDownLatch epochDone) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.session = session;
        this.liveness = liveness;
        this.intervalMs = intervalMs;
        this.epochDone = epochDone;
    }

    @Override
    public void run() {
        try {
            while (epochDone.getCount() > 0) {
                if (!liveness.getAndSet(false)) {
                    log.warn("No pong within {}ms, aborting stream connection", intervalMs);
                    session.abort("heartbeat timeout");
                    return;
                }
                try {
                    session.ping();
                } catch (StreamException e) {
                    log.warn("Heartbeat ping failed: {}", ErrorUtils.formatErrorMessage(e));
                    session.abort("heartbeat ping failed");
                    return;
                }
                if (epochDone.await(intervalMs, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
