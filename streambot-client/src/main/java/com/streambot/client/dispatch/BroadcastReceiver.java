package com.streambot.client.dispatch;

import com.streambot.client.protocol.DownstreamFrame;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One subscriber's view of a {@link CallbackBroadcaster}: an independent
 * bounded queue of every frame published after it subscribed.
 */
public class BroadcastReceiver {

    /** Wakes a blocked {@link #receive()} after {@link #close()}. */
    private static final DownstreamFrame CLOSED = new DownstreamFrame();

    private final BlockingQueue<DownstreamFrame> queue;
    private final CallbackBroadcaster owner;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    BroadcastReceiver(CallbackBroadcaster owner, int capacity) {
        this.owner = owner;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Block until the next published frame.
     *
     * @return the frame, or {@code null} once the receiver is closed
     */
    public DownstreamFrame receive() throws InterruptedException {
        if (closed.get()) {
            return null;
        }
        DownstreamFrame frame = queue.take();
        return frame == CLOSED ? null : frame;
    }

    /**
     * @return {@code false} if the queue was full and the frame was dropped
     */
    boolean offer(DownstreamFrame frame) {
        if (closed.get()) {
            return true;
        }
        if (queue.offer(frame)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            owner.unsubscribe(this);
            queue.clear();
            queue.offer(CLOSED);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
