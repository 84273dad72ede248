package com.streambot.client.dispatch;

import com.streambot.client.protocol.DownstreamFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Multi-consumer publish channel for CALLBACK frames. Publishing never
 * blocks: a subscriber whose queue is full loses the frame (logged).
 */
@Slf4j
public class CallbackBroadcaster {

    public static final int DEFAULT_CAPACITY = 1024;

    private final List<BroadcastReceiver> receivers = new CopyOnWriteArrayList<>();
    private final int capacity;

    public CallbackBroadcaster() {
        this(DEFAULT_CAPACITY);
    }

    public CallbackBroadcaster(int capacity) {
        this.capacity = capacity;
    }

    public BroadcastReceiver subscribe() {
        BroadcastReceiver receiver = new BroadcastReceiver(this, capacity);
        receivers.add(receiver);
        return receiver;
    }

    void unsubscribe(BroadcastReceiver receiver) {
        receivers.remove(receiver);
    }

    /**
     * Deliver the frame to every current subscriber.
     *
     * @return number of subscribers that accepted it
     */
    public int publish(DownstreamFrame frame) {
        int delivered = 0;
        for (BroadcastReceiver receiver : receivers) {
            if (receiver.offer(frame)) {
                delivered++;
            } else {
                log.warn("Dropping callback {} for slow subscriber ({} dropped so far)",
                        frame.messageId(), receiver.getDroppedCount());
            }
        }
        return delivered;
    }

    public int getSubscriberCount() {
        return receivers.size();
    }
}
