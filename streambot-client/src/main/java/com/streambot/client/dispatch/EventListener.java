package com.streambot.client.dispatch;

import com.streambot.client.protocol.EventAck;
import com.streambot.client.protocol.EventData;

/**
 * The single catch-all handler of EVENT frames. Its result is sent back to
 * the server as the frame's acknowledgement.
 */
@FunctionalInterface
public interface EventListener {

    /** Accepts everything. */
    EventListener ACK_ALL = event -> EventAck.success();

    EventAck onEvent(EventData event) throws Exception;
}
