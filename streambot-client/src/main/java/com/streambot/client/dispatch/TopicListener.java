package com.streambot.client.dispatch;

/**
 * Handler of CALLBACK frames for one topic, receiving the decoded payload.
 *
 * @param <T> payload type the frame's {@code data} is decoded into
 */
@FunctionalInterface
public interface TopicListener<T> {

    void onMessage(T message) throws Exception;
}
