package com.streambot.client.dispatch;

import com.streambot.client.credential.Credentials;
import com.streambot.client.credential.Subscription;
import com.streambot.client.credential.SubscriptionType;
import com.streambot.client.protocol.DownstreamFrame;
import com.streambot.client.protocol.FrameCodec;
import com.streambot.client.protocol.FrameParseException;
import com.streambot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handler store: one replaceable slot for EVENT frames and one consumer task
 * per CALLBACK topic, each fed by its own {@link BroadcastReceiver}.
 * <p>
 * Consumers only handle frames of their own topic. Registering a topic a
 * second time swaps the handler of the running consumer.
 */
@Slf4j
public class CallbackRegistry implements AutoCloseable {

    private final Credentials credentials;
    private final Executor executor;
    private final FrameCodec codec;
    private final CallbackBroadcaster broadcaster;
    private final AtomicReference<EventListener> eventListener = new AtomicReference<>(EventListener.ACK_ALL);
    private final Map<String, TopicConsumer> consumers = new ConcurrentHashMap<>();

    public CallbackRegistry(Credentials credentials, Executor executor, FrameCodec codec,
            CallbackBroadcaster broadcaster) {
        this.credentials = credentials;
        this.executor = executor;
        this.codec = codec;
        this.broadcaster = broadcaster;
    }

    // =========================================================================
    // EVENT
    // =========================================================================

    /**
     * Replace the event listener; effective for the next EVENT frame.
     */
    public void registerEventListener(EventListener listener) {
        eventListener.set(Objects.requireNonNull(listener, "listener"));
    }

    public EventListener getEventListener() {
        return eventListener.get();
    }

    // =========================================================================
    // CALLBACK
    // =========================================================================

    /**
     * Subscribe to a callback topic. The subscription is advertised from the
     * next endpoint negotiation on, once its consumer is running.
     *
     * @throws RejectedExecutionException if the consumer cannot be started;
     *                                    nothing is registered then
     */
    public <T> void registerTopicListener(String topic, Class<T> type, TopicListener<T> listener) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        Binding<T> binding = new Binding<>(type, listener);

        if (swapBinding(topic, binding)) {
            return;
        }
        TopicConsumer consumer = new TopicConsumer(topic, broadcaster.subscribe(), binding);
        if (consumers.putIfAbsent(topic, consumer) != null) {
            consumer.receiver.close();
            swapBinding(topic, binding);
            return;
        }
        try {
            executor.execute(consumer);
        } catch (RejectedExecutionException e) {
            consumers.remove(topic, consumer);
            consumer.receiver.close();
            throw e;
        }
        log.debug("Topic consumer started for {}", topic);
        credentials.addSubscription(new Subscription(SubscriptionType.CALLBACK, topic));
    }

    private boolean swapBinding(String topic, Binding<?> binding) {
        TopicConsumer existing = consumers.get(topic);
        if (existing == null) {
            return false;
        }
        log.info("Replacing listener for topic {}", topic);
        existing.binding.set(binding);
        return true;
    }

    /**
     * Hand a CALLBACK frame to every topic consumer without waiting for them.
     */
    public void publish(DownstreamFrame frame) {
        int delivered = broadcaster.publish(frame);
        if (delivered == 0) {
            log.debug("No topic consumer for callback {} ({})", frame.messageId(), frame.topic());
        }
    }

    public Set<String> getTopics() {
        return Set.copyOf(consumers.keySet());
    }

    /**
     * Stop every topic consumer.
     */
    @Override
    public void close() {
        consumers.values().forEach(c -> c.receiver.close());
        consumers.clear();
    }

    // =========================================================================
    // Internal
    // =========================================================================

    private record Binding<T>(Class<T> type, TopicListener<T> listener) {

        void deliver(FrameCodec codec, DownstreamFrame frame) throws Exception {
            T message;
            try {
                message = codec.decodePayload(frame.getData(), type);
            } catch (FrameParseException e) {
                log.warn("Skipping callback {} on {}: {}", frame.messageId(), frame.topic(), e.getMessage());
                return;
            }
            listener.onMessage(message);
        }
    }

    private final class TopicConsumer implements Runnable {

        private final String topic;
        private final BroadcastReceiver receiver;
        private final AtomicReference<Binding<?>> binding;

        TopicConsumer(String topic, BroadcastReceiver receiver, Binding<?> binding) {
            this.topic = topic;
            this.receiver = receiver;
            this.binding = new AtomicReference<>(binding);
        }

        @Override
        public void run() {
            try {
                DownstreamFrame frame;
                while ((frame = receiver.receive()) != null) {
                    if (!topic.equals(frame.topic())) {
                        continue;
                    }
                    try {
                        binding.get().deliver(codec, frame);
                    } catch (Exception e) {
                        log.error("Listener for {} failed on callback {}: {}",
                                topic, frame.messageId(), ErrorUtils.formatErrorMessage(e), e);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                receiver.close();
                consumers.remove(topic, this);
                log.debug("Topic consumer for {} stopped", topic);
            }
        }
    }
}
