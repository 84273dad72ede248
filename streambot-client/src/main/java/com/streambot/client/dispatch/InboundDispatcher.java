package com.streambot.client.dispatch;

import com.streambot.client.StreamConstants;
import com.streambot.client.StreamException;
import com.streambot.client.protocol.DownstreamFrame;
import com.streambot.client.protocol.EventAck;
import com.streambot.client.protocol.FrameCodec;
import com.streambot.client.protocol.FrameParseException;
import com.streambot.client.protocol.UpstreamAck;
import com.streambot.client.transport.TransportEvent;
import com.streambot.client.transport.TransportSession;
import com.streambot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes the receive-half of one session: classifies every frame, answers
 * the ones the protocol requires an acknowledgement for, and routes
 * EVENT/CALLBACK frames to the {@link CallbackRegistry}.
 * <p>
 * Frames are handled strictly in receipt order. The loop ends on a close
 * frame, a transport error, a failed acknowledgement write or interruption.
 */
@Slf4j
public class InboundDispatcher {

    private final TransportSession session;
    private final FrameCodec codec;
    private final CallbackRegistry registry;
    private final AtomicBoolean liveness;

    /**
     * @param liveness set to {@code true} whenever a pong arrives
     */
    public InboundDispatcher(TransportSession session, FrameCodec codec,
            CallbackRegistry registry, AtomicBoolean liveness) {
        this.session = session;
        this.codec = codec;
        this.registry = registry;
        this.liveness = liveness;
    }

    /**
     * Run until the session ends. Never throws: every way out is a normal
     * disconnect.
     */
    public void run() {
        try {
            while (true) {
                TransportEvent event = session.nextEvent();
                switch (event.kind()) {
                    case TEXT -> handleText(event.text());
                    case PONG -> liveness.set(true);
                    case CLOSE -> {
                        log.info("Stream closed (code={}, reason={})", event.code(), event.text());
                        return;
                    }
                    case ERROR -> {
                        log.warn("Stream read error: {}", ErrorUtils.formatErrorMessage(event.error()));
                        return;
                    }
                    default -> log.debug("Ignoring {} frame", event.text());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Dispatcher interrupted");
        } catch (StreamException e) {
            log.warn("Acknowledgement could not be sent, dropping connection: {}",
                    ErrorUtils.formatCauseChain(e));
        }
    }

    void handleText(String text) throws StreamException {
        DownstreamFrame frame;
        try {
            frame = codec.decode(text);
        } catch (FrameParseException e) {
            log.warn("Dropping unparseable frame: {}", e.getMessage());
            return;
        }
        handleFrame(frame);
    }

    void handleFrame(DownstreamFrame frame) throws StreamException {
        switch (frame.getType()) {
            case SYSTEM -> onSystem(frame);
            case EVENT -> onEvent(frame);
            case CALLBACK -> onCallback(frame);
            default -> log.warn("Unknown frame type for message {}", frame.messageId());
        }
    }

    private void onSystem(DownstreamFrame frame) throws StreamException {
        String topic = frame.topic() == null ? "" : frame.topic();
        switch (topic) {
            case StreamConstants.SYSTEM_PING -> {
                log.debug("[SYSTEM] ping");
                sendAck(frame.getData(), frame.messageId());
            }
            case StreamConstants.SYSTEM_CONNECTED -> log.debug("[SYSTEM] connected");
            case StreamConstants.SYSTEM_REGISTERED -> log.debug("[SYSTEM] registered");
            case StreamConstants.SYSTEM_DISCONNECT -> log.debug("[SYSTEM] disconnect");
            case StreamConstants.SYSTEM_KEEPALIVE -> log.debug("[SYSTEM] keepalive");
            default -> log.warn("Unknown system message: {}", topic);
        }
    }

    private void onEvent(DownstreamFrame frame) throws StreamException {
        log.debug("Event received: {} ({})", frame.messageId(), frame.getHeaders().getEventType());
        EventAck ack;
        try {
            ack = registry.getEventListener().onEvent(frame.toEventData());
        } catch (Exception e) {
            log.error("Event listener failed on {}: {}", frame.messageId(), ErrorUtils.formatErrorMessage(e), e);
            ack = EventAck.later(ErrorUtils.formatErrorMessage(e));
        }
        if (ack == null) {
            ack = EventAck.success();
        }
        sendAck(codec.encode(ack), frame.messageId());
    }

    private void onCallback(DownstreamFrame frame) throws StreamException {
        log.debug("Callback received: {} on {}", frame.messageId(), frame.topic());
        sendAck(StreamConstants.CALLBACK_ACK_DATA, frame.messageId());
        registry.publish(frame);
    }

    private void sendAck(String data, String messageId) throws StreamException {
        session.send(codec.encode(UpstreamAck.of(data, messageId)));
    }
}
