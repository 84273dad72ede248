package com.streambot.client.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One JSON text frame pushed by the server. Treated as read-only once
 * decoded; CALLBACK frames are shared by every topic consumer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DownstreamFrame {

    private String specVersion;
    private FrameType type;
    private StreamHeaders headers;

    /** Opaque payload; for CALLBACK frames a JSON document in a string. */
    private String data;

    public String messageId() {
        return headers != null ? headers.getMessageId() : null;
    }

    public String topic() {
        return headers != null ? headers.getTopic() : null;
    }

    /**
     * The flattened event fields plus the raw payload.
     */
    public EventData toEventData() {
        StreamHeaders h = headers != null ? headers : new StreamHeaders();
        return EventData.builder()
                .eventType(h.getEventType())
                .eventBornTime(h.getEventBornTime())
                .eventId(h.getEventId())
                .eventCorpId(h.getEventCorpId())
                .eventUnifiedAppId(h.getEventUnifiedAppId())
                .topic(h.getTopic())
                .data(data)
                .build();
    }
}
