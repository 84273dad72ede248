package com.streambot.client.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Headers of a downstream frame. EVENT frames carry the event fields
 * flattened in here as well.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamHeaders {

    private String appId;
    private String connectionId;
    private String contentType;
    private String messageId;
    private String time;
    private String topic;

    // --- Event fields ---
    private String eventType;
    private String eventBornTime;
    private String eventId;
    private String eventCorpId;
    private String eventUnifiedAppId;
}
