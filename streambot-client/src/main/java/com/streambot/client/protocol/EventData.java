package com.streambot.client.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event pushed by the platform (org changes, approvals, ...).
 * See https://open.dingtalk.com/document/orgapp/org-event-overview for the
 * meaning of each event type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventData {
    private String eventType;
    private String eventBornTime;
    private String eventId;
    private String eventCorpId;
    private String eventUnifiedAppId;
    private String topic;
    /** Raw event body (JSON text). */
    private String data;
}
