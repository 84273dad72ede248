package com.streambot.client.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.streambot.client.StreamConstants;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement frame; {@code headers.messageId} always echoes the
 * downstream frame being answered.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"code", "headers", "message", "data"})
public class UpstreamAck {

    private int code;
    private Headers headers;
    private String message;
    private String data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"contentType", "messageId"})
    public static class Headers {
        private String contentType;
        private String messageId;
    }

    public static UpstreamAck of(String data, String messageId) {
        return new UpstreamAck(200, new Headers(StreamConstants.CONTENT_TYPE_JSON, messageId), "OK", data);
    }
}
