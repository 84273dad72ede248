package com.streambot.client;

/**
 * Endpoints, topics and fixed payloads of the DingTalk stream protocol.
 */
public final class StreamConstants {

    private StreamConstants() {
    }

    // =========================================================================
    // Endpoints
    // =========================================================================

    public static final String DEFAULT_TOKEN_URL = "https://oapi.dingtalk.com/gettoken";
    public static final String DEFAULT_GATEWAY_URL = "https://api.dingtalk.com/v1.0/gateway/connections/open";
    public static final String DEFAULT_OPEN_API_BASE_URL = "https://api.dingtalk.com";
    public static final String DEFAULT_OAPI_BASE_URL = "https://oapi.dingtalk.com";

    public static final String GROUP_SEND_PATH = "/v1.0/robot/groupMessages/send";
    public static final String BATCH_SEND_PATH = "/v1.0/robot/oToMessages/batchSend";
    public static final String DOWNLOAD_PATH = "/v1.0/robot/messageFiles/download";
    public static final String UPLOAD_PATH = "/media/upload";

    // =========================================================================
    // Topics
    // =========================================================================

    /** Robot message callback. */
    public static final String TOPIC_ROBOT = "/v1.0/im/bot/messages/get";
    /** Interactive card callback. */
    public static final String TOPIC_CARD = "/v1.0/card/instances/callback";

    /** Wildcard topic used by the default EVENT and SYSTEM subscriptions. */
    public static final String TOPIC_ALL = "*";

    public static final String SYSTEM_PING = "ping";
    public static final String SYSTEM_CONNECTED = "CONNECTED";
    public static final String SYSTEM_REGISTERED = "REGISTERED";
    public static final String SYSTEM_DISCONNECT = "disconnect";
    public static final String SYSTEM_KEEPALIVE = "KEEPALIVE";

    // =========================================================================
    // Wire constants
    // =========================================================================

    public static final String ACCESS_TOKEN_HEADER = "access-token";
    public static final String OPEN_API_TOKEN_HEADER = "x-acs-dingtalk-access-token";
    public static final String CONTENT_TYPE_JSON = "application/json";

    /** Payload of the immediate acknowledgement of every CALLBACK frame. */
    public static final String CALLBACK_ACK_DATA = "{\"response\":{}}";
}
