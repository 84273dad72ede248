package com.streambot.client;

import com.streambot.common.config.StreamBotConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Construction-time settings of a {@link StreamClient}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StreamClientConfig {

    public static final String DEFAULT_USER_AGENT = "streambot-java/0.1.0";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 8_000;
    public static final long DEFAULT_RECONNECT_INTERVAL_MS = 1_000;

    /** AppKey of the robot application. */
    private String clientId;
    /** AppSecret of the robot application. */
    private String clientSecret;

    @Builder.Default
    private String userAgent = DEFAULT_USER_AGENT;

    /** Transport ping period; 0 disables the heartbeat watchdog. */
    @Builder.Default
    private long heartbeatIntervalMs = DEFAULT_HEARTBEAT_INTERVAL_MS;

    /** Delay before reconnecting; 0 makes the supervisor return after one epoch. */
    @Builder.Default
    private long reconnectIntervalMs = DEFAULT_RECONNECT_INTERVAL_MS;

    @Builder.Default
    private String tokenUrl = StreamConstants.DEFAULT_TOKEN_URL;
    @Builder.Default
    private String gatewayUrl = StreamConstants.DEFAULT_GATEWAY_URL;
    @Builder.Default
    private String openApiBaseUrl = StreamConstants.DEFAULT_OPEN_API_BASE_URL;
    @Builder.Default
    private String oapiBaseUrl = StreamConstants.DEFAULT_OAPI_BASE_URL;

    @Builder.Default
    private long httpTimeoutMs = 10_000;
    @Builder.Default
    private long handshakeTimeoutMs = 10_000;

    /**
     * Map a loaded config file onto client settings; unset values keep the
     * defaults.
     */
    public static StreamClientConfig from(StreamBotConfig file) {
        StreamClientConfig config = StreamClientConfig.builder()
                .clientId(file.getClientId())
                .clientSecret(file.getClientSecret())
                .build();
        if (file.getUserAgent() != null && !file.getUserAgent().isBlank()) {
            config.setUserAgent(file.getUserAgent());
        }
        if (file.getHeartbeatIntervalMs() != null) {
            config.setHeartbeatIntervalMs(file.getHeartbeatIntervalMs());
        }
        if (file.getReconnectIntervalMs() != null) {
            config.setReconnectIntervalMs(file.getReconnectIntervalMs());
        }
        StreamBotConfig.EndpointsConfig endpoints = file.getEndpoints();
        if (endpoints != null) {
            if (endpoints.getTokenUrl() != null) {
                config.setTokenUrl(endpoints.getTokenUrl());
            }
            if (endpoints.getGatewayUrl() != null) {
                config.setGatewayUrl(endpoints.getGatewayUrl());
            }
            if (endpoints.getOpenApiBaseUrl() != null) {
                config.setOpenApiBaseUrl(endpoints.getOpenApiBaseUrl());
            }
            if (endpoints.getOapiBaseUrl() != null) {
                config.setOapiBaseUrl(endpoints.getOapiBaseUrl());
            }
        }
        return config;
    }

    /**
     * @throws IllegalArgumentException if the identity is missing or an
     *                                  interval is negative
     */
    public void validate() {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("clientSecret is required");
        }
        if (heartbeatIntervalMs < 0 || reconnectIntervalMs < 0) {
            throw new IllegalArgumentException("intervals must be >= 0");
        }
    }

    @Override
    public String toString() {
        return "StreamClientConfig(clientId=" + clientId
                + ", heartbeatIntervalMs=" + heartbeatIntervalMs
                + ", reconnectIntervalMs=" + reconnectIntervalMs
                + ", gatewayUrl=" + gatewayUrl + ")";
    }
}
