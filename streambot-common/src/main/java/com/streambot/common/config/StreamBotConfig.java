package com.streambot.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Root configuration document ({@code ~/.streambot/config.json}).
 * <p>
 * Unset values stay {@code null}; the client applies its own defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamBotConfig {

    /** AppKey of the robot application. */
    private String clientId;

    /** AppSecret of the robot application. */
    private String clientSecret;

    /** User-Agent advertised to the gateway. */
    private String userAgent;

    /** Transport ping period; 0 disables the heartbeat watchdog. */
    private Long heartbeatIntervalMs;

    /** Delay before reconnecting; 0 disables reconnection. */
    private Long reconnectIntervalMs;

    private EndpointsConfig endpoints;
    private RobotConfig robot;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EndpointsConfig {
        private String tokenUrl;
        private String gatewayUrl;
        private String openApiBaseUrl;
        private String oapiBaseUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RobotConfig {
        /** Reply to every robot message with its own text. */
        private Boolean echo;
    }
}
