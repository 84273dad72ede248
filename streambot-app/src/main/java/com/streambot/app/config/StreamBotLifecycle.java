package com.streambot.app.config;

import com.streambot.app.robot.RobotEchoHandler;
import com.streambot.client.StreamClient;
import com.streambot.common.infra.ErrorUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Starts the stream connection with the application and stops it on
 * shutdown.
 */
@Slf4j
@Component
public class StreamBotLifecycle {

    private final StreamClient streamClient;
    private final RobotEchoHandler robotEchoHandler;

    public StreamBotLifecycle(StreamClient streamClient, RobotEchoHandler robotEchoHandler) {
        this.streamClient = streamClient;
        this.robotEchoHandler = robotEchoHandler;
    }

    @PostConstruct
    public void start() {
        streamClient
                .registerRobotListener(robotEchoHandler)
                .addStateListener((previous, current) -> log.info("Stream bot {} -> {}", previous, current));

        streamClient.start().whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Stream bot stopped: {}", ErrorUtils.formatCauseChain(error));
            } else {
                log.info("Stream bot stopped");
            }
        });
    }

    @PreDestroy
    public void stop() {
        streamClient.exit();
    }
}
