package com.streambot.app.config;

import com.streambot.app.robot.RobotEchoHandler;
import com.streambot.client.StreamClient;
import com.streambot.client.StreamClientConfig;
import com.streambot.common.config.ConfigService;
import com.streambot.common.config.StreamBotConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the stream client and its collaborators.
 */
@Slf4j
@Configuration
public class StreamBotBeans {

    @Value("${streambot.config:~/.streambot/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    /**
     * Runs the connection loop, heartbeat watchdogs and topic consumers.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "streambot-host-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "close")
    public StreamClient streamClient(ConfigService configService, ExecutorService streamExecutor) {
        StreamClientConfig config = StreamClientConfig.from(configService.loadConfig());
        log.info("Stream client configured from {}: {}", configService.getConfigPath(), config);
        return new StreamClient(config, streamExecutor);
    }

    @Bean
    public RobotEchoHandler robotEchoHandler(StreamClient streamClient, ConfigService configService) {
        StreamBotConfig.RobotConfig robot = configService.loadConfig().getRobot();
        boolean echo = robot != null && Boolean.TRUE.equals(robot.getEcho());
        return new RobotEchoHandler(streamClient.messages(), echo);
    }
}
