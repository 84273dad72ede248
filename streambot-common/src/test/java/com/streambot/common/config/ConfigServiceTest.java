package com.streambot.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "clientId": "ding_app",
                  "clientSecret": "secret",
                  "heartbeatIntervalMs": 5000,
                  "reconnectIntervalMs": 0,
                  "endpoints": {
                    "gatewayUrl": "https://example.test/gateway"
                  },
                  "robot": { "echo": true }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        StreamBotConfig config = service.loadConfig();

        assertEquals("ding_app", config.getClientId());
        assertEquals("secret", config.getClientSecret());
        assertEquals(5000L, config.getHeartbeatIntervalMs());
        assertEquals(0L, config.getReconnectIntervalMs());
        assertEquals("https://example.test/gateway", config.getEndpoints().getGatewayUrl());
        assertNull(config.getEndpoints().getTokenUrl());
        assertTrue(config.getRobot().getEcho());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        StreamBotConfig config = service.loadConfig();

        assertNotNull(config);
        assertNull(config.getClientId());
        assertNotNull(config.getEndpoints());
        assertFalse(config.getRobot().getEcho());
    }

    @Test
    void loadConfig_malformedJson_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        StreamBotConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getEndpoints());
        assertNull(config.getClientSecret());
    }

    @Test
    void loadConfig_unknownFieldsIgnored() throws IOException {
        Files.writeString(configPath, """
                { "clientId": "a", "somethingElse": { "x": 1 } }
                """);

        assertEquals("a", new ConfigService(configPath).loadConfig().getClientId());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "clientId": "${APP_KEY}", "clientSecret": "${APP_SECRET:-fallback}" }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200),
                Map.of("APP_KEY", "from-env")::get);
        StreamBotConfig config = service.loadConfig();

        assertEquals("from-env", config.getClientId());
        assertEquals("fallback", config.getClientSecret());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_empty() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), name -> null);
        assertEquals("[]", service.substituteEnvVars("[${__UNLIKELY_VAR_XYZ}]"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "clientId": "first" }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(1), name -> null);
        StreamBotConfig first = service.loadConfig();
        Files.writeString(configPath, """
                { "clientId": "second" }
                """);
        StreamBotConfig second = service.loadConfig();

        assertSame(first, second);
        assertEquals("first", second.getClientId());
    }
}
