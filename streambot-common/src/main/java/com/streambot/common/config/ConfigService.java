package com.streambot.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the streambot configuration file.
 */
@Slf4j
public class ConfigService {

    public static final Path DEFAULT_CONFIG_PATH = Path.of("~", ".streambot", "config.json");

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, StreamBotConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    /** Constructor for testing – allows injecting the environment lookup. */
    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public StreamBotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    public Path getConfigPath() {
        return configPath;
    }

    private StreamBotConfig doLoadConfig() {
        try {
            if (!Files.exists(configPath)) {
                log.warn("Config file not found: {}, using defaults", configPath);
                return applyDefaults(new StreamBotConfig());
            }
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);
            StreamBotConfig config = applyDefaults(objectMapper.readValue(raw, StreamBotConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new StreamBotConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill in missing sections so callers never see a {@code null} sub-config.
     */
    StreamBotConfig applyDefaults(StreamBotConfig config) {
        if (config.getEndpoints() == null) {
            config.setEndpoints(new StreamBotConfig.EndpointsConfig());
        }
        if (config.getRobot() == null) {
            config.setRobot(new StreamBotConfig.RobotConfig());
        }
        if (config.getRobot().getEcho() == null) {
            config.getRobot().setEcho(false);
        }
        return config;
    }
}
