package com.replybot.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches ReplyBot configuration.
 * <p>
 * The file is JSON; {@code ${VAR}} and {@code ${VAR:-default}} are replaced
 * from the environment before parsing. A missing or unreadable file yields
 * the defaults.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ReplyBotConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
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
    public ReplyBotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ReplyBotConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write the config back to disk (pretty-printed) and drop the cache.
     */
    public void saveConfig(ReplyBotConfig config) throws IOException {
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(config);
        Files.writeString(configPath, json);
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ReplyBotConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ReplyBotConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            ReplyBotConfig config = objectMapper.readValue(raw, ReplyBotConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new ReplyBotConfig());
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
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    ReplyBotConfig applyDefaults(ReplyBotConfig config) {
        if (config.getDataPath() == null || config.getDataPath().isBlank()) {
            config.setDataPath(System.getProperty("user.home") + "/.replybot/data");
        }
        if (config.getPersistence() == null) {
            config.setPersistence(new ReplyBotConfig.PersistenceConfig());
        }
        if (config.getAnalytics() == null) {
            config.setAnalytics(new ReplyBotConfig.AnalyticsConfig());
        }
        if (config.getConnection() == null) {
            config.setConnection(new ReplyBotConfig.ConnectionConfig());
        }
        if (config.getPipeline() == null) {
            config.setPipeline(new ReplyBotConfig.PipelineConfig());
        }
        if (config.getSettings() == null) {
            config.setSettings(new BotSettings());
        }
        applyDefaults(config.getSettings());
        return config;
    }

    /**
     * Fill missing sections of operator settings in place, e.g. a saved
     * settings file with {@code "llm": null}.
     */
    public static BotSettings applyDefaults(BotSettings settings) {
        if (settings.getWorkingHours() == null) {
            settings.setWorkingHours(new BotSettings.WorkingHours());
        }
        if (settings.getLlm() == null) {
            settings.setLlm(new LlmSettings());
        }
        if (settings.getAllowedContacts() == null) {
            settings.setAllowedContacts(new ArrayList<>());
        }
        if (settings.getBlockedContacts() == null) {
            settings.setBlockedContacts(new ArrayList<>());
        }
        return settings;
    }
}
