package com.replybot.common.config;

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
        configPath = tempDir.resolve("replybot.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "connection": { "maxRetries": 5, "reconnectDelayMs": 2000 },
                  "settings": {
                    "autoReply": false,
                    "blockedContacts": ["15550001"],
                    "workingHours": { "enabled": true, "start": "08:30", "end": "18:00" },
                    "llm": { "enabled": true, "provider": "openai", "model": "gpt-4o-mini" }
                  }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        ReplyBotConfig config = service.loadConfig();

        assertEquals(5, config.getConnection().getMaxRetries());
        assertEquals(2000, config.getConnection().getReconnectDelayMs());
        assertFalse(config.getSettings().isAutoReply());
        assertEquals("08:30", config.getSettings().getWorkingHours().getStart());
        assertEquals(LlmProvider.OPENAI, config.getSettings().getLlm().getProvider());
        // untouched defaults survive partial JSON
        assertEquals(150, config.getSettings().getLlm().getMaxTokens());
        assertEquals(10_000, config.getSettings().getLlm().getTimeoutMs());
        assertEquals(1000, config.getAnalytics().getErrorLogCapacity());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        ReplyBotConfig config = service.loadConfig();

        assertNotNull(config.getSettings());
        assertTrue(config.getSettings().isAutoReply());
        assertEquals(BotSettings.DEFAULT_AUTO_REPLY_MESSAGE, config.getSettings().getAutoReplyMessage());
        assertEquals(3, config.getConnection().getMaxRetries());
        assertNotNull(config.getDataPath());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "settings": { "llm": { "apiKey": "${GEMINI_API_KEY}", "model": "${LLM_MODEL:-gemini-pro}" } } }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200),
                Map.of("GEMINI_API_KEY", "secret-value"));
        ReplyBotConfig config = service.loadConfig();

        assertEquals("secret-value", config.getSettings().getLlm().getApiKey());
        assertEquals("gemini-pro", config.getSettings().getLlm().getModel());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"pipeline\": { \"lanes\": 2 } }");

        ConfigService service = new ConfigService(configPath);
        ReplyBotConfig first = service.loadConfig();
        ReplyBotConfig second = service.loadConfig();

        assertSame(first, second);
        assertEquals(2, first.getPipeline().getLanes());
    }

    @Test
    void saveConfig_thenReload_roundTripsSettings() throws IOException {
        ConfigService service = new ConfigService(configPath);
        ReplyBotConfig config = service.loadConfig();
        config.getSettings().setAutoReplyMessage("Back soon");

        service.saveConfig(config);

        assertEquals("Back soon", service.reloadConfig().getSettings().getAutoReplyMessage());
    }

    @Test
    void loadConfig_nullSettingsSections_getDefaults() throws IOException {
        Files.writeString(configPath, """
                { "settings": { "workingHours": null, "llm": null, "blockedContacts": null } }
                """);

        BotSettings settings = new ConfigService(configPath).loadConfig().getSettings();

        assertNotNull(settings.getWorkingHours());
        assertFalse(settings.getWorkingHours().isEnabled());
        assertEquals(LlmSettings.DEFAULT_FALLBACK_MESSAGE, settings.getLlm().getFallbackMessage());
        assertTrue(settings.getBlockedContacts().isEmpty());
    }
}
