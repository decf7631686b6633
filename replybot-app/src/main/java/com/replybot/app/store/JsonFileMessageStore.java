package com.replybot.app.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.replybot.autoreply.AutoReplyRecord;
import com.replybot.channel.model.Message;
import com.replybot.channel.model.MessageStatus;
import com.replybot.common.config.BotSettings;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory store, optionally backed by JSON files under a data directory.
 * <p>
 * Messages and auto-reply records are appended as JSON lines
 * ({@code messages.jsonl}, {@code autoreplies.jsonl}); a status update appends
 * the updated message and the last line for an id wins on load. Settings and
 * analytics are whole-file JSON documents written with owner-only permissions.
 */
@Slf4j
public class JsonFileMessageStore implements MessageStore {

    static final String MESSAGES_FILE = "messages.jsonl";
    static final String AUTO_REPLIES_FILE = "autoreplies.jsonl";
    static final String SETTINGS_FILE = "settings.json";

    private final Path dataDir;
    private final ObjectMapper mapper;

    private final Map<String, Message> messages = new LinkedHashMap<>();
    private final List<AutoReplyRecord> autoReplies = new ArrayList<>();
    private final Map<String, Object> analytics = new LinkedHashMap<>();
    private BotSettings settings;

    /** Memory-only store. */
    public JsonFileMessageStore() {
        this(null);
    }

    /**
     * @param dataDir directory for the JSON files, or {@code null} to keep
     *                everything in memory
     */
    public JsonFileMessageStore(Path dataDir) {
        this.dataDir = dataDir;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        if (dataDir != null) {
            load();
        }
    }

    // ── Messages ────────────────────────────────────────────────────────

    @Override
    public synchronized void saveMessage(Message message) {
        messages.put(message.getId(), message);
        appendLine(MESSAGES_FILE, message);
    }

    @Override
    public synchronized boolean updateMessageStatus(String messageId, MessageStatus status, Instant updatedAt) {
        Message existing = messages.get(messageId);
        if (existing == null) {
            log.debug("[store] Status update for unknown message {}", messageId);
            return false;
        }
        Message updated = existing.toBuilder().status(status).statusUpdatedAt(updatedAt).build();
        messages.put(messageId, updated);
        appendLine(MESSAGES_FILE, updated);
        return true;
    }

    @Override
    public synchronized Optional<Message> getMessage(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public synchronized List<Message> getMessages(Instant from, Instant to) {
        return messages.values().stream()
                .filter(m -> m.getTimestamp() != null
                        && !m.getTimestamp().isBefore(from)
                        && m.getTimestamp().isBefore(to))
                .sorted(Comparator.comparing(Message::getTimestamp))
                .toList();
    }

    // ── Settings ────────────────────────────────────────────────────────

    @Override
    public synchronized Optional<BotSettings> getSettings() {
        return Optional.ofNullable(settings);
    }

    @Override
    public synchronized void saveSettings(BotSettings next) {
        this.settings = next;
        writeDocument(SETTINGS_FILE, next);
    }

    // ── Auto-replies ────────────────────────────────────────────────────

    @Override
    public synchronized void saveAutoReply(AutoReplyRecord record) {
        autoReplies.add(record);
        appendLine(AUTO_REPLIES_FILE, record);
    }

    @Override
    public synchronized List<AutoReplyRecord> getAutoReplies(int limit) {
        int from = Math.max(0, autoReplies.size() - limit);
        return new ArrayList<>(autoReplies.subList(from, autoReplies.size()));
    }

    // ── Analytics ───────────────────────────────────────────────────────

    @Override
    public synchronized void saveAnalytics(String kind, Object payload) {
        analytics.put(kind, payload);
        writeDocument(analyticsFile(kind), payload);
    }

    @Override
    public synchronized <T> Optional<T> loadAnalytics(String kind, Class<T> type) {
        Object cached = analytics.get(kind);
        if (type.isInstance(cached)) {
            return Optional.of(type.cast(cached));
        }
        if (dataDir == null) {
            return Optional.empty();
        }
        Path file = dataDir.resolve(analyticsFile(kind));
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("[store] Unreadable analytics file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String analyticsFile(String kind) {
        return "analytics-" + kind + ".json";
    }

    // ── File I/O ────────────────────────────────────────────────────────

    private void load() {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + dataDir, e);
        }
        readLines(MESSAGES_FILE, Message.class).forEach(m -> messages.put(m.getId(), m));
        autoReplies.addAll(readLines(AUTO_REPLIES_FILE, AutoReplyRecord.class));

        Path settingsFile = dataDir.resolve(SETTINGS_FILE);
        if (Files.exists(settingsFile)) {
            try {
                settings = mapper.readValue(settingsFile.toFile(), BotSettings.class);
            } catch (IOException e) {
                log.warn("[store] Ignoring unreadable settings file {}: {}", settingsFile, e.getMessage());
            }
        }
        log.info("[store] Loaded {} messages, {} auto-replies from {}",
                messages.size(), autoReplies.size(), dataDir);
    }

    private <T> List<T> readLines(String fileName, Class<T> type) {
        Path file = dataDir.resolve(fileName);
        List<T> result = new ArrayList<>();
        if (!Files.exists(file)) {
            return result;
        }
        try (BufferedReader reader = Files.newBufferedReader(file)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    result.add(mapper.readValue(line, type));
                } catch (JsonProcessingException e) {
                    log.warn("[store] Skipping malformed line {} of {}: {}", lineNo, file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        return result;
    }

    private void appendLine(String fileName, Object value) {
        if (dataDir == null) {
            return;
        }
        Path file = dataDir.resolve(fileName);
        try {
            Files.writeString(file, mapper.writeValueAsString(value) + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to " + file, e);
        }
    }

    private void writeDocument(String fileName, Object value) {
        if (dataDir == null) {
            return;
        }
        Path file = dataDir.resolve(fileName);
        try {
            Files.writeString(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value) + "\n");
            restrictPermissions(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    private static void restrictPermissions(Path file) throws IOException {
        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(file, perms);
        } catch (UnsupportedOperationException e) {
            log.debug("[store] POSIX permissions unsupported for {}", file);
        }
    }
}
