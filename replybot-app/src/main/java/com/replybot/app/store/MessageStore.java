package com.replybot.app.store;

import com.replybot.autoreply.AutoReplyRecord;
import com.replybot.channel.model.Message;
import com.replybot.channel.model.MessageStatus;
import com.replybot.common.config.BotSettings;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for messages, auto-reply audit records, operator settings and
 * analytics snapshots.
 * <p>
 * Implementations may throw unchecked exceptions on I/O failure; the
 * pipeline logs and continues.
 */
public interface MessageStore {

    void saveMessage(Message message);

    /**
     * @return whether a message with {@code messageId} was known
     */
    boolean updateMessageStatus(String messageId, MessageStatus status, Instant updatedAt);

    Optional<Message> getMessage(String messageId);

    /** Messages with a timestamp in {@code [from, to)}, oldest first. */
    List<Message> getMessages(Instant from, Instant to);

    /** Saved operator settings, empty when none were ever saved. */
    Optional<BotSettings> getSettings();

    void saveSettings(BotSettings settings);

    void saveAutoReply(AutoReplyRecord record);

    /** Most recent auto-reply records, newest last. */
    List<AutoReplyRecord> getAutoReplies(int limit);

    void saveAnalytics(String kind, Object payload);

    <T> Optional<T> loadAnalytics(String kind, Class<T> type);
}
