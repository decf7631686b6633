package com.replybot.channel.events;

/**
 * Topic names used with {@link EventBroadcaster}.
 */
public final class EventTopics {

    private EventTopics() {
    }

    public static final String BOT_STATUS = "bot:status";
    public static final String BOT_QR = "bot:qr";
    public static final String BOT_READY = "bot:ready";

    public static final String MESSAGE_NEW = "message:new";
    public static final String MESSAGE_SENT = "message:sent";
    public static final String MESSAGE_FAILED = "message:failed";
    public static final String MESSAGE_STATUS = "message:status";

    public static final String AUTO_REPLY_SENT = "autoreply:sent";
    public static final String SETTINGS_UPDATED = "settings:updated";
}
