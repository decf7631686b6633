package com.replybot.autoreply;

/** Why the gate declined to answer a message. */
public enum RejectReason {
    AUTO_REPLY_DISABLED,
    FROM_ME,
    OUTSIDE_BUSINESS_HOURS,
    NOT_ALLOWED,
    BLOCKED,
    RATE_LIMITED
}
