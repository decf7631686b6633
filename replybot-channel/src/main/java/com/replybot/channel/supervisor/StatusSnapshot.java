package com.replybot.channel.supervisor;

import com.replybot.channel.transport.ChatTransport;

import java.time.Instant;

/**
 * Point-in-time view of the supervised session, as broadcast on
 * {@code bot:status} and returned by {@link ConnectionSupervisor#getStatus()}.
 */
public record StatusSnapshot(
        ConnectionState state,
        boolean ready,
        ChatTransport.ClientInfo clientInfo,
        String qrCode,
        int retryCount,
        int maxRetries,
        Instant timestamp) {
}
