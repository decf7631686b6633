package com.replybot.autoreply;

import com.replybot.agent.prompt.GenerationContext;
import com.replybot.agent.runtime.GenerationException;
import com.replybot.agent.runtime.ResponseGenerator;
import com.replybot.autoreply.ratelimit.RateLimiter;
import com.replybot.autoreply.schedule.BusinessHours;
import com.replybot.channel.model.Message;
import com.replybot.channel.transport.PhoneNumbers;
import com.replybot.common.config.BotSettings;
import com.replybot.common.config.LlmSettings;
import com.replybot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Decides whether and how to answer an inbound message.
 * <p>
 * Checks run in order and stop at the first rejection: auto-reply enabled,
 * not our own message, working hours (only when the restriction is enabled),
 * allow-list, block-list, rate limit. A passing message is answered by the
 * language model when it is enabled for auto-replies. A generation failure
 * answers with the configured fallback text inside working hours and the
 * after-hours message outside them, without charging the rate limit.
 * <p>
 * {@link #evaluate} blocks for at most the generation timeout.
 */
@Slf4j
public class AutoReplyGate {

    private final RateLimiter rateLimiter;
    private final ResponseGenerator generator;
    private final BusinessHours businessHours;
    private final Clock clock;

    public AutoReplyGate(RateLimiter rateLimiter, ResponseGenerator generator,
            BusinessHours businessHours, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.generator = generator;
        this.businessHours = businessHours;
        this.clock = clock;
    }

    public AutoReplyDecision evaluate(Message message, BotSettings settings) {
        String sender = message.getSender();

        if (!settings.isAutoReply()) {
            return reject(RejectReason.AUTO_REPLY_DISABLED, sender);
        }
        if (message.isFromMe()) {
            return reject(RejectReason.FROM_ME, sender);
        }

        Instant now = clock.instant();
        BotSettings.WorkingHours hours = settings.getWorkingHours();
        boolean open = businessHours.isOpen(hours, now);
        if (hours.isEnabled() && !open) {
            return reject(RejectReason.OUTSIDE_BUSINESS_HOURS, sender);
        }

        List<String> allowed = settings.getAllowedContacts();
        if (allowed != null && !allowed.isEmpty() && !containsContact(allowed, sender)) {
            return reject(RejectReason.NOT_ALLOWED, sender);
        }
        if (containsContact(settings.getBlockedContacts(), sender)) {
            return reject(RejectReason.BLOCKED, sender);
        }
        if (!rateLimiter.allow(sender)) {
            return reject(RejectReason.RATE_LIMITED, sender);
        }

        LlmSettings llm = settings.getLlm();
        boolean useLlm = llm.isEnabled() && llm.isAutoReply() && !(llm.isOnlyDuringBusinessHours() && !open);
        if (useLlm) {
            GenerationContext context = GenerationContext.builder()
                    .senderId(sender)
                    .senderName(message.getSenderName())
                    .group(message.isGroup())
                    .businessHours(open)
                    .build();
            try {
                String text = generator.generate(message.getContent(), context).join();
                rateLimiter.record(sender);
                log.debug("[gate] LLM reply for {}", sender);
                return AutoReplyDecision.reply(text, ResponseType.LLM, open);
            } catch (CompletionException | CancellationException e) {
                Throwable cause = ErrorUtils.unwrap(e);
                String reason = cause instanceof GenerationException ge
                        ? ge.getReason().name()
                        : cause.getClass().getSimpleName();
                log.warn("[gate] Generation failed for {} ({}: {}), using fallback reply",
                        sender, reason, ErrorUtils.formatErrorMessage(cause));
                return fallbackReply(settings, llm, open);
            }
        }
        return staticReply(settings, open);
    }

    private static AutoReplyDecision fallbackReply(BotSettings settings, LlmSettings llm, boolean open) {
        String fallback = llm.getFallbackMessage();
        if (!open || fallback == null || fallback.isBlank()) {
            return staticReply(settings, open);
        }
        return AutoReplyDecision.reply(fallback, ResponseType.DEFAULT, true);
    }

    private static AutoReplyDecision staticReply(BotSettings settings, boolean open) {
        if (!open) {
            String text = settings.getAfterHoursMessage() != null
                    ? settings.getAfterHoursMessage() : BotSettings.DEFAULT_AFTER_HOURS_MESSAGE;
            return AutoReplyDecision.reply(text, ResponseType.AFTER_HOURS, false);
        }
        String text = settings.getAutoReplyMessage() != null && !settings.getAutoReplyMessage().isBlank()
                ? settings.getAutoReplyMessage() : BotSettings.DEFAULT_AUTO_REPLY_MESSAGE;
        return AutoReplyDecision.reply(text, ResponseType.DEFAULT, true);
    }

    private static AutoReplyDecision reject(RejectReason reason, String sender) {
        log.debug("[gate] Skipping auto-reply for {}: {}", sender, reason);
        return AutoReplyDecision.rejected(reason);
    }

    /**
     * List membership that treats {@code "+1 555-0001"}, {@code "15550001"} and
     * {@code "15550001@c.us"} as the same contact.
     */
    static boolean containsContact(List<String> contacts, String sender) {
        if (contacts == null || contacts.isEmpty() || sender == null) {
            return false;
        }
        String target = canonical(sender);
        for (String contact : contacts) {
            if (contact != null && canonical(contact).equals(target)) {
                return true;
            }
        }
        return false;
    }

    private static String canonical(String contact) {
        try {
            return PhoneNumbers.toChatId(contact);
        } catch (IllegalArgumentException e) {
            return contact.trim();
        }
    }
}
