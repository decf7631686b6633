package com.replybot.autoreply;

/**
 * Outcome of {@link AutoReplyGate#evaluate}: either a rejection or a reply to
 * send.
 *
 * @param rejectReason   set for rejections, {@code null} for replies
 * @param text           reply text
 * @param responseType   where the text came from
 * @param isWorkingHours whether the message arrived inside the working-hours window
 */
public record AutoReplyDecision(
        RejectReason rejectReason,
        String text,
        ResponseType responseType,
        boolean isWorkingHours) {

    public static AutoReplyDecision rejected(RejectReason reason) {
        return new AutoReplyDecision(reason, null, null, false);
    }

    public static AutoReplyDecision reply(String text, ResponseType responseType, boolean isWorkingHours) {
        return new AutoReplyDecision(null, text, responseType, isWorkingHours);
    }

    public boolean isReply() {
        return rejectReason == null;
    }
}
