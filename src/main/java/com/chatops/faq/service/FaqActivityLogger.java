package com.chatops.faq.service;

import com.chatops.faq.config.FaqBotConfig;
import com.chatops.faq.exception.FaqReviewException;
import com.chatops.faq.model.FaqLogEntry;
import com.chatops.faq.model.MessageType;
import com.chatops.faq.model.ReviewRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Audit trail of bot activity: an application log line for every entry, mirrored to the
 * configured log channel when one is set. Never throws.
 */
@Component
public class FaqActivityLogger {

    private static final Logger log = LoggerFactory.getLogger(FaqActivityLogger.class);

    private final FaqBotConfig config;
    private final NotificationPort notificationPort;

    public FaqActivityLogger(FaqBotConfig config, NotificationPort notificationPort) {
        this.config = config;
        this.notificationPort = notificationPort;
    }

    public void log(FaqLogEntry entry) {
        log.info("FAQ activity: type={}, score={}, reviewId={}, reviewer={}, sender={}, room={}",
                entry.getType(), String.format(Locale.ROOT, "%.2f", entry.getScore()),
                entry.getReviewId(), entry.getReviewerUsername(),
                entry.getSenderUsername(), entry.getRoomName());
        postToLogChannel(format(entry));
    }

    public void logStatusChange(ReviewRecord review, String actor) {
        log.info("Review {} is now {} (by {})", review.getReviewId(), review.getStatus(), actor);
        postToLogChannel(formatStatusChange(review, actor));
    }

    static String format(FaqLogEntry entry) {
        StringBuilder text = new StringBuilder();
        boolean direct = entry.getType() == MessageType.ALPHA;
        text.append(direct ? "🟢 **[Direct Match]**" : "🟡 **[Review Needed]**").append('\n');
        text.append(String.format(Locale.ROOT, "**From:** @%s | **Room:** #%s | **Score:** %.2f",
                entry.getSenderUsername(), entry.getRoomName(), entry.getScore())).append('\n');
        text.append("**User Message:**\n>").append(entry.getOriginalMessage()).append('\n');

        if (direct) {
            text.append("**Response Given:**\n").append(entry.getProposedAnswer());
        } else {
            text.append("**Proposed Response:**\n").append(entry.getProposedAnswer()).append('\n');
            text.append("**Reviewer:** @").append(entry.getReviewerUsername()).append('\n');
            text.append("**Review ID:** ").append(entry.getReviewId()).append(" | **Status:** Pending Review");
        }
        return text.toString();
    }

    static String formatStatusChange(ReviewRecord review, String actor) {
        String emoji = switch (review.getStatus()) {
            case APPROVED -> "✅";
            case REJECTED -> "❌";
            case EXPIRED -> "⌛";
            default -> "📝";
        };
        return String.format("%s Review **%s** was **%s** by @%s",
                emoji, review.getReviewId(), review.getStatus().name().toLowerCase(Locale.ROOT), actor);
    }

    private void postToLogChannel(String text) {
        String channel = config.getLogChannelName();
        if (channel == null || channel.isBlank()) {
            return;
        }
        try {
            notificationPort.postToChannel(channel, text);
        } catch (FaqReviewException e) {
            log.warn("Could not post to log channel {}: {}", channel, e.getMessage());
        }
    }
}
