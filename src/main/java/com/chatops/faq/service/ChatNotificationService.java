package com.chatops.faq.service;

import com.chatops.faq.client.ChatApiClient;
import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.exception.DeliveryException;
import com.chatops.faq.exception.ExternalServiceException;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ChatNotificationService implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(ChatNotificationService.class);

    private final ChatApiClient chatApiClient;
    private final MetricsConfig metricsConfig;

    public ChatNotificationService(ChatApiClient chatApiClient, MetricsConfig metricsConfig) {
        this.chatApiClient = chatApiClient;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public void deliver(String roomId, String answer) {
        send("answer", roomId, BOT_PREFIX + answer);
        log.info("Answer delivered to room {}", roomId);
    }

    @Override
    public void notifyReviewer(ReviewRecord review, ReviewerIdentity reviewer) {
        String roomId = directRoom("review", reviewer.username());
        send("review", roomId, buildReviewRequest(review));
        log.info("Review {} sent to reviewer {}", review.getReviewId(), reviewer.username());
    }

    @Override
    public void sendConfirmation(String reviewerUsername, ReviewRecord review, ReviewAction action) {
        String roomId = directRoom("confirmation", reviewerUsername);
        send("confirmation", roomId, buildConfirmation(review, action));
    }

    @Override
    public void postToChannel(String channelName, String text) {
        String target = channelName.startsWith("#") ? channelName : "#" + channelName;
        send("log", target, text);
    }

    static String buildReviewRequest(ReviewRecord review) {
        String detected = review.getDetectedQuestion() != null && !review.getDetectedQuestion().isEmpty()
                ? review.getDetectedQuestion() : "(not identified)";
        return String.format(
                "*New FAQ Response Review*\n" +
                "*Original Message:*\n%s\n" +
                "*Room:* %s | *From:* %s\n" +
                "*Detected FAQ:*\n%s\n" +
                "*Proposed Response:*\n%s\n\n" +
                "Review ID: %s\n" +
                "Actions: approve, reject, edit",
                review.getOriginalMessageText(),
                review.getRoomName(),
                review.getSenderUsername(),
                detected,
                review.getProposedAnswer(),
                review.getReviewId());
    }

    static String buildConfirmation(ReviewRecord review, ReviewAction action) {
        return switch (action) {
            case APPROVE -> "✅ You approved the response to: \"" + review.getOriginalMessageText() + "\"\n\n"
                    + "The following response has been sent to the channel:\n\n" + review.getProposedAnswer();
            case REJECT -> "❌ You rejected the response to: \"" + review.getOriginalMessageText() + "\"\n\n"
                    + "No response has been sent to the channel.";
            case EDIT -> "📝 To edit this response, submit your edited text for review "
                    + review.getReviewId() + ":\n\n" + review.getProposedAnswer();
            case SUBMIT_EDIT -> "✅ Your edited response to: \"" + review.getOriginalMessageText() + "\" has been sent:\n\n"
                    + review.getProposedAnswer();
            case CANCEL_EDIT -> "Edit canceled. No changes were made to the FAQ response.";
            default -> throw new IllegalArgumentException("No confirmation for " + action);
        };
    }

    private String directRoom(String kind, String username) {
        try {
            return chatApiClient.createDirectRoom(username);
        } catch (ExternalServiceException e) {
            metricsConfig.recordDelivery(kind, "error");
            throw new DeliveryException("Could not open a direct room with " + username, e);
        }
    }

    private void send(String kind, String target, String text) {
        try {
            chatApiClient.postMessage(target, text);
            metricsConfig.recordDelivery(kind, "success");
        } catch (ExternalServiceException e) {
            metricsConfig.recordDelivery(kind, "error");
            throw new DeliveryException("Failed to post " + kind + " message to " + target, e);
        }
    }
}
