package com.chatops.faq.service;

import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.config.ReviewerAlertConfig;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewerIdentity;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Optional SMS/WhatsApp heads-up to a reviewer when a review is assigned to them.
 * Reviewers without a configured number are skipped.
 */
@Service
public class TwilioReviewerAlertService {

    private static final Logger log = LoggerFactory.getLogger(TwilioReviewerAlertService.class);

    private static final int MAX_PREVIEW = 120;

    private final ReviewerAlertConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioReviewerAlertService(ReviewerAlertConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio reviewer alerts initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio reviewer alerts are DISABLED.");
        }
    }

    @Async
    @Observed(name = "reviewer.alert.send", contextualName = "send-reviewer-alert")
    public void alertReviewer(ReviewRecord review, ReviewerIdentity reviewer) {
        if (!config.isEnabled()) {
            return;
        }
        String number = config.getReviewerNumbers().get(reviewer.username());
        if (number == null || number.isBlank()) {
            log.debug("No phone number configured for reviewer {}", reviewer.username());
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(number)),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(review)
            ).create();

            metricsConfig.recordDelivery(config.getChannel(), "success");
            log.info("Reviewer alert sent for review={}, sid={}", review.getReviewId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordDelivery(config.getChannel(), "error");
            log.error("Failed to send reviewer alert for review={}: {}", review.getReviewId(), e.getMessage(), e);
        }
    }

    static String buildMessageBody(ReviewRecord review) {
        String question = review.getOriginalMessageText();
        if (question != null && question.length() > MAX_PREVIEW) {
            question = question.substring(0, MAX_PREVIEW) + "...";
        }
        return String.format(
                "[FAQ REVIEW] New response waiting for you\n" +
                "Room: %s\n" +
                "From: %s\n" +
                "Question: %s\n" +
                "Review ID: %s",
                review.getRoomName(),
                review.getSenderUsername(),
                question,
                review.getReviewId());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
