package com.chatops.faq.service;

import com.chatops.faq.config.FaqBotConfig;
import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.engine.MessageClassifier;
import com.chatops.faq.exception.ConfigurationException;
import com.chatops.faq.exception.DeliveryException;
import com.chatops.faq.exception.PersistenceException;
import com.chatops.faq.exception.ReviewerNotFoundException;
import com.chatops.faq.model.ClassificationResult;
import com.chatops.faq.model.FaqLogEntry;
import com.chatops.faq.model.GeneratedAnswer;
import com.chatops.faq.model.InboundMessage;
import com.chatops.faq.model.MessageType;
import com.chatops.faq.model.ProcessingOutcome;
import com.chatops.faq.model.ProcessingResult;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import com.chatops.faq.model.ReviewerIdentity;
import com.chatops.faq.repository.ReviewRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for inbound chat messages: filter, classify, then answer directly,
 * escalate to a reviewer, or drop.
 *
 * Messages from the same room are processed one at a time so answers come out in
 * arrival order; rooms do not wait on each other.
 */
@Service
public class FaqMessageService {

    private static final Logger log = LoggerFactory.getLogger(FaqMessageService.class);

    private final FaqBotConfig config;
    private final MessageClassifier classifier;
    private final AnswerGenerator answerGenerator;
    private final ReviewerRotator reviewerRotator;
    private final ReviewRepository reviewRepository;
    private final NotificationPort notificationPort;
    private final TwilioReviewerAlertService reviewerAlerts;
    private final FaqActivityLogger activityLogger;
    private final ConversationLocks conversationLocks;
    private final MetricsConfig metricsConfig;

    public FaqMessageService(FaqBotConfig config,
                             MessageClassifier classifier,
                             AnswerGenerator answerGenerator,
                             ReviewerRotator reviewerRotator,
                             ReviewRepository reviewRepository,
                             NotificationPort notificationPort,
                             TwilioReviewerAlertService reviewerAlerts,
                             FaqActivityLogger activityLogger,
                             ConversationLocks conversationLocks,
                             MetricsConfig metricsConfig) {
        this.config = config;
        this.classifier = classifier;
        this.answerGenerator = answerGenerator;
        this.reviewerRotator = reviewerRotator;
        this.reviewRepository = reviewRepository;
        this.notificationPort = notificationPort;
        this.reviewerAlerts = reviewerAlerts;
        this.activityLogger = activityLogger;
        this.conversationLocks = conversationLocks;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "faq.message.process", contextualName = "process-message")
    public ProcessingResult process(InboundMessage message) {
        String skipReason = skipReason(message);
        if (skipReason != null) {
            log.debug("Ignoring message {}: {}", message.getMessageId(), skipReason);
            return ProcessingResult.ignored(message.getMessageId(), skipReason);
        }
        String roomKey = message.getRoomId() != null ? message.getRoomId() : "";
        return conversationLocks.withLock(roomKey, () -> handle(message));
    }

    private String skipReason(InboundMessage message) {
        String text = message.getText();
        if (text == null || text.isBlank()) {
            return "empty message";
        }
        if (message.isFromBot()) {
            return "sent by a bot";
        }
        if (config.getBotUserId() != null && config.getBotUserId().equals(message.getSenderId())) {
            return "sent by this app";
        }
        if (text.startsWith(NotificationPort.BOT_PREFIX.trim())) {
            return "bot answer";
        }
        return null;
    }

    private ProcessingResult handle(InboundMessage message) {
        try {
            requireGeneratorSettings();
        } catch (ConfigurationException e) {
            log.error("Dropping message {}: {}", message.getMessageId(), e.getMessage());
            return result(message, ProcessingOutcome.DROPPED, null, 0.0).reason(e.getMessage()).build();
        }

        ClassificationResult classification = classifier.classify(message.getText());
        metricsConfig.recordClassification(classification.getType().name(), classification.getScore());
        log.debug("Message {} classified {} (score {})",
                message.getMessageId(), classification.getType(), classification.getScore());

        return switch (classification.getType()) {
            case ALPHA -> answerDirectly(message, classification);
            case BETA -> handleCandidate(message, classification);
            default -> result(message, ProcessingOutcome.IGNORED, MessageType.UNRELATED, classification.getScore())
                    .reason("unrelated")
                    .build();
        };
    }

    private void requireGeneratorSettings() {
        if (isBlank(config.getApiKey()) || isBlank(config.getApiEndpoint())) {
            throw new ConfigurationException("Generator API key and endpoint must both be configured");
        }
    }

    private ProcessingResult answerDirectly(InboundMessage message, ClassificationResult classification) {
        String answer = classification.getMatchedEntry().answer();
        try {
            notificationPort.deliver(message.getRoomId(), answer);
        } catch (DeliveryException e) {
            log.error("Direct answer for message {} could not be delivered: {}",
                    message.getMessageId(), e.getMessage(), e);
            return result(message, ProcessingOutcome.FAILED, MessageType.ALPHA, classification.getScore())
                    .reason("delivery failed")
                    .build();
        }

        activityLogger.log(logEntry(message, classification)
                .matchedQuestion(classification.getMatchedEntry().question())
                .proposedAnswer(answer)
                .build());
        return result(message, ProcessingOutcome.ANSWERED, MessageType.ALPHA, classification.getScore()).build();
    }

    private ProcessingResult handleCandidate(InboundMessage message, ClassificationResult classification) {
        GeneratedAnswer generated = answerGenerator.check(message.getText(), classifier.getCorpus());
        if (!generated.hasAnswer()) {
            String reason = generated.error() != null ? generated.error() : "no matching FAQ";
            log.info("No answer for message {}: {}", message.getMessageId(), reason);
            return result(message, ProcessingOutcome.DROPPED, MessageType.BETA, classification.getScore())
                    .reason(reason)
                    .build();
        }

        if (!config.isEnableReviewMode()) {
            try {
                notificationPort.deliver(message.getRoomId(), generated.answer());
            } catch (DeliveryException e) {
                log.error("Generated answer for message {} could not be delivered: {}",
                        message.getMessageId(), e.getMessage(), e);
                return result(message, ProcessingOutcome.FAILED, MessageType.BETA, classification.getScore())
                        .reason("delivery failed")
                        .build();
            }
            return result(message, ProcessingOutcome.ANSWERED, MessageType.BETA, classification.getScore()).build();
        }

        return escalate(message, classification, generated);
    }

    private ProcessingResult escalate(InboundMessage message, ClassificationResult classification,
                                      GeneratedAnswer generated) {
        Optional<ReviewerIdentity> selected = reviewerRotator.selectNext(config.getReviewerUsernames());
        if (selected.isEmpty()) {
            ReviewerNotFoundException e = new ReviewerNotFoundException(config.getReviewerUsernames());
            log.warn("Dropping message {}: {}", message.getMessageId(), e.getMessage());
            return result(message, ProcessingOutcome.DROPPED, MessageType.BETA, classification.getScore())
                    .reason(e.getMessage())
                    .build();
        }
        ReviewerIdentity reviewer = selected.get();

        long now = System.currentTimeMillis();
        ReviewRecord review = ReviewRecord.builder()
                .reviewId(ReviewRepository.generateReviewId(now))
                .sourceMessageId(message.getMessageId())
                .roomId(message.getRoomId())
                .roomType(message.getRoomType())
                .roomName(message.getRoomName())
                .senderId(message.getSenderId())
                .senderUsername(message.getSenderUsername())
                .originalMessageText(message.getText())
                .detectedQuestion(generated.detectedQuestion() != null ? generated.detectedQuestion() : "")
                .proposedAnswer(generated.answer())
                .createdAt(now)
                .status(ReviewStatus.PENDING)
                .reviewerId(reviewer.id())
                .reviewerUsername(reviewer.username())
                .build();

        try {
            reviewRepository.create(review);
        } catch (PersistenceException e) {
            log.error("Could not store review for message {}: {}", message.getMessageId(), e.getMessage(), e);
            return result(message, ProcessingOutcome.FAILED, MessageType.BETA, classification.getScore())
                    .reason("review could not be stored")
                    .build();
        }
        log.info("Review {} created for message {}, assigned to {}",
                review.getReviewId(), message.getMessageId(), reviewer.username());

        try {
            notificationPort.notifyReviewer(review, reviewer);
        } catch (DeliveryException e) {
            log.error("Review {} stored but reviewer {} could not be notified: {}",
                    review.getReviewId(), reviewer.username(), e.getMessage(), e);
        }
        reviewerAlerts.alertReviewer(review, reviewer);

        activityLogger.log(logEntry(message, classification)
                .matchedQuestion(review.getDetectedQuestion())
                .proposedAnswer(review.getProposedAnswer())
                .reviewId(review.getReviewId())
                .reviewerId(reviewer.id())
                .reviewerUsername(reviewer.username())
                .build());

        return result(message, ProcessingOutcome.ESCALATED, MessageType.BETA, classification.getScore())
                .reviewId(review.getReviewId())
                .reviewerId(reviewer.id())
                .build();
    }

    private static FaqLogEntry.FaqLogEntryBuilder logEntry(InboundMessage message, ClassificationResult classification) {
        return FaqLogEntry.builder()
                .type(classification.getType())
                .score(classification.getScore())
                .senderUsername(message.getSenderUsername())
                .roomName(message.getRoomName())
                .originalMessage(message.getText());
    }

    private static ProcessingResult.ProcessingResultBuilder result(InboundMessage message, ProcessingOutcome outcome,
                                                                   MessageType type, double score) {
        return ProcessingResult.builder()
                .messageId(message.getMessageId())
                .outcome(outcome)
                .type(type)
                .score(score);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
