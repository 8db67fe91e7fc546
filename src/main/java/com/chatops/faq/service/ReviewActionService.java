package com.chatops.faq.service;

import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.exception.DeliveryException;
import com.chatops.faq.exception.InvalidTransitionException;
import com.chatops.faq.exception.ReviewNotFoundException;
import com.chatops.faq.model.ActionOutcome;
import com.chatops.faq.model.ActionResult;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.repository.ReviewRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies reviewer actions to reviews.
 *
 * The state change is committed first. Delivering the answer and confirming to the
 * reviewer happen afterwards; their failures are reported in the {@link ActionResult}
 * and never undo the transition.
 */
@Service
public class ReviewActionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewActionService.class);

    private final ReviewRepository reviewRepository;
    private final NotificationPort notificationPort;
    private final FaqActivityLogger activityLogger;
    private final MetricsConfig metricsConfig;

    public ReviewActionService(ReviewRepository reviewRepository,
                               NotificationPort notificationPort,
                               FaqActivityLogger activityLogger,
                               MetricsConfig metricsConfig) {
        this.reviewRepository = reviewRepository;
        this.notificationPort = notificationPort;
        this.activityLogger = activityLogger;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @param editedText replacement answer, required for {@link ReviewAction#SUBMIT_EDIT}
     *                   and ignored otherwise
     * @throws IllegalArgumentException for a missing actor, a system-only action, or an
     *                                  edit submitted without text
     */
    @Observed(name = "review.action", contextualName = "apply-review-action")
    public ActionResult apply(String reviewId, ReviewAction action, String actor, String editedText) {
        if (!action.isHumanAction()) {
            throw new IllegalArgumentException("Action " + action.label() + " cannot be requested by a reviewer");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
        if (action == ReviewAction.SUBMIT_EDIT && (editedText == null || editedText.isBlank())) {
            throw new IllegalArgumentException("text is required when submitting an edit");
        }

        ReviewRecord current = reviewRepository.findById(reviewId);
        if (current == null) {
            log.warn("Action {} on unknown review {}", action.label(), reviewId);
            return ActionResult.notFound(reviewId, action);
        }
        if (!action.isAllowedFrom(current.getStatus())) {
            log.info("Rejected {} on review {}: status is {}", action.label(), reviewId, current.getStatus());
            return ActionResult.invalidState(reviewId, action, current.getStatus());
        }

        ReviewRecord updated;
        try {
            updated = reviewRepository.transition(reviewId, action, actor,
                    action == ReviewAction.SUBMIT_EDIT ? editedText.trim() : null);
        } catch (ReviewNotFoundException e) {
            return ActionResult.notFound(reviewId, action);
        } catch (InvalidTransitionException e) {
            return ActionResult.invalidState(reviewId, action, e.getCurrentStatus());
        }

        metricsConfig.recordTransition(action.label());
        log.info("Review {} {} by {}: {} -> {}", reviewId, action.label(), actor,
                action.getFrom(), updated.getStatus());

        boolean delivered = false;
        if (action.delivers()) {
            try {
                notificationPort.deliver(updated.getRoomId(), updated.getProposedAnswer());
                delivered = true;
            } catch (DeliveryException e) {
                log.error("Review {} is {} but the answer could not be delivered to room {}: {}",
                        reviewId, updated.getStatus(), updated.getRoomId(), e.getMessage(), e);
            }
        }

        boolean confirmed = false;
        try {
            notificationPort.sendConfirmation(actor, updated, action);
            confirmed = true;
        } catch (DeliveryException e) {
            log.error("Could not confirm {} of review {} to {}: {}",
                    action.label(), reviewId, actor, e.getMessage(), e);
        }

        if (updated.getStatus().isTerminal()) {
            activityLogger.logStatusChange(updated, actor);
        }

        return ActionResult.builder()
                .reviewId(reviewId)
                .action(action.label())
                .outcome(ActionOutcome.APPLIED)
                .status(updated.getStatus())
                .delivered(delivered)
                .confirmed(confirmed)
                .message(action.delivers() && !delivered
                        ? "Review " + updated.getStatus() + " but the answer was not delivered"
                        : "Review " + updated.getStatus())
                .build();
    }
}
