package com.chatops.faq.service;

import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.config.ReviewConfig;
import com.chatops.faq.exception.InvalidTransitionException;
import com.chatops.faq.exception.PersistenceException;
import com.chatops.faq.exception.ReviewNotFoundException;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import com.chatops.faq.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class ReviewExpiryService {

    private static final Logger log = LoggerFactory.getLogger(ReviewExpiryService.class);

    static final String SYSTEM_ACTOR = "SYSTEM";

    private final ReviewRepository reviewRepository;
    private final ReviewConfig reviewConfig;
    private final MetricsConfig metricsConfig;

    public ReviewExpiryService(ReviewRepository reviewRepository,
                               ReviewConfig reviewConfig,
                               MetricsConfig metricsConfig) {
        this.reviewRepository = reviewRepository;
        this.reviewConfig = reviewConfig;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(fixedRateString = "${faq.review.expiry-check-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public int expireStaleReviews() {
        return expireStaleReviews(System.currentTimeMillis());
    }

    /**
     * Expires every PENDING review older than the configured timeout at {@code now}.
     * Reviews a reviewer acts on during the sweep keep the reviewer's outcome.
     */
    int expireStaleReviews(long now) {
        long timeoutMs = TimeUnit.MINUTES.toMillis(reviewConfig.getExpiryTimeoutMinutes());
        List<ReviewRecord> pending = reviewRepository.findByStatus(ReviewStatus.PENDING);
        int expired = 0;

        for (ReviewRecord review : pending) {
            if (now - review.getCreatedAt() <= timeoutMs) {
                continue;
            }
            try {
                reviewRepository.transition(review.getReviewId(), ReviewAction.EXPIRE, SYSTEM_ACTOR, null);
                expired++;
            } catch (InvalidTransitionException e) {
                log.debug("Review {} changed before it could expire: now {}",
                        review.getReviewId(), e.getCurrentStatus());
            } catch (ReviewNotFoundException e) {
                log.warn("Review {} disappeared during the expiry sweep", review.getReviewId());
            } catch (PersistenceException e) {
                log.error("Failed to expire review {}: {}", review.getReviewId(), e.getMessage(), e);
            }
        }

        if (expired > 0) {
            log.info("Expired {} pending reviews older than {} minutes",
                    expired, reviewConfig.getExpiryTimeoutMinutes());
            metricsConfig.recordExpired(expired);
        }
        return expired;
    }
}
