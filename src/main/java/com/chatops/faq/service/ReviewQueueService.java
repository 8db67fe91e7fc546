package com.chatops.faq.service;

import com.chatops.faq.config.ReviewConfig;
import com.chatops.faq.exception.ReviewNotFoundException;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import com.chatops.faq.repository.ReviewRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the review store.
 */
@Service
public class ReviewQueueService {

    private final ReviewRepository reviewRepository;
    private final ReviewConfig reviewConfig;

    public ReviewQueueService(ReviewRepository reviewRepository, ReviewConfig reviewConfig) {
        this.reviewRepository = reviewRepository;
        this.reviewConfig = reviewConfig;
    }

    public List<ReviewRecord> getReviews(ReviewStatus status, Integer limit) {
        int effectiveLimit = limit == null ? reviewConfig.getListLimit() : limit;
        if (effectiveLimit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return reviewRepository.findRecent(status, Math.min(effectiveLimit, reviewConfig.getListLimit()));
    }

    public ReviewRecord getReview(String reviewId) {
        ReviewRecord review = reviewRepository.findById(reviewId);
        if (review == null) {
            throw new ReviewNotFoundException(reviewId);
        }
        return review;
    }

    public Map<String, Integer> getStats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<ReviewStatus, Integer> entry : reviewRepository.countByStatus().entrySet()) {
            stats.put(entry.getKey().name(), entry.getValue());
            total += entry.getValue();
        }
        stats.put("total", total);
        return stats;
    }
}
