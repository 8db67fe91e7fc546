package com.chatops.faq.exception;

public class ReviewNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    private final String reviewId;

    public ReviewNotFoundException(String reviewId) {
        super("Review not found: " + reviewId);
        this.reviewId = reviewId;
    }

    public String getReviewId() {
        return reviewId;
    }
}
