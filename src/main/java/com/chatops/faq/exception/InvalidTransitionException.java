package com.chatops.faq.exception;

import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewStatus;

public class InvalidTransitionException extends FaqReviewException {

    private static final long serialVersionUID = 1L;

    private final ReviewAction action;
    private final ReviewStatus currentStatus;

    public InvalidTransitionException(String reviewId, ReviewAction action, ReviewStatus currentStatus) {
        super("Cannot " + action.label() + " review " + reviewId + " in state " + currentStatus);
        this.action = action;
        this.currentStatus = currentStatus;
    }

    public ReviewAction getAction() {
        return action;
    }

    public ReviewStatus getCurrentStatus() {
        return currentStatus;
    }
}
