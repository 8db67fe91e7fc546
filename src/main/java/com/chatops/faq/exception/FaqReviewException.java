package com.chatops.faq.exception;

/**
 * Base type for every failure the FAQ review pipeline reports.
 */
public class FaqReviewException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FaqReviewException(String message) {
        super(message);
    }

    public FaqReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
