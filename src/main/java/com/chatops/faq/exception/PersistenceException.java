package com.chatops.faq.exception;

/**
 * Review or rotation storage failed. Callers must not assume the operation took effect.
 */
public class PersistenceException extends FaqReviewException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
