package com.chatops.faq.exception;

/**
 * A collaborator outside this service (answer generator, chat server) failed.
 */
public class ExternalServiceException extends FaqReviewException {

    private static final long serialVersionUID = 1L;

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
