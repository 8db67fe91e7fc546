package com.chatops.faq.exception;

/**
 * A message could not be posted to the chat server.
 */
public class DeliveryException extends FaqReviewException {

    private static final long serialVersionUID = 1L;

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
