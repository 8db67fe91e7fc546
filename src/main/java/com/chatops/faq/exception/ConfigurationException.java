package com.chatops.faq.exception;

/**
 * Required configuration is missing or invalid. Processing of the current message stops.
 */
public class ConfigurationException extends FaqReviewException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
