package com.chatops.faq.exception;

import java.util.List;

public class ReviewerNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public ReviewerNotFoundException(List<String> usernames) {
        super("No reviewer could be resolved from " + usernames);
    }
}
