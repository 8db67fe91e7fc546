package com.chatops.faq.model;

public enum ReviewStatus {
    PENDING,
    EDITING,
    APPROVED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == EXPIRED;
    }
}
