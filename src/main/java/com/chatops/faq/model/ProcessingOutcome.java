package com.chatops.faq.model;

public enum ProcessingOutcome {
    IGNORED,
    ANSWERED,
    ESCALATED,
    DROPPED,
    FAILED
}
