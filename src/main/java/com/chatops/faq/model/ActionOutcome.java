package com.chatops.faq.model;

public enum ActionOutcome {
    APPLIED,
    NOT_FOUND,
    INVALID_STATE
}
