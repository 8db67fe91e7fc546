package com.chatops.faq.model;

public enum MessageType {
    /** Direct corpus match, answered without the generator. */
    ALPHA,
    /** Probable match, escalated to the generator and a reviewer. */
    BETA,
    /** Dropped. */
    UNRELATED
}
