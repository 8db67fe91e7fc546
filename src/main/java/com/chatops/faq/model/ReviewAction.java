package com.chatops.faq.model;

import java.util.Locale;

/**
 * Closed transition table of the review lifecycle. Every legal edge is one constant;
 * anything else is rejected.
 */
public enum ReviewAction {
    APPROVE(ReviewStatus.PENDING, ReviewStatus.APPROVED, true),
    REJECT(ReviewStatus.PENDING, ReviewStatus.REJECTED, false),
    EDIT(ReviewStatus.PENDING, ReviewStatus.EDITING, false),
    SUBMIT_EDIT(ReviewStatus.EDITING, ReviewStatus.APPROVED, true),
    CANCEL_EDIT(ReviewStatus.EDITING, ReviewStatus.PENDING, false),
    EXPIRE(ReviewStatus.PENDING, ReviewStatus.EXPIRED, false);

    private final ReviewStatus from;
    private final ReviewStatus to;
    private final boolean delivers;

    ReviewAction(ReviewStatus from, ReviewStatus to, boolean delivers) {
        this.from = from;
        this.to = to;
        this.delivers = delivers;
    }

    public ReviewStatus getFrom() {
        return from;
    }

    public ReviewStatus getTo() {
        return to;
    }

    /** True if applying this action posts the answer to the source room. */
    public boolean delivers() {
        return delivers;
    }

    public boolean isAllowedFrom(ReviewStatus current) {
        return current == from;
    }

    /** EXPIRE is time-driven and never accepted from a human actor. */
    public boolean isHumanAction() {
        return this != EXPIRE;
    }

    /**
     * Parses a human action name: "approve", "reject", "edit", "submit-edit", "cancel-edit".
     * Underscores and dashes are interchangeable.
     */
    public static ReviewAction parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        ReviewAction action;
        try {
            action = ReviewAction.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown review action: " + name);
        }
        if (!action.isHumanAction()) {
            throw new IllegalArgumentException("Action " + name + " cannot be requested by a reviewer");
        }
        return action;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
