package com.chatops.faq.service;

import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.exception.ExternalServiceException;
import com.chatops.faq.exception.PersistenceException;
import com.chatops.faq.model.ReviewerIdentity;
import com.chatops.faq.repository.RotationCursorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Round-robin reviewer assignment. The index of the last reviewer chosen is persisted,
 * so the rotation carries on across restarts.
 */
@Service
public class ReviewerRotator {

    private static final Logger log = LoggerFactory.getLogger(ReviewerRotator.class);

    private final UserDirectory userDirectory;
    private final RotationCursorRepository cursorRepository;
    private final MetricsConfig metricsConfig;

    public ReviewerRotator(UserDirectory userDirectory,
                           RotationCursorRepository cursorRepository,
                           MetricsConfig metricsConfig) {
        this.userDirectory = userDirectory;
        this.cursorRepository = cursorRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Resolves configured usernames in order. Names that do not resolve are skipped.
     */
    public List<ReviewerIdentity> resolveReviewers(List<String> usernames) {
        List<ReviewerIdentity> reviewers = new ArrayList<>();
        if (usernames == null) {
            return reviewers;
        }
        for (String raw : usernames) {
            if (raw == null || raw.isBlank()) continue;
            String username = raw.trim();
            try {
                Optional<ReviewerIdentity> identity = userDirectory.findByUsername(username);
                if (identity.isPresent()) {
                    reviewers.add(identity.get());
                } else {
                    log.warn("Reviewer '{}' not found in the user directory, skipping", username);
                }
            } catch (ExternalServiceException e) {
                log.warn("Could not look up reviewer '{}': {}", username, e.getMessage());
            }
        }
        return reviewers;
    }

    public Optional<ReviewerIdentity> selectNext(List<String> usernames) {
        return selectFrom(resolveReviewers(usernames));
    }

    /**
     * Picks the reviewer after the last one chosen. A single reviewer is returned without
     * touching the cursor; a stored cursor that no longer fits the list restarts at index 0.
     */
    public synchronized Optional<ReviewerIdentity> selectFrom(List<ReviewerIdentity> reviewers) {
        if (reviewers.isEmpty()) {
            return Optional.empty();
        }
        if (reviewers.size() == 1) {
            ReviewerIdentity only = reviewers.get(0);
            metricsConfig.recordReviewerAssigned(only.username());
            return Optional.of(only);
        }

        int cursor = readCursor();
        if (cursor < 0 || cursor >= reviewers.size()) {
            cursor = -1;
        }
        int next = (cursor + 1) % reviewers.size();

        try {
            cursorRepository.save(next);
        } catch (PersistenceException e) {
            log.error("Failed to persist reviewer cursor {}: {}", next, e.getMessage(), e);
        }

        ReviewerIdentity selected = reviewers.get(next);
        metricsConfig.recordReviewerAssigned(selected.username());
        log.debug("Selected reviewer {} (index {} of {})", selected.username(), next, reviewers.size());
        return Optional.of(selected);
    }

    /** Stored cursor, or -1 when none is stored or it cannot be read. */
    public int readCursor() {
        try {
            OptionalInt stored = cursorRepository.read();
            return stored.orElse(-1);
        } catch (PersistenceException e) {
            log.warn("Could not read reviewer cursor, starting from the first reviewer: {}", e.getMessage());
            return -1;
        }
    }
}
