package com.chatops.faq.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of classifying one message. Built only through the static factories so that
 * an ALPHA always carries its matched entry and BETA/UNRELATED never do.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassificationResult {

    MessageType type;
    CorpusEntry matchedEntry;
    double score;
    String message;

    public static ClassificationResult alpha(CorpusEntry matchedEntry, double score, String message) {
        if (matchedEntry == null) {
            throw new IllegalArgumentException("ALPHA classification requires a matched entry");
        }
        return new ClassificationResult(MessageType.ALPHA, matchedEntry, score, message);
    }

    public static ClassificationResult beta(double score, String message) {
        return new ClassificationResult(MessageType.BETA, null, score, message);
    }

    public static ClassificationResult unrelated(String message) {
        return new ClassificationResult(MessageType.UNRELATED, null, 0.0, message);
    }

    public boolean isAlpha() {
        return type == MessageType.ALPHA;
    }

    public boolean isBeta() {
        return type == MessageType.BETA;
    }
}
