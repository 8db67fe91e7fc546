package com.chatops.faq.engine;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap "does this look like a question or a request for help" check, used as an
 * optional pre-filter before escalating non-direct matches.
 */
public final class QuestionHeuristic {

    private static final Set<String> LEADING_WORDS = Set.of(
            "how", "what", "why", "where", "when", "who", "which", "whats", "hows",
            "can", "could", "would", "should", "is", "are", "do", "does", "did",
            "will", "may", "help", "anyone", "please", "pls", "plz");

    private static final List<String> HELP_PHRASES = List.of(
            "help me", "how to", "is there a way", "i need", "i can't", "i cant",
            "not working", "unable to", "trying to");

    private QuestionHeuristic() {}

    public static boolean looksLikeQuestion(String text) {
        if (text == null) return false;
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return false;
        if (trimmed.indexOf('?') >= 0) return true;

        String lower = trimmed.toLowerCase(Locale.ROOT);
        String firstWord = lower.split("[^\\p{L}\\p{N}']+", 2)[0].replace("'", "");
        if (LEADING_WORDS.contains(firstWord)) return true;

        for (String phrase : HELP_PHRASES) {
            if (lower.contains(phrase)) return true;
        }
        return false;
    }
}
