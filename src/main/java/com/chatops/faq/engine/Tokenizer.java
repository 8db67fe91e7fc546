package com.chatops.faq.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns text into BM25 index terms: lowercase, punctuation replaced by spaces,
 * split on whitespace, stop words removed. Queries and corpus questions go
 * through the same path.
 */
public final class Tokenizer {

    // ASCII word characters only: accented letters split words ("café" -> "caf").
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "is", "are", "was", "were",
            "in", "on", "at", "to", "for", "with", "by", "about", "of", "do",
            "does", "did", "has", "have", "had", "can", "could", "will", "would",
            "should", "i", "you", "he", "she", "it", "we", "they", "this", "that");

    private Tokenizer() {}

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String word : WHITESPACE.split(cleaned)) {
            if (!word.isEmpty() && !STOP_WORDS.contains(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }
}
