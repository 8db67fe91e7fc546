package com.chatops.faq.engine;

import com.chatops.faq.model.CorpusEntry;

/**
 * Best corpus entry for a query. {@code entry} is null and {@code index} is -1 only
 * when the corpus is empty.
 */
public record Bm25SearchResult(CorpusEntry entry, int index, double score, boolean directMatch) {

    static Bm25SearchResult empty() {
        return new Bm25SearchResult(null, -1, 0.0, false);
    }
}
