package com.chatops.faq.engine;

import com.chatops.faq.model.ClassificationResult;
import com.chatops.faq.model.CorpusEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tags a message ALPHA (direct corpus match), BETA (escalate) or UNRELATED.
 *
 * The BM25 index is published through an {@link AtomicReference}: corpus or parameter
 * changes build a complete new index first and then swap it in, so a concurrent
 * {@link #classify(String)} sees either the old index or the new one, never a partial one.
 */
public class MessageClassifier {

    private static final Logger log = LoggerFactory.getLogger(MessageClassifier.class);

    private final AtomicReference<Bm25Index> index;
    private final double minThreshold;
    private final int minMessageLength;
    private final boolean questionFilterEnabled;
    private volatile double threshold;

    public MessageClassifier(List<CorpusEntry> corpus, double threshold, double minThreshold,
                             int minMessageLength, boolean questionFilterEnabled,
                             double k1, double b) {
        this.index = new AtomicReference<>(new Bm25Index(corpus, k1, b));
        this.minThreshold = minThreshold;
        this.minMessageLength = minMessageLength;
        this.questionFilterEnabled = questionFilterEnabled;
        this.threshold = clamp(threshold);
    }

    public ClassificationResult classify(String message) {
        return classify(message, threshold);
    }

    /**
     * Classifies with an explicit threshold. The threshold is still clamped to the
     * configured minimum.
     */
    public ClassificationResult classify(String message, double requestedThreshold) {
        String text = message == null ? "" : message;
        if (text.length() < minMessageLength) {
            log.debug("Message too short ({} < {} chars), unrelated", text.length(), minMessageLength);
            return ClassificationResult.unrelated(text);
        }

        double effectiveThreshold = Math.max(requestedThreshold, minThreshold);
        Bm25SearchResult result = index.get().search(text, effectiveThreshold);
        log.debug("BM25 best match index={} score={} threshold={}",
                result.index(), result.score(), effectiveThreshold);

        if (result.directMatch() && result.entry() != null) {
            return ClassificationResult.alpha(result.entry(), result.score(), text);
        }

        if (questionFilterEnabled && !QuestionHeuristic.looksLikeQuestion(text)) {
            log.debug("Message does not look like a question, unrelated");
            return ClassificationResult.unrelated(text);
        }

        return ClassificationResult.beta(result.score(), text);
    }

    public void updateCorpus(List<CorpusEntry> corpus) {
        List<CorpusEntry> snapshot = List.copyOf(corpus);
        index.updateAndGet(current -> new Bm25Index(snapshot, current.getK1(), current.getB()));
        log.info("Classifier corpus replaced, {} entries indexed", corpus.size());
    }

    public void updateBm25Parameters(double k1, double b) {
        index.updateAndGet(current -> new Bm25Index(current.getEntries(), k1, b));
        log.info("BM25 parameters updated: k1={}, b={}", k1, b);
    }

    public double updateThreshold(double requested) {
        double clamped = clamp(requested);
        this.threshold = clamped;
        return clamped;
    }

    private double clamp(double requested) {
        if (Double.isNaN(requested) || requested < minThreshold) {
            log.debug("Similarity threshold {} raised to minimum {}", requested, minThreshold);
            return minThreshold;
        }
        return requested;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMinThreshold() {
        return minThreshold;
    }

    public List<CorpusEntry> getCorpus() {
        return index.get().getEntries();
    }

    public Bm25Index currentIndex() {
        return index.get();
    }
}
