package com.chatops.faq.engine;

import com.chatops.faq.model.CorpusEntry;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable Okapi BM25 index over the questions of an FAQ corpus.
 *
 * <pre>
 * IDF(t)       = ln(1 + (N - n_t + 0.5) / (n_t + 0.5))
 * contrib(t,d) = IDF(t) * tf(t,d) * (k1 + 1) / (tf(t,d) + k1 * (1 - b + b * len(d) / avgLen))
 * score(d)     = sum of contrib(t,d) over query terms t
 * </pre>
 *
 * A corpus change means building a new index; nothing here is mutable after construction,
 * so instances can be shared between threads freely.
 */
public final class Bm25Index {

    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    private final List<CorpusEntry> entries;
    private final double k1;
    private final double b;

    // term -> frequency per document (array indexed by corpus position)
    private final Map<String, int[]> termFrequencies;
    private final Map<String, Double> idf;
    private final int[] docLengths;
    private final double avgDocLength;

    public Bm25Index(List<CorpusEntry> corpus) {
        this(corpus, DEFAULT_K1, DEFAULT_B);
    }

    public Bm25Index(List<CorpusEntry> corpus, double k1, double b) {
        if (!(k1 >= 0)) throw new IllegalArgumentException("k1 must be >= 0");
        if (!(b >= 0 && b <= 1)) throw new IllegalArgumentException("b must be in [0, 1]");

        this.entries = List.copyOf(corpus);
        this.k1 = k1;
        this.b = b;

        int n = entries.size();
        Map<String, int[]> frequencies = new HashMap<>();
        this.docLengths = new int[n];
        long totalLength = 0;

        for (int doc = 0; doc < n; doc++) {
            List<String> tokens = Tokenizer.tokenize(entries.get(doc).question());
            docLengths[doc] = tokens.size();
            totalLength += tokens.size();
            for (String token : tokens) {
                frequencies.computeIfAbsent(token, t -> new int[n])[doc]++;
            }
        }

        this.avgDocLength = n == 0 ? 0.0 : (double) totalLength / n;

        Map<String, Double> idfTable = new HashMap<>();
        for (Map.Entry<String, int[]> e : frequencies.entrySet()) {
            int docsWithTerm = 0;
            for (int tf : e.getValue()) {
                if (tf > 0) docsWithTerm++;
            }
            idfTable.put(e.getKey(), Math.log(1 + (n - docsWithTerm + 0.5) / (docsWithTerm + 0.5)));
        }

        this.termFrequencies = Collections.unmodifiableMap(frequencies);
        this.idf = Collections.unmodifiableMap(idfTable);
    }

    /**
     * Scores every corpus entry against the query, in corpus order.
     */
    public double[] scores(String query) {
        double[] scores = new double[entries.size()];
        for (String token : Tokenizer.tokenize(query)) {
            int[] tfs = termFrequencies.get(token);
            if (tfs == null) continue;

            double termIdf = idf.get(token);
            for (int doc = 0; doc < scores.length; doc++) {
                int tf = tfs[doc];
                if (tf == 0) continue;

                double lengthRatio = avgDocLength > 0 ? docLengths[doc] / avgDocLength : 0.0;
                double numerator = tf * (k1 + 1);
                double denominator = tf + k1 * (1 - b + b * lengthRatio);
                scores[doc] += termIdf * (numerator / denominator);
            }
        }
        return scores;
    }

    /**
     * Returns the highest-scoring entry. Ties go to the entry indexed first.
     * {@code directMatch} is {@code score >= threshold}.
     */
    public Bm25SearchResult search(String query, double threshold) {
        if (entries.isEmpty()) {
            return Bm25SearchResult.empty();
        }

        double[] scores = scores(query);
        int best = 0;
        for (int doc = 1; doc < scores.length; doc++) {
            if (scores[doc] > scores[best]) {
                best = doc;
            }
        }

        double bestScore = scores[best];
        return new Bm25SearchResult(entries.get(best), best, bestScore, bestScore >= threshold);
    }

    public double idf(String term) {
        return idf.getOrDefault(term, 0.0);
    }

    public List<CorpusEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public double getAvgDocLength() {
        return avgDocLength;
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }
}
