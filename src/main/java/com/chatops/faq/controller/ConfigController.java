package com.chatops.faq.controller;

import com.chatops.faq.config.FaqBotConfig;
import com.chatops.faq.engine.Bm25Index;
import com.chatops.faq.engine.MessageClassifier;
import com.chatops.faq.model.CorpusEntry;
import com.chatops.faq.service.CorpusLoader;
import com.chatops.faq.service.ReviewerRotator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (classifier, corpus, reviewers)")
public class ConfigController {

    private final FaqBotConfig botConfig;
    private final MessageClassifier classifier;
    private final ReviewerRotator reviewerRotator;

    public ConfigController(FaqBotConfig botConfig,
                            MessageClassifier classifier,
                            ReviewerRotator reviewerRotator) {
        this.botConfig = botConfig;
        this.classifier = classifier;
        this.reviewerRotator = reviewerRotator;
    }

    // ── Classifier ──

    @Operation(summary = "Get classifier settings")
    @GetMapping("/classifier")
    public ResponseEntity<Map<String, Object>> getClassifier() {
        Bm25Index index = classifier.currentIndex();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("similarityThreshold", classifier.getThreshold());
        response.put("minSimilarityThreshold", classifier.getMinThreshold());
        response.put("minMessageLength", botConfig.getClassifier().getMinMessageLength());
        response.put("questionFilterEnabled", botConfig.getClassifier().isQuestionFilterEnabled());
        response.put("k1", index.getK1());
        response.put("b", index.getB());
        response.put("corpusSize", index.size());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update classifier settings",
            description = "similarityThreshold is raised to the configured minimum if lower. "
                    + "Changes apply immediately but reset on restart.")
    @PutMapping("/classifier")
    public ResponseEntity<?> updateClassifier(@RequestBody Map<String, Object> body) {
        Bm25Index index = classifier.currentIndex();
        double threshold = toDouble(body, "similarityThreshold", classifier.getThreshold());
        double k1 = toDouble(body, "k1", index.getK1());
        double b = toDouble(body, "b", index.getB());

        if (Double.isNaN(threshold)) return badRequest("similarityThreshold must be a number", "similarityThreshold");
        if (!(k1 >= 0)) return badRequest("k1 must be >= 0", "k1");
        if (!(b >= 0 && b <= 1)) return badRequest("b must be in [0, 1]", "b");

        double applied = classifier.updateThreshold(threshold);
        botConfig.setSimilarityThreshold(applied);
        if (k1 != index.getK1() || b != index.getB()) {
            classifier.updateBm25Parameters(k1, b);
            botConfig.getClassifier().setK1(k1);
            botConfig.getClassifier().setB(b);
        }
        return getClassifier();
    }

    // ── Corpus ──

    @Operation(summary = "Get the FAQ corpus")
    @GetMapping("/corpus")
    public ResponseEntity<List<CorpusEntry>> getCorpus() {
        return ResponseEntity.ok(classifier.getCorpus());
    }

    @Operation(summary = "Replace the FAQ corpus",
            description = "Rebuilds the search index. Messages classified meanwhile use the previous corpus.")
    @PutMapping("/corpus")
    public ResponseEntity<?> replaceCorpus(@RequestBody List<CorpusEntry> corpus) {
        try {
            CorpusLoader.validate(corpus);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), "corpus");
        }
        classifier.updateCorpus(corpus);
        return ResponseEntity.ok(classifier.getCorpus());
    }

    // ── Reviewers (read-only) ──

    @Operation(summary = "Get configured reviewers and the rotation cursor")
    @GetMapping("/reviewers")
    public ResponseEntity<Map<String, Object>> getReviewers() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("reviewerUsernames", botConfig.getReviewerUsernames());
        response.put("enableReviewMode", botConfig.isEnableReviewMode());
        response.put("lastReviewerIndex", reviewerRotator.readCursor());
        return ResponseEntity.ok(response);
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }
}
