package com.chatops.faq.controller;

import com.chatops.faq.model.ActionResult;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import com.chatops.faq.service.ReviewActionService;
import com.chatops.faq.service.ReviewExpiryService;
import com.chatops.faq.service.ReviewQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reviews")
@Tag(name = "Reviews", description = "Human review of generated answers")
public class ReviewController {

    private final ReviewQueueService reviewQueueService;
    private final ReviewActionService reviewActionService;
    private final ReviewExpiryService reviewExpiryService;

    public ReviewController(ReviewQueueService reviewQueueService,
                            ReviewActionService reviewActionService,
                            ReviewExpiryService reviewExpiryService) {
        this.reviewQueueService = reviewQueueService;
        this.reviewActionService = reviewActionService;
        this.reviewExpiryService = reviewExpiryService;
    }

    @GetMapping
    @Operation(summary = "List reviews",
               description = "Newest first. Optionally filtered by status (PENDING, EDITING, APPROVED, REJECTED, EXPIRED).")
    public ResponseEntity<List<ReviewRecord>> getReviews(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {
        ReviewStatus filter = status == null || status.isBlank()
                ? null
                : ReviewStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(reviewQueueService.getReviews(filter, limit));
    }

    @GetMapping("/{reviewId}")
    @Operation(summary = "Get one review")
    public ResponseEntity<ReviewRecord> getReview(@PathVariable String reviewId) {
        return ResponseEntity.ok(reviewQueueService.getReview(reviewId));
    }

    @PostMapping("/{reviewId}/actions")
    @Operation(summary = "Apply a reviewer action",
               description = "action is one of approve, reject, edit, submit-edit, cancel-edit; "
                       + "text is the edited answer for submit-edit. "
                       + "Returns 404 for an unknown review and 409 when the review is not in a state that allows the action.")
    public ResponseEntity<ActionResult> applyAction(@PathVariable String reviewId,
                                                    @RequestBody Map<String, String> body) {
        String actor = body.get("actor");
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }

        ReviewAction action = ReviewAction.parse(body.get("action"));
        ActionResult result = reviewActionService.apply(reviewId, action, actor.trim(), body.get("text"));
        return switch (result.getOutcome()) {
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
            case INVALID_STATE -> ResponseEntity.status(HttpStatus.CONFLICT).body(result);
            default -> ResponseEntity.ok(result);
        };
    }

    @PostMapping("/expire")
    @Operation(summary = "Run the expiry sweep now",
               description = "Expires PENDING reviews older than the configured timeout.")
    public ResponseEntity<Map<String, Integer>> expireNow() {
        return ResponseEntity.ok(Map.of("expiredCount", reviewExpiryService.expireStaleReviews()));
    }

    @GetMapping("/stats")
    @Operation(summary = "Review counts by status")
    public ResponseEntity<Map<String, Integer>> getStats() {
        return ResponseEntity.ok(reviewQueueService.getStats());
    }
}
