package com.chatops.faq.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of applying a reviewer action")
public class ActionResult {

    private String reviewId;

    @Schema(example = "approve")
    private String action;

    private ActionOutcome outcome;

    @Schema(description = "Review status after the action; null when the review does not exist")
    private ReviewStatus status;

    @Schema(description = "True when the answer reached the source room")
    private boolean delivered;

    @Schema(description = "True when the reviewer confirmation was sent")
    private boolean confirmed;

    private String message;

    public static ActionResult notFound(String reviewId, ReviewAction action) {
        return ActionResult.builder()
                .reviewId(reviewId)
                .action(action.label())
                .outcome(ActionOutcome.NOT_FOUND)
                .message("Review not found: " + reviewId)
                .build();
    }

    public static ActionResult invalidState(String reviewId, ReviewAction action, ReviewStatus current) {
        return ActionResult.builder()
                .reviewId(reviewId)
                .action(action.label())
                .outcome(ActionOutcome.INVALID_STATE)
                .status(current)
                .message("Cannot " + action.label() + " a review in state " + current)
                .build();
    }

    public boolean isApplied() {
        return outcome == ActionOutcome.APPLIED;
    }
}
