package com.chatops.faq.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A generated answer waiting for (or past) human review")
public class ReviewRecord {

    @Schema(description = "Review ID", example = "review_1739886764000_k3j9x0a")
    private String reviewId;

    @Schema(description = "ID of the chat message that triggered the review")
    private String sourceMessageId;

    private String roomId;
    private String roomType;
    private String roomName;
    private String senderId;
    private String senderUsername;
    private String originalMessageText;

    @Schema(description = "Corpus question the generator matched, empty if unknown")
    private String detectedQuestion;

    @Schema(description = "Answer that will be posted on approval")
    private String proposedAnswer;

    @Schema(description = "Creation time in epoch milliseconds")
    private long createdAt;

    private ReviewStatus status;

    private String reviewerId;
    private String reviewerUsername;

    private String actedBy;       // username, or "SYSTEM" for expiry
    private long actedAt;         // 0 until acted upon
}
