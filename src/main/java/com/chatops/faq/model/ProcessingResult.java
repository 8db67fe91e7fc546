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
@Schema(description = "What the pipeline did with an inbound message")
public class ProcessingResult {

    private String messageId;

    @Schema(description = "IGNORED, ANSWERED, ESCALATED, DROPPED or FAILED")
    private ProcessingOutcome outcome;

    @Schema(description = "Classification, null when the message was ignored before classification")
    private MessageType type;

    private double score;
    private String reviewId;
    private String reviewerId;

    @Schema(description = "Why the message was ignored, dropped or failed")
    private String reason;

    public static ProcessingResult ignored(String messageId, String reason) {
        return ProcessingResult.builder()
                .messageId(messageId)
                .outcome(ProcessingOutcome.IGNORED)
                .reason(reason)
                .build();
    }
}
