package com.chatops.faq.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "One FAQ question with its canned answer")
public record CorpusEntry(
        @Schema(description = "FAQ question text", example = "How do I create a channel?")
        String question,
        @Schema(description = "Answer sent for a direct match")
        String answer) {}
