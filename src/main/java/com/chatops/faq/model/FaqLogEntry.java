package com.chatops.faq.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FaqLogEntry {
    MessageType type;
    double score;
    String matchedQuestion;
    String proposedAnswer;
    String reviewId;
    String reviewerId;
    String reviewerUsername;
    String senderUsername;
    String roomName;
    String originalMessage;
}
