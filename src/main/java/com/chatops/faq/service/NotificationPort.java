package com.chatops.faq.service;

import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewerIdentity;

/**
 * Outbound chat messages. Every method throws
 * {@link com.chatops.faq.exception.DeliveryException} when the message could not be sent.
 */
public interface NotificationPort {

    /** Prefix on every answer the bot posts; inbound messages starting with it are ignored. */
    String BOT_PREFIX = "🤖 FAQ Bot: ";

    /** Posts an answer to the room the question came from. */
    void deliver(String roomId, String answer);

    /** Sends the review request to the assigned reviewer's direct-message room. */
    void notifyReviewer(ReviewRecord review, ReviewerIdentity reviewer);

    /** Tells the reviewer what their action did. */
    void sendConfirmation(String reviewerUsername, ReviewRecord review, ReviewAction action);

    void postToChannel(String channelName, String text);
}
