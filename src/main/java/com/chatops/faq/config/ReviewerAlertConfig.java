package com.chatops.faq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Out-of-band alerts to reviewers through Twilio when a review is assigned to them.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class ReviewerAlertConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String channel = "sms";  // "sms" or "whatsapp"

    // Chat username -> phone number. Reviewers without an entry are not alerted.
    private Map<String, String> reviewerNumbers = new HashMap<>();
}
