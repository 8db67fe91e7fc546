package com.chatops.faq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "faq.review")
public class ReviewConfig {
    private long expiryTimeoutMinutes = 60;
    private int expiryCheckIntervalSeconds = 60;
    private int listLimit = 100;
}
