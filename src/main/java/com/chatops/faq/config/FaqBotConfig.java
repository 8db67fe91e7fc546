package com.chatops.faq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "faq")
public class FaqBotConfig {

    // Generative backend credentials. Both must be set or message processing aborts.
    private String apiKey;
    private String apiEndpoint;
    private String modelType = "meta-llama/Llama-3.2-11B-Vision-Instruct";

    // Comma-separated in properties; bound to a list.
    private List<String> reviewerUsernames = new ArrayList<>();
    private boolean enableReviewMode = true;

    // Raw BM25 score at or above which a message is answered straight from the corpus.
    private double similarityThreshold = 0.99;

    // Blank disables posting to a log channel.
    private String logChannelName = "faq-log";

    // Chat user id of this bot, used to ignore its own messages.
    private String botUserId;

    private String corpusLocation = "classpath:faq-corpus.json";

    private Classifier classifier = new Classifier();
    private Generator generator = new Generator();

    @Data
    public static class Classifier {
        private int minMessageLength = 5;
        private double minSimilarityThreshold = 0.99;
        private double k1 = 1.2;
        private double b = 0.75;
        private boolean questionFilterEnabled = false;
    }

    @Data
    public static class Generator {
        private Duration timeout = Duration.ofSeconds(30);
        private double temperature = 0.7;
        private int maxTokens = 500;
    }
}
