package com.chatops.faq.service;

import com.chatops.faq.config.FaqBotConfig;
import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.model.CorpusEntry;
import com.chatops.faq.model.GeneratedAnswer;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Answer generator backed by an OpenAI-compatible chat-completions endpoint.
 */
@Service
public class LlmAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmAnswerGenerator.class);

    static final String NO_MATCH_MARKER = "no match found";

    private static final Pattern QA_PREFIX = Pattern.compile("(?m)^(Q|A):\\s*");
    private static final Pattern NO_MATCH_TEXT = Pattern.compile("(?i)no match found\\.?");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RestClient restClient;
    private final FaqBotConfig config;
    private final MetricsConfig metricsConfig;

    public LlmAnswerGenerator(@Qualifier("generatorRestClient") RestClient restClient,
                              FaqBotConfig config,
                              MetricsConfig metricsConfig) {
        this.restClient = restClient;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Override
    @Observed(name = "faq.generator", contextualName = "generate-answer")
    public GeneratedAnswer check(String message, List<CorpusEntry> corpus) {
        Map<String, Object> request = Map.of(
                "model", config.getModelType(),
                "messages", List.of(
                        Map.of("role", "system", "content", FaqPromptBuilder.SYSTEM_PROMPT),
                        Map.of("role", "user", "content", FaqPromptBuilder.userPrompt(message, corpus))),
                "temperature", config.getGenerator().getTemperature(),
                "max_tokens", config.getGenerator().getMaxTokens());

        JsonNode body;
        try {
            body = restClient.post()
                    .uri(config.getApiEndpoint())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            metricsConfig.recordGeneratorCall("timeout");
            log.warn("Generator call failed or timed out: {}", e.getMessage());
            return GeneratedAnswer.failure("Generator unreachable: " + e.getMessage());
        } catch (RestClientException e) {
            metricsConfig.recordGeneratorCall("error");
            log.error("Generator call failed: {}", e.getMessage(), e);
            return GeneratedAnswer.failure("Generator call failed: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            // Relative or malformed endpoint URI, rejected before any request is sent.
            metricsConfig.recordGeneratorCall("error");
            log.error("Invalid generator endpoint '{}': {}", config.getApiEndpoint(), e.getMessage());
            return GeneratedAnswer.failure("Invalid generator endpoint: " + e.getMessage());
        }

        GeneratedAnswer answer = parseResponse(body, corpus);
        metricsConfig.recordGeneratorCall(answer.error() != null ? "invalid" : answer.matched() ? "match" : "no_match");
        return answer;
    }

    /**
     * Reads {@code choices[0].message.content} from a completions response.
     */
    static GeneratedAnswer parseResponse(JsonNode body, List<CorpusEntry> corpus) {
        JsonNode content = body == null ? null : body.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            log.warn("Generator response has no choices[0].message.content");
            return GeneratedAnswer.failure("Invalid generator response");
        }

        String reply = content.asText();
        if (reply.toLowerCase(Locale.ROOT).contains(NO_MATCH_MARKER)) {
            log.debug("Generator found no matching FAQ");
            return GeneratedAnswer.noMatch();
        }

        String cleaned = cleanResponse(reply);
        if (cleaned.isEmpty()) {
            return GeneratedAnswer.noMatch();
        }
        CorpusEntry detected = findMatchedEntry(reply, corpus);
        return GeneratedAnswer.match(cleaned, detected != null ? detected.question() : null);
    }

    static String cleanResponse(String reply) {
        String cleaned = QA_PREFIX.matcher(reply).replaceAll("");
        cleaned = NO_MATCH_TEXT.matcher(cleaned).replaceAll("").trim();
        return EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
    }

    /**
     * The first entry whose significant answer words (longer than four characters)
     * mostly (over 70%) appear in the reply.
     */
    static CorpusEntry findMatchedEntry(String reply, List<CorpusEntry> corpus) {
        String lowerReply = reply.toLowerCase(Locale.ROOT);
        for (CorpusEntry entry : corpus) {
            List<String> words = WHITESPACE.splitAsStream(entry.answer())
                    .filter(word -> word.length() > 4)
                    .toList();
            if (words.isEmpty()) {
                continue;
            }
            long hits = words.stream()
                    .filter(word -> lowerReply.contains(word.toLowerCase(Locale.ROOT)))
                    .count();
            if ((double) hits / words.size() > 0.7) {
                return entry;
            }
        }
        return null;
    }
}
