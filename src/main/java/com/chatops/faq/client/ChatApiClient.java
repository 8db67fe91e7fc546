package com.chatops.faq.client;

import com.chatops.faq.exception.ExternalServiceException;
import com.chatops.faq.model.ReviewerIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;
import java.util.Optional;

/**
 * Thin adapter over the chat server's REST API (Rocket.Chat style endpoints).
 */
@Component
public class ChatApiClient {

    private static final Logger log = LoggerFactory.getLogger(ChatApiClient.class);

    private final RestClient restClient;

    public ChatApiClient(@Qualifier("chatRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Posts a message. {@code target} is either a room id or a "#channel" name.
     *
     * @return id of the created message, or null if the server did not return one
     */
    public String postMessage(String target, String text) {
        Map<String, String> body = target.startsWith("#")
                ? Map.of("channel", target, "text", text)
                : Map.of("roomId", target, "text", text);

        JsonNode response = post("/api/v1/chat.postMessage", body);
        requireSuccess(response, "chat.postMessage");
        return response.path("message").path("_id").asText(null);
    }

    /** Opens (or reuses) the direct-message room with a user and returns its room id. */
    public String createDirectRoom(String username) {
        JsonNode response = post("/api/v1/im.create", Map.of("username", username));
        requireSuccess(response, "im.create");

        JsonNode room = response.path("room");
        String roomId = room.hasNonNull("rid") ? room.get("rid").asText() : room.path("_id").asText(null);
        if (roomId == null || roomId.isEmpty()) {
            throw new ExternalServiceException("im.create returned no room id for " + username);
        }
        return roomId;
    }

    public Optional<ReviewerIdentity> findUserByUsername(String username) {
        JsonNode response;
        try {
            response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/api/v1/users.info")
                            .queryParam("username", username)
                            .build())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException e) {
            // unknown users come back as 400/404
            log.debug("users.info for {} returned {}", username, e.getStatusCode());
            return Optional.empty();
        } catch (RestClientException e) {
            throw new ExternalServiceException("users.info failed for " + username, e);
        }

        if (response == null || !response.path("success").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode user = response.path("user");
        String id = user.path("_id").asText(null);
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ReviewerIdentity(id, user.path("username").asText(username)));
    }

    private JsonNode post(String path, Object body) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException("Chat API call " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static void requireSuccess(JsonNode response, String endpoint) {
        if (response == null || !response.path("success").asBoolean(false)) {
            String error = response != null ? response.path("error").asText("unknown error") : "empty response";
            throw new ExternalServiceException(endpoint + " was not successful: " + error);
        }
    }
}
