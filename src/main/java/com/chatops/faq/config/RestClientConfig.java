package com.chatops.faq.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Dedicated HTTP clients for the chat server and the answer generator backend,
 * each with its own timeouts.
 */
@Configuration
public class RestClientConfig {

    @Bean("chatRestClient")
    public RestClient chatRestClient(ChatApiConfig chatConfig) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) chatConfig.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) chatConfig.getReadTimeout().toMillis());

        RestClient.Builder builder = RestClient.builder()
                .requestFactory(factory)
                .baseUrl(chatConfig.getBaseUrl());
        if (chatConfig.getAuthToken() != null && !chatConfig.getAuthToken().isBlank()
                && chatConfig.getUserId() != null) {
            builder.defaultHeader("X-Auth-Token", chatConfig.getAuthToken());
            builder.defaultHeader("X-User-Id", chatConfig.getUserId());
        }
        return builder.build();
    }

    @Bean("generatorRestClient")
    public RestClient generatorRestClient(FaqBotConfig botConfig) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) botConfig.getGenerator().getTimeout().toMillis();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);

        return RestClient.builder()
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }
}
