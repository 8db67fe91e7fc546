package com.chatops.faq.service;

import com.chatops.faq.client.ChatApiClient;
import com.chatops.faq.model.ReviewerIdentity;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class ChatUserDirectory implements UserDirectory {

    private final ChatApiClient chatApiClient;

    public ChatUserDirectory(ChatApiClient chatApiClient) {
        this.chatApiClient = chatApiClient;
    }

    @Override
    public Optional<ReviewerIdentity> findByUsername(String username) {
        return chatApiClient.findUserByUsername(username);
    }
}
