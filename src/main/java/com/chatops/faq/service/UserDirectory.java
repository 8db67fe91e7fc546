package com.chatops.faq.service;

import com.chatops.faq.model.ReviewerIdentity;

import java.util.Optional;

public interface UserDirectory {

    Optional<ReviewerIdentity> findByUsername(String username);
}
