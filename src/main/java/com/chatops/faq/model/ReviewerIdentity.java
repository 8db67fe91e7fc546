package com.chatops.faq.model;

public record ReviewerIdentity(String id, String username) {}
