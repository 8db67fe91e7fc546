package com.chatops.faq.model;

public record GeneratedAnswer(boolean matched, String answer, String detectedQuestion, String error) {

    public static GeneratedAnswer match(String answer, String detectedQuestion) {
        return new GeneratedAnswer(true, answer, detectedQuestion, null);
    }

    public static GeneratedAnswer noMatch() {
        return new GeneratedAnswer(false, null, null, null);
    }

    public static GeneratedAnswer failure(String error) {
        return new GeneratedAnswer(false, null, null, error);
    }

    public boolean hasAnswer() {
        return matched && answer != null && !answer.isBlank();
    }
}
