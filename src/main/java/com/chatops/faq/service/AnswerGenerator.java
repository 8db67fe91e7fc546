package com.chatops.faq.service;

import com.chatops.faq.model.CorpusEntry;
import com.chatops.faq.model.GeneratedAnswer;

import java.util.List;

/**
 * Proposes an answer for a message that is not a direct corpus match.
 * Implementations never throw: failures come back as {@link GeneratedAnswer#failure(String)}.
 */
public interface AnswerGenerator {

    GeneratedAnswer check(String message, List<CorpusEntry> corpus);
}
