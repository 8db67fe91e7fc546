package com.chatops.faq.service;

import com.chatops.faq.exception.ConfigurationException;
import com.chatops.faq.model.CorpusEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the FAQ corpus, a JSON array of {@code {"question": ..., "answer": ...}} objects.
 */
@Component
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public CorpusLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public List<CorpusEntry> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("FAQ corpus not found at " + location);
        }

        List<CorpusEntry> entries;
        try (InputStream in = resource.getInputStream()) {
            entries = objectMapper.readValue(in, new TypeReference<List<CorpusEntry>>() {});
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read FAQ corpus from " + location, e);
        }

        validate(entries);
        log.info("Loaded {} FAQ entries from {}", entries.size(), location);
        return List.copyOf(entries);
    }

    public static void validate(List<CorpusEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("corpus must not be null");
        }
        for (int i = 0; i < entries.size(); i++) {
            CorpusEntry entry = entries.get(i);
            if (entry == null || isBlank(entry.question()) || isBlank(entry.answer())) {
                throw new IllegalArgumentException("corpus entry " + i + " needs a question and an answer");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
