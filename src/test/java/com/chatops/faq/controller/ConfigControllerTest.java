package com.chatops.faq.controller;

import com.chatops.faq.config.FaqBotConfig;
import com.chatops.faq.engine.Bm25Index;
import com.chatops.faq.engine.MessageClassifier;
import com.chatops.faq.model.CorpusEntry;
import com.chatops.faq.service.ReviewerRotator;
import com.chatops.faq.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FaqBotConfig botConfig;

    @MockBean
    private MessageClassifier classifier;

    @MockBean
    private ReviewerRotator reviewerRotator;

    private final FaqBotConfig.Classifier classifierConfig = new FaqBotConfig.Classifier();

    @BeforeEach
    void setUp() {
        when(botConfig.getClassifier()).thenReturn(classifierConfig);
        when(classifier.currentIndex()).thenReturn(new Bm25Index(TestDataFactory.defaultCorpus()));
        when(classifier.getThreshold()).thenReturn(0.99);
        when(classifier.getMinThreshold()).thenReturn(0.99);
    }

    @Test
    void getClassifier_returnsCurrentSettings() throws Exception {
        mockMvc.perform(get("/api/v1/config/classifier"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.similarityThreshold").value(0.99))
                .andExpect(jsonPath("$.minSimilarityThreshold").value(0.99))
                .andExpect(jsonPath("$.minMessageLength").value(5))
                .andExpect(jsonPath("$.questionFilterEnabled").value(false))
                .andExpect(jsonPath("$.k1").value(1.2))
                .andExpect(jsonPath("$.b").value(0.75))
                .andExpect(jsonPath("$.corpusSize").value(5));
    }

    @Test
    void updateClassifier_thresholdBelowMinimum_isClamped() throws Exception {
        when(classifier.updateThreshold(0.5)).thenReturn(0.99);

        mockMvc.perform(put("/api/v1/config/classifier")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("similarityThreshold", 0.5))))
                .andExpect(status().isOk());

        verify(classifier).updateThreshold(0.5);
        verify(botConfig).setSimilarityThreshold(0.99);
        verify(classifier, never()).updateBm25Parameters(anyDouble(), anyDouble());
    }

    @Test
    void updateClassifier_newBm25Parameters_rebuildsIndex() throws Exception {
        when(classifier.updateThreshold(0.99)).thenReturn(0.99);

        mockMvc.perform(put("/api/v1/config/classifier")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("k1", 1.5, "b", 0.5))))
                .andExpect(status().isOk());

        verify(classifier).updateBm25Parameters(1.5, 0.5);
    }

    @Test
    void updateClassifier_bOutOfRange_badRequest() throws Exception {
        mockMvc.perform(put("/api/v1/config/classifier")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("b", 1.5))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("b"));

        verify(classifier, never()).updateThreshold(anyDouble());
    }

    @Test
    void updateClassifier_nonNumericThreshold_badRequest() throws Exception {
        mockMvc.perform(put("/api/v1/config/classifier")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("similarityThreshold", "high"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("similarityThreshold"));
    }

    @Test
    void getCorpus() throws Exception {
        when(classifier.getCorpus()).thenReturn(List.of(TestDataFactory.CREATE_CHANNEL));

        mockMvc.perform(get("/api/v1/config/corpus"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].question").value("How do I create a channel?"));
    }

    @Test
    void replaceCorpus_valid() throws Exception {
        List<CorpusEntry> corpus = List.of(new CorpusEntry("How do I reset my password?", "Use the login page."));
        when(classifier.getCorpus()).thenReturn(corpus);

        mockMvc.perform(put("/api/v1/config/corpus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(corpus)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].answer").value("Use the login page."));

        verify(classifier).updateCorpus(corpus);
    }

    @Test
    void replaceCorpus_entryWithoutAnswer_badRequest() throws Exception {
        mockMvc.perform(put("/api/v1/config/corpus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"question\":\"How do I reset my password?\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("corpus"));

        verify(classifier, never()).updateCorpus(anyList());
    }

    @Test
    void getReviewers() throws Exception {
        when(botConfig.getReviewerUsernames()).thenReturn(List.of("alice", "bob"));
        when(botConfig.isEnableReviewMode()).thenReturn(true);
        when(reviewerRotator.readCursor()).thenReturn(1);

        mockMvc.perform(get("/api/v1/config/reviewers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reviewerUsernames[1]").value("bob"))
                .andExpect(jsonPath("$.enableReviewMode").value(true))
                .andExpect(jsonPath("$.lastReviewerIndex").value(1));
    }
}
