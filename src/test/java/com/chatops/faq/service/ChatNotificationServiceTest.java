package com.chatops.faq.service;

import com.chatops.faq.client.ChatApiClient;
import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.exception.DeliveryException;
import com.chatops.faq.exception.ExternalServiceException;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import com.chatops.faq.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatNotificationServiceTest {

    @Mock private ChatApiClient chatApiClient;
    @Mock private MetricsConfig metricsConfig;

    private ChatNotificationService service;

    @BeforeEach
    void setUp() {
        service = new ChatNotificationService(chatApiClient, metricsConfig);
    }

    @Test
    void deliver_prefixesBotMarker() {
        service.deliver("ROOM-1", "Click +.");

        verify(chatApiClient).postMessage("ROOM-1", "🤖 FAQ Bot: Click +.");
        verify(metricsConfig).recordDelivery("answer", "success");
    }

    @Test
    void deliver_failure_becomesDeliveryException() {
        when(chatApiClient.postMessage(any(), any())).thenThrow(new ExternalServiceException("503"));

        assertThatThrownBy(() -> service.deliver("ROOM-1", "x"))
                .isInstanceOf(DeliveryException.class)
                .hasCauseInstanceOf(ExternalServiceException.class);
        verify(metricsConfig).recordDelivery("answer", "error");
    }

    @Test
    void notifyReviewer_sendsReviewToDirectRoom() {
        ReviewRecord review = TestDataFactory.createReview("R1", ReviewStatus.PENDING);
        when(chatApiClient.createDirectRoom("alice")).thenReturn("DM-1");

        service.notifyReviewer(review, TestDataFactory.reviewer("U-1", "alice"));

        verify(chatApiClient).postMessage(eq("DM-1"), argThat(text ->
                text.contains("R1") && text.contains(review.getOriginalMessageText())
                        && text.contains(review.getProposedAnswer())));
    }

    @Test
    void notifyReviewer_directRoomFailure_becomesDeliveryException() {
        when(chatApiClient.createDirectRoom("alice")).thenThrow(new ExternalServiceException("no such user"));

        assertThatThrownBy(() -> service.notifyReviewer(
                TestDataFactory.createReview("R1", ReviewStatus.PENDING),
                TestDataFactory.reviewer("U-1", "alice")))
                .isInstanceOf(DeliveryException.class);
        verify(chatApiClient, never()).postMessage(any(), any());
    }

    @Test
    void confirmationTexts() {
        ReviewRecord review = TestDataFactory.createReview("R1", ReviewStatus.APPROVED);

        assertThat(ChatNotificationService.buildConfirmation(review, ReviewAction.APPROVE))
                .startsWith("✅ You approved the response to: \"can u help me make a new channel\"")
                .contains(review.getProposedAnswer());
        assertThat(ChatNotificationService.buildConfirmation(review, ReviewAction.REJECT))
                .startsWith("❌ You rejected")
                .contains("No response has been sent");
        assertThat(ChatNotificationService.buildConfirmation(review, ReviewAction.CANCEL_EDIT))
                .contains("Edit canceled");
    }

    @Test
    void postToChannel_addsHash() {
        service.postToChannel("faq-log", "entry");

        verify(chatApiClient).postMessage("#faq-log", "entry");
    }
}
