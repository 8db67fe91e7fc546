package com.chatops.faq.service;

import com.chatops.faq.config.MetricsConfig;
import com.chatops.faq.config.ReviewConfig;
import com.chatops.faq.exception.InvalidTransitionException;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import com.chatops.faq.repository.ReviewRepository;
import com.chatops.faq.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewExpiryServiceTest {

    private static final long NOW = 1_739_886_764_000L;

    @Mock private ReviewRepository reviewRepository;
    @Mock private MetricsConfig metricsConfig;

    private ReviewExpiryService service;

    @BeforeEach
    void setUp() {
        ReviewConfig config = new ReviewConfig();
        config.setExpiryTimeoutMinutes(60);
        service = new ReviewExpiryService(reviewRepository, config, metricsConfig);
    }

    private static long minutesAgo(long minutes) {
        return NOW - TimeUnit.MINUTES.toMillis(minutes);
    }

    @Test
    void olderThanTimeout_expires_exactlyTimeoutDoesNot() {
        ReviewRecord stale = TestDataFactory.createReview("R-61", ReviewStatus.PENDING, minutesAgo(61));
        ReviewRecord boundary = TestDataFactory.createReview("R-60", ReviewStatus.PENDING, minutesAgo(60));
        ReviewRecord fresh = TestDataFactory.createReview("R-5", ReviewStatus.PENDING, minutesAgo(5));
        when(reviewRepository.findByStatus(ReviewStatus.PENDING)).thenReturn(List.of(stale, boundary, fresh));

        int expired = service.expireStaleReviews(NOW);

        assertThat(expired).isEqualTo(1);
        verify(reviewRepository).transition("R-61", ReviewAction.EXPIRE, "SYSTEM", null);
        verify(reviewRepository, never()).transition(eq("R-60"), any(), any(), any());
        verify(reviewRepository, never()).transition(eq("R-5"), any(), any(), any());
        verify(metricsConfig).recordExpired(1);
    }

    @Test
    void oneMillisecondPastTimeout_expires() {
        ReviewRecord review = TestDataFactory.createReview("R1", ReviewStatus.PENDING, minutesAgo(60) - 1);
        when(reviewRepository.findByStatus(ReviewStatus.PENDING)).thenReturn(List.of(review));

        assertThat(service.expireStaleReviews(NOW)).isEqualTo(1);
    }

    @Test
    void reviewActedOnDuringSweep_isSkipped() {
        ReviewRecord a = TestDataFactory.createReview("R1", ReviewStatus.PENDING, minutesAgo(90));
        ReviewRecord b = TestDataFactory.createReview("R2", ReviewStatus.PENDING, minutesAgo(90));
        when(reviewRepository.findByStatus(ReviewStatus.PENDING)).thenReturn(List.of(a, b));
        when(reviewRepository.transition("R1", ReviewAction.EXPIRE, "SYSTEM", null))
                .thenThrow(new InvalidTransitionException("R1", ReviewAction.EXPIRE, ReviewStatus.APPROVED));

        int expired = service.expireStaleReviews(NOW);

        assertThat(expired).isEqualTo(1);
        verify(reviewRepository).transition("R2", ReviewAction.EXPIRE, "SYSTEM", null);
    }

    @Test
    void nothingPending_recordsNothing() {
        when(reviewRepository.findByStatus(ReviewStatus.PENDING)).thenReturn(List.of());

        assertThat(service.expireStaleReviews(NOW)).isZero();
        verifyNoInteractions(metricsConfig);
    }
}
