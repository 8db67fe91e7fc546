package com.chatops.faq.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String type, double score) {
        Counter.builder("faq.classification.count")
                .tag("type", type)
                .register(registry)
                .increment();

        DistributionSummary.builder("faq.classification.score")
                .tag("type", type)
                .register(registry)
                .record(score);
    }

    public void recordTransition(String action) {
        Counter.builder("faq.review.transition.count")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordExpired(int count) {
        Counter.builder("faq.review.expired.count")
                .register(registry)
                .increment(count);
    }

    public void recordDelivery(String kind, String status) {
        Counter.builder("faq.delivery.count")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordGeneratorCall(String status) {
        Counter.builder("faq.generator.call.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReviewerAssigned(String reviewer) {
        Counter.builder("faq.reviewer.assigned.count")
                .tag("reviewer", reviewer)
                .register(registry)
                .increment();
    }
}
