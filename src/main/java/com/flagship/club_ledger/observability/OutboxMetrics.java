package com.flagship.club_ledger.observability;

import com.flagship.club_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Receipt outbox gauges and delivery counters. Gauges read cached values that
 * {@link MetricsScheduler} refreshes, so scrapes never hit the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Receipt messages waiting for delivery")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest undelivered receipt message")
                .register(meterRegistry);

        Gauge.builder("outbox.events.dead_lettered", deadLetteredCount, AtomicLong::get)
                .description("Receipt messages that exhausted their retries")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            backlogSize.set(outboxService.countUnpublished());
            oldestEventAgeSeconds.set(Math.max(0, outboxService.oldestUnpublishedAge().getSeconds()));
            deadLetteredCount.set(outboxService.countDeadLettered());
            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                    backlogSize.get(), oldestEventAgeSeconds.get(), deadLetteredCount.get());
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    long backlogSize() {
        return backlogSize.get();
    }
}
