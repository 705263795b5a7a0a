package com.flagship.club_ledger.observability;

import com.flagship.club_ledger.webhook.IdempotencyGate;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over the claim table. A growing stuck count means events were claimed
 * and never finished; with permanent claims those need operator attention.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentEventMetrics {

    private final IdempotencyGate idempotencyGate;
    private final MeterRegistry meterRegistry;

    private final AtomicLong stuckClaims = new AtomicLong(0);
    private final AtomicLong failedEvents = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.payment_events.stuck", stuckClaims, AtomicLong::get)
                .description("Claims left in PROCESSING past the stuck threshold")
                .register(meterRegistry);

        Gauge.builder("ledger.payment_events.failed", failedEvents, AtomicLong::get)
                .description("Events whose handler failed")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            stuckClaims.set(idempotencyGate.countStuck());
            failedEvents.set(idempotencyGate.countFailed());
            if (stuckClaims.get() > 0) {
                log.warn("{} payment event claims are stuck in PROCESSING", stuckClaims.get());
            }
        } catch (Exception e) {
            log.warn("Failed to refresh payment event metrics: {}", e.getMessage());
        }
    }

    public long stuckClaims() {
        return stuckClaims.get();
    }
}
