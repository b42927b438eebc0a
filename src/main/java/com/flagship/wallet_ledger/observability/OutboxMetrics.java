package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wallet event outbox gauges and publish counters.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a
 * Prometheus scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private static final String PREFIX = "ledger.outbox.";

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pendingEvents = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();

    @PostConstruct
    public void init() {
        Gauge.builder(PREFIX + "pending", pendingEvents, AtomicLong::get)
                .description("Wallet events written but not yet acknowledged by Kafka")
                .register(meterRegistry);

        Gauge.builder(PREFIX + "pending.oldest.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("How long the oldest pending wallet event has been waiting")
                .register(meterRegistry);

        Gauge.builder(PREFIX + "dead_letters", deadLetters, AtomicLong::get)
                .description("Wallet events that used up their publish retries")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long pending = outboxRepository.countUnpublished();
            long oldestAge = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Duration.between(oldest, Instant.now(clock)).getSeconds())
                    .orElse(0L);
            long deadLettered = outboxRepository.countDeadLettered(maxRetries);

            pendingEvents.set(pending);
            oldestPendingSeconds.set(Math.max(0, oldestAge));
            deadLetters.set(deadLettered);

            log.debug("Outbox gauges: pending={}, oldest={}s, deadLetters={}", pending, oldestAge, deadLettered);
        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox gauges: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        recordPublish(eventType, "acked");
    }

    public void recordEventPublishFailed(String eventType) {
        recordPublish(eventType, "failed");
    }

    public void recordEventDeadLettered(String eventType) {
        recordPublish(eventType, "dead_lettered");
    }

    private void recordPublish(String eventType, String outcome) {
        meterRegistry.counter(PREFIX + "publish",
                "event_type", eventType,
                "outcome", outcome
        ).increment();
    }
}
