package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Custom actuator health indicators.
 */
public class HealthIndicators {

    /**
     * Reports the outbox backlog. A growing backlog means ledger events are
     * committed but not reaching Kafka.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long warningThreshold;
        private final long criticalThreshold;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.warning-threshold:1000}") long warningThreshold,
                                     @Value("${outbox.health.critical-threshold:10000}") long criticalThreshold) {
            this.outboxRepository = outboxRepository;
            this.warningThreshold = warningThreshold;
            this.criticalThreshold = criticalThreshold;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < warningThreshold
                        ? Health.up()
                        : backlogSize < criticalThreshold
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", warningThreshold)
                        .withDetail("criticalThreshold", criticalThreshold)
                        .build();

            } catch (DataAccessException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
