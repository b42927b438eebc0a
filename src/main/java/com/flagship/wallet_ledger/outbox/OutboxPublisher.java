package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Background publisher that drains the outbox to Kafka.
 *
 * Each poll claims a batch of pending events, sends them one by one keyed by
 * wallet id (so one wallet's events stay on one partition, in order) and marks
 * them published once the broker acknowledged. A failed send increments the
 * retry count; after {@code outbox.publisher.max-retries} the event is left in
 * place as a dead letter and no longer picked up.
 *
 * Delivery is at-least-once. Consumers deduplicate on the event id.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String WALLET_AGGREGATE = "Wallet";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.wallets:wallet-events}")
    private String walletsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPendingEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read pending outbox events", e);
            return;
        }

        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} pending outbox events", events.size());

        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        String key = event.getAggregateId().toString();

        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}, will retry on next poll", event.getId());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            String error = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), error);
            outboxService.markFailed(event.getId(), error);
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), moved to dead letter. eventType={}, walletId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    private String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case WALLET_AGGREGATE -> walletsTopic;
            default -> {
                log.warn("Unknown aggregate type {} for event {}, routing to {}",
                    event.getAggregateType(), event.getId(), walletsTopic);
                yield walletsTopic;
            }
        };
    }
}
