package com.company.alerting.service;

import com.company.alerting.domain.DeadLetterRecord;
import com.company.alerting.domain.DeliveryAttempt;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.exception.DeadLetterNotFoundException;
import com.company.alerting.repository.DeadLetterRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Durable sink for deliveries that exhausted their retries or failed permanently.
 * A dead letter that cannot be stored is logged in full so it is never silently lost.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterService {

    private final DeadLetterRepository repository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public void deadLetter(EnrichedEvent event, Subscription subscription, String reason,
                           int attempts, List<DeliveryAttempt> history) {
        String payload = toJson(event);
        DeadLetterRecord record = DeadLetterRecord.builder()
                .eventId(event.getEventId())
                .severity(event.getSeverity().name())
                .channelType(subscription.getChannelType().name())
                .endpoint(subscription.getEndpoint())
                .reason(reason)
                .attempts(attempts)
                .payload(payload)
                .history(toJson(history))
                .createdAt(clock.instant())
                .build();

        try {
            repository.save(record);
            meterRegistry.counter("alerts.deadletter.written",
                    "channel", subscription.getChannelType().name()
            ).increment();
            log.warn("Dead-lettered event {} for {} after {} attempts: {}",
                    event.getEventId(), subscription.describe(), attempts, reason);
        } catch (DataAccessException e) {
            meterRegistry.counter("alerts.deadletter.write_failures").increment();
            log.error("Failed to store dead letter for event {} to {} (reason: {}), payload={} history={}",
                    event.getEventId(), subscription.describe(), reason, payload, record.getHistory(), e);
        }
    }

    public List<DeadLetterRecord> recent(int limit) {
        return repository.findRecent(limit);
    }

    public DeadLetterRecord get(long deadLetterId) {
        return repository.findById(deadLetterId)
                .orElseThrow(() -> new DeadLetterNotFoundException(deadLetterId));
    }

    public EnrichedEvent payloadOf(DeadLetterRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), EnrichedEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Dead letter " + record.getDeadLetterId() + " has an unreadable payload", e);
        }
    }

    public void recordReplay(long deadLetterId, String status) {
        repository.markReplayed(deadLetterId, status, clock.instant());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} for dead letter", value.getClass().getSimpleName(), e);
            return String.valueOf(value);
        }
    }
}
