package com.company.alerting.service;

import com.company.alerting.domain.DeadLetterRecord;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.Severity;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletionException;

/**
 * Manual re-delivery of a dead letter to its original channel and endpoint.
 * Bypasses dedup: an operator replay is always intentional.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterReplayService {

    private final DeadLetterService deadLetterService;
    private final DeliveryService deliveryService;
    private final MeterRegistry meterRegistry;

    public DeliveryResult replay(long deadLetterId) {
        DeadLetterRecord record = deadLetterService.get(deadLetterId);
        EnrichedEvent event = deadLetterService.payloadOf(record);

        Subscription subscription = Subscription.builder()
                .severity(Severity.fromString(record.getSeverity()))
                .channelType(ChannelType.fromString(record.getChannelType()))
                .endpoint(record.getEndpoint())
                .build();

        log.info("Replaying dead letter {} (event {}) to {}", deadLetterId, record.getEventId(), subscription.describe());

        DeliveryResult result;
        try {
            result = deliveryService.deliver(event, subscription).getResult().join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Replay of dead letter " + deadLetterId + " failed", e.getCause());
        }

        deadLetterService.recordReplay(deadLetterId, result.getStatus().name());
        meterRegistry.counter("alerts.deadletter.replayed",
                "status", result.getStatus().name().toLowerCase()).increment();
        return result;
    }
}
