package com.company.alerting.channel;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.EnrichedEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Copies every routed event to a central queue for downstream analytics. Best effort:
 * failures are logged and counted, never retried and never surfaced to the router.
 */
@Component
@Slf4j
public class AggregateQueuePublisher {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final EngineConfig config;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    public AggregateQueuePublisher(SqsClient sqsClient,
                                   ObjectMapper objectMapper,
                                   EngineConfig config,
                                   @Qualifier("deliveryExecutor") ExecutorService executor,
                                   MeterRegistry meterRegistry) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public CompletableFuture<Void> publish(EnrichedEvent event) {
        if (!config.isAggregateEnabled()) {
            return CompletableFuture.completedFuture(null);
        }

        return CompletableFuture
                .runAsync(() -> send(event), executor)
                .exceptionally(e -> {
                    log.warn("Failed to publish event {} to aggregate queue: {}",
                            event.getEventId(), e.getMessage());
                    meterRegistry.counter("alerts.aggregate.failures").increment();
                    return null;
                });
    }

    private void send(EnrichedEvent event) {
        String body;
        try {
            body = objectMapper.writeValueAsString(AlertMessage.from(event));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialize event " + event.getEventId(), e);
        }

        sqsClient.sendMessage(SendMessageRequest.builder()
                .queueUrl(config.getAggregateQueueUrl())
                .messageBody(body)
                .build());
        meterRegistry.counter("alerts.aggregate.published").increment();
    }
}
