package com.company.alerting.service;

import com.company.alerting.cache.RedisDedupCache;
import com.company.alerting.channel.AggregateQueuePublisher;
import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.DeliveryStatus;
import com.company.alerting.util.DedupKeys;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Fans an enriched event out to every subscription of its severity.
 *
 * <p>Identical events within the dedup window are skipped. Deliveries run asynchronously; the
 * router waits up to the configured result wait and reports anything still in flight as RETRYING.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChannelRouter {

    private final EngineConfig config;
    private final RedisDedupCache dedupCache;
    private final DeliveryService deliveryService;
    private final AggregateQueuePublisher aggregatePublisher;
    private final MeterRegistry meterRegistry;

    public List<DeliveryResult> route(EnrichedEvent event) {
        List<Subscription> subscriptions = config.subscriptionsFor(event.getSeverity());
        if (subscriptions.isEmpty()) {
            log.warn("No subscriptions for severity {}, event {} not delivered",
                    event.getSeverity(), event.getEventId());
            meterRegistry.counter("alerts.routed.unsubscribed",
                    "severity", event.getSeverity().name()).increment();
            aggregatePublisher.publish(event);
            return List.of();
        }

        String key = DedupKeys.deliveryKey(event.getEvent());
        if (!dedupCache.claim(key, event.getEventId(), config.getDedupWindow())) {
            log.info("Event {} is a duplicate within {}, skipping", event.getEventId(), config.getDedupWindow());
            return skip(event.getEvent(), DeliveryStatus.SKIPPED_DEDUPED, "duplicate within dedup window");
        }

        aggregatePublisher.publish(event);

        List<PendingDelivery> pending = subscriptions.stream()
                .map(subscription -> deliveryService.deliver(event, subscription))
                .collect(Collectors.toList());

        awaitResults(pending);

        List<DeliveryResult> results = pending.stream()
                .map(PendingDelivery::currentResult)
                .collect(Collectors.toList());
        results.forEach(this::count);

        log.info("Routed event {} ({}) to {} subscription(s): {}",
                event.getEventId(), event.getSeverity(), results.size(),
                results.stream().map(r -> r.getChannelType() + "=" + r.getStatus()).collect(Collectors.joining(", ")));
        return results;
    }

    /**
     * One skip result per subscription the event would have reached, or a single channel-less
     * result when there is none.
     */
    public List<DeliveryResult> skip(AlertEvent event, DeliveryStatus status, String reason) {
        List<Subscription> subscriptions = event.getSeverity() != null
                ? config.subscriptionsFor(event.getSeverity())
                : List.of();

        List<DeliveryResult> results = subscriptions.isEmpty()
                ? List.of(DeliveryResult.skipped(event.getId(), null, status, reason))
                : subscriptions.stream()
                        .map(s -> DeliveryResult.skipped(event.getId(), s, status, reason))
                        .collect(Collectors.toList());

        results.forEach(this::count);
        return results;
    }

    private void awaitResults(List<PendingDelivery> pending) {
        CompletableFuture<?>[] futures = pending.stream()
                .map(PendingDelivery::getResult)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(config.getResultWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Result wait of {} elapsed with deliveries in flight", config.getResultWait());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            // Delivery futures are always completed normally
            log.error("Unexpected delivery failure", e.getCause());
        }
    }

    private void count(DeliveryResult result) {
        meterRegistry.counter("alerts.routed",
                "status", result.getStatus().name().toLowerCase(),
                "channel", result.getChannelType() != null ? result.getChannelType().name() : "none"
        ).increment();
    }
}
