package com.company.alerting.service;

import com.company.alerting.channel.DeliveryAdapter;
import com.company.alerting.config.EngineConfiguration;
import com.company.alerting.domain.DeliveryAttempt;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.DeliveryStatus;
import com.company.alerting.domain.enums.FailureClassification;
import com.company.alerting.exception.DeliveryException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Delivers one event to one subscription: bounded attempts with exponential backoff on
 * transient failures, each attempt under a deadline, then a dead letter if nothing succeeded.
 */
@Service
@Slf4j
public class DeliveryService {

    private final Map<ChannelType, DeliveryAdapter> adapters;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService deliveryExecutor;
    private final ExecutorService attemptExecutor;
    private final DeadLetterService deadLetterService;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DeliveryService(List<DeliveryAdapter> adapters,
                           RetryRegistry retryRegistry,
                           TimeLimiter timeLimiter,
                           @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
                           @Qualifier("attemptExecutor") ExecutorService attemptExecutor,
                           DeadLetterService deadLetterService,
                           Tracer tracer,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.adapters = new EnumMap<>(ChannelType.class);
        for (DeliveryAdapter adapter : adapters) {
            this.adapters.put(adapter.channelType(), adapter);
        }
        this.retry = retryRegistry.retry(EngineConfiguration.DELIVERY_RETRY);
        this.timeLimiter = timeLimiter;
        this.deliveryExecutor = deliveryExecutor;
        this.attemptExecutor = attemptExecutor;
        this.deadLetterService = deadLetterService;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Starts the delivery on the delivery executor and returns immediately.
     */
    public PendingDelivery deliver(EnrichedEvent event, Subscription subscription) {
        PendingDelivery pending = new PendingDelivery(event, subscription);
        try {
            deliveryExecutor.execute(() -> run(pending));
        } catch (RejectedExecutionException e) {
            log.error("Delivery executor rejected event {} for {}", event.getEventId(), subscription.describe());
            pending.getResult().complete(deadLetter(pending,
                    DeliveryException.transientFailure("delivery executor saturated", e)));
        }
        return pending;
    }

    private void run(PendingDelivery pending) {
        EnrichedEvent event = pending.getEvent();
        MDC.put("eventId", event.getEventId());
        try {
            pending.getResult().complete(execute(pending));
        } catch (RuntimeException e) {
            log.error("Unexpected failure delivering event {}", event.getEventId(), e);
            pending.getResult().complete(deadLetter(pending,
                    DeliveryException.transientFailure("unexpected: " + e.getMessage(), e)));
        } finally {
            MDC.remove("eventId");
        }
    }

    private DeliveryResult execute(PendingDelivery pending) {
        Subscription subscription = pending.getSubscription();
        DeliveryAdapter adapter = adapters.get(subscription.getChannelType());
        if (adapter == null) {
            return deadLetter(pending, DeliveryException.permanentFailure(
                    "No adapter for channel " + subscription.getChannelType(), null));
        }

        Instant preparedAt = clock.instant();
        try {
            adapter.prepare(subscription.getEndpoint());
        } catch (DeliveryException e) {
            record(pending, pending.nextAttempt(), preparedAt, e);
            log.warn("Preparing {} for event {} failed ({}): {}", subscription.describe(),
                    pending.getEvent().getEventId(), e.getClassification(), e.getMessage());
            return deadLetter(pending, e);
        }

        try {
            retry.executeCheckedSupplier(() -> {
                attempt(pending, adapter);
                return null;
            });
        } catch (DeliveryException e) {
            return deadLetter(pending, e);
        } catch (Throwable t) {
            return deadLetter(pending, DeliveryException.transientFailure(t.getMessage(), t));
        }

        DeliveryResult result = DeliveryResult.builder()
                .eventId(pending.getEvent().getEventId())
                .channelType(subscription.getChannelType())
                .endpoint(subscription.getEndpoint())
                .status(DeliveryStatus.DELIVERED)
                .attempts(pending.getAttempts().get())
                .build();
        countResult(result);
        log.info("Delivered event {} to {} in {} attempt(s)",
                result.getEventId(), subscription.describe(), result.getAttempts());
        return result;
    }

    private void attempt(PendingDelivery pending, DeliveryAdapter adapter) {
        EnrichedEvent event = pending.getEvent();
        Subscription subscription = pending.getSubscription();
        int attempt = pending.nextAttempt();
        Instant startedAt = clock.instant();

        Span span = tracer.spanBuilder("alert.delivery.attempt")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.event_id", event.getEventId());
            span.setAttribute("alert.severity", event.getSeverity().name());
            span.setAttribute("delivery.channel", subscription.getChannelType().name());
            span.setAttribute("delivery.endpoint", subscription.getEndpoint());
            span.setAttribute("delivery.attempt", attempt);

            timeLimiter.executeFutureSupplier(() -> attemptExecutor.submit(() -> {
                adapter.send(subscription.getEndpoint(), event);
                return null;
            }));

            record(pending, attempt, startedAt, null);
        } catch (DeliveryException e) {
            fail(span, pending, attempt, startedAt, e);
            throw e;
        } catch (TimeoutException e) {
            DeliveryException timeout = DeliveryException.transientFailure(
                    "attempt timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
            fail(span, pending, attempt, startedAt, timeout);
            throw timeout;
        } catch (Exception e) {
            DeliveryException unexpected = DeliveryException.transientFailure(e.getMessage(), e);
            fail(span, pending, attempt, startedAt, unexpected);
            throw unexpected;
        } finally {
            span.end();
        }
    }

    private void fail(Span span, PendingDelivery pending, int attempt, Instant startedAt, DeliveryException e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, e.getClassification().name());
        record(pending, attempt, startedAt, e);
        log.warn("Attempt {} delivering event {} to {} failed ({}): {}",
                attempt, pending.getEvent().getEventId(), pending.getSubscription().describe(),
                e.getClassification(), e.getMessage());
    }

    private void record(PendingDelivery pending, int attempt, Instant startedAt, DeliveryException error) {
        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        pending.recordAttempt(DeliveryAttempt.builder()
                .attempt(attempt)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .success(error == null)
                .classification(error != null ? error.getClassification() : null)
                .error(error != null ? error.getMessage() : null)
                .build());

        meterRegistry.counter("alerts.delivery.attempts",
                "channel", pending.getSubscription().getChannelType().name(),
                "outcome", error == null ? "success" : error.getClassification().name().toLowerCase()
        ).increment();
    }

    private DeliveryResult deadLetter(PendingDelivery pending, DeliveryException cause) {
        String reason = cause.getClassification() == FailureClassification.PERMANENT
                ? "permanent failure: " + cause.getMessage()
                : "retries exhausted: " + cause.getMessage();

        deadLetterService.deadLetter(pending.getEvent(), pending.getSubscription(), reason,
                pending.getAttempts().get(), List.copyOf(pending.getHistory()));

        DeliveryResult result = DeliveryResult.builder()
                .eventId(pending.getEvent().getEventId())
                .channelType(pending.getSubscription().getChannelType())
                .endpoint(pending.getSubscription().getEndpoint())
                .status(DeliveryStatus.DEAD_LETTERED)
                .attempts(pending.getAttempts().get())
                .lastError(cause.getMessage())
                .build();
        countResult(result);
        return result;
    }

    private void countResult(DeliveryResult result) {
        meterRegistry.counter("alerts.delivery.results",
                "channel", result.getChannelType().name(),
                "status", result.getStatus().name().toLowerCase()
        ).increment();
    }
}
