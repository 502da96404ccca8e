package com.company.alerting.service;

import com.company.alerting.domain.DeliveryAttempt;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.DeliveryStatus;
import lombok.Getter;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One in-flight (event, subscription) delivery. Progress can be read while the delivery runs.
 */
@Getter
public class PendingDelivery {

    private final EnrichedEvent event;
    private final Subscription subscription;
    private final AtomicInteger attempts = new AtomicInteger();
    private final List<DeliveryAttempt> history = new CopyOnWriteArrayList<>();
    private final CompletableFuture<DeliveryResult> result = new CompletableFuture<>();

    private volatile String lastError;

    PendingDelivery(EnrichedEvent event, Subscription subscription) {
        this.event = event;
        this.subscription = subscription;
    }

    int nextAttempt() {
        return attempts.incrementAndGet();
    }

    void recordAttempt(DeliveryAttempt attempt) {
        history.add(attempt);
        if (!attempt.isSuccess()) {
            lastError = attempt.getError();
        }
    }

    /**
     * Final result if done, otherwise a RETRYING snapshot with the attempts made so far.
     */
    public DeliveryResult currentResult() {
        DeliveryResult done = result.getNow(null);
        if (done != null) {
            return done;
        }
        return DeliveryResult.builder()
                .eventId(event.getEventId())
                .channelType(subscription.getChannelType())
                .endpoint(subscription.getEndpoint())
                .status(DeliveryStatus.RETRYING)
                .attempts(attempts.get())
                .lastError(lastError)
                .build();
    }
}
