package com.company.alerting.scheduled;

import com.company.alerting.event.CompositeAlarmReleasedEvent;
import com.company.alerting.suppression.CompositeOutcome;
import com.company.alerting.suppression.SuppressionDecision;
import com.company.alerting.suppression.SuppressionEngine;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Expires suppression wait and extension windows. Held notifications whose wait period
 * ended with the suppressor still in ALARM are published for routing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "alerting.suppression.sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SuppressionWindowJob {

    private final SuppressionEngine suppressionEngine;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${alerting.suppression.sweep.interval-ms:1000}",
            initialDelayString = "${alerting.suppression.sweep.initial-delay-ms:5000}"
    )
    public void sweep() {
        SuppressionDecision decision;
        try {
            decision = suppressionEngine.advance(clock.instant());
        } catch (RuntimeException e) {
            log.error("Suppression window sweep failed", e);
            meterRegistry.counter("alerts.suppression.errors", "reason", "sweep").increment();
            return;
        }

        for (CompositeOutcome outcome : decision.getOutcomes()) {
            if (outcome.getAction() == CompositeOutcome.Action.EMIT) {
                log.info("Releasing held composite {} from rule {}",
                        outcome.getComposite().getId(), outcome.getRuleName());
                meterRegistry.counter("alerts.suppression.released").increment();
                eventPublisher.publishEvent(
                        new CompositeAlarmReleasedEvent(outcome.getRuleName(), outcome.getComposite()));
            } else if (outcome.isSkipped()) {
                log.info("Held composite {} from rule {} dropped: {}",
                        outcome.getComposite().getId(), outcome.getRuleName(), outcome.getReason());
            }
        }
    }
}
