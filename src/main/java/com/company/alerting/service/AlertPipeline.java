package com.company.alerting.service;

import com.company.alerting.cache.RedisDedupCache;
import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.DeliveryStatus;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.event.CompositeAlarmReleasedEvent;
import com.company.alerting.exception.UnknownSourceException;
import com.company.alerting.suppression.AlarmStateTable;
import com.company.alerting.suppression.CompositeOutcome;
import com.company.alerting.suppression.SuppressionDecision;
import com.company.alerting.suppression.SuppressionEngine;
import com.company.alerting.util.DedupKeys;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Ingestion to delivery: idempotency, evaluation, classification, state-change gate,
 * suppression, enrichment, redaction and routing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertPipeline {

    private final EngineConfig config;
    private final RedisDedupCache dedupCache;
    private final AlertEvaluator evaluator;
    private final SeverityClassifier classifier;
    private final AlarmStateTable stateTable;
    private final SuppressionEngine suppressionEngine;
    private final EnrichmentService enrichmentService;
    private final RedactionService redactionService;
    private final ChannelRouter router;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public PipelineResult process(AlertEvent incoming) {
        Instant now = clock.instant();
        AlertEvent event = incoming.toBuilder()
                .id(incoming.getId() != null ? incoming.getId() : UUID.randomUUID().toString())
                .timestamp(incoming.getTimestamp() != null ? incoming.getTimestamp() : now)
                .build();

        MDC.put("eventId", event.getId());
        try {
            return doProcess(event, now);
        } finally {
            MDC.remove("eventId");
        }
    }

    private PipelineResult doProcess(AlertEvent event, Instant now) {
        meterRegistry.counter("alerts.ingested",
                "source", event.getSource() != null ? event.getSource().name() : "unknown").increment();

        if (!dedupCache.claim(DedupKeys.ingestionKey(event), event.getId(), config.getIdempotencyWindow())) {
            log.info("Event {} already ingested within {}", event.getId(), config.getIdempotencyWindow());
            meterRegistry.counter("alerts.ingested.duplicate").increment();
            return result(event, List.of(DeliveryResult.skipped(
                    event.getId(), null, DeliveryStatus.SKIPPED_DEDUPED, "duplicate ingestion")));
        }

        List<AlertEvent> alarms = event.isRawSample() ? evaluator.resolve(event, now) : List.of(event);
        List<DeliveryResult> results = new ArrayList<>();
        AlertEvent reported = null;

        for (AlertEvent alarm : alarms) {
            if (event.isRawSample()) {
                log.debug("Raw sample for {} evaluated to {}", alarm.alarmKey(), alarm.getState());
            }
            if (processAlarm(alarm, results) && (reported == null || alarm.getState() == AlarmState.ALARM)) {
                reported = alarm;
            }
        }

        return PipelineResult.builder()
                .eventId(event.getId())
                .severity(reported != null ? reported.getSeverity() : null)
                .state(reported != null ? reported.getState() : alarms.get(0).getState())
                .results(List.copyOf(results))
                .build();
    }

    /**
     * Runs one resolved alarm from previous state lookup through routing.
     * Returns false when the alarm could not be classified.
     */
    private boolean processAlarm(AlertEvent event, List<DeliveryResult> results) {
        if (event.getPreviousState() == null && event.alarmKey() != null) {
            event.setPreviousState(stateTable.stateOf(event.alarmKey()));
        }

        if (event.getSeverity() == null) {
            try {
                event.setSeverity(classifier.classify(event));
            } catch (UnknownSourceException e) {
                log.warn("Dropping event {}: {}", event.getId(), e.getMessage());
                meterRegistry.counter("alerts.dropped.unclassified").increment();
                results.add(DeliveryResult.skipped(
                        event.getId(), null, DeliveryStatus.DROPPED_UNCLASSIFIED, e.getMessage()));
                return false;
            }
        }

        boolean notify = passesStateGate(event);
        SuppressionDecision decision = suppress(event);

        if (notify) {
            results.addAll(deliver(event));
        } else {
            log.debug("Event {} for {} did not change state ({}), not notifying",
                    event.getId(), event.alarmKey(), event.getState());
            results.addAll(router.skip(event, DeliveryStatus.SKIPPED_UNCHANGED,
                    "state unchanged: " + event.getState()));
        }

        for (CompositeOutcome outcome : decision.getOutcomes()) {
            switch (outcome.getAction()) {
                case EMIT:
                    results.addAll(deliver(outcome.getComposite()));
                    break;
                case SUPPRESS:
                case CANCEL:
                    results.addAll(router.skip(outcome.getComposite(),
                            DeliveryStatus.SKIPPED_SUPPRESSED, outcome.getReason()));
                    break;
                case HOLD:
                    log.info("Composite {} from rule {} {}", outcome.getComposite().getId(),
                            outcome.getRuleName(), outcome.getReason());
                    break;
            }
        }
        return true;
    }

    /**
     * Routes composites released by the suppression window sweep.
     */
    @Async
    @EventListener
    public void onCompositeReleased(CompositeAlarmReleasedEvent released) {
        AlertEvent composite = released.getComposite();
        MDC.put("eventId", composite.getId());
        try {
            List<DeliveryResult> results = deliver(composite);
            log.info("Released composite {} from rule {} routed to {} subscription(s)",
                    composite.getId(), released.getRuleName(), results.size());
        } catch (RuntimeException e) {
            log.error("Failed to route released composite {} from rule {}",
                    composite.getId(), released.getRuleName(), e);
        } finally {
            MDC.remove("eventId");
        }
    }

    /**
     * Enrich, redact and route an already classified event.
     */
    public List<DeliveryResult> deliver(AlertEvent event) {
        EnrichedEvent enriched = redactionService.redact(enrichmentService.enrich(event));
        return router.route(enriched);
    }

    private boolean passesStateGate(AlertEvent event) {
        if (event.isStateChange()) {
            return true;
        }
        return event.getSeverity() == Severity.INFO && event.isHeartbeat();
    }

    private SuppressionDecision suppress(AlertEvent event) {
        try {
            return suppressionEngine.evaluate(event);
        } catch (RuntimeException e) {
            log.error("Suppression evaluation failed for event {}, continuing unsuppressed", event.getId(), e);
            meterRegistry.counter("alerts.suppression.errors", "reason", "engine").increment();
            return SuppressionDecision.NONE;
        }
    }

    private PipelineResult result(AlertEvent event, List<DeliveryResult> results) {
        return PipelineResult.builder()
                .eventId(event.getId())
                .severity(event.getSeverity())
                .state(event.getState())
                .results(List.copyOf(results))
                .build();
    }
}
