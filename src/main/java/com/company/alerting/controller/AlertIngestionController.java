package com.company.alerting.controller;

import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.ComparisonOperator;
import com.company.alerting.dto.request.AlertEventRequest;
import com.company.alerting.dto.response.DeliveryResultResponse;
import com.company.alerting.dto.response.IngestionResponse;
import com.company.alerting.exception.InvalidAlertException;
import com.company.alerting.security.CallerContext;
import com.company.alerting.service.AlertPipeline;
import com.company.alerting.service.PipelineResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alert Ingestion", description = "Push normalized alert events into the engine")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class AlertIngestionController {

    private final AlertPipeline pipeline;
    private final CallerContext callerContext;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Ingest an alert event",
            description = "Classifies, suppresses, enriches and routes the event; returns one result per channel")
    @PreAuthorize("hasAnyRole('ALERT_PRODUCER', 'OPERATOR')")
    public ResponseEntity<IngestionResponse> ingest(@Valid @RequestBody AlertEventRequest request) {
        AlertEvent event = toEvent(request);

        log.info("Alert {} from {}: {} {} {}", event.getId(), callerContext.getCurrentCallerId(),
                request.getSource(), event.alarmKey(), request.getState());
        meterRegistry.counter("api.alerts.requests",
                "source", event.getSource() != null ? event.getSource().name() : "unknown"
        ).increment();

        PipelineResult result = pipeline.process(event);

        return ResponseEntity.ok(IngestionResponse.builder()
                .eventId(result.getEventId())
                .severity(result.getSeverity() != null ? result.getSeverity().name() : null)
                .state(result.getState() != null ? result.getState().name() : null)
                .results(result.getResults().stream()
                        .map(DeliveryResultResponse::from)
                        .collect(Collectors.toList()))
                .build());
    }

    private AlertEvent toEvent(AlertEventRequest request) {
        return AlertEvent.builder()
                .id(UUID.randomUUID().toString())
                .alarmName(request.getAlarmName())
                .source(AlertSource.fromString(request.getSource()))
                .state(parseState("state", request.getState()))
                .previousState(parseState("previousState", request.getPreviousState()))
                .metricName(request.getMetricName())
                .namespace(request.getNamespace())
                .dimensions(request.getDimensions())
                .value(request.getValue())
                .threshold(request.getThreshold())
                .comparisonOperator(parseOperator(request.getComparisonOperator()))
                .timestamp(request.getTimestamp())
                .resourceTags(request.getResourceTags())
                .description(request.getDescription())
                .rawPayload(request.getRawPayload())
                .heartbeat(request.isHeartbeat())
                .rawSample(request.isRawSample())
                .expectedValue(request.getExpectedValue())
                .baselineAsOf(request.getBaselineAsOf())
                .anomalyMonitor(request.getAnomalyMonitor())
                .build();
    }

    private AlarmState parseState(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        AlarmState state = AlarmState.fromString(value);
        if (state == null) {
            throw new InvalidAlertException(field, value);
        }
        return state;
    }

    private ComparisonOperator parseOperator(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        ComparisonOperator op = ComparisonOperator.fromString(value);
        if (op == null) {
            throw new InvalidAlertException("comparisonOperator", value);
        }
        return op;
    }
}
