package com.company.alerting.channel;

import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.EnrichedEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Wire body for webhook, queue, function and aggregate deliveries.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertMessage {

    String eventId;
    String alarmName;
    String severity;
    String source;
    String metricName;
    String state;
    String previousState;
    Double value;
    Double threshold;

    // RFC3339, UTC
    String timestamp;

    @JsonProperty("runbookURL")
    String runbookUrl;

    Map<String, String> dimensions;
    List<String> auditFlags;
    String environment;
    String description;

    public static AlertMessage from(EnrichedEvent enriched) {
        AlertEvent event = enriched.getEvent();
        return AlertMessage.builder()
                .eventId(event.getId())
                .alarmName(event.alarmKey())
                .severity(event.getSeverity() != null ? event.getSeverity().name() : null)
                .source(event.getSource() != null ? event.getSource().getWireName() : null)
                .metricName(event.getMetricName())
                .state(event.getState() != null ? event.getState().getWireName() : null)
                .previousState(event.getPreviousState() != null ? event.getPreviousState().getWireName() : null)
                .value(event.getValue())
                .threshold(event.getThreshold())
                .timestamp(event.getTimestamp() != null ? event.getTimestamp().toString() : null)
                .runbookUrl(enriched.getRunbookUrl())
                .dimensions(event.getDimensions() != null ? event.getDimensions() : Map.of())
                .auditFlags(enriched.getAuditFlags() != null ? enriched.getAuditFlags() : List.of())
                .environment(enriched.getEnvironment())
                .description(event.getDescription())
                .build();
    }
}
