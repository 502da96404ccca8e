package com.company.alerting.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Normalized alert pushed by a producer. Severity is never accepted from the producer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertEventRequest {

    // Unknown or missing sources are accepted and dropped as unclassified
    private String source;

    private String alarmName;

    @NotBlank(message = "Metric name is required")
    @Size(max = 255)
    private String metricName;

    private String namespace;
    private Map<String, String> dimensions;

    // Alarm, OK or InsufficientData; computed by the engine for raw samples
    private String state;
    private String previousState;

    private Double value;
    private Double threshold;
    private String comparisonOperator;

    private Instant timestamp;
    private Map<String, String> resourceTags;

    @Size(max = 4096)
    private String description;

    @Size(max = 65536)
    private String rawPayload;

    private boolean heartbeat;
    private boolean rawSample;

    private Double expectedValue;
    private Instant baselineAsOf;
    private String anomalyMonitor;

    @JsonIgnore
    @AssertTrue(message = "State is required unless the event is a raw sample")
    public boolean isStateProvided() {
        return rawSample || (state != null && !state.isBlank());
    }
}
