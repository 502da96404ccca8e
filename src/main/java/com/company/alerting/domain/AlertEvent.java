package com.company.alerting.domain;

import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.ComparisonOperator;
import com.company.alerting.domain.enums.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Normalized alert signal pushed by whatever observes metrics, logs or cost data.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    // Generated at ingestion
    private String id;

    // Key into the alarm state table; falls back to metricName
    private String alarmName;

    private AlertSource source;
    private Severity severity;

    private AlarmState state;
    private AlarmState previousState;

    private String metricName;
    private String namespace;
    private Map<String, String> dimensions;

    private Double value;
    private Double threshold;
    private ComparisonOperator comparisonOperator;

    private Instant timestamp;
    private Map<String, String> resourceTags;

    // Free text, subject to redaction
    private String description;
    private String rawPayload;

    private boolean heartbeat;

    // State must be derived by the evaluator
    private boolean rawSample;

    // Anomaly inputs, supplied by the metrics collaborator
    private Double expectedValue;
    private Instant baselineAsOf;
    private String anomalyMonitor;

    @JsonIgnore
    public String alarmKey() {
        return alarmName != null && !alarmName.isBlank() ? alarmName : metricName;
    }

    @JsonIgnore
    public boolean isStateChange() {
        return state != previousState;
    }
}
