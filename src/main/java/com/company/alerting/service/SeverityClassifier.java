package com.company.alerting.service;

import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.ComparisonOperator;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.exception.UnknownSourceException;
import org.springframework.stereotype.Service;

/**
 * Maps an event to its severity tier. Pure: the result depends only on the event.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>security findings: SECURITY</li>
 *   <li>cost anomalies: COST</li>
 *   <li>status-check or host-health failures in ALARM: CRITICAL</li>
 *   <li>any other ALARM: WARNING</li>
 *   <li>OK, INSUFFICIENT_DATA and heartbeats: INFO</li>
 * </ol>
 */
@Service
public class SeverityClassifier {

    public Severity classify(AlertEvent event) {
        if (event.getSource() == null) {
            throw new UnknownSourceException(event.getId());
        }

        switch (event.getSource()) {
            case SECURITY_FINDING:
                return Severity.SECURITY;
            case COST_ANOMALY:
                return Severity.COST;
            default:
                break;
        }

        if (event.getState() == AlarmState.ALARM) {
            return isHostHealthFailure(event) ? Severity.CRITICAL : Severity.WARNING;
        }

        return Severity.INFO;
    }

    private boolean isHostHealthFailure(AlertEvent event) {
        String metric = event.getMetricName();
        if (metric == null) {
            return false;
        }
        ComparisonOperator op = event.getComparisonOperator();

        // StatusCheckFailed, StatusCheckFailed_Instance, StatusCheckFailed_System...
        if (metric.startsWith("StatusCheckFailed")) {
            return op == null || op.isUpward();
        }
        if (metric.equalsIgnoreCase("UnHealthyHostCount")) {
            return op == null || op.isUpward();
        }
        if (metric.equalsIgnoreCase("HealthyHostCount")) {
            return op == null || op.isDownward();
        }
        return metric.equalsIgnoreCase("SSMPingStatus");
    }
}
