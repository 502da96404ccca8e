package com.company.alerting.channel;

import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.EnrichedEvent;

import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable renderings for email and SMS.
 */
final class AlertMessageFormatter {

    // Single SMS segment limit for GSM-7
    static final int SMS_MAX_LENGTH = 160;

    private AlertMessageFormatter() {
    }

    static String subject(EnrichedEvent enriched) {
        AlertEvent event = enriched.getEvent();
        return String.format("[%s][%s] %s is %s",
                event.getSeverity(), enriched.getEnvironment(), event.alarmKey(), stateName(event));
    }

    static String body(EnrichedEvent enriched) {
        AlertEvent event = enriched.getEvent();
        StringBuilder sb = new StringBuilder();
        sb.append("Alarm: ").append(event.alarmKey()).append('\n');
        sb.append("Severity: ").append(event.getSeverity()).append('\n');
        sb.append("Source: ").append(event.getSource().getWireName()).append('\n');
        sb.append("State: ").append(stateName(event));
        if (event.getPreviousState() != null) {
            sb.append(" (was ").append(event.getPreviousState().getWireName()).append(')');
        }
        sb.append('\n');
        if (event.getMetricName() != null) {
            sb.append("Metric: ").append(event.getMetricName());
            if (event.getNamespace() != null) {
                sb.append(" [").append(event.getNamespace()).append(']');
            }
            sb.append('\n');
        }
        if (event.getValue() != null) {
            sb.append("Value: ").append(event.getValue());
            if (event.getThreshold() != null) {
                sb.append(" (threshold ").append(event.getThreshold()).append(')');
            }
            sb.append('\n');
        }
        if (event.getDimensions() != null && !event.getDimensions().isEmpty()) {
            sb.append("Dimensions: ").append(new TreeMap<>(event.getDimensions())).append('\n');
        }
        if (event.getDescription() != null) {
            sb.append('\n').append(event.getDescription()).append('\n');
        }
        sb.append('\n');
        sb.append("Time: ").append(event.getTimestamp()).append('\n');
        sb.append("Environment: ").append(enriched.getEnvironment()).append('\n');
        sb.append("Runbook: ").append(enriched.getRunbookUrl()).append('\n');
        appendTags(sb, enriched.getResourceTags());
        sb.append("Event: ").append(event.getId()).append('\n');
        return sb.toString();
    }

    static String sms(EnrichedEvent enriched) {
        AlertEvent event = enriched.getEvent();
        String text = String.format("%s %s: %s is %s%s %s",
                event.getSeverity(), enriched.getEnvironment(), event.alarmKey(), stateName(event),
                event.getValue() != null ? " (" + event.getValue() + ")" : "",
                enriched.getRunbookUrl());
        return text.length() <= SMS_MAX_LENGTH ? text : text.substring(0, SMS_MAX_LENGTH - 3) + "...";
    }

    private static void appendTags(StringBuilder sb, Map<String, String> tags) {
        if (tags != null && !tags.isEmpty()) {
            sb.append("Tags: ").append(new TreeMap<>(tags)).append('\n');
        }
    }

    private static String stateName(AlertEvent event) {
        return event.getState() != null ? event.getState().getWireName() : "unknown";
    }
}
