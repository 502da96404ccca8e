package com.company.alerting.domain.enums;

public enum AlertSource {
    METRIC_ALARM("MetricAlarm"),
    COMPOSITE_ALARM("CompositeAlarm"),
    COST_ANOMALY("CostAnomaly"),
    SECURITY_FINDING("SecurityFinding"),
    CUSTOM("Custom");

    private final String wireName;

    AlertSource(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public String slug() {
        return name().toLowerCase().replace('_', '-');
    }

    /**
     * Accepts either the wire name (MetricAlarm) or the constant name (METRIC_ALARM).
     * Unknown sources map to null and are never defaulted: the classifier rejects them.
     */
    public static AlertSource fromString(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        String trimmed = source.trim();
        for (AlertSource candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(trimmed) || candidate.name().equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        return null;
    }
}
