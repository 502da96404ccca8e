package com.company.alerting.domain.enums;

public enum Severity {
    CRITICAL("Critical - service impacting, immediate action required"),
    WARNING("Warning - threshold breached, requires attention"),
    INFO("Informational - recoveries and heartbeats"),
    SECURITY("Security finding"),
    COST("Cost or budget anomaly");

    private final String description;

    Severity(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Lower-case form used in runbook links and metric tags
     */
    public String slug() {
        return name().toLowerCase();
    }

    /**
     * Returns null for unknown values. Callers decide whether that is a configuration error.
     */
    public static Severity fromString(String severity) {
        if (severity == null) {
            return null;
        }
        try {
            return Severity.valueOf(severity.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
