package com.company.alerting.domain.enums;

public enum AlarmState {
    ALARM("Alarm", "Threshold breached"),
    OK("OK", "Within threshold"),
    INSUFFICIENT_DATA("InsufficientData", "Not enough data to determine state");

    private final String wireName;
    private final String description;

    AlarmState(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    public static AlarmState fromString(String state) {
        if (state == null || state.isBlank()) {
            return null;
        }
        String normalized = state.trim().replace("_", "").replace("-", "");
        for (AlarmState candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
