package com.company.alerting.domain.enums;

import java.time.Duration;

public enum MonitorFrequency {
    DAILY(1),
    WEEKLY(7);

    private final int periodDays;

    MonitorFrequency(int periodDays) {
        this.periodDays = periodDays;
    }

    public Duration getPeriod() {
        return Duration.ofDays(periodDays);
    }

    public static MonitorFrequency fromString(String frequency) {
        if (frequency == null) {
            return DAILY;
        }
        try {
            return MonitorFrequency.valueOf(frequency.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return DAILY;
        }
    }
}
