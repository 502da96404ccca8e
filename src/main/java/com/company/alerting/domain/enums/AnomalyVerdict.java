package com.company.alerting.domain.enums;

public enum AnomalyVerdict {
    ANOMALY,
    NORMAL,
    /** Baseline missing or older than the freshness window. */
    UNKNOWN
}
