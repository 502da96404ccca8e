package com.company.alerting.domain.enums;

/**
 * Decides whether a failed delivery attempt is retried.
 */
public enum FailureClassification {
    TRANSIENT,
    PERMANENT
}
