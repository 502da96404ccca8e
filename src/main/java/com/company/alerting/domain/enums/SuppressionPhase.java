package com.company.alerting.domain.enums;

public enum SuppressionPhase {
    IDLE,
    /** Notification held while the suppressor is in alarm. */
    PENDING,
    /** Held notification was released; further notifications are dropped. */
    SUPPRESSING
}
