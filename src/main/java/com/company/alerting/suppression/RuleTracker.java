package com.company.alerting.suppression;

import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.SuppressionRule;
import com.company.alerting.domain.enums.SuppressionPhase;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable window state of one rule. Every field except {@code phase} is guarded by {@code lock}.
 */
class RuleTracker {

    final SuppressionRule rule;
    final ReentrantLock lock = new ReentrantLock();

    // Read without the lock by the held-notification gauge
    volatile SuppressionPhase phase = SuppressionPhase.IDLE;

    // Last evaluated value of the trigger expression
    boolean active;

    AlertEvent held;
    Instant deadline;
    Instant suppressUntil;

    RuleTracker(SuppressionRule rule) {
        this.rule = rule;
    }

    void reset() {
        phase = SuppressionPhase.IDLE;
        held = null;
        deadline = null;
        suppressUntil = null;
    }
}
