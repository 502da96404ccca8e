package com.company.alerting.suppression;

import com.company.alerting.domain.AlertEvent;
import lombok.Value;

/**
 * What happened to one composite notification during an evaluation or sweep.
 */
@Value
public class CompositeOutcome {

    public enum Action {
        // Route now
        EMIT,
        // Waiting for the suppressor to clear or the wait period to pass
        HOLD,
        // Coalesced into a held notification or dropped during the extension period
        SUPPRESS,
        // Held notification discarded because the suppressor cleared
        CANCEL
    }

    String ruleName;
    Action action;
    AlertEvent composite;
    String reason;

    public boolean isSkipped() {
        return action == Action.SUPPRESS || action == Action.CANCEL;
    }
}
