package com.company.alerting.event;

import com.company.alerting.domain.AlertEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A held composite notification whose wait period elapsed with the suppressor still in ALARM.
 */
@Getter
@AllArgsConstructor
public class CompositeAlarmReleasedEvent {
    private final String ruleName;
    private final AlertEvent composite;
}
