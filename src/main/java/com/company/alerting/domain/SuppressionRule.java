package com.company.alerting.domain;

import com.company.alerting.domain.enums.Severity;
import com.company.alerting.domain.expression.AlarmExpression;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Composite alarm definition. Built from configuration at startup and never mutated.
 */
@Value
@Builder
public class SuppressionRule {
    // Identifier of the composite alarm itself
    String name;

    AlarmExpression triggerExpression;
    String expressionText;

    String suppressorAlarmId;
    Duration waitPeriod;
    Duration extensionPeriod;

    Severity severity;

    public boolean hasSuppressor() {
        return suppressorAlarmId != null && !suppressorAlarmId.isBlank();
    }

    public Set<String> referencedAlarms() {
        return triggerExpression.alarmRefs();
    }
}
