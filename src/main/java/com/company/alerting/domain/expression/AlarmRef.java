package com.company.alerting.domain.expression;

import com.company.alerting.domain.enums.AlarmState;
import lombok.Value;

import java.util.Set;
import java.util.function.Function;

/**
 * ALARM(id), OK(id) or INSUFFICIENT_DATA(id). An alarm never seen counts as INSUFFICIENT_DATA.
 */
@Value
public class AlarmRef implements AlarmExpression {
    String alarmId;
    AlarmState expectedState;

    @Override
    public boolean evaluate(Function<String, AlarmState> stateLookup) {
        AlarmState current = stateLookup.apply(alarmId);
        if (current == null) {
            current = AlarmState.INSUFFICIENT_DATA;
        }
        return current == expectedState;
    }

    @Override
    public void collectAlarmRefs(Set<String> refs) {
        refs.add(alarmId);
    }

    @Override
    public String toString() {
        return expectedState.name() + "(\"" + alarmId + "\")";
    }
}
