package com.company.alerting.domain.expression;

import com.company.alerting.domain.enums.AlarmState;
import lombok.Value;

import java.util.Set;
import java.util.function.Function;

@Value
public class Or implements AlarmExpression {
    AlarmExpression left;
    AlarmExpression right;

    @Override
    public boolean evaluate(Function<String, AlarmState> stateLookup) {
        return left.evaluate(stateLookup) || right.evaluate(stateLookup);
    }

    @Override
    public void collectAlarmRefs(Set<String> refs) {
        left.collectAlarmRefs(refs);
        right.collectAlarmRefs(refs);
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
