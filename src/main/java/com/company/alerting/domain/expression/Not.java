package com.company.alerting.domain.expression;

import com.company.alerting.domain.enums.AlarmState;
import lombok.Value;

import java.util.Set;
import java.util.function.Function;

@Value
public class Not implements AlarmExpression {
    AlarmExpression operand;

    @Override
    public boolean evaluate(Function<String, AlarmState> stateLookup) {
        return !operand.evaluate(stateLookup);
    }

    @Override
    public void collectAlarmRefs(Set<String> refs) {
        operand.collectAlarmRefs(refs);
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
