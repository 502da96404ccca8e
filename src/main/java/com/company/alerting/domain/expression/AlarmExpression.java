package com.company.alerting.domain.expression;

import com.company.alerting.domain.enums.AlarmState;

import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Boolean expression over alarm states, parsed once from configuration.
 */
public interface AlarmExpression {

    boolean evaluate(Function<String, AlarmState> stateLookup);

    void collectAlarmRefs(Set<String> refs);

    default Set<String> alarmRefs() {
        Set<String> refs = new TreeSet<>();
        collectAlarmRefs(refs);
        return refs;
    }
}
