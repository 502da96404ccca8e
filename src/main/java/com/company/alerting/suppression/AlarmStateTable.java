package com.company.alerting.suppression;

import com.company.alerting.domain.AlarmStateEntry;
import com.company.alerting.domain.enums.AlarmState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest known state per alarm id. Only the suppression engine writes to it.
 */
@Component
public class AlarmStateTable {

    private final ConcurrentHashMap<String, AlarmStateEntry> states = new ConcurrentHashMap<>();

    public AlarmState stateOf(String alarmId) {
        AlarmStateEntry entry = states.get(alarmId);
        return entry != null ? entry.getState() : null;
    }

    public AlarmStateEntry entry(String alarmId) {
        return states.get(alarmId);
    }

    public int size() {
        return states.size();
    }

    /**
     * @return the previous state, or null on first observation
     */
    AlarmState update(String alarmId, AlarmState state, Instant at) {
        AlarmStateEntry previous = states.put(alarmId, new AlarmStateEntry(state, at));
        return previous != null ? previous.getState() : null;
    }
}
