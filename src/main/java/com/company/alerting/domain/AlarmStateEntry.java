package com.company.alerting.domain;

import com.company.alerting.domain.enums.AlarmState;
import lombok.Value;

import java.time.Instant;

@Value
public class AlarmStateEntry {
    AlarmState state;
    Instant updatedAt;
}
