package com.company.alerting.service;

import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineResult {
    String eventId;
    // Null when the event was dropped before classification
    Severity severity;
    AlarmState state;
    List<DeliveryResult> results;
}
