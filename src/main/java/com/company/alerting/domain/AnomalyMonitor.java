package com.company.alerting.domain;

import com.company.alerting.domain.enums.AnomalyDimension;
import com.company.alerting.domain.enums.MonitorFrequency;
import lombok.Builder;
import lombok.Value;

/**
 * Dual-threshold anomaly configuration: both absolute and percentage impact must be met.
 */
@Value
@Builder
public class AnomalyMonitor {
    String name;
    AnomalyDimension dimension;
    double thresholdAbsolute;
    double thresholdPercentage;
    MonitorFrequency frequency;
}
