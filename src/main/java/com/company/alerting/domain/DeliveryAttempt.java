package com.company.alerting.domain;

import com.company.alerting.domain.enums.FailureClassification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a delivery history, persisted with dead letters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAttempt {
    private int attempt;
    private Instant startedAt;
    private long durationMs;
    private boolean success;
    private FailureClassification classification;
    private String error;
}
