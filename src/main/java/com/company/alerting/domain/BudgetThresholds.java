package com.company.alerting.domain;

import com.company.alerting.exception.ConfigurationException;
import com.company.alerting.exception.InvalidThresholdOrderException;
import lombok.Value;

/**
 * Absolute budget thresholds derived from a budget amount and two percentages.
 */
@Value
public class BudgetThresholds {
    double amount;
    double warningPct;
    double criticalPct;
    double warningThreshold;
    double criticalThreshold;
    String metricName;

    public static BudgetThresholds of(double amount, double warningPct, double criticalPct, String metricName) {
        if (amount <= 0) {
            throw new ConfigurationException("Budget amount must be positive: " + amount);
        }
        if (warningPct >= criticalPct) {
            throw new InvalidThresholdOrderException(warningPct, criticalPct);
        }
        return new BudgetThresholds(
                amount,
                warningPct,
                criticalPct,
                amount * warningPct / 100,
                amount * criticalPct / 100,
                metricName
        );
    }
}
