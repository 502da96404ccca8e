package com.company.alerting.exception;

public class InvalidThresholdOrderException extends ConfigurationException {
    public InvalidThresholdOrderException(double warningPct, double criticalPct) {
        super("Budget warning percentage " + warningPct
                + " must be lower than critical percentage " + criticalPct);
    }
}
