package com.company.alerting.exception;

public class UnknownAlarmReferenceException extends ConfigurationException {
    public UnknownAlarmReferenceException(String ruleName, String alarmId) {
        super("Suppression rule " + ruleName + " references unknown alarm: " + alarmId);
    }
}
