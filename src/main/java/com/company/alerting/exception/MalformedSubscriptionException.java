package com.company.alerting.exception;

public class MalformedSubscriptionException extends ConfigurationException {
    public MalformedSubscriptionException(int index, String reason) {
        super("Subscription #" + index + " is malformed: " + reason);
    }
}
