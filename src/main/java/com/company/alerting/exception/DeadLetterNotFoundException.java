package com.company.alerting.exception;

public class DeadLetterNotFoundException extends RuntimeException {
    public DeadLetterNotFoundException(Long deadLetterId) {
        super("Dead letter not found: " + deadLetterId);
    }
}
