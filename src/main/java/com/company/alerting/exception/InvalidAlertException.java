package com.company.alerting.exception;

public class InvalidAlertException extends RuntimeException {
    public InvalidAlertException(String field, String value) {
        super("Invalid value for " + field + ": " + value);
    }
}
