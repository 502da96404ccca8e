package com.company.alerting.exception;

public class MalformedExpressionException extends ConfigurationException {
    public MalformedExpressionException(String expression, int position, String reason) {
        super("Invalid alarm expression at position " + position + " (" + reason + "): " + expression);
    }
}
