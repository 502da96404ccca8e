package com.company.alerting.exception;

/**
 * Invalid engine configuration. Raised while building the engine config so startup fails fast.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
