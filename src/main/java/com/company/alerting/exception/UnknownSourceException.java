package com.company.alerting.exception;

/**
 * The event source is missing or not one of the supported sources.
 */
public class UnknownSourceException extends RuntimeException {
    public UnknownSourceException(String eventId) {
        super("Cannot classify event " + eventId + ": unknown source");
    }
}
