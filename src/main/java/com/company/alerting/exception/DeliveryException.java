package com.company.alerting.exception;

import com.company.alerting.domain.enums.FailureClassification;
import lombok.Getter;

/**
 * Adapter failure. The classification decides whether the router retries.
 */
@Getter
public class DeliveryException extends RuntimeException {

    private final FailureClassification classification;

    public DeliveryException(String message, FailureClassification classification) {
        super(message);
        this.classification = classification;
    }

    public DeliveryException(String message, FailureClassification classification, Throwable cause) {
        super(message, cause);
        this.classification = classification;
    }

    public static DeliveryException transientFailure(String message, Throwable cause) {
        return new DeliveryException(message, FailureClassification.TRANSIENT, cause);
    }

    public static DeliveryException permanentFailure(String message, Throwable cause) {
        return new DeliveryException(message, FailureClassification.PERMANENT, cause);
    }

    public boolean isRetryable() {
        return classification == FailureClassification.TRANSIENT;
    }
}
