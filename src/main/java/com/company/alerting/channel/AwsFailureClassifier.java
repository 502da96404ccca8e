package com.company.alerting.channel;

import com.company.alerting.exception.DeliveryException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.Set;

/**
 * Maps AWS SDK failures onto transient and permanent delivery failures.
 *
 * <p>Throttling, 429, 5xx and client-side errors (network, timeouts) are transient.
 * Provider-specific codes and any other 4xx are permanent.
 */
final class AwsFailureClassifier {

    private AwsFailureClassifier() {
    }

    static DeliveryException classify(String provider, String endpoint, SdkException e, Set<String> permanentCodes) {
        if (e instanceof SdkClientException) {
            return DeliveryException.transientFailure(
                    provider + " client error for " + endpoint + ": " + e.getMessage(), e);
        }

        if (e instanceof AwsServiceException ase) {
            int status = ase.statusCode();
            String code = ase.awsErrorDetails() != null ? ase.awsErrorDetails().errorCode() : null;
            String message = provider + " rejected delivery to " + endpoint
                    + " (status " + status + ", code " + code + ")";

            if (ase.isThrottlingException() || status == 429 || status >= 500) {
                return DeliveryException.transientFailure(message, e);
            }
            if (code != null && permanentCodes.contains(code)) {
                return DeliveryException.permanentFailure(message, e);
            }
            if (status >= 400) {
                return DeliveryException.permanentFailure(message, e);
            }
            return DeliveryException.transientFailure(message, e);
        }

        return DeliveryException.transientFailure(provider + " failure for " + endpoint + ": " + e.getMessage(), e);
    }
}
