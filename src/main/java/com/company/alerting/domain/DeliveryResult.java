package com.company.alerting.domain;

import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.DeliveryStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one (event, subscription) pair. Skip results for events that never reached
 * a subscription carry no channel.
 */
@Value
@Builder(toBuilder = true)
public class DeliveryResult {
    String eventId;
    ChannelType channelType;
    String endpoint;
    DeliveryStatus status;
    int attempts;
    String lastError;

    public static DeliveryResult skipped(String eventId, Subscription subscription,
                                         DeliveryStatus status, String reason) {
        return DeliveryResult.builder()
                .eventId(eventId)
                .channelType(subscription != null ? subscription.getChannelType() : null)
                .endpoint(subscription != null ? subscription.getEndpoint() : null)
                .status(status)
                .attempts(0)
                .lastError(reason)
                .build();
    }
}
