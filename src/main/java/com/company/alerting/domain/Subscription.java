package com.company.alerting.domain;

import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * One configured delivery target. Immutable once loaded.
 */
@Value
@Builder
public class Subscription {
    Severity severity;
    ChannelType channelType;
    String endpoint;

    // Webhook only
    boolean autoConfirm;

    public String describe() {
        return channelType + ":" + endpoint;
    }
}
