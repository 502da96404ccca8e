package com.company.alerting.channel;

import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.exception.DeliveryException;

/**
 * One delivery channel backed by a single external provider.
 *
 * <p>Implementations are shared across delivery threads and must be thread-safe. A call makes
 * exactly one provider attempt; retries, time limits and dead-lettering happen above this layer.
 */
public interface DeliveryAdapter {

    ChannelType channelType();

    /**
     * One-time setup for an endpoint, run before the first attempt and outside the attempt
     * deadline. A failure here dead-letters the delivery without retries.
     */
    default void prepare(String endpoint) throws DeliveryException {
    }

    /**
     * @throws DeliveryException classified as transient or permanent
     */
    void send(String endpoint, EnrichedEvent event) throws DeliveryException;
}
