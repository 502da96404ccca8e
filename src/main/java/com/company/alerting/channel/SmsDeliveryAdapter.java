package com.company.alerting.channel;

import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.ChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

import java.util.Map;
import java.util.Set;

/**
 * SNS direct-to-phone SMS, sent as transactional messages.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SmsDeliveryAdapter implements DeliveryAdapter {

    static final Set<String> PERMANENT_CODES = Set.of(
            "OptedOut",
            "InvalidParameter",
            "InvalidParameterValue",
            "AuthorizationError",
            "EndpointDisabled",
            "NotFound"
    );

    private final SnsClient snsClient;

    @Override
    public ChannelType channelType() {
        return ChannelType.SMS;
    }

    @Override
    public void send(String endpoint, EnrichedEvent event) {
        PublishRequest request = PublishRequest.builder()
                .phoneNumber(endpoint)
                .message(AlertMessageFormatter.sms(event))
                .messageAttributes(Map.of("AWS.SNS.SMS.SMSType", MessageAttributeValue.builder()
                        .dataType("String")
                        .stringValue("Transactional")
                        .build()))
                .build();

        try {
            PublishResponse response = snsClient.publish(request);
            log.debug("SMS for event {} published as {}", event.getEventId(), response.messageId());
        } catch (SdkException e) {
            throw AwsFailureClassifier.classify("SNS", endpoint, e, PERMANENT_CODES);
        }
    }
}
