package com.company.alerting.channel;

import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.exception.DeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.util.Map;
import java.util.Set;

/**
 * SQS queue delivery. At-least-once: consumers dedupe on {@code eventId}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QueueDeliveryAdapter implements DeliveryAdapter {

    static final Set<String> PERMANENT_CODES = Set.of(
            "QueueDoesNotExist",
            "AWS.SimpleQueueService.NonExistentQueue",
            "InvalidMessageContents",
            "InvalidAddress",
            "AccessDenied",
            "AccessDeniedException"
    );

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;

    @Override
    public ChannelType channelType() {
        return ChannelType.QUEUE;
    }

    @Override
    public void send(String endpoint, EnrichedEvent event) {
        SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(endpoint)
                .messageBody(toJson(event))
                .messageAttributes(Map.of("severity", MessageAttributeValue.builder()
                        .dataType("String")
                        .stringValue(event.getSeverity().name())
                        .build()))
                .build();

        try {
            SendMessageResponse response = sqsClient.sendMessage(request);
            log.debug("Event {} queued to {} as {}", event.getEventId(), endpoint, response.messageId());
        } catch (SdkException e) {
            throw AwsFailureClassifier.classify("SQS", endpoint, e, PERMANENT_CODES);
        }
    }

    private String toJson(EnrichedEvent event) {
        try {
            return objectMapper.writeValueAsString(AlertMessage.from(event));
        } catch (JsonProcessingException e) {
            throw DeliveryException.permanentFailure("Cannot serialize event " + event.getEventId(), e);
        }
    }
}
