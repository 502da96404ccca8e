package com.company.alerting.channel;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.exception.DeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;

import java.util.Set;

/**
 * Synchronous Lambda invocation. The function's own failures are treated as transient.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FunctionDeliveryAdapter implements DeliveryAdapter {

    static final Set<String> PERMANENT_CODES = Set.of(
            "ResourceNotFoundException",
            "InvalidParameterValueException",
            "InvalidRequestContentException",
            "RequestTooLargeException",
            "AccessDeniedException"
    );

    private final LambdaClient lambdaClient;
    private final ObjectMapper objectMapper;
    private final EngineConfig config;

    @Override
    public ChannelType channelType() {
        return ChannelType.FUNCTION;
    }

    @Override
    public void send(String endpoint, EnrichedEvent event) {
        InvokeRequest request = InvokeRequest.builder()
                .functionName(endpoint)
                .invocationType(InvocationType.REQUEST_RESPONSE)
                .payload(SdkBytes.fromUtf8String(toJson(event)))
                .overrideConfiguration(o -> o.apiCallTimeout(config.getAttemptTimeout()))
                .build();

        InvokeResponse response;
        try {
            response = lambdaClient.invoke(request);
        } catch (SdkException e) {
            throw AwsFailureClassifier.classify("Lambda", endpoint, e, PERMANENT_CODES);
        }

        Integer status = response.statusCode();
        if (status == null || status < 200 || status >= 300) {
            throw DeliveryException.transientFailure(
                    "Function " + endpoint + " returned status " + status, null);
        }
        if (response.functionError() != null) {
            throw DeliveryException.transientFailure(
                    "Function " + endpoint + " failed: " + response.functionError(), null);
        }
        log.debug("Function {} handled event {}", endpoint, event.getEventId());
    }

    private String toJson(EnrichedEvent event) {
        try {
            return objectMapper.writeValueAsString(AlertMessage.from(event));
        } catch (JsonProcessingException e) {
            throw DeliveryException.permanentFailure("Cannot serialize event " + event.getEventId(), e);
        }
    }
}
