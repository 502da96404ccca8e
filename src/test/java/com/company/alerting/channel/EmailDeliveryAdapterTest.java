package com.company.alerting.channel;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.exception.DeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.MessageRejectedException;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.TooManyRequestsException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailDeliveryAdapterTest {

    @Mock
    private SesV2Client sesClient;

    private EmailDeliveryAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new EmailDeliveryAdapter(sesClient, EngineConfig.builder()
                .environment("prod")
                .emailFromAddress("alerts@company.com")
                .build());
    }

    @Test
    void sendsSubjectAndBodyFromEvent() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
                .thenReturn(SendEmailResponse.builder().messageId("m-1").build());

        adapter.send("oncall@company.com", enriched());

        ArgumentCaptor<SendEmailRequest> request = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(sesClient).sendEmail(request.capture());
        assertThat(request.getValue().fromEmailAddress()).isEqualTo("alerts@company.com");
        assertThat(request.getValue().destination().toAddresses()).containsExactly("oncall@company.com");
        assertThat(request.getValue().content().simple().subject().data())
                .isEqualTo("[CRITICAL][prod] web-status-check is Alarm");
        assertThat(request.getValue().content().simple().body().text().data())
                .contains("Runbook: https://runbooks.company.com/critical/metric-alarm")
                .contains("State: Alarm (was OK)");
    }

    @Test
    void rejectedMessageIsPermanent() {
        when(sesClient.sendEmail(any(SendEmailRequest.class))).thenThrow(MessageRejectedException.builder()
                .statusCode(400)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("MessageRejected").build())
                .message("Email address is not verified")
                .build());

        assertThatThrownBy(() -> adapter.send("oncall@company.com", enriched()))
                .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void throttlingAndNetworkErrorsAreTransient() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
                .thenThrow(TooManyRequestsException.builder()
                        .statusCode(429)
                        .awsErrorDetails(AwsErrorDetails.builder().errorCode("TooManyRequestsException").build())
                        .build())
                .thenThrow(SdkClientException.create("connection reset"));

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> adapter.send("oncall@company.com", enriched()))
                    .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.isRetryable()).isTrue());
        }
    }

    @Test
    void smsTextFitsOneSegment() {
        EnrichedEvent event = enriched().toBuilder()
                .runbookUrl("https://runbooks.company.com/" + "x".repeat(300))
                .build();

        assertThat(AlertMessageFormatter.sms(event)).hasSize(AlertMessageFormatter.SMS_MAX_LENGTH).endsWith("...");
    }

    private static EnrichedEvent enriched() {
        return EnrichedEvent.builder()
                .event(AlertEvent.builder()
                        .id("evt-1")
                        .alarmName("web-status-check")
                        .source(AlertSource.METRIC_ALARM)
                        .severity(Severity.CRITICAL)
                        .metricName("StatusCheckFailed")
                        .state(AlarmState.ALARM)
                        .previousState(AlarmState.OK)
                        .build())
                .runbookUrl("https://runbooks.company.com/critical/metric-alarm")
                .environment("prod")
                .auditFlags(List.of())
                .build();
    }
}
