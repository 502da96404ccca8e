package com.company.alerting.channel;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.ChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;

import java.util.Set;

/**
 * SES v2 email. Unverified identities and suspended sending are permanent.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmailDeliveryAdapter implements DeliveryAdapter {

    static final Set<String> PERMANENT_CODES = Set.of(
            "MessageRejected",
            "MessageRejectedException",
            "MailFromDomainNotVerified",
            "MailFromDomainNotVerifiedException",
            "AccountSuspendedException",
            "SendingPausedException",
            "NotFoundException",
            "BadRequestException"
    );

    private static final String CHARSET = "UTF-8";

    private final SesV2Client sesClient;
    private final EngineConfig config;

    @Override
    public ChannelType channelType() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(String endpoint, EnrichedEvent event) {
        SendEmailRequest request = SendEmailRequest.builder()
                .fromEmailAddress(config.getEmailFromAddress())
                .destination(Destination.builder().toAddresses(endpoint).build())
                .content(EmailContent.builder()
                        .simple(Message.builder()
                                .subject(Content.builder().charset(CHARSET)
                                        .data(AlertMessageFormatter.subject(event)).build())
                                .body(Body.builder()
                                        .text(Content.builder().charset(CHARSET)
                                                .data(AlertMessageFormatter.body(event)).build())
                                        .build())
                                .build())
                        .build())
                .build();

        try {
            SendEmailResponse response = sesClient.sendEmail(request);
            log.debug("Email for event {} accepted by SES as {}", event.getEventId(), response.messageId());
        } catch (SdkException e) {
            throw AwsFailureClassifier.classify("SES", endpoint, e, PERMANENT_CODES);
        }
    }
}
