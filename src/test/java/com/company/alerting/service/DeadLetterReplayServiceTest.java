package com.company.alerting.service;

import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.DeadLetterRecord;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.DeliveryStatus;
import com.company.alerting.domain.enums.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeadLetterReplayServiceTest {

    @Mock
    private DeadLetterService deadLetterService;

    @Mock
    private DeliveryService deliveryService;

    @Test
    void replaysToOriginalChannelAndRecordsOutcome() {
        DeadLetterRecord record = DeadLetterRecord.builder()
                .deadLetterId(7L)
                .eventId("evt-1")
                .severity("CRITICAL")
                .channelType("WEBHOOK")
                .endpoint("https://hooks.company.com/oncall")
                .build();
        EnrichedEvent event = EnrichedEvent.builder()
                .event(AlertEvent.builder()
                        .id("evt-1")
                        .source(AlertSource.METRIC_ALARM)
                        .severity(Severity.CRITICAL)
                        .build())
                .auditFlags(List.of())
                .build();

        when(deadLetterService.get(7L)).thenReturn(record);
        when(deadLetterService.payloadOf(record)).thenReturn(event);
        when(deliveryService.deliver(eq(event), any())).thenAnswer(inv -> {
            PendingDelivery pending = new PendingDelivery(event, inv.getArgument(1));
            pending.getResult().complete(DeliveryResult.builder()
                    .eventId("evt-1")
                    .channelType(ChannelType.WEBHOOK)
                    .endpoint("https://hooks.company.com/oncall")
                    .status(DeliveryStatus.DELIVERED)
                    .attempts(1)
                    .build());
            return pending;
        });

        DeadLetterReplayService replayService =
                new DeadLetterReplayService(deadLetterService, deliveryService, new SimpleMeterRegistry());
        DeliveryResult result = replayService.replay(7L);

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);

        ArgumentCaptor<Subscription> subscription = ArgumentCaptor.forClass(Subscription.class);
        verify(deliveryService).deliver(eq(event), subscription.capture());
        assertThat(subscription.getValue().getChannelType()).isEqualTo(ChannelType.WEBHOOK);
        assertThat(subscription.getValue().getEndpoint()).isEqualTo("https://hooks.company.com/oncall");
        verify(deadLetterService).recordReplay(7L, "DELIVERED");
    }
}
