package com.company.alerting.service;

import com.company.alerting.config.EngineConfiguration;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.DeadLetterRecord;
import com.company.alerting.domain.DeliveryAttempt;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.FailureClassification;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.exception.DeadLetterNotFoundException;
import com.company.alerting.repository.DeadLetterRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeadLetterServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static final Subscription SMS = Subscription.builder()
            .severity(Severity.CRITICAL)
            .channelType(ChannelType.SMS)
            .endpoint("+15555550100")
            .build();

    @Mock
    private DeadLetterRepository repository;

    private SimpleMeterRegistry meterRegistry;
    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new DeadLetterService(repository, new EngineConfiguration().objectMapper(),
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void storesPayloadAndHistory() {
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        service.deadLetter(enriched(), SMS, "retries exhausted: throttled", 3, List.of(attempt(1), attempt(2), attempt(3)));

        ArgumentCaptor<DeadLetterRecord> record = ArgumentCaptor.forClass(DeadLetterRecord.class);
        verify(repository).save(record.capture());
        assertThat(record.getValue().getEventId()).isEqualTo("evt-1");
        assertThat(record.getValue().getChannelType()).isEqualTo("SMS");
        assertThat(record.getValue().getAttempts()).isEqualTo(3);
        assertThat(record.getValue().getCreatedAt()).isEqualTo(NOW);
        assertThat(record.getValue().getHistory()).contains("\"classification\":\"TRANSIENT\"");

        assertThat(service.payloadOf(record.getValue())).isEqualTo(enriched());
    }

    @Test
    void storeFailureIsLoggedNotThrown() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        service.deadLetter(enriched(), SMS, "permanent failure: opted out", 1, List.of(attempt(1)));

        assertThat(meterRegistry.counter("alerts.deadletter.write_failures").count()).isEqualTo(1.0);
    }

    @Test
    void missingDeadLetterIsNotFound() {
        when(repository.findById(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get(42L)).isInstanceOf(DeadLetterNotFoundException.class);
    }

    private static DeliveryAttempt attempt(int n) {
        return DeliveryAttempt.builder()
                .attempt(n)
                .startedAt(NOW)
                .durationMs(12)
                .success(false)
                .classification(FailureClassification.TRANSIENT)
                .error("throttled")
                .build();
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
                        .timestamp(NOW)
                        .dimensions(Map.of("InstanceId", "i-123"))
                        .build())
                .runbookUrl("https://runbooks.company.com/critical/metric-alarm")
                .resourceTags(Map.of("team", "payments"))
                .environment("prod")
                .auditFlags(List.of())
                .enrichedAt(NOW)
                .build();
    }
}
