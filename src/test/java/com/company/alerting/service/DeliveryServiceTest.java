package com.company.alerting.service;

import com.company.alerting.channel.DeliveryAdapter;
import com.company.alerting.config.EngineConfig;
import com.company.alerting.config.EngineConfiguration;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.DeliveryAttempt;
import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.DeliveryStatus;
import com.company.alerting.domain.enums.FailureClassification;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.exception.DeliveryException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DeliveryServiceTest {

    private static final Subscription WEBHOOK = Subscription.builder()
            .severity(Severity.CRITICAL)
            .channelType(ChannelType.WEBHOOK)
            .endpoint("https://hooks.company.com/oncall")
            .build();

    @Mock
    private DeadLetterService deadLetterService;

    private final EngineConfiguration wiring = new EngineConfiguration();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private EngineConfig config;
    private ExecutorService deliveryExecutor;
    private ExecutorService attemptExecutor;

    @BeforeEach
    void setUp() {
        config = EngineConfig.builder()
                .environment("test")
                .maxAttempts(3)
                .backoffBase(Duration.ofMillis(10))
                .backoffMultiplier(2.0)
                .attemptTimeout(Duration.ofMillis(200))
                .build();
        deliveryExecutor = Executors.newFixedThreadPool(2);
        attemptExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        deliveryExecutor.shutdownNow();
        attemptExecutor.shutdownNow();
    }

    @Test
    void transientFailuresAreRetriedUpToMaxAttemptsThenDeadLettered() throws Exception {
        ScriptedAdapter adapter = new ScriptedAdapter(attempt -> {
            throw DeliveryException.transientFailure("503 from provider", null);
        });

        DeliveryResult result = deliver(adapter);

        assertThat(adapter.calls.get()).isEqualTo(3);
        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DEAD_LETTERED);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getLastError()).isEqualTo("503 from provider");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeliveryAttempt>> history = ArgumentCaptor.forClass(List.class);
        verify(deadLetterService).deadLetter(
                eq(enriched()), eq(WEBHOOK), startsWith("retries exhausted"), eq(3), history.capture());
        assertThat(history.getValue())
                .extracting(DeliveryAttempt::getClassification)
                .containsOnly(FailureClassification.TRANSIENT);
    }

    @Test
    void permanentFailureIsNotRetried() throws Exception {
        ScriptedAdapter adapter = new ScriptedAdapter(attempt -> {
            throw DeliveryException.permanentFailure("400 invalid address", null);
        });

        DeliveryResult result = deliver(adapter);

        assertThat(adapter.calls.get()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DEAD_LETTERED);
        verify(deadLetterService).deadLetter(
                eq(enriched()), eq(WEBHOOK), startsWith("permanent failure"), eq(1), anyList());
    }

    @Test
    void succeedsAfterTransientFailure() throws Exception {
        ScriptedAdapter adapter = new ScriptedAdapter(attempt -> {
            if (attempt == 1) {
                throw DeliveryException.transientFailure("throttled", null);
            }
        });

        DeliveryResult result = deliver(adapter);

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(result.getAttempts()).isEqualTo(2);
        verify(deadLetterService, never()).deadLetter(
                any(), any(),
                anyString(), anyInt(), anyList());
    }

    @Test
    void attemptExceedingDeadlineCountsAsTransient() throws Exception {
        ScriptedAdapter adapter = new ScriptedAdapter(attempt -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        DeliveryResult result = deliver(adapter);

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DEAD_LETTERED);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getLastError()).contains("timed out");
    }

    @Test
    void slowEndpointPreparationIsNotBoundByAttemptDeadline() throws Exception {
        ScriptedAdapter adapter = new ScriptedAdapter(attempt -> {
        }, call -> {
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        DeliveryResult result = deliver(adapter);

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(adapter.prepareCalls.get()).isEqualTo(1);
    }

    @Test
    void failedPreparationIsDeadLetteredWithoutRetry() throws Exception {
        ScriptedAdapter adapter = new ScriptedAdapter(attempt -> {
        }, call -> {
            throw DeliveryException.permanentFailure("Confirmation handshake timed out", null);
        });

        DeliveryResult result = deliver(adapter);

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DEAD_LETTERED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(adapter.prepareCalls.get()).isEqualTo(1);
        assertThat(adapter.calls.get()).isZero();
        verify(deadLetterService).deadLetter(
                eq(enriched()), eq(WEBHOOK), startsWith("permanent failure"), eq(1), anyList());
    }

    @Test
    void missingAdapterDeadLettersWithoutAttempts() throws Exception {
        DeliveryService service = service(List.of());

        DeliveryResult result = service.deliver(enriched(), WEBHOOK).getResult().get(5, TimeUnit.SECONDS);

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.DEAD_LETTERED);
        assertThat(result.getAttempts()).isZero();
    }

    private DeliveryResult deliver(DeliveryAdapter adapter) throws Exception {
        return service(List.of(adapter)).deliver(enriched(), WEBHOOK).getResult().get(10, TimeUnit.SECONDS);
    }

    private DeliveryService service(List<DeliveryAdapter> adapters) {
        return new DeliveryService(
                adapters,
                wiring.deliveryRetryRegistry(config),
                wiring.deliveryTimeLimiter(config),
                deliveryExecutor,
                attemptExecutor,
                deadLetterService,
                OpenTelemetry.noop().getTracer("test"),
                meterRegistry,
                Clock.systemUTC());
    }

    private static EnrichedEvent enriched() {
        return EnrichedEvent.builder()
                .event(AlertEvent.builder()
                        .id("evt-1")
                        .source(AlertSource.METRIC_ALARM)
                        .severity(Severity.CRITICAL)
                        .metricName("StatusCheckFailed")
                        .state(AlarmState.ALARM)
                        .build())
                .environment("test")
                .auditFlags(List.of())
                .build();
    }

    private interface Script {
        void run(int attempt);
    }

    private static class ScriptedAdapter implements DeliveryAdapter {

        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger prepareCalls = new AtomicInteger();
        private final Script script;
        private final Script prepareScript;

        ScriptedAdapter(Script script) {
            this(script, call -> {
            });
        }

        ScriptedAdapter(Script script, Script prepareScript) {
            this.script = script;
            this.prepareScript = prepareScript;
        }

        @Override
        public void prepare(String endpoint) {
            prepareScript.run(prepareCalls.incrementAndGet());
        }

        @Override
        public ChannelType channelType() {
            return ChannelType.WEBHOOK;
        }

        @Override
        public void send(String endpoint, EnrichedEvent event) {
            script.run(calls.incrementAndGet());
        }
    }
}
