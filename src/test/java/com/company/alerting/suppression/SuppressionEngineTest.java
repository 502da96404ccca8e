package com.company.alerting.suppression;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.SuppressionRule;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.domain.enums.SuppressionPhase;
import com.company.alerting.domain.expression.AlarmExpression;
import com.company.alerting.domain.expression.AlarmExpressionParser;
import com.company.alerting.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class SuppressionEngineTest {

    private static final Duration WAIT = Duration.ofMinutes(2);
    private static final Duration EXTENSION = Duration.ofMinutes(10);

    private MutableClock clock;
    private AlarmStateTable stateTable;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        stateTable = new AlarmStateTable();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void compositeWithoutSuppressorEmitsImmediately() {
        SuppressionEngine engine = engine(rule("web", "ALARM(cpu) AND ALARM(hosts)", null));

        assertThat(engine.evaluate(alarm("cpu", AlarmState.ALARM)).getOutcomes()).isEmpty();
        SuppressionDecision decision = engine.evaluate(alarm("hosts", AlarmState.ALARM));

        assertThat(decision.getOutcomes()).singleElement().satisfies(o -> {
            assertThat(o.getAction()).isEqualTo(CompositeOutcome.Action.EMIT);
            assertThat(o.getComposite().getSource()).isEqualTo(AlertSource.COMPOSITE_ALARM);
            assertThat(o.getComposite().getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(o.getComposite().alarmKey()).isEqualTo("web");
        });
        assertThat(stateTable.stateOf("web")).isEqualTo(AlarmState.ALARM);
    }

    @Test
    void firesOnlyOnFalseToTrueTransition() {
        SuppressionEngine engine = engine(rule("web", "ALARM(cpu) AND ALARM(hosts)", null));
        engine.evaluate(alarm("cpu", AlarmState.ALARM));
        engine.evaluate(alarm("hosts", AlarmState.ALARM));

        assertThat(engine.evaluate(alarm("hosts", AlarmState.ALARM)).getOutcomes()).isEmpty();
        assertThat(engine.evaluate(alarm("cpu", AlarmState.ALARM)).getOutcomes()).isEmpty();

        engine.evaluate(alarm("cpu", AlarmState.OK));
        assertThat(stateTable.stateOf("web")).isEqualTo(AlarmState.OK);
        assertThat(engine.evaluate(alarm("cpu", AlarmState.ALARM)).emitted()).hasSize(1);
    }

    @Test
    void suppressorClearingWithinWaitCancelsHeldNotification() {
        SuppressionEngine engine = engine(rule("web", "ALARM(cpu) AND ALARM(hosts)", "outage"));
        engine.evaluate(alarm("outage", AlarmState.ALARM));
        engine.evaluate(alarm("cpu", AlarmState.ALARM));

        SuppressionDecision held = engine.evaluate(alarm("hosts", AlarmState.ALARM));
        assertThat(held.heldCount()).isEqualTo(1);
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.PENDING);
        assertThat(engine.heldCount()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(1));
        SuppressionDecision cleared = engine.evaluate(alarm("outage", AlarmState.OK));

        assertThat(cleared.getOutcomes()).singleElement().satisfies(o -> {
            assertThat(o.getAction()).isEqualTo(CompositeOutcome.Action.CANCEL);
            assertThat(o.getComposite().getId()).isEqualTo(held.getOutcomes().get(0).getComposite().getId());
        });
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.IDLE);

        clock.advance(Duration.ofMinutes(5));
        assertThat(engine.advance(clock.instant()).getOutcomes()).isEmpty();
    }

    @Test
    void suppressorStillInAlarmReleasesOnceThenSuppresses() {
        SuppressionEngine engine = engine(rule("web", "ALARM(cpu) AND ALARM(hosts)", "outage"));
        engine.evaluate(alarm("outage", AlarmState.ALARM));
        engine.evaluate(alarm("cpu", AlarmState.ALARM));
        engine.evaluate(alarm("hosts", AlarmState.ALARM));

        clock.advance(WAIT.minusSeconds(1));
        assertThat(engine.advance(clock.instant()).getOutcomes()).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        SuppressionDecision released = engine.advance(clock.instant());
        assertThat(released.emitted()).hasSize(1);
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.SUPPRESSING);
        assertThat(engine.advance(clock.instant()).getOutcomes()).isEmpty();

        // Re-fire inside the extension period is dropped
        engine.evaluate(alarm("cpu", AlarmState.OK));
        SuppressionDecision refire = engine.evaluate(alarm("cpu", AlarmState.ALARM));
        assertThat(refire.getOutcomes()).singleElement()
                .extracting(CompositeOutcome::getAction)
                .isEqualTo(CompositeOutcome.Action.SUPPRESS);

        // Suppressor clearing does not end the extension period
        engine.evaluate(alarm("outage", AlarmState.OK));
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.SUPPRESSING);

        clock.advance(EXTENSION);
        engine.advance(clock.instant());
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.IDLE);
    }

    @Test
    void waitPeriodExpiresLazilyWhenRuleIsTouched() {
        SuppressionEngine engine = engine(rule("web", "ALARM(cpu) OR ALARM(hosts)", "outage"));
        engine.evaluate(alarm("outage", AlarmState.ALARM));
        engine.evaluate(alarm("cpu", AlarmState.ALARM));

        clock.advance(WAIT);
        SuppressionDecision decision = engine.evaluate(alarm("hosts", AlarmState.ALARM));

        assertThat(decision.emitted()).hasSize(1);
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.SUPPRESSING);
    }

    @Test
    void compositesCascadeIntoDependentComposites() {
        SuppressionEngine engine = engine(
                rule("web", "ALARM(cpu) AND ALARM(hosts)", null),
                rule("site", "ALARM(web) OR ALARM(dns)", null));
        engine.evaluate(alarm("cpu", AlarmState.ALARM));

        SuppressionDecision decision = engine.evaluate(alarm("hosts", AlarmState.ALARM));

        assertThat(decision.getOutcomes())
                .extracting(CompositeOutcome::getRuleName)
                .containsExactly("web", "site");
        assertThat(decision.emitted()).hasSize(2);
    }

    @Test
    void failingExpressionEmitsUnsuppressedAndIsCounted() {
        AlarmExpression broken = new AlarmExpression() {
            @Override
            public boolean evaluate(Function<String, AlarmState> stateLookup) {
                throw new IllegalStateException("lookup unavailable");
            }

            @Override
            public void collectAlarmRefs(Set<String> refs) {
                refs.add("cpu");
            }
        };
        SuppressionEngine engine = engine(SuppressionRule.builder()
                .name("web")
                .triggerExpression(broken)
                .expressionText("ALARM(cpu)")
                .suppressorAlarmId("outage")
                .waitPeriod(WAIT)
                .extensionPeriod(EXTENSION)
                .severity(Severity.CRITICAL)
                .build());
        engine.evaluate(alarm("outage", AlarmState.ALARM));

        SuppressionDecision decision = engine.evaluate(alarm("cpu", AlarmState.ALARM));

        assertThat(decision.getOutcomes()).singleElement()
                .extracting(CompositeOutcome::getAction)
                .isEqualTo(CompositeOutcome.Action.EMIT);
        assertThat(engine.phaseOf("web")).isEqualTo(SuppressionPhase.IDLE);
        assertThat(meterRegistry.counter("alerts.suppression.errors", "reason", "expression").count())
                .isEqualTo(1.0);
    }

    @Test
    void recordsStateOfEveryEvaluatedAlarm() {
        SuppressionEngine engine = engine();

        assertThat(engine.evaluate(alarm("cpu", AlarmState.ALARM))).isEqualTo(SuppressionDecision.NONE);
        assertThat(stateTable.stateOf("cpu")).isEqualTo(AlarmState.ALARM);
        assertThat(stateTable.entry("cpu").getUpdatedAt()).isEqualTo(clock.instant());
    }

    private SuppressionEngine engine(SuppressionRule... rules) {
        EngineConfig config = EngineConfig.builder()
                .environment("test")
                .suppressionRules(List.of(rules))
                .build();
        return new SuppressionEngine(config, stateTable, clock, meterRegistry);
    }

    private static SuppressionRule rule(String name, String expression, String suppressor) {
        return SuppressionRule.builder()
                .name(name)
                .triggerExpression(AlarmExpressionParser.parse(expression))
                .expressionText(expression)
                .suppressorAlarmId(suppressor)
                .waitPeriod(WAIT)
                .extensionPeriod(EXTENSION)
                .severity(Severity.CRITICAL)
                .build();
    }

    private static AlertEvent alarm(String alarmName, AlarmState state) {
        return AlertEvent.builder()
                .id(alarmName + "-" + state)
                .alarmName(alarmName)
                .metricName(alarmName)
                .source(AlertSource.METRIC_ALARM)
                .state(state)
                .build();
    }
}
