package com.company.alerting.suppression;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.SuppressionRule;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AlertSource;
import com.company.alerting.domain.enums.SuppressionPhase;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Composite alarm evaluation with suppressor-driven wait and extension windows.
 *
 * <p>Each rule moves through {@code IDLE -> PENDING -> SUPPRESSING -> IDLE}. A composite that fires
 * while its suppressor is in ALARM is held for the wait period. If the suppressor clears first the
 * held notification is cancelled; otherwise it is released once and further fires are dropped for
 * the extension period.
 *
 * <p>Rules are locked individually. Windows expire lazily when a rule is touched and
 * eagerly through {@link #advance(Instant)}.
 */
@Component
@Slf4j
public class SuppressionEngine {

    private final AlarmStateTable stateTable;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<String, RuleTracker> trackers;
    // alarm id -> rules whose expression references it
    private final Map<String, List<RuleTracker>> triggeredBy;
    // alarm id -> rules it suppresses
    private final Map<String, List<RuleTracker>> suppressing;

    public SuppressionEngine(EngineConfig config, AlarmStateTable stateTable,
                             Clock clock, MeterRegistry meterRegistry) {
        this.stateTable = stateTable;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        Map<String, RuleTracker> byName = new LinkedHashMap<>();
        Map<String, List<RuleTracker>> byTrigger = new HashMap<>();
        Map<String, List<RuleTracker>> bySuppressor = new HashMap<>();

        for (SuppressionRule rule : config.getSuppressionRules()) {
            RuleTracker tracker = new RuleTracker(rule);
            byName.put(rule.getName(), tracker);
            for (String alarmId : rule.referencedAlarms()) {
                byTrigger.computeIfAbsent(alarmId, k -> new ArrayList<>()).add(tracker);
            }
            if (rule.hasSuppressor()) {
                bySuppressor.computeIfAbsent(rule.getSuppressorAlarmId(), k -> new ArrayList<>()).add(tracker);
            }
        }

        this.trackers = Collections.unmodifiableMap(byName);
        this.triggeredBy = Collections.unmodifiableMap(byTrigger);
        this.suppressing = Collections.unmodifiableMap(bySuppressor);

        log.info("Suppression engine initialized with {} rules", trackers.size());
    }

    /**
     * Records the event's state and re-evaluates every rule that depends on it, directly or
     * through other composites.
     */
    public SuppressionDecision evaluate(AlertEvent event) {
        String alarmId = event.alarmKey();
        if (alarmId == null || event.getState() == null) {
            return SuppressionDecision.NONE;
        }

        Instant now = clock.instant();
        stateTable.update(alarmId, event.getState(), now);

        if (trackers.isEmpty()) {
            return SuppressionDecision.NONE;
        }

        List<CompositeOutcome> outcomes = new ArrayList<>();
        Deque<String> changed = new ArrayDeque<>();
        changed.add(alarmId);

        // Composites referencing each other through NOT can flip-flop; bound the cascade
        int remaining = trackers.size() * 2 + 1;
        while (!changed.isEmpty()) {
            if (remaining-- == 0) {
                log.error("Composite cascade for alarm {} did not settle, stopping at {}", alarmId, changed);
                meterRegistry.counter("alerts.suppression.errors", "reason", "cascade").increment();
                break;
            }
            String id = changed.poll();
            for (RuleTracker tracker : triggeredBy.getOrDefault(id, List.of())) {
                reevaluate(tracker, now, outcomes, changed);
            }
            for (RuleTracker tracker : suppressing.getOrDefault(id, List.of())) {
                onSuppressorChange(tracker, now, outcomes);
            }
        }

        return new SuppressionDecision(List.copyOf(outcomes));
    }

    /**
     * Expires wait and extension windows that ended at or before {@code now}.
     * Released notifications come back as {@link CompositeOutcome.Action#EMIT} outcomes.
     */
    public SuppressionDecision advance(Instant now) {
        List<CompositeOutcome> outcomes = new ArrayList<>();
        for (RuleTracker tracker : trackers.values()) {
            tracker.lock.lock();
            try {
                expire(tracker, now, outcomes);
            } finally {
                tracker.lock.unlock();
            }
        }
        return new SuppressionDecision(List.copyOf(outcomes));
    }

    public int heldCount() {
        return (int) trackers.values().stream()
                .filter(t -> t.phase == SuppressionPhase.PENDING)
                .count();
    }

    public int ruleCount() {
        return trackers.size();
    }

    public SuppressionPhase phaseOf(String ruleName) {
        RuleTracker tracker = trackers.get(ruleName);
        return tracker != null ? tracker.phase : null;
    }

    private void reevaluate(RuleTracker tracker, Instant now, List<CompositeOutcome> outcomes, Deque<String> changed) {
        SuppressionRule rule = tracker.rule;
        tracker.lock.lock();
        try {
            expire(tracker, now, outcomes);

            boolean value;
            boolean failOpen = false;
            try {
                value = rule.getTriggerExpression().evaluate(stateTable::stateOf);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate composite rule {} ({}), emitting unsuppressed",
                        rule.getName(), rule.getExpressionText(), e);
                meterRegistry.counter("alerts.suppression.errors", "reason", "expression").increment();
                value = true;
                failOpen = true;
            }

            boolean fired = value && !tracker.active;
            if (value != tracker.active) {
                tracker.active = value;
                stateTable.update(rule.getName(), value ? AlarmState.ALARM : AlarmState.OK, now);
                changed.add(rule.getName());
            }

            if (fired) {
                outcomes.add(onFire(tracker, now, failOpen));
            }
        } finally {
            tracker.lock.unlock();
        }
    }

    private CompositeOutcome onFire(RuleTracker tracker, Instant now, boolean failOpen) {
        SuppressionRule rule = tracker.rule;
        AlertEvent composite = compositeEvent(rule, now);
        meterRegistry.counter("alerts.suppression.fired", "rule", rule.getName()).increment();

        if (tracker.phase == SuppressionPhase.PENDING) {
            return outcome(rule, CompositeOutcome.Action.SUPPRESS, composite,
                    "coalesced into held notification " + tracker.held.getId());
        }
        if (tracker.phase == SuppressionPhase.SUPPRESSING) {
            return outcome(rule, CompositeOutcome.Action.SUPPRESS, composite,
                    "suppressed until " + tracker.suppressUntil);
        }

        if (!failOpen && suppressorInAlarm(rule)) {
            tracker.phase = SuppressionPhase.PENDING;
            tracker.held = composite;
            tracker.deadline = now.plus(rule.getWaitPeriod());
            log.info("Holding composite {} for rule {} until {}: suppressor {} in ALARM",
                    composite.getId(), rule.getName(), tracker.deadline, rule.getSuppressorAlarmId());
            return outcome(rule, CompositeOutcome.Action.HOLD, composite,
                    "held until " + tracker.deadline);
        }

        log.info("Composite rule {} fired, emitting {}", rule.getName(), composite.getId());
        return outcome(rule, CompositeOutcome.Action.EMIT, composite, null);
    }

    private void onSuppressorChange(RuleTracker tracker, Instant now, List<CompositeOutcome> outcomes) {
        SuppressionRule rule = tracker.rule;
        tracker.lock.lock();
        try {
            expire(tracker, now, outcomes);
            if (tracker.phase == SuppressionPhase.PENDING && !suppressorInAlarm(rule)) {
                log.info("Suppressor {} cleared, cancelling held composite {} for rule {}",
                        rule.getSuppressorAlarmId(), tracker.held.getId(), rule.getName());
                outcomes.add(outcome(rule, CompositeOutcome.Action.CANCEL, tracker.held,
                        "suppressor " + rule.getSuppressorAlarmId() + " cleared within wait period"));
                tracker.reset();
            }
        } finally {
            tracker.lock.unlock();
        }
    }

    // Caller holds tracker.lock
    private void expire(RuleTracker tracker, Instant now, List<CompositeOutcome> outcomes) {
        SuppressionRule rule = tracker.rule;

        if (tracker.phase == SuppressionPhase.PENDING && !now.isBefore(tracker.deadline)) {
            AlertEvent held = tracker.held;
            if (suppressorInAlarm(rule)) {
                tracker.reset();
                tracker.phase = SuppressionPhase.SUPPRESSING;
                tracker.suppressUntil = now.plus(rule.getExtensionPeriod());
                log.info("Wait period for rule {} elapsed, releasing {} and suppressing until {}",
                        rule.getName(), held.getId(), tracker.suppressUntil);
                outcomes.add(outcome(rule, CompositeOutcome.Action.EMIT, held,
                        "released after wait period"));
            } else {
                tracker.reset();
                outcomes.add(outcome(rule, CompositeOutcome.Action.CANCEL, held,
                        "suppressor " + rule.getSuppressorAlarmId() + " no longer in ALARM"));
            }
        }

        if (tracker.phase == SuppressionPhase.SUPPRESSING && !now.isBefore(tracker.suppressUntil)) {
            log.debug("Extension period for rule {} ended", rule.getName());
            tracker.reset();
        }
    }

    private boolean suppressorInAlarm(SuppressionRule rule) {
        return rule.hasSuppressor() && stateTable.stateOf(rule.getSuppressorAlarmId()) == AlarmState.ALARM;
    }

    private CompositeOutcome outcome(SuppressionRule rule, CompositeOutcome.Action action,
                                     AlertEvent composite, String reason) {
        meterRegistry.counter("alerts.suppression.outcomes",
                "rule", rule.getName(),
                "action", action.name().toLowerCase()
        ).increment();
        return new CompositeOutcome(rule.getName(), action, composite, reason);
    }

    private AlertEvent compositeEvent(SuppressionRule rule, Instant now) {
        return AlertEvent.builder()
                .id(UUID.randomUUID().toString())
                .alarmName(rule.getName())
                .metricName(rule.getName())
                .source(AlertSource.COMPOSITE_ALARM)
                .severity(rule.getSeverity())
                .state(AlarmState.ALARM)
                .previousState(AlarmState.OK)
                .dimensions(Map.of())
                .resourceTags(Map.of())
                .timestamp(now)
                .description("Composite alarm " + rule.getName() + " is in ALARM: " + rule.getExpressionText())
                .build();
    }
}
