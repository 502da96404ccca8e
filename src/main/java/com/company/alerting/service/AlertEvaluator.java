package com.company.alerting.service;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.AnomalyMonitor;
import com.company.alerting.domain.BudgetThresholds;
import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.domain.enums.AnomalyVerdict;
import com.company.alerting.domain.enums.BudgetLevel;
import com.company.alerting.domain.enums.ComparisonOperator;
import com.company.alerting.domain.enums.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Threshold, anomaly and budget decisions. Stateless apart from the loaded configuration.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertEvaluator {

    public static final String BUDGET_LEVEL_DIMENSION = "BudgetLevel";

    private final EngineConfig config;

    public boolean evaluateThreshold(double value, double threshold, ComparisonOperator op) {
        if (op == null) {
            throw new IllegalArgumentException("Comparison operator is required");
        }
        switch (op) {
            case GREATER_THAN_THRESHOLD:
                return value > threshold;
            case GREATER_THAN_OR_EQUAL_TO_THRESHOLD:
                return value >= threshold;
            case LESS_THAN_THRESHOLD:
                return value < threshold;
            case LESS_THAN_OR_EQUAL_TO_THRESHOLD:
                return value <= threshold;
            default:
                throw new IllegalArgumentException("Unsupported operator " + op);
        }
    }

    /**
     * True only when both the absolute and the percentage impact reach the monitor's thresholds.
     * With a zero baseline the percentage check is vacuous and only the absolute impact counts.
     */
    public boolean evaluateAnomaly(AnomalyMonitor monitor, double observed, double expected) {
        double absoluteImpact = observed - expected;
        if (absoluteImpact < monitor.getThresholdAbsolute()) {
            return false;
        }
        if (expected == 0) {
            return true;
        }
        double percentageImpact = absoluteImpact / expected * 100;
        return percentageImpact >= monitor.getThresholdPercentage();
    }

    /**
     * Anomaly verdict that refuses to judge against a stale or undated baseline.
     */
    public AnomalyVerdict evaluateAnomaly(AnomalyMonitor monitor, double observed, double expected,
                                          Instant baselineAsOf, Instant now) {
        if (baselineAsOf == null) {
            return AnomalyVerdict.UNKNOWN;
        }
        Duration age = Duration.between(baselineAsOf, now);
        if (age.compareTo(config.getBaselineFreshness()) > 0) {
            log.debug("Baseline for monitor {} is {} old, verdict unknown", monitor.getName(), age);
            return AnomalyVerdict.UNKNOWN;
        }
        return evaluateAnomaly(monitor, observed, expected) ? AnomalyVerdict.ANOMALY : AnomalyVerdict.NORMAL;
    }

    public BudgetLevel evaluateBudget(double observed) {
        return evaluateBudget(config.getBudget(), observed);
    }

    public static BudgetLevel evaluateBudget(BudgetThresholds budget, double observed) {
        if (budget == null) {
            return BudgetLevel.NONE;
        }
        if (observed >= budget.getCriticalThreshold()) {
            return BudgetLevel.CRITICAL;
        }
        if (observed >= budget.getWarningThreshold()) {
            return BudgetLevel.WARNING;
        }
        return BudgetLevel.NONE;
    }

    /**
     * Fills in the state of a raw sample. Budget metrics win over anomaly monitors,
     * which win over plain thresholds. Samples missing their inputs resolve to INSUFFICIENT_DATA.
     *
     * <p>A budget sample resolves to two alarms, {@code <alarm>:warning} and {@code <alarm>:critical},
     * so each level changes state on its own.
     */
    public List<AlertEvent> resolve(AlertEvent event, Instant now) {
        BudgetThresholds budget = config.getBudget();
        if (budget != null && budget.getMetricName().equals(event.getMetricName()) && event.getValue() != null) {
            return List.of(
                    resolveBudgetLevel(event, budget, BudgetLevel.WARNING),
                    resolveBudgetLevel(event, budget, BudgetLevel.CRITICAL));
        }
        if (event.getAnomalyMonitor() != null) {
            return List.of(resolveAnomaly(event, now));
        }
        return List.of(resolveThreshold(event));
    }

    private AlertEvent resolveBudgetLevel(AlertEvent event, BudgetThresholds budget, BudgetLevel level) {
        double threshold = level == BudgetLevel.CRITICAL
                ? budget.getCriticalThreshold()
                : budget.getWarningThreshold();
        boolean breached = event.getValue() >= threshold;
        String suffix = level.name().toLowerCase(Locale.ROOT);

        // Keeps the two levels apart in the delivery dedup key
        Map<String, String> dimensions = new HashMap<>(
                event.getDimensions() != null ? event.getDimensions() : Map.of());
        dimensions.put(BUDGET_LEVEL_DIMENSION, suffix);

        AlertEvent.AlertEventBuilder resolved = event.toBuilder()
                .id(event.getId() + ":" + suffix)
                .alarmName(event.alarmKey() + ":" + suffix)
                .dimensions(dimensions)
                .state(breached ? AlarmState.ALARM : AlarmState.OK)
                .threshold(threshold)
                .comparisonOperator(ComparisonOperator.GREATER_THAN_OR_EQUAL_TO_THRESHOLD);

        if (breached) {
            resolved.description(String.format("Budget %s: observed %.2f reached %.2f of budget %.2f",
                    level, event.getValue(), threshold, budget.getAmount()));
            if (level == BudgetLevel.CRITICAL && event.getSeverity() == null) {
                resolved.severity(Severity.CRITICAL);
            }
        }
        return resolved.build();
    }

    private AlertEvent resolveAnomaly(AlertEvent event, Instant now) {
        Optional<AnomalyMonitor> monitor = config.anomalyMonitor(event.getAnomalyMonitor());
        if (monitor.isEmpty() || event.getValue() == null || event.getExpectedValue() == null) {
            log.warn("Cannot evaluate anomaly sample for {} (monitor={}): missing monitor or values",
                    event.alarmKey(), event.getAnomalyMonitor());
            return event.toBuilder().state(AlarmState.INSUFFICIENT_DATA).build();
        }

        AnomalyVerdict verdict = evaluateAnomaly(monitor.get(), event.getValue(), event.getExpectedValue(),
                event.getBaselineAsOf(), now);
        AlarmState state;
        switch (verdict) {
            case ANOMALY:
                state = AlarmState.ALARM;
                break;
            case NORMAL:
                state = AlarmState.OK;
                break;
            default:
                state = AlarmState.INSUFFICIENT_DATA;
        }
        return event.toBuilder().state(state).build();
    }

    private AlertEvent resolveThreshold(AlertEvent event) {
        if (event.getValue() == null || event.getThreshold() == null || event.getComparisonOperator() == null) {
            return event.toBuilder().state(AlarmState.INSUFFICIENT_DATA).build();
        }
        boolean breached = evaluateThreshold(event.getValue(), event.getThreshold(), event.getComparisonOperator());
        return event.toBuilder().state(breached ? AlarmState.ALARM : AlarmState.OK).build();
    }
}
