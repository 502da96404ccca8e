package com.company.alerting.config;

import com.company.alerting.domain.AnomalyMonitor;
import com.company.alerting.domain.BudgetThresholds;
import com.company.alerting.domain.DataIdentifier;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.SuppressionRule;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, validated engine configuration. Every feature flag is decided here once,
 * when the pipeline is built.
 */
@Value
@Builder
public class EngineConfig {

    String environment;
    String runbookUrlTemplate;
    @Singular
    Map<String, String> runbookOverrides;

    Duration dedupWindow;
    Duration idempotencyWindow;
    Duration resultWait;
    Duration baselineFreshness;

    String aggregateQueueUrl;

    int maxAttempts;
    Duration backoffBase;
    double backoffMultiplier;
    Duration attemptTimeout;

    // Null when no budget is configured
    BudgetThresholds budget;

    @Singular
    Set<String> knownAlarms;
    @Singular
    List<SuppressionRule> suppressionRules;
    @Singular
    Map<String, AnomalyMonitor> anomalyMonitors;
    @Singular
    List<Subscription> subscriptions;
    @Singular
    List<DataIdentifier> dataIdentifiers;

    Duration webhookConnectTimeout;
    Duration webhookReadTimeout;
    Duration webhookConfirmationTimeout;

    String emailFromAddress;

    public List<Subscription> subscriptionsFor(Severity severity) {
        return subscriptions.stream()
                .filter(s -> s.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    public boolean isAggregateEnabled() {
        return aggregateQueueUrl != null && !aggregateQueueUrl.isBlank();
    }

    public Optional<AnomalyMonitor> anomalyMonitor(String name) {
        return Optional.ofNullable(name).map(anomalyMonitors::get);
    }

    public Set<String> autoConfirmEndpoints() {
        return subscriptions.stream()
                .filter(s -> s.getChannelType() == ChannelType.WEBHOOK && s.isAutoConfirm())
                .map(Subscription::getEndpoint)
                .collect(Collectors.toSet());
    }
}
