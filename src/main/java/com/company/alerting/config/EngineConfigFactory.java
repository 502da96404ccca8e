package com.company.alerting.config;

import com.company.alerting.domain.AnomalyMonitor;
import com.company.alerting.domain.BudgetThresholds;
import com.company.alerting.domain.DataIdentifier;
import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.SuppressionRule;
import com.company.alerting.domain.enums.AnomalyDimension;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.IdentifierAction;
import com.company.alerting.domain.enums.MonitorFrequency;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.domain.expression.AlarmExpression;
import com.company.alerting.domain.expression.AlarmExpressionParser;
import com.company.alerting.exception.ConfigurationException;
import com.company.alerting.exception.MalformedSubscriptionException;
import com.company.alerting.exception.UnknownAlarmReferenceException;
import com.company.alerting.service.RedactionService;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Converts bound {@link AlertingProperties} into a validated {@link EngineConfig}.
 * Any violation throws a {@link ConfigurationException} so the application refuses to start.
 */
@Slf4j
public final class EngineConfigFactory {

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{6,14}$");

    private EngineConfigFactory() {
    }

    public static EngineConfig build(AlertingProperties props) {
        EngineConfig.EngineConfigBuilder builder = EngineConfig.builder()
                .environment(requireText(props.getEnvironment(), "environment"))
                .runbookUrlTemplate(requireText(props.getRunbookUrlTemplate(), "runbook-url-template"))
                .runbookOverrides(props.getRunbookOverrides())
                .dedupWindow(requirePositive(props.getDedupWindow(), "dedup-window"))
                .idempotencyWindow(requirePositive(props.getIdempotencyWindow(), "idempotency-window"))
                .resultWait(requireNonNegative(props.getResultWait(), "result-wait"))
                .baselineFreshness(requirePositive(props.getBaselineFreshness(), "baseline-freshness"))
                .aggregateQueueUrl(props.getAggregateQueueUrl())
                .emailFromAddress(props.getEmail().getFromAddress())
                .webhookConnectTimeout(requirePositive(props.getWebhook().getConnectTimeout(), "webhook.connect-timeout"))
                .webhookReadTimeout(requirePositive(props.getWebhook().getReadTimeout(), "webhook.read-timeout"))
                .webhookConfirmationTimeout(requirePositive(
                        props.getWebhook().getConfirmationTimeout(), "webhook.confirmation-timeout"));

        applyRetry(builder, props.getRetry());

        if (props.getBudget().getAmount() != null) {
            AlertingProperties.Budget budget = props.getBudget();
            builder.budget(BudgetThresholds.of(
                    budget.getAmount(), budget.getWarningPct(), budget.getCriticalPct(),
                    requireText(budget.getMetricName(), "budget.metric-name")));
        }

        builder.knownAlarms(props.getAlarms());
        buildRules(props).forEach(builder::suppressionRule);
        buildMonitors(props).forEach(builder::anomalyMonitor);
        buildSubscriptions(props.getSubscriptions()).forEach(builder::subscription);
        buildIdentifiers(props.getRedactionIdentifiers()).forEach(builder::dataIdentifier);

        EngineConfig config = builder.build();
        log.info("Engine config loaded: env={}, rules={}, subscriptions={}, identifiers={}, budget={}",
                config.getEnvironment(), config.getSuppressionRules().size(),
                config.getSubscriptions().size(), config.getDataIdentifiers().size(),
                config.getBudget() != null);
        return config;
    }

    private static void applyRetry(EngineConfig.EngineConfigBuilder builder, AlertingProperties.Retry retry) {
        if (retry.getMaxAttempts() < 1) {
            throw new ConfigurationException("retry.max-attempts must be at least 1: " + retry.getMaxAttempts());
        }
        if (retry.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("retry.backoff-multiplier must be >= 1: " + retry.getBackoffMultiplier());
        }
        builder.maxAttempts(retry.getMaxAttempts())
                .backoffBase(requirePositive(retry.getBackoffBase(), "retry.backoff-base"))
                .backoffMultiplier(retry.getBackoffMultiplier())
                .attemptTimeout(requirePositive(retry.getAttemptTimeout(), "retry.attempt-timeout"));
    }

    static List<SuppressionRule> buildRules(AlertingProperties props) {
        Set<String> ruleNames = new HashSet<>();
        for (AlertingProperties.Rule rule : props.getSuppressionRules()) {
            String name = requireText(rule.getName(), "suppression-rules[].name");
            if (!ruleNames.add(name)) {
                throw new ConfigurationException("Duplicate suppression rule name: " + name);
            }
        }

        // Composites may reference other composites
        Set<String> known = new HashSet<>(props.getAlarms());
        known.addAll(ruleNames);

        return props.getSuppressionRules().stream().map(rule -> {
            AlarmExpression expression = AlarmExpressionParser.parse(rule.getExpression());
            for (String alarmId : expression.alarmRefs()) {
                if (!known.contains(alarmId) || alarmId.equals(rule.getName())) {
                    throw new UnknownAlarmReferenceException(rule.getName(), alarmId);
                }
            }

            String suppressor = rule.getSuppressorAlarmId();
            if (suppressor != null && !suppressor.isBlank()
                    && (!known.contains(suppressor) || suppressor.equals(rule.getName()))) {
                throw new UnknownAlarmReferenceException(rule.getName(), suppressor);
            }

            Severity severity = Severity.fromString(rule.getSeverity());
            if (severity == null) {
                throw new ConfigurationException("Suppression rule " + rule.getName()
                        + " has unknown severity: " + rule.getSeverity());
            }

            return SuppressionRule.builder()
                    .name(rule.getName())
                    .triggerExpression(expression)
                    .expressionText(rule.getExpression())
                    .suppressorAlarmId(suppressor != null && !suppressor.isBlank() ? suppressor : null)
                    .waitPeriod(requireNonNegative(rule.getWaitPeriod(), rule.getName() + ".wait-period"))
                    .extensionPeriod(requireNonNegative(rule.getExtensionPeriod(), rule.getName() + ".extension-period"))
                    .severity(severity)
                    .build();
        }).collect(Collectors.toList());
    }

    private static Map<String, AnomalyMonitor> buildMonitors(AlertingProperties props) {
        Map<String, AnomalyMonitor> monitors = new LinkedHashMap<>();
        for (AlertingProperties.Monitor monitor : props.getAnomalyMonitors()) {
            String name = requireText(monitor.getName(), "anomaly-monitors[].name");
            if (monitor.getThresholdAbsolute() < 0 || monitor.getThresholdPercentage() < 0) {
                throw new ConfigurationException("Anomaly monitor " + name + " has negative thresholds");
            }
            monitors.put(name, AnomalyMonitor.builder()
                    .name(name)
                    .dimension(AnomalyDimension.fromString(monitor.getDimension()))
                    .thresholdAbsolute(monitor.getThresholdAbsolute())
                    .thresholdPercentage(monitor.getThresholdPercentage())
                    .frequency(MonitorFrequency.fromString(monitor.getFrequency()))
                    .build());
        }
        return monitors;
    }

    static List<Subscription> buildSubscriptions(List<AlertingProperties.SubscriptionEntry> entries) {
        return IntStream.range(0, entries.size()).mapToObj(i -> {
            AlertingProperties.SubscriptionEntry entry = entries.get(i);

            Severity severity = Severity.fromString(entry.getSeverity());
            if (severity == null) {
                throw new MalformedSubscriptionException(i, "unknown severity '" + entry.getSeverity() + "'");
            }
            ChannelType channelType = ChannelType.fromString(entry.getChannelType());
            if (channelType == null) {
                throw new MalformedSubscriptionException(i, "unknown channel type '" + entry.getChannelType() + "'");
            }
            String endpoint = entry.getEndpoint();
            if (endpoint == null || endpoint.isBlank()) {
                throw new MalformedSubscriptionException(i, "missing endpoint");
            }
            if (entry.isAutoConfirm() && channelType != ChannelType.WEBHOOK) {
                throw new MalformedSubscriptionException(i, "auto-confirm is only valid for WEBHOOK");
            }
            validateEndpoint(i, channelType, endpoint.trim());

            return Subscription.builder()
                    .severity(severity)
                    .channelType(channelType)
                    .endpoint(endpoint.trim())
                    .autoConfirm(entry.isAutoConfirm())
                    .build();
        }).collect(Collectors.toList());
    }

    private static void validateEndpoint(int index, ChannelType channelType, String endpoint) {
        switch (channelType) {
            case EMAIL:
                if (!endpoint.contains("@")) {
                    throw new MalformedSubscriptionException(index, "not an email address: " + endpoint);
                }
                break;
            case SMS:
                if (!E164.matcher(endpoint).matches()) {
                    throw new MalformedSubscriptionException(index, "not an E.164 phone number: " + endpoint);
                }
                break;
            case WEBHOOK:
                requireUrl(index, endpoint, "http", "https");
                break;
            case QUEUE:
                requireUrl(index, endpoint, "https");
                break;
            case FUNCTION:
            default:
                // Function name, partial ARN or full ARN; the provider validates the rest
                break;
        }
    }

    private static void requireUrl(int index, String endpoint, String... schemes) {
        try {
            URI uri = new URI(endpoint);
            if (uri.getScheme() == null || uri.getHost() == null
                    || !List.of(schemes).contains(uri.getScheme().toLowerCase())) {
                throw new MalformedSubscriptionException(index, "unsupported URL: " + endpoint);
            }
        } catch (URISyntaxException e) {
            throw new MalformedSubscriptionException(index, "invalid URL: " + endpoint);
        }
    }

    static List<DataIdentifier> buildIdentifiers(List<AlertingProperties.IdentifierEntry> entries) {
        return entries.stream().map(entry -> {
            String name = requireText(entry.getName(), "redaction-identifiers[].name");
            DataIdentifier identifier;
            try {
                identifier = DataIdentifier.of(name, entry.getPattern(), IdentifierAction.fromString(entry.getAction()));
            } catch (IllegalArgumentException e) {
                // PatternSyntaxException is an IllegalArgumentException
                String reason = e instanceof PatternSyntaxException ? "invalid pattern" : e.getMessage();
                throw new ConfigurationException("Data identifier " + name + ": " + reason);
            }
            // Redaction must be idempotent
            if (identifier.getPattern().matcher(RedactionService.MASK).find()) {
                throw new ConfigurationException("Data identifier " + name
                        + " matches the redaction mask " + RedactionService.MASK);
            }
            return identifier;
        }).collect(Collectors.toList());
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("alerting." + property + " is required");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String property) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException("alerting." + property + " must be positive");
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String property) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException("alerting." + property + " must not be negative");
        }
        return value;
    }
}
