package com.company.alerting.config;

import com.company.alerting.domain.Subscription;
import com.company.alerting.domain.SuppressionRule;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.exception.ConfigurationException;
import com.company.alerting.exception.InvalidThresholdOrderException;
import com.company.alerting.exception.MalformedExpressionException;
import com.company.alerting.exception.MalformedSubscriptionException;
import com.company.alerting.exception.UnknownAlarmReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigFactoryTest {

    private AlertingProperties props;

    @BeforeEach
    void setUp() {
        props = new AlertingProperties();
        props.setAlarms(List.of("cpu-high", "hosts-unhealthy", "network-outage"));
    }

    @Test
    void defaultsProduceUsableConfig() {
        EngineConfig config = EngineConfigFactory.build(props);

        assertThat(config.getEnvironment()).isEqualTo("dev");
        assertThat(config.getMaxAttempts()).isEqualTo(3);
        assertThat(config.getBudget()).isNull();
        assertThat(config.isAggregateEnabled()).isFalse();
    }

    @Test
    void budgetWarningMustBeBelowCritical() {
        props.getBudget().setAmount(1000.0);
        props.getBudget().setWarningPct(100);
        props.getBudget().setCriticalPct(80);

        assertThatThrownBy(() -> EngineConfigFactory.build(props))
                .isInstanceOf(InvalidThresholdOrderException.class);
    }

    @Test
    void budgetThresholdsAreAbsolute() {
        props.getBudget().setAmount(1000.0);

        EngineConfig config = EngineConfigFactory.build(props);

        assertThat(config.getBudget().getWarningThreshold()).isEqualTo(800);
        assertThat(config.getBudget().getCriticalThreshold()).isEqualTo(1000);
    }

    @Test
    void ruleReferencingUnknownAlarmFails() {
        props.setSuppressionRules(List.of(rule("web", "ALARM(cpu-high) AND ALARM(disk-full)", null)));

        assertThatThrownBy(() -> EngineConfigFactory.build(props))
                .isInstanceOf(UnknownAlarmReferenceException.class)
                .hasMessageContaining("disk-full");
    }

    @Test
    void unknownSuppressorFails() {
        props.setSuppressionRules(List.of(rule("web", "ALARM(cpu-high)", "dns-outage")));

        assertThatThrownBy(() -> EngineConfigFactory.build(props))
                .isInstanceOf(UnknownAlarmReferenceException.class);
    }

    @Test
    void ruleMayNotReferenceItself() {
        props.setSuppressionRules(List.of(rule("web", "ALARM(cpu-high) OR ALARM(web)", null)));

        assertThatThrownBy(() -> EngineConfigFactory.build(props))
                .isInstanceOf(UnknownAlarmReferenceException.class);
    }

    @Test
    void compositesMayReferenceOtherComposites() {
        props.setSuppressionRules(List.of(
                rule("web", "ALARM(cpu-high) AND ALARM(hosts-unhealthy)", "network-outage"),
                rule("site", "ALARM(web) OR ALARM(network-outage)", null)));

        List<SuppressionRule> rules = EngineConfigFactory.buildRules(props);

        assertThat(rules).extracting(SuppressionRule::getName).containsExactly("web", "site");
        assertThat(rules.get(0).getSuppressorAlarmId()).isEqualTo("network-outage");
        assertThat(rules.get(1).referencedAlarms()).containsExactlyInAnyOrder("web", "network-outage");
    }

    @Test
    void duplicateRuleNamesFail() {
        props.setSuppressionRules(List.of(rule("web", "ALARM(cpu-high)", null), rule("web", "OK(cpu-high)", null)));

        assertThatThrownBy(() -> EngineConfigFactory.build(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void malformedExpressionFails() {
        props.setSuppressionRules(List.of(rule("web", "ALARM(cpu-high) AND", null)));

        assertThatThrownBy(() -> EngineConfigFactory.build(props))
                .isInstanceOf(MalformedExpressionException.class);
    }

    @Test
    void subscriptionsAreValidatedPerChannel() {
        assertThatThrownBy(() -> EngineConfigFactory.buildSubscriptions(List.of(
                subscription("CRITICAL", "SMS", "555-0100"))))
                .isInstanceOf(MalformedSubscriptionException.class);

        assertThatThrownBy(() -> EngineConfigFactory.buildSubscriptions(List.of(
                subscription("WARNING", "EMAIL", "ops.company.com"))))
                .isInstanceOf(MalformedSubscriptionException.class);

        assertThatThrownBy(() -> EngineConfigFactory.buildSubscriptions(List.of(
                subscription("LOUD", "EMAIL", "ops@company.com"))))
                .isInstanceOf(MalformedSubscriptionException.class);

        assertThatThrownBy(() -> EngineConfigFactory.buildSubscriptions(List.of(
                subscription("INFO", "QUEUE", "http://sqs.local/queue"))))
                .isInstanceOf(MalformedSubscriptionException.class);
    }

    @Test
    void autoConfirmOnlyForWebhooks() {
        AlertingProperties.SubscriptionEntry email = subscription("CRITICAL", "EMAIL", "oncall@company.com");
        email.setAutoConfirm(true);

        assertThatThrownBy(() -> EngineConfigFactory.buildSubscriptions(List.of(email)))
                .isInstanceOf(MalformedSubscriptionException.class);

        AlertingProperties.SubscriptionEntry webhook = subscription("CRITICAL", "WEBHOOK", "https://hooks.company.com/a");
        webhook.setAutoConfirm(true);

        List<Subscription> subscriptions = EngineConfigFactory.buildSubscriptions(List.of(webhook));
        assertThat(subscriptions).singleElement().satisfies(s -> {
            assertThat(s.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(s.getChannelType()).isEqualTo(ChannelType.WEBHOOK);
            assertThat(s.isAutoConfirm()).isTrue();
        });
    }

    @Test
    void identifierMatchingTheMaskFails() {
        AlertingProperties.IdentifierEntry entry = new AlertingProperties.IdentifierEntry();
        entry.setName("Brackets");
        entry.setPattern("\\[[A-Z]+\\]");
        entry.setAction("REDACT");

        assertThatThrownBy(() -> EngineConfigFactory.buildIdentifiers(List.of(entry)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mask");
    }

    @Test
    void identifierWithoutPatternMustBeBuiltIn() {
        AlertingProperties.IdentifierEntry entry = new AlertingProperties.IdentifierEntry();
        entry.setName("PassportNumber");

        assertThatThrownBy(() -> EngineConfigFactory.buildIdentifiers(List.of(entry)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidRetryPolicyFails() {
        props.getRetry().setMaxAttempts(0);
        assertThatThrownBy(() -> EngineConfigFactory.build(props)).isInstanceOf(ConfigurationException.class);

        props.getRetry().setMaxAttempts(3);
        props.getRetry().setBackoffBase(Duration.ZERO);
        assertThatThrownBy(() -> EngineConfigFactory.build(props)).isInstanceOf(ConfigurationException.class);
    }

    private static AlertingProperties.Rule rule(String name, String expression, String suppressor) {
        AlertingProperties.Rule rule = new AlertingProperties.Rule();
        rule.setName(name);
        rule.setExpression(expression);
        rule.setSuppressorAlarmId(suppressor);
        rule.setWaitPeriod(Duration.ofMinutes(2));
        rule.setExtensionPeriod(Duration.ofMinutes(10));
        return rule;
    }

    private static AlertingProperties.SubscriptionEntry subscription(String severity, String channel, String endpoint) {
        AlertingProperties.SubscriptionEntry entry = new AlertingProperties.SubscriptionEntry();
        entry.setSeverity(severity);
        entry.setChannelType(channel);
        entry.setEndpoint(endpoint);
        return entry;
    }
}
