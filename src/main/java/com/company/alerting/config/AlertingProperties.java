package com.company.alerting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code alerting.*} properties. Validated and frozen into {@link EngineConfig} at startup.
 */
@Data
@ConfigurationProperties(prefix = "alerting")
public class AlertingProperties {

    private String environment = "dev";

    private String runbookUrlTemplate = "https://runbooks.company.com/{severity}/{source}";

    // alarm name -> runbook URL
    private Map<String, String> runbookOverrides = new HashMap<>();

    private Duration dedupWindow = Duration.ofMinutes(5);
    private Duration idempotencyWindow = Duration.ofHours(24);
    private Duration resultWait = Duration.ofSeconds(5);

    // Billing metrics lag 4-6 hours behind
    private Duration baselineFreshness = Duration.ofHours(6);

    private String aggregateQueueUrl;

    private int deliveryThreads = 16;

    // Alarm identifiers the upstream collaborator reports
    private List<String> alarms = new ArrayList<>();

    private Retry retry = new Retry();
    private Budget budget = new Budget();
    private List<Rule> suppressionRules = new ArrayList<>();
    private List<Monitor> anomalyMonitors = new ArrayList<>();
    private List<SubscriptionEntry> subscriptions = new ArrayList<>();
    private List<IdentifierEntry> redactionIdentifiers = new ArrayList<>();
    private Webhook webhook = new Webhook();
    private Email email = new Email();
    private Aws aws = new Aws();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration attemptTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Budget {
        // No budget alarms when unset
        private Double amount;
        private double warningPct = 80;
        private double criticalPct = 100;
        private String metricName = "EstimatedCharges";
    }

    @Data
    public static class Rule {
        private String name;
        private String expression;
        private String suppressorAlarmId;
        private Duration waitPeriod = Duration.ZERO;
        private Duration extensionPeriod = Duration.ZERO;
        private String severity = "CRITICAL";
    }

    @Data
    public static class Monitor {
        private String name;
        private String dimension;
        private double thresholdAbsolute;
        private double thresholdPercentage;
        private String frequency;
    }

    @Data
    public static class SubscriptionEntry {
        private String severity;
        private String channelType;
        private String endpoint;
        private boolean autoConfirm;
    }

    @Data
    public static class IdentifierEntry {
        private String name;
        private String pattern;
        private String action;
    }

    @Data
    public static class Webhook {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        private Duration confirmationTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Email {
        private String fromAddress = "alerts@company.com";
    }

    @Data
    public static class Aws {
        private String region = "us-east-1";
    }
}
