package com.company.alerting.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import com.company.alerting.exception.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Engine wiring: validated config, clock, delivery executors, retry policy and HTTP clients.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(AlertingProperties.class)
public class EngineConfiguration {

    public static final String DELIVERY_RETRY = "alertDelivery";

    @Bean
    public EngineConfig engineConfig(AlertingProperties properties) {
        return EngineConfigFactory.build(properties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Runs whole deliveries (retry loop included) so the router never blocks on a slow channel.
     */
    @Bean(name = "deliveryExecutor", destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(AlertingProperties properties) {
        return Executors.newFixedThreadPool(properties.getDeliveryThreads(),
                new CustomizableThreadFactory("alert-delivery-"));
    }

    /**
     * Runs single adapter calls under the attempt timeout.
     */
    @Bean(name = "attemptExecutor", destroyMethod = "shutdownNow")
    public ExecutorService attemptExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("alert-attempt-"));
    }

    @Bean
    public RetryRegistry deliveryRetryRegistry(EngineConfig config) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.getBackoffBase(), config.getBackoffMultiplier()))
                .retryOnException(e -> e instanceof DeliveryException de && de.isRetryable())
                .failAfterMaxAttempts(false)
                .build();

        RetryRegistry registry = RetryRegistry.of(retryConfig);
        log.info("Delivery retry: maxAttempts={}, backoffBase={}, multiplier={}",
                config.getMaxAttempts(), config.getBackoffBase(), config.getBackoffMultiplier());
        return registry;
    }

    @Bean
    public TimeLimiter deliveryTimeLimiter(EngineConfig config) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(config.getAttemptTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    @Qualifier("webhookRestTemplate")
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, EngineConfig config) {
        return builder
                .setConnectTimeout(config.getWebhookConnectTimeout())
                .setReadTimeout(config.getWebhookReadTimeout())
                .build();
    }

    @Bean
    @Qualifier("confirmationRestTemplate")
    public RestTemplate confirmationRestTemplate(RestTemplateBuilder builder, EngineConfig config) {
        return builder
                .setConnectTimeout(config.getWebhookConnectTimeout())
                .setReadTimeout(config.getWebhookConfirmationTimeout())
                .build();
    }
}
