package com.company.alerting.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.resources.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenTelemetryConfig {

    static final String SERVICE_NAME = "alert-engine";
    static final String INSTRUMENTATION_SCOPE = "com.company.alerting.delivery";

    static final AttributeKey<String> SERVICE_NAME_KEY = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> ENVIRONMENT_KEY = AttributeKey.stringKey("deployment.environment");

    @Bean
    public OpenTelemetry openTelemetry(EngineConfig config) {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addResourceCustomizer((resource, properties) ->
                        resource.merge(engineResource(config.getEnvironment(), properties)))
                .build()
                .getOpenTelemetrySdk();
    }

    /**
     * Delivery spans carry the engine's environment; an explicit otel.service.name still wins.
     */
    static Resource engineResource(String environment, ConfigProperties properties) {
        AttributesBuilder attributes = Attributes.builder()
                .put(ENVIRONMENT_KEY, environment);
        if (properties.getString("otel.service.name") == null) {
            attributes.put(SERVICE_NAME_KEY, SERVICE_NAME);
        }
        return Resource.create(attributes.build());
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }
}
