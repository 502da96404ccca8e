package com.company.alerting.config;

import com.company.alerting.suppression.AlarmStateTable;
import com.company.alerting.suppression.SuppressionEngine;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlarmStateTable stateTable;
    private final SuppressionEngine suppressionEngine;

    @Bean
    public MeterBinder engineMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("alerts.alarms.tracked", stateTable, AlarmStateTable::size)
                    .description("Alarms with a known state")
                    .register(reg);

            Gauge.builder("alerts.suppression.held", suppressionEngine, SuppressionEngine::heldCount)
                    .description("Composite notifications held in a wait period")
                    .register(reg);

            log.info("Engine metrics registered");
        };
    }
}
