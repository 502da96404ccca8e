package com.company.alerting.service;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.EnrichedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class EnrichmentService {

    private final EngineConfig config;
    private final Clock clock;

    /**
     * Attaches runbook link, resource tags and environment. The event must already be classified.
     */
    public EnrichedEvent enrich(AlertEvent event) {
        if (event.getSeverity() == null || event.getSource() == null) {
            throw new IllegalStateException("Cannot enrich unclassified event " + event.getId());
        }

        return EnrichedEvent.builder()
                .event(event)
                .runbookUrl(runbookUrl(event))
                .resourceTags(event.getResourceTags() != null ? Map.copyOf(event.getResourceTags()) : Map.of())
                .environment(config.getEnvironment())
                .auditFlags(List.of())
                .enrichedAt(clock.instant())
                .build();
    }

    String runbookUrl(AlertEvent event) {
        String override = config.getRunbookOverrides().get(event.alarmKey());
        if (override != null) {
            return override;
        }
        return config.getRunbookUrlTemplate()
                .replace("{severity}", event.getSeverity().slug())
                .replace("{source}", event.getSource().slug());
    }
}
