package com.company.alerting.domain;

import com.company.alerting.domain.enums.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Classified event decorated with operational context, ready for routing.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichedEvent {
    AlertEvent event;
    String runbookUrl;
    Map<String, String> resourceTags;
    String environment;

    // Identifier names that matched audit rules, sorted and distinct
    List<String> auditFlags;

    Instant enrichedAt;

    @JsonIgnore
    public String getEventId() {
        return event.getId();
    }

    @JsonIgnore
    public Severity getSeverity() {
        return event.getSeverity();
    }
}
