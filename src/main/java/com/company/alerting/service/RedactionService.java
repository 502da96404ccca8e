package com.company.alerting.service;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.AlertEvent;
import com.company.alerting.domain.DataIdentifier;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.IdentifierAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Masks or flags sensitive data in {@code description} and {@code rawPayload}.
 * Applying it twice yields the same event as applying it once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RedactionService {

    public static final String MASK = "[REDACTED]";

    // Bounds the fixpoint loop for patterns that match around an inserted mask
    private static final int MAX_PASSES = 8;

    private final EngineConfig config;

    public EnrichedEvent redact(EnrichedEvent enriched) {
        return redact(enriched, config.getDataIdentifiers());
    }

    public EnrichedEvent redact(EnrichedEvent enriched, List<DataIdentifier> identifiers) {
        if (identifiers.isEmpty()) {
            return enriched;
        }

        List<DataIdentifier> redacting = new ArrayList<>();
        List<DataIdentifier> auditing = new ArrayList<>();
        for (DataIdentifier identifier : identifiers) {
            (identifier.getAction() == IdentifierAction.AUDIT ? auditing : redacting).add(identifier);
        }

        AlertEvent event = enriched.getEvent();
        String description = mask(event.getDescription(), redacting);
        String rawPayload = mask(event.getRawPayload(), redacting);

        // Audit runs on the masked text so a second pass sees the same input
        Set<String> flags = new TreeSet<>(enriched.getAuditFlags() != null ? enriched.getAuditFlags() : List.of());
        for (DataIdentifier identifier : auditing) {
            if (matches(description, identifier) || matches(rawPayload, identifier)) {
                flags.add(identifier.getName());
            }
        }

        if (!flags.isEmpty()) {
            log.info("Event {} flagged for audit: {}", event.getId(), flags);
        }

        return enriched.toBuilder()
                .event(event.toBuilder()
                        .description(description)
                        .rawPayload(rawPayload)
                        .build())
                .auditFlags(List.copyOf(flags))
                .build();
    }

    private String mask(String text, List<DataIdentifier> identifiers) {
        if (text == null || identifiers.isEmpty()) {
            return text;
        }
        String current = text;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = current;
            for (DataIdentifier identifier : identifiers) {
                next = identifier.getPattern().matcher(next).replaceAll(Matcher.quoteReplacement(MASK));
            }
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private boolean matches(String text, DataIdentifier identifier) {
        return text != null && identifier.getPattern().matcher(text).find();
    }
}
