package com.company.alerting.util;

import com.company.alerting.domain.AlertEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable Redis keys for delivery dedup and ingestion idempotency.
 * Dimension order never affects the key.
 */
public final class DedupKeys {

    public static final String DELIVERY_PREFIX = "alert:dedup:";
    public static final String INGESTION_PREFIX = "alert:ingest:";

    private static final char FIELD_SEPARATOR = '\u001f';
    private static final char ENTRY_SEPARATOR = '\u001e';

    private DedupKeys() {
    }

    /**
     * Key over (source, metricName, dimensions, state).
     */
    public static String deliveryKey(AlertEvent event) {
        return DELIVERY_PREFIX + sha256(canonical(event));
    }

    /**
     * Key over (source, metricName, dimensions, state, timestamp).
     */
    public static String ingestionKey(AlertEvent event) {
        String canonical = canonical(event) + FIELD_SEPARATOR
                + (event.getTimestamp() != null ? event.getTimestamp().toEpochMilli() : "");
        return INGESTION_PREFIX + sha256(canonical);
    }

    static String canonical(AlertEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append(event.getSource() != null ? event.getSource().name() : "").append(FIELD_SEPARATOR);
        sb.append(event.getMetricName() != null ? event.getMetricName() : "").append(FIELD_SEPARATOR);

        Map<String, String> dimensions = event.getDimensions() != null
                ? new TreeMap<>(event.getDimensions())
                : Map.of();
        dimensions.forEach((k, v) -> sb.append(k).append('=').append(v).append(ENTRY_SEPARATOR));

        sb.append(FIELD_SEPARATOR);
        sb.append(event.getState() != null ? event.getState().name() : "");
        return sb.toString();
    }

    public static String sha256(String data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(data.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
