package com.company.alerting.domain.enums;

public enum ComparisonOperator {
    GREATER_THAN_THRESHOLD("GreaterThanThreshold"),
    GREATER_THAN_OR_EQUAL_TO_THRESHOLD("GreaterThanOrEqualToThreshold"),
    LESS_THAN_THRESHOLD("LessThanThreshold"),
    LESS_THAN_OR_EQUAL_TO_THRESHOLD("LessThanOrEqualToThreshold");

    private final String wireName;

    ComparisonOperator(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isUpward() {
        return this == GREATER_THAN_THRESHOLD || this == GREATER_THAN_OR_EQUAL_TO_THRESHOLD;
    }

    public boolean isDownward() {
        return !isUpward();
    }

    public static ComparisonOperator fromString(String operator) {
        if (operator == null || operator.isBlank()) {
            return null;
        }
        String trimmed = operator.trim();
        for (ComparisonOperator candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(trimmed) || candidate.name().equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        return null;
    }
}
