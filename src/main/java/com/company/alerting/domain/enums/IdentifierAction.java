package com.company.alerting.domain.enums;

public enum IdentifierAction {
    REDACT,
    AUDIT;

    public static IdentifierAction fromString(String action) {
        if (action == null) {
            return REDACT;
        }
        try {
            return IdentifierAction.valueOf(action.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return REDACT;
        }
    }
}
