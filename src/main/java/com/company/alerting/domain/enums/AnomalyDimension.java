package com.company.alerting.domain.enums;

public enum AnomalyDimension {
    SERVICE,
    LINKED_ACCOUNT,
    CUSTOM;

    public static AnomalyDimension fromString(String dimension) {
        if (dimension == null) {
            return SERVICE;
        }
        try {
            return AnomalyDimension.valueOf(dimension.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return CUSTOM;
        }
    }
}
