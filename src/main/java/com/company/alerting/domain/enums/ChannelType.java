package com.company.alerting.domain.enums;

public enum ChannelType {
    EMAIL,
    SMS,
    WEBHOOK,
    QUEUE,
    FUNCTION;

    public static ChannelType fromString(String type) {
        if (type == null) {
            return null;
        }
        try {
            return ChannelType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
