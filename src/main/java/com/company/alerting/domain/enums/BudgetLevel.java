package com.company.alerting.domain.enums;

public enum BudgetLevel {
    NONE,
    WARNING,
    CRITICAL
}
