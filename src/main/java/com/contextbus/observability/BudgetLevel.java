package com.contextbus.observability;

public enum BudgetLevel {
    INFO,
    WARNING,
    CRITICAL,
    EMERGENCY
}
