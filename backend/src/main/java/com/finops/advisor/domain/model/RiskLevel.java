package com.finops.advisor.domain.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
