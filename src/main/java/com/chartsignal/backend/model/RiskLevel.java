package com.chartsignal.backend.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
