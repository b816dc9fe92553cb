package com.chartsignal.backend.model;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
