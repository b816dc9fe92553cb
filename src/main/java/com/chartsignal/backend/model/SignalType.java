package com.chartsignal.backend.model;

public enum SignalType {
    BUY,
    SELL,
    NEUTRAL
}
