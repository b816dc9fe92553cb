package com.chartsignal.backend.model;

public enum LevelType {
    SUPPORT,
    RESISTANCE
}
