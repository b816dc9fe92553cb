package com.chartsignal.backend.model;

public enum PatternType {
    BOX,
    BREAKOUT,
    UPTREND,
    DOWNTREND,
    DOUBLE_TOP,
    DOUBLE_BOTTOM,
    HEAD_AND_SHOULDERS
}
