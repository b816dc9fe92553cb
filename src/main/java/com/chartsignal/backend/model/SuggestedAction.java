package com.chartsignal.backend.model;

public enum SuggestedAction {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL,
    WAIT
}
