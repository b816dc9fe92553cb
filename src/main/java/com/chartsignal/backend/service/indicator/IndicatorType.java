package com.chartsignal.backend.service.indicator;

/**
 * The closed set of indicators computed by {@link IndicatorService#calculateIndicators}.
 */
public enum IndicatorType {
    SMA20("sma20"),
    SMA50("sma50"),
    EMA12("ema12"),
    EMA26("ema26"),
    MACD("macd"),
    RSI("rsi"),
    BOLLINGER("bollinger"),
    STOCHASTIC("stochastic"),
    WILLIAMS_R("williams"),
    MOMENTUM("momentum");

    private final String key;

    IndicatorType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static IndicatorType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Indicator name cannot be null");
        }
        for (IndicatorType type : values()) {
            if (type.key.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown indicator: " + value);
    }
}
