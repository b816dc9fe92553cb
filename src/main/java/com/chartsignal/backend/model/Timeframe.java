package com.chartsignal.backend.model;

import java.util.concurrent.TimeUnit;

/**
 * Candle timeframes the analysis works with. The weight orders timeframes
 * by significance when levels and trends from several of them are combined.
 */
public enum Timeframe {
    M15("15m", 1, "15", TimeUnit.MINUTES.toMillis(15)),
    H1("1h", 2, "60", TimeUnit.HOURS.toMillis(1)),
    H4("4h", 3, "240", TimeUnit.HOURS.toMillis(4)),
    D1("1d", 4, "D", TimeUnit.DAYS.toMillis(1));

    private final String code;
    private final int weight;
    private final String bybitInterval;
    private final long durationMillis;

    Timeframe(String code, int weight, String bybitInterval, long durationMillis) {
        this.code = code;
        this.weight = weight;
        this.bybitInterval = bybitInterval;
        this.durationMillis = durationMillis;
    }

    public String getCode() {
        return code;
    }

    public int getWeight() {
        return weight;
    }

    public String getBybitInterval() {
        return bybitInterval;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public static Timeframe fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Timeframe cannot be null");
        }
        String normalized = value.trim();
        for (Timeframe timeframe : values()) {
            if (timeframe.code.equalsIgnoreCase(normalized) || timeframe.name().equalsIgnoreCase(normalized)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe: " + value);
    }

    @Override
    public String toString() {
        return code;
    }
}
