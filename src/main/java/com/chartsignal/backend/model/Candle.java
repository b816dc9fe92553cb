package com.chartsignal.backend.model;

import java.util.Objects;

/**
 * One OHLCV bar. Series handed to the analysis services are ordered by
 * {@code openTime} ascending and are never modified after construction.
 */
public final class Candle {
    private final long openTime;
    private final long closeTime;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;
    private final double quoteVolume;
    private final long tradeCount;

    public Candle(long openTime, long closeTime, double open, double high, double low, double close,
                  double volume, double quoteVolume, long tradeCount) {
        this.openTime = openTime;
        this.closeTime = closeTime;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.quoteVolume = quoteVolume;
        this.tradeCount = tradeCount;
    }

    public Candle(long openTime, double open, double high, double low, double close, double volume) {
        this(openTime, openTime, open, high, low, close, volume, volume * close, 0L);
    }

    public long getOpenTime() {
        return openTime;
    }

    public long getCloseTime() {
        return closeTime;
    }

    public double getOpen() {
        return open;
    }

    public double getHigh() {
        return high;
    }

    public double getLow() {
        return low;
    }

    public double getClose() {
        return close;
    }

    public double getVolume() {
        return volume;
    }

    public double getQuoteVolume() {
        return quoteVolume;
    }

    public long getTradeCount() {
        return tradeCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Candle)) return false;
        Candle that = (Candle) o;
        return openTime == that.openTime
                && closeTime == that.closeTime
                && Double.compare(that.open, open) == 0
                && Double.compare(that.high, high) == 0
                && Double.compare(that.low, low) == 0
                && Double.compare(that.close, close) == 0
                && Double.compare(that.volume, volume) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(openTime, closeTime, open, high, low, close, volume);
    }

    @Override
    public String toString() {
        return "Candle{" +
                "openTime=" + openTime +
                ", open=" + open +
                ", high=" + high +
                ", low=" + low +
                ", close=" + close +
                ", volume=" + volume +
                '}';
    }
}
