package com.chartsignal.backend.service.market;

import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.Timeframe;

import java.util.List;

/**
 * Source of historical candles.
 */
public interface MarketDataProvider {

    /**
     * @param symbol    instrument, e.g. BTCUSDT
     * @param timeframe candle duration
     * @param limit     maximum number of candles, newest kept
     * @param startTime inclusive lower bound in epoch millis, or null
     * @param endTime   inclusive upper bound in epoch millis, or null
     * @return candles ascending by open time without duplicates
     * @throws MarketDataException when the source cannot deliver
     */
    List<Candle> getCandles(String symbol, Timeframe timeframe, int limit, Long startTime, Long endTime);

    default List<Candle> getCandles(String symbol, Timeframe timeframe, int limit) {
        return getCandles(symbol, timeframe, limit, null, null);
    }
}
