package com.chartsignal.backend.service.indicator;

import com.chartsignal.backend.model.BollingerValue;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.IndicatorPoint;
import com.chartsignal.backend.model.MacdValue;
import com.chartsignal.backend.model.StochasticValue;
import com.chartsignal.backend.service.util.TechnicalAnalysisUtil;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Indicator calculations over an ascending candle series.
 *
 * Every method returns one point per candle that satisfies the lookback,
 * stamped with that candle's open time. Input shorter than the minimum
 * yields an empty list rather than an exception.
 */
@Service
public class IndicatorService {

    private static final Logger logger = LoggerFactory.getLogger(IndicatorService.class);

    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int RSI_PERIOD = 14;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_MULTIPLIER = 2.0;
    public static final int STOCHASTIC_K = 14;
    public static final int STOCHASTIC_D = 3;
    public static final int WILLIAMS_PERIOD = 14;
    public static final int MOMENTUM_PERIOD = 10;

    private static final double MIN_AVERAGE_LOSS = 0.0001;

    /**
     * Simple moving average of closes.
     */
    public List<IndicatorPoint<Double>> calculateSMA(List<Candle> candles, int period) {
        if (period <= 0 || candles.size() < period) {
            return Collections.emptyList();
        }

        List<IndicatorPoint<Double>> result = new ArrayList<>(candles.size() - period + 1);
        for (int i = period - 1; i < candles.size(); i++) {
            double sum = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                sum += candles.get(j).getClose();
            }
            result.add(new IndicatorPoint<>(candles.get(i).getOpenTime(), sum / period));
        }
        return result;
    }

    /**
     * Exponential moving average of closes, seeded with the SMA of the first {@code period} closes.
     */
    public List<IndicatorPoint<Double>> calculateEMA(List<Candle> candles, int period) {
        List<IndicatorPoint<Double>> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            closes.add(new IndicatorPoint<>(candle.getOpenTime(), candle.getClose()));
        }
        return emaOfSeries(closes, period);
    }

    /**
     * Same EMA recurrence applied to an already derived series.
     */
    public List<IndicatorPoint<Double>> emaOfSeries(List<IndicatorPoint<Double>> series, int period) {
        if (period <= 0 || series.size() < period) {
            return Collections.emptyList();
        }

        double multiplier = 2.0 / (period + 1);
        double seed = 0.0;
        for (int i = 0; i < period; i++) {
            seed += series.get(i).getValue();
        }
        seed /= period;

        List<IndicatorPoint<Double>> result = new ArrayList<>(series.size() - period + 1);
        result.add(new IndicatorPoint<>(series.get(period - 1).getTimestamp(), seed));

        double previous = seed;
        for (int i = period; i < series.size(); i++) {
            double ema = series.get(i).getValue() * multiplier + previous * (1 - multiplier);
            result.add(new IndicatorPoint<>(series.get(i).getTimestamp(), ema));
            previous = ema;
        }
        return result;
    }

    public List<IndicatorPoint<MacdValue>> calculateMACD(List<Candle> candles) {
        return calculateMACD(candles, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
    }

    /**
     * MACD line, signal line and histogram.
     *
     * @param candles      ascending candles
     * @param fastPeriod   fast EMA period
     * @param slowPeriod   slow EMA period
     * @param signalPeriod EMA period applied to the MACD line
     * @return points aligned to the tail of the series; empty if fewer than slow + signal candles
     */
    public List<IndicatorPoint<MacdValue>> calculateMACD(List<Candle> candles, int fastPeriod, int slowPeriod, int signalPeriod) {
        if (candles.size() < slowPeriod + signalPeriod) {
            return Collections.emptyList();
        }

        List<IndicatorPoint<Double>> fast = calculateEMA(candles, fastPeriod);
        List<IndicatorPoint<Double>> slow = calculateEMA(candles, slowPeriod);

        int length = Math.min(fast.size(), slow.size());
        int fastOffset = fast.size() - length;
        int slowOffset = slow.size() - length;

        List<IndicatorPoint<Double>> macdLine = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            double value = fast.get(fastOffset + i).getValue() - slow.get(slowOffset + i).getValue();
            macdLine.add(new IndicatorPoint<>(slow.get(slowOffset + i).getTimestamp(), value));
        }

        List<IndicatorPoint<Double>> signalLine = emaOfSeries(macdLine, signalPeriod);
        int resultLength = Math.min(macdLine.size(), signalLine.size());
        int macdOffset = macdLine.size() - resultLength;
        int signalOffset = signalLine.size() - resultLength;

        List<IndicatorPoint<MacdValue>> result = new ArrayList<>(resultLength);
        for (int i = 0; i < resultLength; i++) {
            IndicatorPoint<Double> macd = macdLine.get(macdOffset + i);
            double signal = signalLine.get(signalOffset + i).getValue();
            result.add(new IndicatorPoint<>(macd.getTimestamp(),
                    new MacdValue(macd.getValue(), signal, macd.getValue() - signal)));
        }
        return result;
    }

    public List<IndicatorPoint<Double>> calculateRSI(List<Candle> candles) {
        return calculateRSI(candles, RSI_PERIOD);
    }

    /**
     * Wilder RSI. The first reading is at index {@code period}; a zero average
     * loss is floored so the ratio stays finite.
     */
    public List<IndicatorPoint<Double>> calculateRSI(List<Candle> candles, int period) {
        if (period <= 0 || candles.size() < period + 1) {
            return Collections.emptyList();
        }

        int changes = candles.size() - 1;
        double[] gains = new double[changes];
        double[] losses = new double[changes];
        for (int i = 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            gains[i - 1] = change > 0 ? change : 0.0;
            losses[i - 1] = change < 0 ? -change : 0.0;
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 0; i < period; i++) {
            avgGain += gains[i];
            avgLoss += losses[i];
        }
        avgGain /= period;
        avgLoss /= period;

        List<IndicatorPoint<Double>> result = new ArrayList<>(changes - period + 1);
        result.add(new IndicatorPoint<>(candles.get(period).getOpenTime(), rsi(avgGain, avgLoss)));

        for (int i = period; i < changes; i++) {
            avgGain = (avgGain * (period - 1) + gains[i]) / period;
            avgLoss = (avgLoss * (period - 1) + losses[i]) / period;
            result.add(new IndicatorPoint<>(candles.get(i + 1).getOpenTime(), rsi(avgGain, avgLoss)));
        }
        return result;
    }

    private double rsi(double avgGain, double avgLoss) {
        double rs = avgGain / (avgLoss == 0 ? MIN_AVERAGE_LOSS : avgLoss);
        return 100 - (100 / (1 + rs));
    }

    public List<IndicatorPoint<BollingerValue>> calculateBollingerBands(List<Candle> candles) {
        return calculateBollingerBands(candles, BOLLINGER_PERIOD, BOLLINGER_MULTIPLIER);
    }

    public List<IndicatorPoint<BollingerValue>> calculateBollingerBands(List<Candle> candles, int period, double multiplier) {
        if (period <= 0 || candles.size() < period) {
            return Collections.emptyList();
        }

        double[] closes = TechnicalAnalysisUtil.closes(candles);
        List<IndicatorPoint<BollingerValue>> result = new ArrayList<>(candles.size() - period + 1);
        for (int i = period - 1; i < candles.size(); i++) {
            int begin = i - period + 1;
            double middle = StatUtils.mean(closes, begin, period);
            // population deviation, divides by n
            double std = Math.sqrt(StatUtils.populationVariance(closes, middle, begin, period));

            result.add(new IndicatorPoint<>(candles.get(i).getOpenTime(),
                    new BollingerValue(middle + std * multiplier, middle, middle - std * multiplier)));
        }
        return result;
    }

    public List<IndicatorPoint<StochasticValue>> calculateStochastic(List<Candle> candles) {
        return calculateStochastic(candles, STOCHASTIC_K, STOCHASTIC_D);
    }

    /**
     * %K over {@code kPeriod} and %D as the SMA of %K over {@code dPeriod}.
     */
    public List<IndicatorPoint<StochasticValue>> calculateStochastic(List<Candle> candles, int kPeriod, int dPeriod) {
        if (kPeriod <= 0 || dPeriod <= 0 || candles.size() < kPeriod) {
            return Collections.emptyList();
        }

        List<IndicatorPoint<Double>> kValues = new ArrayList<>();
        for (int i = kPeriod - 1; i < candles.size(); i++) {
            double highest = highestHigh(candles, i - kPeriod + 1, i);
            double lowest = lowestLow(candles, i - kPeriod + 1, i);
            double k = (candles.get(i).getClose() - lowest) / (highest - lowest) * 100;
            kValues.add(new IndicatorPoint<>(candles.get(i).getOpenTime(), k));
        }

        List<IndicatorPoint<StochasticValue>> result = new ArrayList<>();
        for (int i = dPeriod - 1; i < kValues.size(); i++) {
            double sum = 0.0;
            for (int j = i - dPeriod + 1; j <= i; j++) {
                sum += kValues.get(j).getValue();
            }
            IndicatorPoint<Double> k = kValues.get(i);
            result.add(new IndicatorPoint<>(k.getTimestamp(), new StochasticValue(k.getValue(), sum / dPeriod)));
        }
        return result;
    }

    public List<IndicatorPoint<Double>> calculateWilliamsR(List<Candle> candles) {
        return calculateWilliamsR(candles, WILLIAMS_PERIOD);
    }

    public List<IndicatorPoint<Double>> calculateWilliamsR(List<Candle> candles, int period) {
        if (period <= 0 || candles.size() < period) {
            return Collections.emptyList();
        }

        List<IndicatorPoint<Double>> result = new ArrayList<>(candles.size() - period + 1);
        for (int i = period - 1; i < candles.size(); i++) {
            double highest = highestHigh(candles, i - period + 1, i);
            double lowest = lowestLow(candles, i - period + 1, i);
            double value = (highest - candles.get(i).getClose()) / (highest - lowest) * -100;
            result.add(new IndicatorPoint<>(candles.get(i).getOpenTime(), value));
        }
        return result;
    }

    public List<IndicatorPoint<Double>> calculateMomentum(List<Candle> candles) {
        return calculateMomentum(candles, MOMENTUM_PERIOD);
    }

    /**
     * Percent rate of change over {@code period} candles.
     */
    public List<IndicatorPoint<Double>> calculateMomentum(List<Candle> candles, int period) {
        if (period <= 0 || candles.size() < period + 1) {
            return Collections.emptyList();
        }

        List<IndicatorPoint<Double>> result = new ArrayList<>(candles.size() - period);
        for (int i = period; i < candles.size(); i++) {
            double previous = candles.get(i - period).getClose();
            double value = (candles.get(i).getClose() - previous) / previous * 100;
            result.add(new IndicatorPoint<>(candles.get(i).getOpenTime(), value));
        }
        return result;
    }

    public Map<IndicatorType, List<? extends IndicatorPoint<?>>> calculateAllIndicators(List<Candle> candles) {
        return calculateIndicators(candles, EnumSet.allOf(IndicatorType.class));
    }

    /**
     * Computes the requested indicators. An indicator that fails is logged and
     * left out of the result so the others are still returned.
     */
    public Map<IndicatorType, List<? extends IndicatorPoint<?>>> calculateIndicators(List<Candle> candles,
                                                                                   Collection<IndicatorType> types) {
        Map<IndicatorType, List<? extends IndicatorPoint<?>>> results = new EnumMap<>(IndicatorType.class);
        for (IndicatorType type : types) {
            try {
                results.put(type, calculate(type, candles));
            } catch (RuntimeException e) {
                logger.error("Failed to calculate indicator {}: {}", type, e.getMessage(), e);
            }
        }
        return results;
    }

    private List<? extends IndicatorPoint<?>> calculate(IndicatorType type, List<Candle> candles) {
        switch (type) {
            case SMA20:
                return calculateSMA(candles, 20);
            case SMA50:
                return calculateSMA(candles, 50);
            case EMA12:
                return calculateEMA(candles, 12);
            case EMA26:
                return calculateEMA(candles, 26);
            case MACD:
                return calculateMACD(candles);
            case RSI:
                return calculateRSI(candles);
            case BOLLINGER:
                return calculateBollingerBands(candles);
            case STOCHASTIC:
                return calculateStochastic(candles);
            case WILLIAMS_R:
                return calculateWilliamsR(candles);
            case MOMENTUM:
                return calculateMomentum(candles);
            default:
                throw new IllegalArgumentException("Unsupported indicator: " + type);
        }
    }

    private static double highestHigh(List<Candle> candles, int from, int to) {
        double highest = Double.NEGATIVE_INFINITY;
        for (int i = from; i <= to; i++) {
            highest = Math.max(highest, candles.get(i).getHigh());
        }
        return highest;
    }

    private static double lowestLow(List<Candle> candles, int from, int to) {
        double lowest = Double.POSITIVE_INFINITY;
        for (int i = from; i <= to; i++) {
            lowest = Math.min(lowest, candles.get(i).getLow());
        }
        return lowest;
    }
}
