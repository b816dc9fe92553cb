package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.model.AnalysisFailure;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.IndicatorPoint;
import com.chartsignal.backend.model.MultiTimeframeTrend;
import com.chartsignal.backend.model.RiskLevel;
import com.chartsignal.backend.model.SuggestedAction;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.model.TimeframeTrend;
import com.chartsignal.backend.model.TradingSuggestion;
import com.chartsignal.backend.model.TrendAlignment;
import com.chartsignal.backend.model.TrendType;
import com.chartsignal.backend.service.indicator.IndicatorService;
import com.chartsignal.backend.service.util.TechnicalAnalysisUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies the EMA trend of each timeframe and combines the timeframes into
 * an overall trend, an alignment measure and a trading suggestion.
 */
@Service
public class MultiTimeframeTrendService {

    private static final Logger logger = LoggerFactory.getLogger(MultiTimeframeTrendService.class);

    public static final int MIN_CANDLES = 120;

    private static final int SLOPE_WINDOW = 10;
    private static final int MOMENTUM_WINDOW = 5;
    private static final int CONSISTENCY_WINDOW = 10;
    private static final int VOLATILITY_WINDOW = 20;
    private static final int DIVERGENCE_WINDOW = 20;
    private static final int MIN_ALIGNED_TIMEFRAMES = 3;

    private final IndicatorService indicatorService;

    public MultiTimeframeTrendService(IndicatorService indicatorService) {
        this.indicatorService = indicatorService;
    }

    /**
     * Trend per timeframe plus the combined view. Timeframes with too few candles are
     * left out and reported in {@link MultiTimeframeTrend#getFailures()}.
     */
    public MultiTimeframeTrend analyze(String symbol, Map<Timeframe, List<Candle>> candlesByTimeframe) {
        Map<Timeframe, TimeframeTrend> trends = new EnumMap<>(Timeframe.class);
        List<AnalysisFailure> failures = new ArrayList<>();
        long timestamp = 0L;

        for (Map.Entry<Timeframe, List<Candle>> entry : candlesByTimeframe.entrySet()) {
            List<Candle> candles = entry.getValue();
            Optional<TimeframeTrend> trend = analyzeTimeframe(entry.getKey(), candles);
            if (trend.isPresent()) {
                trends.put(entry.getKey(), trend.get());
                timestamp = Math.max(timestamp, TechnicalAnalysisUtil.last(candles).getOpenTime());
            } else {
                failures.add(new AnalysisFailure("trend", entry.getKey().getCode(),
                        "Insufficient candles: " + (candles == null ? 0 : candles.size())));
            }
        }

        MultiTimeframeTrend result = combine(symbol, trends, failures);
        result.setTimestamp(timestamp);
        return result;
    }

    /**
     * @return the trend of one timeframe, empty when fewer than {@value #MIN_CANDLES} candles are given
     */
    public Optional<TimeframeTrend> analyzeTimeframe(Timeframe timeframe, List<Candle> candles) {
        if (candles == null || candles.size() < MIN_CANDLES) {
            logger.warn("Not enough candles for {} trend: {}", timeframe, candles == null ? 0 : candles.size());
            return Optional.empty();
        }

        double[] closes = TechnicalAnalysisUtil.closes(candles);
        double currentPrice = closes[closes.length - 1];

        List<IndicatorPoint<Double>> ema20Series = indicatorService.calculateEMA(candles, 20);
        double ema20 = lastValue(ema20Series);
        double ema60 = lastValue(indicatorService.calculateEMA(candles, 60));
        double ema120 = lastValue(indicatorService.calculateEMA(candles, 120));

        double[] ema20Values = new double[ema20Series.size()];
        for (int i = 0; i < ema20Series.size(); i++) {
            ema20Values[i] = ema20Series.get(i).getValue();
        }

        TrendType trend = determineTrend(currentPrice, ema20, ema60, ema120, slope(tail(ema20Values, SLOPE_WINDOW)));
        double strength = calculateTrendStrength(currentPrice, ema20, ema60, ema120, closes);
        double confidence = calculateConfidence(trend, strength, closes);
        boolean divergence = detectDivergence(closes, ema20Values);

        int roundedStrength = (int) Math.round(strength);
        int roundedConfidence = (int) Math.round(confidence);

        return Optional.of(TimeframeTrend.builder()
                .timeframe(timeframe)
                .trend(trend)
                .confidence(roundedConfidence)
                .trendStrength(roundedStrength)
                .currentPrice(currentPrice)
                .ema20(ema20)
                .ema60(ema60)
                .ema120(ema120)
                .divergence(divergence)
                .analysis(describe(timeframe, trend, strength, confidence, divergence))
                .build());
    }

    TrendType determineTrend(double price, double ema20, double ema60, double ema120, double ema20Slope) {
        if (price > ema20 && ema20 > ema60 && ema60 > ema120) {
            double aboveEma = (price - ema20) / ema20;
            if (ema20Slope > 0.002 && aboveEma > 0.05) {
                return TrendType.STRONG_UPTREND;
            }
            if (ema20Slope > 0.001) {
                return TrendType.UPTREND;
            }
            return TrendType.WEAK_UPTREND;
        }

        if (price < ema20 && ema20 < ema60 && ema60 < ema120) {
            double belowEma = (ema20 - price) / ema20;
            if (ema20Slope < -0.002 && belowEma > 0.05) {
                return TrendType.STRONG_DOWNTREND;
            }
            if (ema20Slope < -0.001) {
                return TrendType.DOWNTREND;
            }
            return TrendType.WEAK_DOWNTREND;
        }

        return TrendType.RANGING;
    }

    double calculateTrendStrength(double price, double ema20, double ema60, double ema120, double[] closes) {
        double strength = 0;

        boolean fullUp = price > ema20 && ema20 > ema60 && ema60 > ema120;
        boolean fullDown = price < ema20 && ema20 < ema60 && ema60 < ema120;
        if (fullUp || fullDown) {
            strength += 40;
        } else if ((price > ema20 && ema20 > ema60) || (price < ema20 && ema20 < ema60)) {
            strength += 25;
        }

        double spread2060 = Math.abs(ema20 - ema60) / Math.max(ema20, ema60);
        double spread60120 = Math.abs(ema60 - ema120) / Math.max(ema60, ema120);
        strength += Math.min((spread2060 + spread60120) / 2 * 400, 20);

        double[] recent5 = tail(closes, MOMENTUM_WINDOW);
        double momentum = (recent5[recent5.length - 1] - recent5[0]) / recent5[0];
        strength += Math.min(Math.abs(momentum) * 500, 20);

        double[] recent10 = tail(closes, CONSISTENCY_WINDOW);
        boolean upward = price > ema20 && ema20 > ema60;
        int consistentBars = 0;
        for (int i = 1; i < recent10.length; i++) {
            if (upward ? recent10[i] > recent10[i - 1] : recent10[i] < recent10[i - 1]) {
                consistentBars++;
            }
        }
        strength += (double) consistentBars / (recent10.length - 1) * 20;

        return Math.min(strength, 100);
    }

    double calculateConfidence(TrendType trend, double strength, double[] closes) {
        double confidence = strength * 0.7;
        if (trend.isStrong()) {
            confidence += 15;
        } else if (trend != TrendType.RANGING) {
            confidence += 10;
        }

        double volatility = returnVolatility(tail(closes, VOLATILITY_WINDOW));
        if (volatility < 0.02) {
            confidence += 10;
        } else if (volatility > 0.05) {
            confidence -= 10;
        }
        return TechnicalAnalysisUtil.clamp(confidence, 0, 100);
    }

    /**
     * Price near its recent extreme while the EMA stays well away from its own.
     */
    boolean detectDivergence(double[] closes, double[] ema20Values) {
        if (closes.length < DIVERGENCE_WINDOW || ema20Values.length < DIVERGENCE_WINDOW) {
            return false;
        }
        double[] prices = tail(closes, DIVERGENCE_WINDOW);
        double[] emas = tail(ema20Values, DIVERGENCE_WINDOW);

        double priceHigh = Double.NEGATIVE_INFINITY;
        double priceLow = Double.POSITIVE_INFINITY;
        double emaHigh = Double.NEGATIVE_INFINITY;
        double emaLow = Double.POSITIVE_INFINITY;
        for (int i = 0; i < DIVERGENCE_WINDOW; i++) {
            priceHigh = Math.max(priceHigh, prices[i]);
            priceLow = Math.min(priceLow, prices[i]);
            emaHigh = Math.max(emaHigh, emas[i]);
            emaLow = Math.min(emaLow, emas[i]);
        }

        double lastPrice = prices[prices.length - 1];
        double lastEma = emas[emas.length - 1];
        return (lastPrice > priceHigh * 0.98 && lastEma < emaHigh * 0.95)
                || (lastPrice < priceLow * 1.02 && lastEma > emaLow * 1.05);
    }

    /**
     * Combines already classified timeframes.
     */
    public MultiTimeframeTrend combine(String symbol, Map<Timeframe, TimeframeTrend> trends,
                                       List<AnalysisFailure> failures) {
        if (trends.isEmpty()) {
            logger.warn("No timeframe trend available for {}", symbol);
            return MultiTimeframeTrend.builder()
                    .symbol(symbol)
                    .overallTrend(TrendType.RANGING)
                    .overallConfidence(0)
                    .timeframes(new EnumMap<>(Timeframe.class))
                    .alignment(new TrendAlignment(false, 0, new ArrayList<>()))
                    .tradingSuggestion(new TradingSuggestion(SuggestedAction.WAIT,
                            "No timeframe could be analysed", RiskLevel.HIGH))
                    .failures(failures)
                    .build();
        }

        TrendType overall = calculateOverallTrend(trends);
        TrendAlignment alignment = analyzeAlignment(trends, overall);

        double confidenceSum = 0;
        for (TimeframeTrend trend : trends.values()) {
            confidenceSum += trend.getConfidence();
        }
        double overallConfidence = Math.min(confidenceSum / trends.size() + alignment.getAlignmentScore() * 0.2, 100);

        logger.info("Trend for {}: {} (confidence {}, aligned {})",
                symbol, overall, Math.round(overallConfidence), alignment.isAligned());

        return MultiTimeframeTrend.builder()
                .symbol(symbol)
                .overallTrend(overall)
                .overallConfidence(overallConfidence)
                .timeframes(new EnumMap<>(trends))
                .alignment(alignment)
                .tradingSuggestion(suggest(alignment, overall))
                .failures(failures)
                .build();
    }

    TrendType calculateOverallTrend(Map<Timeframe, TimeframeTrend> trends) {
        double weightedScore = 0;
        double totalWeight = 0;
        for (Map.Entry<Timeframe, TimeframeTrend> entry : trends.entrySet()) {
            int weight = entry.getKey().getWeight();
            weightedScore += entry.getValue().getTrend().getScore() * weight;
            totalWeight += weight;
        }
        return TrendType.fromWeightedScore(weightedScore / totalWeight);
    }

    TrendAlignment analyzeAlignment(Map<Timeframe, TimeframeTrend> trends, TrendType overall) {
        int up = 0;
        int down = 0;
        int ranging = 0;
        List<Timeframe> conflicting = new ArrayList<>();

        for (Map.Entry<Timeframe, TimeframeTrend> entry : trends.entrySet()) {
            TrendType trend = entry.getValue().getTrend();
            if (trend.isUp()) {
                up++;
            } else if (trend.isDown()) {
                down++;
            } else {
                ranging++;
            }
            if ((trend.isUp() && overall.isDown()) || (trend.isDown() && overall.isUp())) {
                conflicting.add(entry.getKey());
            }
        }

        boolean aligned = up >= MIN_ALIGNED_TIMEFRAMES || down >= MIN_ALIGNED_TIMEFRAMES;
        double score = (double) Math.max(up, Math.max(down, ranging)) / trends.size() * 100;
        return new TrendAlignment(aligned, score, conflicting);
    }

    TradingSuggestion suggest(TrendAlignment alignment, TrendType overall) {
        if (alignment.isAligned() && alignment.getAlignmentScore() > 80) {
            switch (overall) {
                case STRONG_UPTREND:
                    return new TradingSuggestion(SuggestedAction.STRONG_BUY,
                            "Every timeframe is in a strong uptrend", RiskLevel.LOW);
                case UPTREND:
                case WEAK_UPTREND:
                    return new TradingSuggestion(SuggestedAction.BUY,
                            "Timeframes agree on an uptrend", RiskLevel.LOW);
                case STRONG_DOWNTREND:
                    return new TradingSuggestion(SuggestedAction.STRONG_SELL,
                            "Every timeframe is in a strong downtrend", RiskLevel.LOW);
                case DOWNTREND:
                case WEAK_DOWNTREND:
                    return new TradingSuggestion(SuggestedAction.SELL,
                            "Timeframes agree on a downtrend", RiskLevel.LOW);
                default:
                    return new TradingSuggestion(SuggestedAction.HOLD,
                            "Timeframes agree but the weighted trend is flat", RiskLevel.MEDIUM);
            }
        }
        if (alignment.getAlignmentScore() < 50) {
            return new TradingSuggestion(SuggestedAction.WAIT,
                    "Timeframes disagree, wait for a clearer signal", RiskLevel.HIGH);
        }
        return new TradingSuggestion(SuggestedAction.HOLD,
                "Trend is not clear enough, hold and observe", RiskLevel.MEDIUM);
    }

    private String describe(Timeframe timeframe, TrendType trend, double strength, double confidence, boolean divergence) {
        StringBuilder text = new StringBuilder()
                .append(timeframe.getCode()).append(" shows ").append(describeTrend(trend));

        if (strength > 80) {
            text.append(", very strong trend");
        } else if (strength > 60) {
            text.append(", moderate trend");
        } else {
            text.append(", weak trend");
        }

        if (confidence > 80) {
            text.append(", high confidence");
        } else if (confidence > 60) {
            text.append(", medium confidence");
        } else {
            text.append(", low confidence");
        }

        if (divergence) {
            text.append(", divergence detected");
        }
        return text.toString();
    }

    private static String describeTrend(TrendType trend) {
        switch (trend) {
            case STRONG_UPTREND:
                return "a strong uptrend";
            case UPTREND:
                return "an uptrend";
            case WEAK_UPTREND:
                return "a weak uptrend";
            case WEAK_DOWNTREND:
                return "a weak downtrend";
            case DOWNTREND:
                return "a downtrend";
            case STRONG_DOWNTREND:
                return "a strong downtrend";
            default:
                return "a ranging market";
        }
    }

    /**
     * Relative change per step between the first and last value.
     */
    static double slope(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double first = values[0];
        return (values[values.length - 1] - first) / first / values.length;
    }

    private static double returnVolatility(double[] prices) {
        if (prices.length < 2) {
            return 0;
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = (prices[i] - prices[i - 1]) / prices[i - 1];
        }
        return TechnicalAnalysisUtil.standardDeviation(returns);
    }

    private static double[] tail(double[] values, int count) {
        int from = Math.max(0, values.length - count);
        double[] result = new double[values.length - from];
        System.arraycopy(values, from, result, 0, result.length);
        return result;
    }

    private static double lastValue(List<IndicatorPoint<Double>> series) {
        return series.get(series.size() - 1).getValue();
    }
}
