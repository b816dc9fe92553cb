package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.model.BollingerValue;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.ComprehensiveScore;
import com.chartsignal.backend.model.IndicatorPoint;
import com.chartsignal.backend.model.MacdValue;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.TouchLevel;
import com.chartsignal.backend.service.indicator.IndicatorType;
import com.chartsignal.backend.service.util.TechnicalAnalysisUtil;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fuses indicator readings and recognized patterns of one timeframe into
 * trend, momentum and volatility scores and a single trading signal.
 */
@Service
public class ComprehensiveScoringService {

    static final double SIGNAL_THRESHOLD = 20;
    private static final double MAX_DIRECTIONAL_CONFIDENCE = 95;
    private static final double NEUTRAL_BASE_CONFIDENCE = 50;
    private static final double PATTERN_TREND_WEIGHT = 20;
    private static final double PATTERN_MOMENTUM_WEIGHT = 15;
    private static final double SIGNIFICANT_PATTERN_CONFIDENCE = 70;
    private static final int STRONG_LEVEL_STRENGTH = 5;

    /**
     * Signal and its pre-pattern confidence, derived from the combined score alone.
     */
    public static class SignalDecision {
        private final SignalType signal;
        private final double confidence;

        public SignalDecision(SignalType signal, double confidence) {
            this.signal = signal;
            this.confidence = confidence;
        }

        public SignalType getSignal() {
            return signal;
        }

        public double getConfidence() {
            return confidence;
        }
    }

    public ComprehensiveScore calculateScore(List<Candle> candles,
                                             Map<IndicatorType, List<? extends IndicatorPoint<?>>> indicators,
                                             List<PatternResult> patterns) {
        double price = TechnicalAnalysisUtil.last(candles).getClose();

        double trend = 0;
        Double sma20 = latest(indicators, IndicatorType.SMA20, Double.class);
        Double sma50 = latest(indicators, IndicatorType.SMA50, Double.class);
        if (sma20 != null && sma50 != null) {
            double priceVsSma20 = (price - sma20) / sma20 * 100;
            double priceVsSma50 = (price - sma50) / sma50 * 100;
            double smaAlignment = (sma20 - sma50) / sma50 * 100;
            trend = TechnicalAnalysisUtil.clamp(priceVsSma20 * 0.4 + priceVsSma50 * 0.3 + smaAlignment * 0.3, -100, 100);
        }

        double momentum = 0;
        Double rsi = latest(indicators, IndicatorType.RSI, Double.class);
        if (rsi != null) {
            momentum += (rsi - 50) * 2;
        }
        MacdValue macd = latest(indicators, IndicatorType.MACD, MacdValue.class);
        if (macd != null) {
            momentum += TechnicalAnalysisUtil.clamp(macd.getHistogram() * 1000, -50, 50);
        }
        momentum = TechnicalAnalysisUtil.clamp(momentum / 2, -100, 100);

        double volatility = 0;
        BollingerValue band = latest(indicators, IndicatorType.BOLLINGER, BollingerValue.class);
        if (band != null) {
            double width = (band.getUpper() - band.getLower()) / band.getMiddle();
            volatility = Math.min(100, width * 500);

            double position = (price - band.getLower()) / (band.getUpper() - band.getLower());
            if (position > 0.8) {
                momentum += 10;
            }
            if (position < 0.2) {
                momentum -= 10;
            }
        }

        for (PatternResult pattern : patterns) {
            double weight = pattern.getConfidence() / 100;
            if (pattern.getSignal() == SignalType.BUY) {
                trend += PATTERN_TREND_WEIGHT * weight;
                momentum += PATTERN_MOMENTUM_WEIGHT * weight;
            } else if (pattern.getSignal() == SignalType.SELL) {
                trend -= PATTERN_TREND_WEIGHT * weight;
                momentum -= PATTERN_MOMENTUM_WEIGHT * weight;
            }
        }

        trend = TechnicalAnalysisUtil.clamp(trend, -100, 100);
        momentum = TechnicalAnalysisUtil.clamp(momentum, -100, 100);
        volatility = TechnicalAnalysisUtil.clamp(volatility, 0, 100);

        int roundedTrend = (int) Math.round(trend);
        int roundedMomentum = (int) Math.round(momentum);
        SignalDecision decision = deriveSignal(roundedTrend, roundedMomentum);
        double patternConfidence = 0;
        for (PatternResult pattern : patterns) {
            patternConfidence = Math.max(patternConfidence, pattern.getConfidence());
        }
        double confidence = TechnicalAnalysisUtil.clamp((decision.getConfidence() + patternConfidence) / 2, 0, 100);

        return ComprehensiveScore.builder()
                .trend(roundedTrend)
                .momentum(roundedMomentum)
                .volatility((int) Math.round(volatility))
                .signal(decision.getSignal())
                .confidence((int) Math.round(confidence))
                .build();
    }

    /**
     * BUY above +20 and SELL below -20 on the mean of trend and momentum, with
     * confidence equal to the score magnitude (at most 95); NEUTRAL otherwise,
     * with confidence 50 plus the magnitude.
     */
    public SignalDecision deriveSignal(double trend, double momentum) {
        double combined = (trend + momentum) / 2;
        if (combined > SIGNAL_THRESHOLD) {
            return new SignalDecision(SignalType.BUY, Math.min(MAX_DIRECTIONAL_CONFIDENCE, Math.abs(combined)));
        }
        if (combined < -SIGNAL_THRESHOLD) {
            return new SignalDecision(SignalType.SELL, Math.min(MAX_DIRECTIONAL_CONFIDENCE, Math.abs(combined)));
        }
        return new SignalDecision(SignalType.NEUTRAL, NEUTRAL_BASE_CONFIDENCE + Math.abs(combined));
    }

    public String generateSummary(ComprehensiveScore score, List<PatternResult> patterns, List<TouchLevel> levels) {
        List<String> parts = new ArrayList<>();

        if (score.getTrend() > 30) {
            parts.add("Strong uptrend");
        } else if (score.getTrend() > 10) {
            parts.add("Weak uptrend");
        } else if (score.getTrend() < -30) {
            parts.add("Strong downtrend");
        } else if (score.getTrend() < -10) {
            parts.add("Weak downtrend");
        } else {
            parts.add("Sideways");
        }

        if (score.getMomentum() > 20) {
            parts.add("strong momentum");
        } else if (score.getMomentum() < -20) {
            parts.add("weak momentum");
        } else {
            parts.add("neutral momentum");
        }

        if (score.getVolatility() > 60) {
            parts.add("high volatility");
        } else if (score.getVolatility() < 30) {
            parts.add("low volatility");
        } else {
            parts.add("moderate volatility");
        }

        List<String> significant = patterns.stream()
                .filter(pattern -> pattern.getConfidence() > SIGNIFICANT_PATTERN_CONFIDENCE)
                .map(pattern -> pattern.getType().name().toLowerCase(Locale.ROOT).replace('_', ' '))
                .collect(Collectors.toList());
        if (!significant.isEmpty()) {
            parts.add("patterns: " + String.join(", ", significant));
        }

        long strongLevels = levels.stream().filter(level -> level.getStrength() >= STRONG_LEVEL_STRENGTH).count();
        if (strongLevels > 0) {
            parts.add(strongLevels + " key support/resistance levels");
        }

        String stance;
        switch (score.getSignal()) {
            case BUY:
                stance = "bullish";
                break;
            case SELL:
                stance = "bearish";
                break;
            default:
                stance = "wait and see";
        }
        parts.add("signal: " + stance + " (confidence " + score.getConfidence() + "%)");

        return String.join(", ", parts);
    }

    private static <T> T latest(Map<IndicatorType, List<? extends IndicatorPoint<?>>> indicators,
                                IndicatorType type, Class<T> valueType) {
        List<? extends IndicatorPoint<?>> series = indicators.get(type);
        if (series == null || series.isEmpty()) {
            return null;
        }
        Object value = series.get(series.size() - 1).getValue();
        return valueType.isInstance(value) ? valueType.cast(value) : null;
    }
}
