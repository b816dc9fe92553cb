package com.chartsignal.backend.service.analysis.pattern;

import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.PatternType;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.TouchLevel;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Directional run measured by the imbalance of up and down closes.
 */
@Component
@Order(3)
public class TrendPatternDetector implements PatternDetector {

    private static final int MIN_CANDLES = 5;
    private static final double MIN_STRENGTH = 0.6;

    private final AnalysisProperties properties;

    public TrendPatternDetector(AnalysisProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "trend";
    }

    @Override
    public List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels) {
        int period = properties.getTrendPatternPeriod();
        List<PatternResult> patterns = new ArrayList<>();
        if (candles.size() < period || period < MIN_CANDLES) {
            return patterns;
        }

        List<Candle> recent = candles.subList(candles.size() - period, candles.size());
        int upMoves = 0;
        int downMoves = 0;
        for (int i = 1; i < recent.size(); i++) {
            double change = recent.get(i).getClose() - recent.get(i - 1).getClose();
            if (change > 0) {
                upMoves++;
            } else if (change < 0) {
                downMoves++;
            }
        }

        int totalMoves = upMoves + downMoves;
        if (totalMoves == 0) {
            return patterns;
        }

        double strength = (double) Math.abs(upMoves - downMoves) / totalMoves;
        if (strength < MIN_STRENGTH) {
            return patterns;
        }

        boolean up = upMoves > downMoves;
        patterns.add(PatternResult.builder()
                .type(up ? PatternType.UPTREND : PatternType.DOWNTREND)
                .signal(up ? SignalType.BUY : SignalType.SELL)
                .confidence(strength * 100)
                .startTime(recent.get(0).getOpenTime())
                .endTime(recent.get(recent.size() - 1).getOpenTime())
                .description(String.format(Locale.ROOT, "%s trend, strength %.1f%%",
                        up ? "Rising" : "Falling", strength * 100))
                .build());
        return patterns;
    }
}
