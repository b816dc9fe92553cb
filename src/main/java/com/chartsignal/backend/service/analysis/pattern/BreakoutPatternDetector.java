package com.chartsignal.backend.service.analysis.pattern;

import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.KeyLevels;
import com.chartsignal.backend.model.LevelType;
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
 * Close that has just crossed a nearby touch level: upward through resistance
 * or downward through support.
 */
@Component
@Order(2)
public class BreakoutPatternDetector implements PatternDetector {

    private static final int RECENT_CANDLES = 20;
    private static final double MAX_LEVEL_DISTANCE = 0.01;
    private static final double MIN_CONFIDENCE = 60;
    private static final double MAX_CONFIDENCE = 95;

    private final AnalysisProperties properties;

    public BreakoutPatternDetector(AnalysisProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "breakout";
    }

    @Override
    public List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels) {
        List<PatternResult> patterns = new ArrayList<>();
        if (candles.isEmpty()) {
            return patterns;
        }

        List<Candle> recent = candles.subList(Math.max(0, candles.size() - RECENT_CANDLES), candles.size());
        Candle latest = recent.get(recent.size() - 1);
        double price = latest.getClose();

        double volumeSum = 0.0;
        for (Candle candle : recent) {
            volumeSum += candle.getVolume();
        }
        double averageVolume = volumeSum / recent.size();
        boolean volumeConfirmed = latest.getVolume() > averageVolume * properties.getBreakoutVolumeMultiplier();

        for (TouchLevel level : touchLevels) {
            double distance = Math.abs(price - level.getPrice()) / level.getPrice();
            if (distance > MAX_LEVEL_DISTANCE) {
                continue;
            }

            SignalType signal;
            if (level.getType() == LevelType.RESISTANCE && price > level.getPrice()) {
                signal = SignalType.BUY;
            } else if (level.getType() == LevelType.SUPPORT && price < level.getPrice()) {
                signal = SignalType.SELL;
            } else {
                continue;
            }

            double confidence = 50 + level.getStrength() * 5;
            if (volumeConfirmed) {
                confidence += 20;
            }
            confidence += Math.min(distance * 1000, 15);
            confidence = Math.min(confidence, MAX_CONFIDENCE);

            if (confidence >= MIN_CONFIDENCE) {
                patterns.add(PatternResult.builder()
                        .type(PatternType.BREAKOUT)
                        .signal(signal)
                        .confidence(confidence)
                        .startTime(recent.get(0).getOpenTime())
                        .endTime(latest.getOpenTime())
                        .description(String.format(Locale.ROOT, "%s breakout at %.2f%s",
                                level.getType() == LevelType.RESISTANCE ? "Resistance" : "Support",
                                level.getPrice(), volumeConfirmed ? " on rising volume" : ""))
                        .keyLevels(KeyLevels.builder().breakoutLevel(level.getPrice()).build())
                        .build());
            }
        }
        return patterns;
    }
}
