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
import java.util.stream.Collectors;

/**
 * Sideways range bounded by a support and a resistance touch level.
 */
@Component
@Order(1)
public class BoxPatternDetector implements PatternDetector {

    private static final double BOUND_TOLERANCE = 0.01;
    private static final double MIN_INSIDE_RATIO = 0.7;
    private static final int MIN_BOUND_TOUCHES = 2;
    private static final double MAX_CONFIDENCE = 95;

    private final AnalysisProperties properties;

    public BoxPatternDetector(AnalysisProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "box";
    }

    @Override
    public List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels) {
        int minDuration = properties.getBoxMinDuration();
        List<PatternResult> patterns = new ArrayList<>();
        if (candles.size() < minDuration * 2) {
            return patterns;
        }

        for (int i = 0; i < touchLevels.size(); i++) {
            for (int j = i + 1; j < touchLevels.size(); j++) {
                TouchLevel first = touchLevels.get(i);
                TouchLevel second = touchLevels.get(j);
                if (first.getType() == second.getType()) {
                    continue;
                }
                TouchLevel support = first.getType() == LevelType.SUPPORT ? first : second;
                TouchLevel resistance = first.getType() == LevelType.RESISTANCE ? first : second;

                double heightRatio = (resistance.getPrice() - support.getPrice()) / support.getPrice();
                if (heightRatio < properties.getBoxMinHeight() || heightRatio > properties.getBoxMaxHeight()) {
                    continue;
                }

                long start = Math.max(support.getFirstTouch(), resistance.getFirstTouch());
                long end = Math.min(support.getLastTouch(), resistance.getLastTouch());
                List<Candle> window = candles.stream()
                        .filter(candle -> candle.getOpenTime() >= start && candle.getOpenTime() <= end)
                        .collect(Collectors.toList());
                if (window.size() < minDuration) {
                    continue;
                }

                Double confidence = validate(window, support.getPrice(), resistance.getPrice());
                if (confidence != null) {
                    patterns.add(PatternResult.builder()
                            .type(PatternType.BOX)
                            .signal(SignalType.NEUTRAL)
                            .confidence(confidence)
                            .startTime(start)
                            .endTime(end)
                            .description(String.format(Locale.ROOT, "Box range: support %.2f, resistance %.2f",
                                    support.getPrice(), resistance.getPrice()))
                            .keyLevels(KeyLevels.builder()
                                    .support(support.getPrice())
                                    .resistance(resistance.getPrice())
                                    .build())
                            .build());
                }
            }
        }
        return patterns;
    }

    /**
     * @return the box confidence, or null when the window does not behave like a range
     */
    private Double validate(List<Candle> window, double support, double resistance) {
        int supportTouches = 0;
        int resistanceTouches = 0;
        int inside = 0;
        for (Candle candle : window) {
            if (Math.abs(candle.getLow() - support) / support <= BOUND_TOLERANCE) {
                supportTouches++;
            }
            if (Math.abs(candle.getHigh() - resistance) / resistance <= BOUND_TOLERANCE) {
                resistanceTouches++;
            }
            if (candle.getLow() >= support * (1 - BOUND_TOLERANCE) && candle.getHigh() <= resistance * (1 + BOUND_TOLERANCE)) {
                inside++;
            }
        }

        double ratio = (double) inside / window.size();
        if (ratio < MIN_INSIDE_RATIO || supportTouches < MIN_BOUND_TOUCHES || resistanceTouches < MIN_BOUND_TOUCHES) {
            return null;
        }
        return Math.min(ratio * 100, MAX_CONFIDENCE);
    }
}
