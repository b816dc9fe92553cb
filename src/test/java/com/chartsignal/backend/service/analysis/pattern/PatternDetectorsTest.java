package com.chartsignal.backend.service.analysis.pattern;

import com.chartsignal.backend.CandleFixtures;
import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.LevelType;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.PatternType;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.TouchLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PatternDetectorsTest {

    private final AnalysisProperties properties = new AnalysisProperties();

    @Test
    void trendDetector_shouldReportStraightRiseAsUptrend() {
        List<PatternResult> patterns = new TrendPatternDetector(properties)
                .detect(CandleFixtures.linear(25, 100, 1), Collections.emptyList());

        assertEquals(1, patterns.size());
        assertEquals(PatternType.UPTREND, patterns.get(0).getType());
        assertEquals(SignalType.BUY, patterns.get(0).getSignal());
        assertEquals(100.0, patterns.get(0).getConfidence(), 1e-9);
    }

    @Test
    void trendDetector_shouldReportNothingWithoutMoves() {
        assertTrue(new TrendPatternDetector(properties)
                .detect(CandleFixtures.constant(25, 100), Collections.emptyList()).isEmpty());
    }

    @Test
    void trendDetector_shouldIgnoreChoppySeries() {
        assertTrue(new TrendPatternDetector(properties)
                .detect(CandleFixtures.box(40), Collections.emptyList()).isEmpty());
    }

    @Test
    void breakoutDetector_shouldFlagResistanceBreak() {
        List<PatternResult> patterns = new BreakoutPatternDetector(properties)
                .detect(breakoutSeries(1000), Collections.singletonList(touchLevel(100.0, LevelType.RESISTANCE, 4)));

        assertEquals(1, patterns.size());
        assertEquals(PatternType.BREAKOUT, patterns.get(0).getType());
        assertEquals(SignalType.BUY, patterns.get(0).getSignal());
        assertEquals(75.0, patterns.get(0).getConfidence(), 1e-6);
        assertEquals(100.0, patterns.get(0).getKeyLevels().getBreakoutLevel(), 1e-9);
    }

    @Test
    void breakoutDetector_shouldAddVolumeConfirmationAndCap() {
        List<PatternResult> patterns = new BreakoutPatternDetector(properties)
                .detect(breakoutSeries(10_000), Collections.singletonList(touchLevel(100.0, LevelType.RESISTANCE, 4)));

        assertEquals(1, patterns.size());
        assertEquals(95.0, patterns.get(0).getConfidence(), 1e-6);
    }

    @Test
    void breakoutDetector_shouldIgnoreSupportBelowPrice() {
        assertTrue(new BreakoutPatternDetector(properties)
                .detect(breakoutSeries(1000), Collections.singletonList(touchLevel(100.0, LevelType.SUPPORT, 10)))
                .isEmpty());
    }

    @Test
    void breakoutDetector_shouldDropWeakBreaks() {
        // strength 0 without volume gives 50 + 5, under the emit threshold
        assertTrue(new BreakoutPatternDetector(properties)
                .detect(breakoutSeries(1000), Collections.singletonList(touchLevel(100.0, LevelType.RESISTANCE, 0)))
                .isEmpty());
    }

    @Test
    void boxDetector_shouldRejectRangesOutsideHeightBounds() {
        List<Candle> candles = CandleFixtures.box(60);
        List<TouchLevel> levels = new ArrayList<>();
        levels.add(touchLevel(100.0, LevelType.SUPPORT, 10, candles.get(0).getOpenTime(), candles.get(51).getOpenTime()));
        levels.add(touchLevel(130.0, LevelType.RESISTANCE, 10, candles.get(5).getOpenTime(), candles.get(56).getOpenTime()));

        assertTrue(new BoxPatternDetector(properties).detect(candles, levels).isEmpty());
    }

    @Test
    void boxDetector_shouldHonourConfiguredHeightBounds() {
        List<Candle> candles = CandleFixtures.box(60);
        List<TouchLevel> levels = new ArrayList<>();
        levels.add(touchLevel(100.0, LevelType.SUPPORT, 10, candles.get(0).getOpenTime(), candles.get(51).getOpenTime()));
        levels.add(touchLevel(110.0, LevelType.RESISTANCE, 10, candles.get(5).getOpenTime(), candles.get(56).getOpenTime()));

        AnalysisProperties narrow = new AnalysisProperties();
        narrow.setBoxMaxHeight(0.05);

        assertEquals(1, new BoxPatternDetector(properties).detect(candles, levels).size());
        assertTrue(new BoxPatternDetector(narrow).detect(candles, levels).isEmpty());
    }

    private static List<Candle> breakoutSeries(double lastVolume) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 19; i++) {
            candles.add(new Candle(CandleFixtures.START + i * CandleFixtures.STEP, 99, 99.2, 98.8, 99, 1000));
        }
        candles.add(new Candle(CandleFixtures.START + 19 * CandleFixtures.STEP, 99, 100.6, 99, 100.5, lastVolume));
        return candles;
    }

    private static TouchLevel touchLevel(double price, LevelType type, int strength) {
        return touchLevel(price, type, strength, CandleFixtures.START, CandleFixtures.START);
    }

    private static TouchLevel touchLevel(double price, LevelType type, int strength, long first, long last) {
        return TouchLevel.builder()
                .price(price)
                .type(type)
                .strength(strength)
                .touchCount(strength)
                .firstTouch(first)
                .lastTouch(last)
                .build();
    }
}
