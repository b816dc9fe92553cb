package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.CandleFixtures;
import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.LevelStrength;
import com.chartsignal.backend.model.LevelType;
import com.chartsignal.backend.model.PriceRange;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.SupportResistanceLevel;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.model.TouchLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SupportResistanceServiceTest {

    private final AnalysisProperties properties = new AnalysisProperties();
    private final SupportResistanceService service = new SupportResistanceService(properties);

    @Test
    void findSwingHighs_shouldAcceptEqualNeighbours() {
        List<Candle> strict = withHighs(1, 3, 2, 5, 2, 1, 4);
        List<Candle> plateau = withHighs(1, 3, 3, 1);

        assertEquals(Arrays.asList(1, 3), service.findSwingHighs(strict, 1));
        assertEquals(Arrays.asList(1, 2), service.findSwingHighs(plateau, 1));
    }

    @Test
    void findSwingLows_shouldSkipEdgesWithinLookback() {
        List<Candle> candles = CandleFixtures.box(30);

        List<Integer> lows = service.findSwingLows(candles, 5);

        assertFalse(lows.isEmpty());
        for (int index : lows) {
            assertTrue(index >= 5 && index < candles.size() - 5);
            assertEquals(100.0, candles.get(index).getLow(), 1e-9);
        }
    }

    @Test
    void consolidateLevels_shouldMergeNearbyLevelsOfSameType() {
        SupportResistanceLevel first = level(LevelType.SUPPORT, 100.0, LevelStrength.MEDIUM, 70, 2, Timeframe.H1, 1L);
        SupportResistanceLevel second = level(LevelType.SUPPORT, 100.5, LevelStrength.STRONG, 60, 3, Timeframe.H4, 2L);
        SupportResistanceLevel distant = level(LevelType.SUPPORT, 95.0, LevelStrength.WEAK, 50, 1, Timeframe.M15, 3L);
        SupportResistanceLevel weak = level(LevelType.RESISTANCE, 120.0, LevelStrength.WEAK, 30, 1, Timeframe.M15, 4L);

        List<SupportResistanceLevel> result =
                service.consolidateLevels(Arrays.asList(first, second, distant, weak), 110.0);

        assertEquals(2, result.size());
        SupportResistanceLevel merged = result.get(0);
        assertEquals(5, merged.getTouchCount());
        assertEquals(80, merged.getConfidence());
        assertEquals(LevelStrength.STRONG, merged.getStrength());
        assertEquals(2L, merged.getLastTouchTimestamp());
        assertEquals((100.0 * 4 + 100.5 * 9) / 13, merged.getPriceRange().getCenter(), 1e-9);
        assertEquals(99.5, merged.getPriceRange().getMin(), 1e-9);
        assertEquals(101.0, merged.getPriceRange().getMax(), 1e-9);
        assertEquals(distant, result.get(1));
    }

    @Test
    void consolidateLevels_shouldBeIdempotent() {
        List<SupportResistanceLevel> levels = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            levels.add(level(i % 2 == 0 ? LevelType.SUPPORT : LevelType.RESISTANCE,
                    100 + i * 0.4, LevelStrength.MEDIUM, 45 + i, 1 + i % 3, Timeframe.H1, i));
        }

        List<SupportResistanceLevel> once = service.consolidateLevels(levels, 102.0);
        List<SupportResistanceLevel> twice = service.consolidateLevels(once, 102.0);

        assertEquals(once, twice);
    }

    @Test
    void analyze_withNoCandles_shouldReturnEmptyPicture() {
        SupportResistanceAnalysis analysis = service.analyze("BTCUSDT", new EnumMap<>(Timeframe.class));

        assertTrue(analysis.getSupports().isEmpty());
        assertTrue(analysis.getResistances().isEmpty());
        assertEquals(SupportResistanceAnalysis.PriceAction.CONSOLIDATING, analysis.getCurrentPosition().getPriceAction());
    }

    @Test
    void analyze_shouldFindBoxBoundsOnBothSides() {
        List<Candle> candles = CandleFixtures.box(60);
        Map<Timeframe, List<Candle>> input = new EnumMap<>(Timeframe.class);
        input.put(Timeframe.H1, candles);

        SupportResistanceAnalysis analysis = service.analyze("BTCUSDT", input);

        assertEquals(102.0, analysis.getCurrentPrice(), 1e-9);
        assertEquals(candles.get(59).getOpenTime(), analysis.getTimestamp());
        assertFalse(analysis.getSupports().isEmpty());
        assertFalse(analysis.getResistances().isEmpty());
        assertEquals(100.0, analysis.getSupports().get(0).getPriceRange().getCenter(), 0.5);
        assertEquals(110.0, analysis.getResistances().get(0).getPriceRange().getCenter(), 0.5);
        assertNotNull(analysis.getKeyLevels().getNearestSupport());
        assertNotNull(analysis.getKeyLevels().getNearestResistance());
        for (SupportResistanceLevel support : analysis.getSupports()) {
            assertTrue(support.getConfidence() >= 40);
        }
    }

    @Test
    void identifyTouchLevels_shouldRequireFiftyCandles() {
        assertTrue(service.identifyTouchLevels(CandleFixtures.box(49)).isEmpty());
    }

    @Test
    void identifyTouchLevels_shouldFindRepeatedlyTouchedBounds() {
        List<TouchLevel> levels = service.identifyTouchLevels(CandleFixtures.box(60));

        assertEquals(2, levels.size());
        TouchLevel resistance = levels.stream().filter(l -> l.getType() == LevelType.RESISTANCE).findFirst().orElseThrow();
        TouchLevel support = levels.stream().filter(l -> l.getType() == LevelType.SUPPORT).findFirst().orElseThrow();
        assertEquals(110.0, resistance.getPrice(), 1e-9);
        assertEquals(100.0, support.getPrice(), 1e-9);
        assertEquals(10, resistance.getStrength());
        assertEquals(10, support.getStrength());
    }

    private static List<Candle> withHighs(double... highs) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < highs.length; i++) {
            candles.add(new Candle(CandleFixtures.START + i * CandleFixtures.STEP, highs[i], highs[i], 0.5, highs[i], 1000));
        }
        return candles;
    }

    private static SupportResistanceLevel level(LevelType type, double price, LevelStrength strength, int confidence,
                                                int touches, Timeframe timeframe, long lastTouch) {
        return SupportResistanceLevel.builder()
                .type(type)
                .priceRange(new PriceRange(price - 0.5, price + 0.5, price))
                .strength(strength)
                .confidence(confidence)
                .touchCount(touches)
                .lastTouchTimestamp(lastTouch)
                .timeframe(timeframe)
                .active(true)
                .distance(0)
                .description("test level")
                .build();
    }
}
