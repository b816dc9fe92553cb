package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.CandleFixtures;
import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.model.AnalysisFailure;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.PatternType;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.TouchLevel;
import com.chartsignal.backend.service.analysis.pattern.BoxPatternDetector;
import com.chartsignal.backend.service.analysis.pattern.BreakoutPatternDetector;
import com.chartsignal.backend.service.analysis.pattern.DoubleTopBottomDetector;
import com.chartsignal.backend.service.analysis.pattern.HeadAndShouldersDetector;
import com.chartsignal.backend.service.analysis.pattern.PatternDetector;
import com.chartsignal.backend.service.analysis.pattern.TrendPatternDetector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PatternRecognitionServiceTest {

    private final AnalysisProperties properties = new AnalysisProperties();
    private final SupportResistanceService supportResistanceService = new SupportResistanceService(properties);

    private PatternRecognitionService serviceWith(PatternDetector... detectors) {
        return new PatternRecognitionService(Arrays.asList(detectors), supportResistanceService);
    }

    private PatternRecognitionService defaultService() {
        return serviceWith(new BoxPatternDetector(properties), new BreakoutPatternDetector(properties),
                new TrendPatternDetector(properties), new DoubleTopBottomDetector(), new HeadAndShouldersDetector());
    }

    @Test
    void recognizeAllPatterns_shouldDetectBoxInRangeBoundSeries() {
        List<PatternResult> patterns = defaultService().recognizeAllPatterns(CandleFixtures.box(60));

        PatternResult box = patterns.stream()
                .filter(pattern -> pattern.getType() == PatternType.BOX)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no box pattern in " + patterns));
        assertEquals(SignalType.NEUTRAL, box.getSignal());
        assertTrue(box.getConfidence() >= 70);
        assertEquals(110.0, box.getKeyLevels().getResistance(), 1e-9);
        assertEquals(100.0, box.getKeyLevels().getSupport(), 1e-9);
    }

    @Test
    void recognizeAllPatterns_shouldSortByConfidenceDescending() {
        List<PatternResult> patterns = defaultService().recognizeAllPatterns(CandleFixtures.box(60));

        for (int i = 1; i < patterns.size(); i++) {
            assertTrue(patterns.get(i - 1).getConfidence() >= patterns.get(i).getConfidence());
        }
    }

    @Test
    void recognizeAllPatterns_shouldRecordFailingDetectorAndKeepOthers() {
        PatternDetector broken = new PatternDetector() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels) {
                throw new IllegalStateException("boom");
            }
        };
        List<AnalysisFailure> failures = new ArrayList<>();

        List<PatternResult> patterns = serviceWith(broken, new TrendPatternDetector(properties))
                .recognizeAllPatterns(CandleFixtures.linear(30, 100, 1), new ArrayList<>(), failures);

        assertEquals(1, patterns.size());
        assertEquals(PatternType.UPTREND, patterns.get(0).getType());
        assertEquals(1, failures.size());
        assertEquals("pattern:broken", failures.get(0).getComponent());
        assertEquals("boom", failures.get(0).getMessage());
    }

    @Test
    void reversalDetectors_shouldReportNothing() {
        List<Candle> candles = CandleFixtures.wave(120);
        List<TouchLevel> levels = supportResistanceService.identifyTouchLevels(candles);

        assertTrue(new DoubleTopBottomDetector().detect(candles, levels).isEmpty());
        assertTrue(new HeadAndShouldersDetector().detect(candles, levels).isEmpty());
    }
}
