package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.model.AnalysisFailure;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.TouchLevel;
import com.chartsignal.backend.service.analysis.pattern.PatternDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered {@link PatternDetector} over one candle series and
 * merges their output, highest confidence first.
 */
@Service
public class PatternRecognitionService {

    private static final Logger logger = LoggerFactory.getLogger(PatternRecognitionService.class);

    private final List<PatternDetector> detectors;
    private final SupportResistanceService supportResistanceService;

    public PatternRecognitionService(List<PatternDetector> detectors, SupportResistanceService supportResistanceService) {
        this.detectors = detectors;
        this.supportResistanceService = supportResistanceService;
    }

    public List<PatternResult> recognizeAllPatterns(List<Candle> candles) {
        return recognizeAllPatterns(candles, supportResistanceService.identifyTouchLevels(candles), new ArrayList<>());
    }

    /**
     * @param candles     ascending series
     * @param touchLevels touch levels of the same series
     * @param failures    receives one entry per detector that threw
     * @return all detected patterns sorted by confidence descending
     */
    public List<PatternResult> recognizeAllPatterns(List<Candle> candles, List<TouchLevel> touchLevels,
                                                    List<AnalysisFailure> failures) {
        List<PatternResult> patterns = new ArrayList<>();
        for (PatternDetector detector : detectors) {
            try {
                patterns.addAll(detector.detect(candles, touchLevels));
            } catch (RuntimeException e) {
                logger.error("Pattern detector {} failed: {}", detector.getName(), e.getMessage(), e);
                failures.add(new AnalysisFailure("pattern:" + detector.getName(), null, e.getMessage()));
            }
        }

        patterns.sort(Comparator.comparingDouble(PatternResult::getConfidence).reversed());
        logger.debug("Recognized {} patterns over {} candles", patterns.size(), candles.size());
        return patterns;
    }
}
