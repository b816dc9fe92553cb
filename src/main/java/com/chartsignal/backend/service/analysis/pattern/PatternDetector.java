package com.chartsignal.backend.service.analysis.pattern;

import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.TouchLevel;

import java.util.List;

/**
 * One chart-pattern recognizer. Implementations are registered as beans and run by
 * {@link com.chartsignal.backend.service.analysis.PatternRecognitionService}.
 */
public interface PatternDetector {

    /**
     * Short name used in logs and failure reports.
     */
    String getName();

    /**
     * @param candles     ascending candle series
     * @param touchLevels swing levels of the same series, strongest first
     * @return detected patterns, empty when none or when the series is too short
     */
    List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels);
}
