package com.chartsignal.backend.service.analysis.pattern;

import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.TouchLevel;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Registered placeholder for double top and double bottom reversals. It reports
 * no patterns until a recognition rule is agreed on.
 */
@Component
@Order(4)
public class DoubleTopBottomDetector implements PatternDetector {

    @Override
    public String getName() {
        return "double-top-bottom";
    }

    @Override
    public List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels) {
        return Collections.emptyList();
    }
}
