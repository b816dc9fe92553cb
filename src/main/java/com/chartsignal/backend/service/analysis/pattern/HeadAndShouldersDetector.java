package com.chartsignal.backend.service.analysis.pattern;

import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.TouchLevel;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Registered placeholder for head-and-shoulders reversals; reports no patterns yet.
 */
@Component
@Order(5)
public class HeadAndShouldersDetector implements PatternDetector {

    @Override
    public String getName() {
        return "head-and-shoulders";
    }

    @Override
    public List<PatternResult> detect(List<Candle> candles, List<TouchLevel> touchLevels) {
        return Collections.emptyList();
    }
}
