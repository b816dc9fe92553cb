package com.chartsignal.backend.model;

import com.chartsignal.backend.service.indicator.IndicatorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComprehensiveAnalysis {
    private String symbol;
    private Timeframe interval;
    private long timestamp;
    private double currentPrice;
    @Builder.Default
    private Map<IndicatorType, List<? extends IndicatorPoint<?>>> indicators = new EnumMap<>(IndicatorType.class);
    @Builder.Default
    private List<PatternResult> patterns = new ArrayList<>();
    @Builder.Default
    private List<TouchLevel> touchLevels = new ArrayList<>();
    private ComprehensiveScore score;
    private String summary;
    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();
}
