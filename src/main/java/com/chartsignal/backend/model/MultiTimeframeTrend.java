package com.chartsignal.backend.model;

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
public class MultiTimeframeTrend {
    private String symbol;
    private long timestamp;
    private TrendType overallTrend;
    private double overallConfidence;
    @Builder.Default
    private Map<Timeframe, TimeframeTrend> timeframes = new EnumMap<>(Timeframe.class);
    private TrendAlignment alignment;
    private TradingSuggestion tradingSuggestion;
    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();
}
