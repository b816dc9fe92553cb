package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeframeTrend {
    private Timeframe timeframe;
    private TrendType trend;
    private int confidence;
    private int trendStrength;
    private double currentPrice;
    private double ema20;
    private double ema60;
    private double ema120;
    private boolean divergence;
    private String analysis;
}
