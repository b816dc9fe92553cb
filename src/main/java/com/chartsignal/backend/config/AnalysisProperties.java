package com.chartsignal.backend.config;

import com.chartsignal.backend.model.Timeframe;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tunable analysis parameters, bound from {@code analysis.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    /** Candles on each side a swing extreme must dominate. */
    private int swingLookback = 5;

    /** Box height bounds as a fraction of the support price. */
    private double boxMinHeight = 0.02;
    private double boxMaxHeight = 0.15;
    private int boxMinDuration = 20;

    private int trendPatternPeriod = 20;
    private double breakoutVolumeMultiplier = 1.5;

    private List<Timeframe> timeframes = new ArrayList<>(Arrays.asList(Timeframe.values()));
    private int trendCandleLimit = 200;
    private int levelCandleLimit = 200;
    private int comprehensiveCandleLimit = 100;
    private int minComprehensiveCandles = 20;

    private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
}
