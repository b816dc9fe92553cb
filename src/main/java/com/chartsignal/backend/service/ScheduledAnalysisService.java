package com.chartsignal.backend.service;

import com.chartsignal.backend.model.AnalysisResult;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.MultiTimeframeTrend;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.service.alert.AlertService;
import com.chartsignal.backend.service.analysis.TechnicalAnalysisService;
import com.chartsignal.backend.service.history.AnalysisResultService;
import com.chartsignal.backend.service.market.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;

@Service
public class ScheduledAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledAnalysisService.class);

    private final TechnicalAnalysisService technicalAnalysisService;
    private final AnalysisResultService analysisResultService;
    private final AlertService alertService;

    @Value("${analysis.schedule.enabled:true}")
    private boolean enabled;

    @Value("${analysis.schedule.symbols:BTCUSDT,ETHUSDT,SOLUSDT}")
    private String[] symbols;

    @Value("${analysis.schedule.interval:1h}")
    private String interval;

    @Value("${analysis.schedule.limit:100}")
    private int limit;

    @Value("${analysis.history.retention-days:30}")
    private int retentionDays;

    public ScheduledAnalysisService(TechnicalAnalysisService technicalAnalysisService,
                                    AnalysisResultService analysisResultService,
                                    AlertService alertService) {
        this.technicalAnalysisService = technicalAnalysisService;
        this.analysisResultService = analysisResultService;
        this.alertService = alertService;
    }

    @Scheduled(cron = "${analysis.schedule.cron:0 */15 * * * *}")
    public void runScheduledAnalysis() {
        if (!enabled) {
            logger.debug("Scheduled analysis disabled, skipping");
            return;
        }

        Timeframe timeframe = Timeframe.fromString(interval);
        logger.info("Starting scheduled analysis for symbols {} on {}", Arrays.toString(symbols), timeframe);

        int completed = 0;
        for (String symbol : symbols) {
            try {
                analyzeSymbol(MarketDataService.normalizeSymbol(symbol), timeframe);
                completed++;
            } catch (RuntimeException e) {
                logger.error("Scheduled analysis failed for {}: {}", symbol, e.getMessage(), e);
            }
        }

        logger.info("Scheduled analysis finished: {}/{} symbols", completed, symbols.length);
    }

    /**
     * Comprehensive analysis, persisted with the trading zones of the support/resistance
     * picture and checked for a signal alert, then the multi-timeframe trend with its
     * alignment alert.
     */
    void analyzeSymbol(String symbol, Timeframe timeframe) {
        ComprehensiveAnalysis analysis = technicalAnalysisService.performComprehensiveAnalysis(symbol, timeframe, limit);
        if (!analysis.getFailures().isEmpty()) {
            logger.warn("Analysis of {} {} finished with {} failures: {}", symbol, timeframe,
                    analysis.getFailures().size(), analysis.getFailures());
        }

        if (analysis.getScore() != null) {
            // Read before saving so the alert compares against the prior run
            Optional<AnalysisResult> previous = analysisResultService.findLatest(symbol, timeframe);
            analysisResultService.save(analysis, analyzeLevels(symbol));
            alertService.evaluateAnalysis(analysis, previous).ifPresent(alertService::dispatch);
        }

        MultiTimeframeTrend trend = technicalAnalysisService.analyzeMultiTimeframeTrend(symbol);
        alertService.evaluateTrend(trend).ifPresent(alertService::dispatch);
    }

    private SupportResistanceAnalysis analyzeLevels(String symbol) {
        try {
            SupportResistanceAnalysis levels = technicalAnalysisService.analyzeSupportResistance(symbol);
            logger.debug("{} has {} supports and {} resistances", symbol,
                    levels.getSupports().size(), levels.getResistances().size());
            return levels;
        } catch (RuntimeException e) {
            logger.warn("Support/resistance analysis failed for {}, saving without zones: {}", symbol, e.getMessage());
            return null;
        }
    }

    @Scheduled(cron = "${analysis.history.cleanup-cron:0 30 3 * * *}")
    public void purgeOldResults() {
        try {
            analysisResultService.deleteOlderThan(LocalDateTime.now().minusDays(retentionDays));
        } catch (RuntimeException e) {
            logger.error("Failed to purge old analysis results: {}", e.getMessage(), e);
        }
    }
}
