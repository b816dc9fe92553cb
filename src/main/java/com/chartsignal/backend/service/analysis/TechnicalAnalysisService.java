package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.config.ExecutorConfig;
import com.chartsignal.backend.model.AnalysisFailure;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.ComprehensiveScore;
import com.chartsignal.backend.model.IndicatorPoint;
import com.chartsignal.backend.model.MultiTimeframeTrend;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.model.TouchLevel;
import com.chartsignal.backend.service.indicator.IndicatorService;
import com.chartsignal.backend.service.indicator.IndicatorType;
import com.chartsignal.backend.service.market.MarketDataService;
import com.chartsignal.backend.service.util.TechnicalAnalysisUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry points of the analysis engine. Validates input, fetches candles through
 * {@link MarketDataService} and runs the indicator, level, pattern, trend and
 * scoring engines. Per-timeframe and per-symbol work is fanned out on the
 * analysis executor; a failed part is logged, recorded as an
 * {@link AnalysisFailure} and left out of the result.
 */
@Service
public class TechnicalAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(TechnicalAnalysisService.class);

    static final Set<IndicatorType> COMPREHENSIVE_INDICATORS = Collections.unmodifiableSet(EnumSet.of(
            IndicatorType.SMA20, IndicatorType.SMA50, IndicatorType.EMA12, IndicatorType.EMA26,
            IndicatorType.MACD, IndicatorType.RSI, IndicatorType.BOLLINGER, IndicatorType.STOCHASTIC,
            IndicatorType.MOMENTUM));

    private static final Comparator<AnalysisFailure> BY_TIMEFRAME = Comparator.comparingInt(
            failure -> failure.getTimeframe() == null ? 0 : Timeframe.fromString(failure.getTimeframe()).getWeight());

    private final MarketDataService marketDataService;
    private final IndicatorService indicatorService;
    private final SupportResistanceService supportResistanceService;
    private final PatternRecognitionService patternRecognitionService;
    private final MultiTimeframeTrendService multiTimeframeTrendService;
    private final ComprehensiveScoringService comprehensiveScoringService;
    private final AnalysisProperties properties;
    private final ExecutorService analysisExecutor;

    public TechnicalAnalysisService(MarketDataService marketDataService,
                                    IndicatorService indicatorService,
                                    SupportResistanceService supportResistanceService,
                                    PatternRecognitionService patternRecognitionService,
                                    MultiTimeframeTrendService multiTimeframeTrendService,
                                    ComprehensiveScoringService comprehensiveScoringService,
                                    AnalysisProperties properties,
                                    @Qualifier(ExecutorConfig.ANALYSIS_EXECUTOR) ExecutorService analysisExecutor) {
        this.marketDataService = marketDataService;
        this.indicatorService = indicatorService;
        this.supportResistanceService = supportResistanceService;
        this.patternRecognitionService = patternRecognitionService;
        this.multiTimeframeTrendService = multiTimeframeTrendService;
        this.comprehensiveScoringService = comprehensiveScoringService;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * @throws IllegalArgumentException for a malformed symbol or an unsupported interval
     */
    public ComprehensiveAnalysis performComprehensiveAnalysis(String symbol, String interval, int limit) {
        String normalized = MarketDataService.normalizeSymbol(symbol);
        Timeframe timeframe = Timeframe.fromString(interval);
        return performComprehensiveAnalysis(normalized, timeframe, limit);
    }

    public ComprehensiveAnalysis performComprehensiveAnalysis(String symbol, Timeframe timeframe, int limit) {
        if (limit < properties.getMinComprehensiveCandles()) {
            throw new IllegalArgumentException("Limit must be at least " + properties.getMinComprehensiveCandles());
        }
        logger.info("Starting comprehensive analysis for {} {} ({} candles)", symbol, timeframe, limit);

        List<Candle> candles;
        try {
            candles = marketDataService.getCandles(symbol, timeframe, limit);
        } catch (RuntimeException e) {
            logger.error("Failed to fetch candles for {} {}: {}", symbol, timeframe, e.getMessage(), e);
            return emptyAnalysis(symbol, timeframe, new AnalysisFailure("candles", timeframe.getCode(), e.getMessage()));
        }

        return analyzeCandles(symbol, timeframe, candles);
    }

    /**
     * Runs indicators, touch levels, patterns and scoring over an already fetched series.
     */
    public ComprehensiveAnalysis analyzeCandles(String symbol, Timeframe timeframe, List<Candle> candles) {
        if (candles == null || candles.size() < properties.getMinComprehensiveCandles()) {
            int count = candles == null ? 0 : candles.size();
            logger.warn("Not enough candles for comprehensive analysis of {} {}: {} < {}",
                    symbol, timeframe, count, properties.getMinComprehensiveCandles());
            return emptyAnalysis(symbol, timeframe, new AnalysisFailure("candles", timeframe.getCode(),
                    "Insufficient candles: " + count));
        }

        List<AnalysisFailure> failures = new ArrayList<>();

        Map<IndicatorType, List<? extends IndicatorPoint<?>>> indicators =
                indicatorService.calculateIndicators(candles, COMPREHENSIVE_INDICATORS);

        List<TouchLevel> touchLevels;
        try {
            touchLevels = supportResistanceService.identifyTouchLevels(candles);
        } catch (RuntimeException e) {
            logger.error("Touch level detection failed for {} {}: {}", symbol, timeframe, e.getMessage(), e);
            failures.add(new AnalysisFailure("levels", timeframe.getCode(), e.getMessage()));
            touchLevels = new ArrayList<>();
        }

        List<PatternResult> patterns = patternRecognitionService.recognizeAllPatterns(candles, touchLevels, failures);
        for (AnalysisFailure failure : failures) {
            if (failure.getTimeframe() == null) {
                failure.setTimeframe(timeframe.getCode());
            }
        }

        ComprehensiveScore score = comprehensiveScoringService.calculateScore(candles, indicators, patterns);
        String summary = comprehensiveScoringService.generateSummary(score, patterns, touchLevels);

        Candle latest = TechnicalAnalysisUtil.last(candles);
        logger.info("Analysis of {} {} done: signal {} with confidence {}%",
                symbol, timeframe, score.getSignal(), score.getConfidence());

        return ComprehensiveAnalysis.builder()
                .symbol(symbol)
                .interval(timeframe)
                .timestamp(latest.getOpenTime())
                .currentPrice(latest.getClose())
                .indicators(indicators)
                .patterns(patterns)
                .touchLevels(touchLevels)
                .score(score)
                .summary(summary)
                .failures(failures)
                .build();
    }

    /**
     * Selected indicators for one timeframe, keyed by indicator name. An empty
     * selection computes every indicator.
     *
     * @throws IllegalArgumentException for a malformed symbol, an unsupported interval or an unknown indicator name
     */
    public Map<String, List<? extends IndicatorPoint<?>>> calculateIndicators(String symbol, String interval,
                                                                            List<String> indicatorNames, int limit) {
        String normalized = MarketDataService.normalizeSymbol(symbol);
        Timeframe timeframe = Timeframe.fromString(interval);
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        Set<IndicatorType> types = EnumSet.noneOf(IndicatorType.class);
        if (indicatorNames != null) {
            for (String name : indicatorNames) {
                types.add(IndicatorType.fromString(name));
            }
        }

        logger.info("Calculating {} indicators for {} {} ({} candles)",
                types.isEmpty() ? "all" : types, normalized, timeframe, limit);
        List<Candle> candles = marketDataService.getCandles(normalized, timeframe, limit);
        Map<IndicatorType, List<? extends IndicatorPoint<?>>> computed = types.isEmpty()
                ? indicatorService.calculateAllIndicators(candles)
                : indicatorService.calculateIndicators(candles, types);

        Map<String, List<? extends IndicatorPoint<?>>> byKey = new LinkedHashMap<>();
        computed.forEach((type, values) -> byKey.put(type.getKey(), values));
        return byKey;
    }

    /**
     * Trend over every configured timeframe. Timeframes whose fetch fails or that
     * return too few candles are omitted and reported as failures.
     */
    public MultiTimeframeTrend analyzeMultiTimeframeTrend(String symbol) {
        String normalized = MarketDataService.normalizeSymbol(symbol);
        logger.info("Starting multi-timeframe trend analysis for {}", normalized);

        List<AnalysisFailure> fetchFailures = new ArrayList<>();
        Map<Timeframe, List<Candle>> candlesByTimeframe =
                fetchAllTimeframes(normalized, properties.getTrendCandleLimit(), "trend", fetchFailures);

        MultiTimeframeTrend trend = multiTimeframeTrendService.analyze(normalized, candlesByTimeframe);
        trend.getFailures().addAll(fetchFailures);
        trend.getFailures().sort(BY_TIMEFRAME);
        return trend;
    }

    /**
     * Support and resistance merged over every configured timeframe.
     */
    public SupportResistanceAnalysis analyzeSupportResistance(String symbol) {
        String normalized = MarketDataService.normalizeSymbol(symbol);
        logger.info("Starting support/resistance analysis for {}", normalized);

        List<AnalysisFailure> fetchFailures = new ArrayList<>();
        Map<Timeframe, List<Candle>> candlesByTimeframe =
                fetchAllTimeframes(normalized, properties.getLevelCandleLimit(), "levels", fetchFailures);

        SupportResistanceAnalysis analysis = supportResistanceService.analyze(normalized, candlesByTimeframe);
        analysis.getFailures().addAll(fetchFailures);
        analysis.getFailures().sort(BY_TIMEFRAME);
        return analysis;
    }

    /**
     * Comprehensive analysis of several symbols in parallel. Symbols that fail
     * validation or analysis are logged and left out.
     */
    public List<ComprehensiveAnalysis> performBatchAnalysis(List<String> symbols, String interval) {
        Timeframe timeframe = Timeframe.fromString(interval);
        logger.info("Starting batch analysis of {} symbols on {}", symbols.size(), timeframe);

        List<CompletableFuture<ComprehensiveAnalysis>> futures = new ArrayList<>();
        for (String symbol : symbols) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return performComprehensiveAnalysis(MarketDataService.normalizeSymbol(symbol), timeframe,
                            properties.getComprehensiveCandleLimit());
                } catch (RuntimeException e) {
                    logger.error("Batch analysis failed for {} {}: {}", symbol, timeframe, e.getMessage());
                    return null;
                }
            }, analysisExecutor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ComprehensiveAnalysis> results = new ArrayList<>();
        for (CompletableFuture<ComprehensiveAnalysis> future : futures) {
            try {
                ComprehensiveAnalysis analysis = future.join();
                if (analysis != null) {
                    results.add(analysis);
                }
            } catch (CompletionException e) {
                logger.error("Exception retrieving batch result: {}", e.getMessage(), e);
            }
        }

        logger.info("Batch analysis finished: {}/{} symbols analysed", results.size(), symbols.size());
        return results;
    }

    /**
     * Fetches every configured timeframe in parallel, one task per timeframe.
     * Failed fetches are recorded under {@code component} and left out of the map.
     */
    private Map<Timeframe, List<Candle>> fetchAllTimeframes(String symbol, int limit, String component,
                                                            List<AnalysisFailure> failures) {
        Map<Timeframe, CompletableFuture<List<Candle>>> futures = new LinkedHashMap<>();
        Map<Timeframe, String> errors = new ConcurrentHashMap<>();

        for (Timeframe timeframe : properties.getTimeframes()) {
            futures.put(timeframe, CompletableFuture.supplyAsync(() -> {
                try {
                    return marketDataService.getCandles(symbol, timeframe, limit);
                } catch (RuntimeException e) {
                    logger.error("Candle fetch for {} {} failed: {}", symbol, timeframe, e.getMessage(), e);
                    errors.put(timeframe, String.valueOf(e.getMessage()));
                    return null;
                }
            }, analysisExecutor));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<Timeframe, List<Candle>> candlesByTimeframe = new EnumMap<>(Timeframe.class);
        futures.forEach((timeframe, future) -> {
            List<Candle> candles = future.join();
            if (candles != null) {
                candlesByTimeframe.put(timeframe, candles);
            } else {
                failures.add(new AnalysisFailure(component, timeframe.getCode(), errors.get(timeframe)));
            }
        });
        return candlesByTimeframe;
    }

    private ComprehensiveAnalysis emptyAnalysis(String symbol, Timeframe timeframe, AnalysisFailure failure) {
        List<AnalysisFailure> failures = new ArrayList<>();
        failures.add(failure);
        return ComprehensiveAnalysis.builder()
                .symbol(symbol)
                .interval(timeframe)
                .summary("Not enough data to analyse " + symbol + " on " + timeframe)
                .failures(failures)
                .build();
    }
}
