package com.chartsignal.backend.controller;

import com.chartsignal.backend.model.AnalysisResult;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.IndicatorPoint;
import com.chartsignal.backend.model.MultiTimeframeTrend;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.service.analysis.TechnicalAnalysisService;
import com.chartsignal.backend.service.history.AnalysisResultService;
import com.chartsignal.backend.service.market.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/analysis")
@CrossOrigin(origins = "http://localhost:3000", allowCredentials = "true")
public class TechnicalAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(TechnicalAnalysisController.class);

    private static final int MAX_BATCH_SYMBOLS = 20;

    private final TechnicalAnalysisService technicalAnalysisService;
    private final AnalysisResultService analysisResultService;

    public TechnicalAnalysisController(TechnicalAnalysisService technicalAnalysisService,
                                       AnalysisResultService analysisResultService) {
        this.technicalAnalysisService = technicalAnalysisService;
        this.analysisResultService = analysisResultService;
    }

    /**
     * Indicators, patterns, touch levels and the fused score for one timeframe
     */
    @GetMapping("/{symbol}/comprehensive")
    public ResponseEntity<Map<String, Object>> getComprehensiveAnalysis(@PathVariable String symbol,
                                                                        @RequestParam(defaultValue = "1h") String interval,
                                                                        @RequestParam(defaultValue = "100") int limit) {
        try {
            ComprehensiveAnalysis analysis = technicalAnalysisService.performComprehensiveAnalysis(symbol, interval, limit);
            return ResponseEntity.ok(success(analysis));
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected comprehensive analysis request for {} {}: {}", symbol, interval, e.getMessage());
            return ResponseEntity.badRequest().body(failure(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Comprehensive analysis failed for {} {}: {}", symbol, interval, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failure("Analysis failed: " + e.getMessage()));
        }
    }

    /**
     * Indicator series by name, e.g. {@code indicators=sma20,rsi,macd}; all of them when omitted
     */
    @GetMapping("/{symbol}/indicators")
    public ResponseEntity<Map<String, Object>> getIndicators(@PathVariable String symbol,
                                                             @RequestParam(defaultValue = "1h") String interval,
                                                             @RequestParam(required = false) List<String> indicators,
                                                             @RequestParam(defaultValue = "100") int limit) {
        try {
            Map<String, List<? extends IndicatorPoint<?>>> result =
                    technicalAnalysisService.calculateIndicators(symbol, interval, indicators, limit);
            return ResponseEntity.ok(success(result));
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected indicator request for {} {}: {}", symbol, interval, e.getMessage());
            return ResponseEntity.badRequest().body(failure(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Indicator calculation failed for {} {}: {}", symbol, interval, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failure("Indicator calculation failed: " + e.getMessage()));
        }
    }

    /**
     * Trend on every configured timeframe plus the combined view
     */
    @GetMapping("/{symbol}/trend")
    public ResponseEntity<Map<String, Object>> getMultiTimeframeTrend(@PathVariable String symbol) {
        try {
            MultiTimeframeTrend trend = technicalAnalysisService.analyzeMultiTimeframeTrend(symbol);
            return ResponseEntity.ok(success(trend));
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected trend request for {}: {}", symbol, e.getMessage());
            return ResponseEntity.badRequest().body(failure(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Trend analysis failed for {}: {}", symbol, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failure("Analysis failed: " + e.getMessage()));
        }
    }

    @GetMapping("/{symbol}/support-resistance")
    public ResponseEntity<Map<String, Object>> getSupportResistance(@PathVariable String symbol) {
        try {
            SupportResistanceAnalysis analysis = technicalAnalysisService.analyzeSupportResistance(symbol);
            return ResponseEntity.ok(success(analysis));
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected support/resistance request for {}: {}", symbol, e.getMessage());
            return ResponseEntity.badRequest().body(failure(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Support/resistance analysis failed for {}: {}", symbol, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failure("Analysis failed: " + e.getMessage()));
        }
    }

    /**
     * Stored results, newest first
     */
    @GetMapping("/{symbol}/history")
    public ResponseEntity<Map<String, Object>> getHistory(@PathVariable String symbol,
                                                          @RequestParam(defaultValue = "1h") String interval,
                                                          @RequestParam(defaultValue = "10") int limit) {
        try {
            String normalized = MarketDataService.normalizeSymbol(symbol);
            Timeframe timeframe = Timeframe.fromString(interval);
            List<AnalysisResult> history = analysisResultService.getHistory(normalized, timeframe, limit);
            Map<String, Object> response = success(history);
            response.put("count", history.size());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(failure(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("History query failed for {} {}: {}", symbol, interval, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failure("History query failed: " + e.getMessage()));
        }
    }

    @GetMapping("/batch")
    public ResponseEntity<Map<String, Object>> getBatchAnalysis(@RequestParam List<String> symbols,
                                                                @RequestParam(defaultValue = "1h") String interval) {
        if (symbols.isEmpty() || symbols.size() > MAX_BATCH_SYMBOLS) {
            return ResponseEntity.badRequest().body(failure("Between 1 and " + MAX_BATCH_SYMBOLS + " symbols required"));
        }
        try {
            List<ComprehensiveAnalysis> results = technicalAnalysisService.performBatchAnalysis(symbols, interval);
            Map<String, Object> response = success(results);
            response.put("requested", symbols.size());
            response.put("analysed", results.size());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(failure(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Batch analysis failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failure("Batch analysis failed: " + e.getMessage()));
        }
    }

    private Map<String, Object> success(Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", data);
        return response;
    }

    private Map<String, Object> failure(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", message);
        return response;
    }
}
