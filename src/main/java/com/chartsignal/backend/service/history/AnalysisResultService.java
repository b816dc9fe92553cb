package com.chartsignal.backend.service.history;

import com.chartsignal.backend.model.AnalysisResult;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.ComprehensiveScore;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.repository.AnalysisResultRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Stores finished comprehensive analyses and answers history queries.
 * Storage problems are logged and never propagate into the analysis path.
 */
@Service
public class AnalysisResultService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisResultService.class);

    private static final int MAX_HISTORY = 500;

    private final AnalysisResultRepository analysisResultRepository;
    private final ObjectMapper objectMapper;

    public AnalysisResultService(AnalysisResultRepository analysisResultRepository, ObjectMapper objectMapper) {
        this.analysisResultRepository = analysisResultRepository;
        this.objectMapper = objectMapper;
    }

    public Optional<AnalysisResult> save(ComprehensiveAnalysis analysis) {
        return save(analysis, null);
    }

    /**
     * Persist a snapshot of the analysis, with the buy and sell zones of the
     * support/resistance picture when one is given. Runs in the repository's
     * own transaction, so a failed insert is rolled back there and reported as empty.
     *
     * @return the saved entity, or empty when the analysis carries no score or saving failed
     */
    public Optional<AnalysisResult> save(ComprehensiveAnalysis analysis, SupportResistanceAnalysis levels) {
        ComprehensiveScore score = analysis.getScore();
        if (score == null) {
            logger.debug("Skipping persistence of unscored analysis for {} {}", analysis.getSymbol(), analysis.getInterval());
            return Optional.empty();
        }

        try {
            AnalysisResult result = new AnalysisResult();
            result.setSymbol(analysis.getSymbol());
            result.setTimeframe(analysis.getInterval().getCode());
            result.setAnalysisTimestamp(analysis.getTimestamp());
            result.setCurrentPrice(analysis.getCurrentPrice());
            result.setTrendScore(score.getTrend());
            result.setMomentumScore(score.getMomentum());
            result.setVolatilityScore(score.getVolatility());
            result.setSignal(score.getSignal());
            result.setConfidence(score.getConfidence());
            result.setPatternsJson(objectMapper.writeValueAsString(analysis.getPatterns()));
            result.setLevelsJson(objectMapper.writeValueAsString(analysis.getTouchLevels()));
            if (levels != null && levels.getTradingZones() != null) {
                result.setZonesJson(objectMapper.writeValueAsString(levels.getTradingZones()));
            }
            result.setSummary(truncate(analysis.getSummary(), 1000));

            AnalysisResult saved = analysisResultRepository.save(result);
            logger.debug("Saved analysis result {} for {} {}", saved.getId(), saved.getSymbol(), saved.getTimeframe());
            return Optional.of(saved);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize analysis of {}: {}", analysis.getSymbol(), e.getMessage(), e);
        } catch (DataAccessException e) {
            logger.error("Failed to save analysis of {}: {}", analysis.getSymbol(), e.getMessage(), e);
        }
        return Optional.empty();
    }

    /**
     * Most recent results first.
     */
    @Transactional(readOnly = true)
    public List<AnalysisResult> getHistory(String symbol, Timeframe timeframe, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY));
        return analysisResultRepository.findBySymbolAndTimeframeOrderByAnalysisTimestampDesc(
                symbol, timeframe.getCode(), PageRequest.of(0, pageSize));
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisResult> findLatest(String symbol, Timeframe timeframe) {
        return analysisResultRepository.findFirstBySymbolAndTimeframeOrderByAnalysisTimestampDesc(symbol, timeframe.getCode());
    }

    @Transactional
    public int deleteOlderThan(LocalDateTime cutoff) {
        int deleted = analysisResultRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            logger.info("Deleted {} analysis results created before {}", deleted, cutoff);
        }
        return deleted;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
