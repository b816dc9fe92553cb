package com.chartsignal.backend.service.alert;

import com.chartsignal.backend.model.AlertNotification;
import com.chartsignal.backend.model.AlertSeverity;
import com.chartsignal.backend.model.AnalysisResult;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.ComprehensiveScore;
import com.chartsignal.backend.model.MultiTimeframeTrend;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.SuggestedAction;
import com.chartsignal.backend.model.TradingSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which analysis outcomes are worth an alert and hands them to every
 * registered {@link AlertDispatcher}.
 */
@Service
public class AlertService {

    private static final Logger logger = LoggerFactory.getLogger(AlertService.class);

    private final List<AlertDispatcher> dispatchers;
    private final int minConfidence;
    private final int criticalConfidence;

    public AlertService(List<AlertDispatcher> dispatchers,
                        @Value("${analysis.alert.min-confidence:60}") int minConfidence,
                        @Value("${analysis.alert.critical-confidence:80}") int criticalConfidence) {
        this.dispatchers = dispatchers;
        this.minConfidence = minConfidence;
        this.criticalConfidence = criticalConfidence;
    }

    /**
     * Alert for a directional signal at or above the confidence threshold. When the
     * previous stored result for the same symbol and timeframe already carried the
     * same signal, nothing is raised.
     *
     * @param previous latest stored result before this analysis, if any
     */
    public Optional<AlertNotification> evaluateAnalysis(ComprehensiveAnalysis analysis, Optional<AnalysisResult> previous) {
        ComprehensiveScore score = analysis.getScore();
        if (score == null || score.getSignal() == SignalType.NEUTRAL || score.getConfidence() < minConfidence) {
            return Optional.empty();
        }

        SignalType previousSignal = previous.map(AnalysisResult::getSignal).orElse(null);
        if (previousSignal == score.getSignal()) {
            logger.debug("Signal for {} {} unchanged ({}), no alert", analysis.getSymbol(), analysis.getInterval(), previousSignal);
            return Optional.empty();
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("interval", analysis.getInterval().getCode());
        metadata.put("price", analysis.getCurrentPrice());
        metadata.put("signal", score.getSignal().name());
        metadata.put("confidence", score.getConfidence());
        metadata.put("trendScore", score.getTrend());
        metadata.put("momentumScore", score.getMomentum());
        if (previousSignal != null) {
            metadata.put("previousSignal", previousSignal.name());
            metadata.put("previousConfidence", previous.get().getConfidence());
        }

        String title = analysis.getSymbol() + " " + analysis.getInterval().getCode() + " " + score.getSignal()
                + (previousSignal == null ? "" : " (was " + previousSignal + ")");

        return Optional.of(AlertNotification.builder()
                .title(title)
                .body(analysis.getSummary())
                .severity(score.getConfidence() >= criticalConfidence ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                .symbol(analysis.getSymbol())
                .timestamp(analysis.getTimestamp())
                .metadata(metadata)
                .build());
    }

    /**
     * Alert when every timeframe agrees on a strong move.
     */
    public Optional<AlertNotification> evaluateTrend(MultiTimeframeTrend trend) {
        TradingSuggestion suggestion = trend.getTradingSuggestion();
        if (suggestion == null || trend.getAlignment() == null || !trend.getAlignment().isAligned()) {
            return Optional.empty();
        }
        if (suggestion.getAction() != SuggestedAction.STRONG_BUY && suggestion.getAction() != SuggestedAction.STRONG_SELL) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("overallTrend", trend.getOverallTrend().name());
        metadata.put("overallConfidence", Math.round(trend.getOverallConfidence()));
        metadata.put("alignmentScore", Math.round(trend.getAlignment().getAlignmentScore()));
        metadata.put("action", suggestion.getAction().name());
        metadata.put("riskLevel", suggestion.getRiskLevel().name());

        return Optional.of(AlertNotification.builder()
                .title(trend.getSymbol() + " " + suggestion.getAction() + " across timeframes")
                .body(suggestion.getReason())
                .severity(AlertSeverity.INFO)
                .symbol(trend.getSymbol())
                .timestamp(trend.getTimestamp())
                .metadata(metadata)
                .build());
    }

    /**
     * @return number of dispatchers that accepted the alert
     */
    public int dispatch(AlertNotification notification) {
        int delivered = 0;
        for (AlertDispatcher dispatcher : dispatchers) {
            try {
                dispatcher.dispatch(notification);
                delivered++;
            } catch (RuntimeException e) {
                logger.error("Alert dispatch via {} failed for {}: {}", dispatcher.getChannel(),
                        notification.getSymbol(), e.getMessage(), e);
            }
        }
        return delivered;
    }
}
