package com.chartsignal.backend.service;

import com.chartsignal.backend.model.AlertNotification;
import com.chartsignal.backend.model.AlertSeverity;
import com.chartsignal.backend.model.AnalysisFailure;
import com.chartsignal.backend.model.AnalysisResult;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.ComprehensiveScore;
import com.chartsignal.backend.model.MultiTimeframeTrend;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.service.alert.AlertService;
import com.chartsignal.backend.service.analysis.TechnicalAnalysisService;
import com.chartsignal.backend.service.history.AnalysisResultService;
import com.chartsignal.backend.service.market.MarketDataException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ScheduledAnalysisServiceTest {

    @Mock
    private TechnicalAnalysisService technicalAnalysisService;

    @Mock
    private AnalysisResultService analysisResultService;

    @Mock
    private AlertService alertService;

    @InjectMocks
    private ScheduledAnalysisService scheduledAnalysisService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(scheduledAnalysisService, "enabled", true);
        ReflectionTestUtils.setField(scheduledAnalysisService, "symbols", new String[]{"btcusdt", "ETHUSDT"});
        ReflectionTestUtils.setField(scheduledAnalysisService, "interval", "1h");
        ReflectionTestUtils.setField(scheduledAnalysisService, "limit", 100);
        ReflectionTestUtils.setField(scheduledAnalysisService, "retentionDays", 30);
    }

    private ComprehensiveAnalysis scored(String symbol) {
        return ComprehensiveAnalysis.builder()
                .symbol(symbol)
                .interval(Timeframe.H1)
                .score(ComprehensiveScore.builder().signal(SignalType.BUY).confidence(75).build())
                .build();
    }

    @Test
    void analyzeSymbol_shouldReadPreviousResultBeforeSaving() {
        ComprehensiveAnalysis analysis = scored("BTCUSDT");
        Optional<AnalysisResult> previous = Optional.of(new AnalysisResult());
        AlertNotification alert = AlertNotification.builder().title("BTCUSDT 1h BUY").severity(AlertSeverity.WARNING).build();
        MultiTimeframeTrend trend = MultiTimeframeTrend.builder().symbol("BTCUSDT").build();
        SupportResistanceAnalysis levels = SupportResistanceAnalysis.builder().symbol("BTCUSDT").build();
        when(technicalAnalysisService.performComprehensiveAnalysis("BTCUSDT", Timeframe.H1, 100)).thenReturn(analysis);
        when(analysisResultService.findLatest("BTCUSDT", Timeframe.H1)).thenReturn(previous);
        when(technicalAnalysisService.analyzeSupportResistance("BTCUSDT")).thenReturn(levels);
        when(alertService.evaluateAnalysis(analysis, previous)).thenReturn(Optional.of(alert));
        when(technicalAnalysisService.analyzeMultiTimeframeTrend("BTCUSDT")).thenReturn(trend);
        when(alertService.evaluateTrend(trend)).thenReturn(Optional.empty());

        scheduledAnalysisService.analyzeSymbol("BTCUSDT", Timeframe.H1);

        InOrder inOrder = inOrder(analysisResultService, alertService);
        inOrder.verify(analysisResultService).findLatest("BTCUSDT", Timeframe.H1);
        inOrder.verify(analysisResultService).save(analysis, levels);
        inOrder.verify(alertService).evaluateAnalysis(analysis, previous);
        inOrder.verify(alertService).dispatch(alert);
    }

    @Test
    void analyzeSymbol_withoutScore_shouldNotPersist() {
        ComprehensiveAnalysis unscored = ComprehensiveAnalysis.builder()
                .symbol("BTCUSDT")
                .interval(Timeframe.H1)
                .failures(Collections.singletonList(new AnalysisFailure("candles", "1h", "Insufficient candles: 5")))
                .build();
        MultiTimeframeTrend trend = MultiTimeframeTrend.builder().symbol("BTCUSDT").build();
        when(technicalAnalysisService.performComprehensiveAnalysis("BTCUSDT", Timeframe.H1, 100)).thenReturn(unscored);
        when(technicalAnalysisService.analyzeMultiTimeframeTrend("BTCUSDT")).thenReturn(trend);
        when(alertService.evaluateTrend(trend)).thenReturn(Optional.empty());

        scheduledAnalysisService.analyzeSymbol("BTCUSDT", Timeframe.H1);

        verify(analysisResultService, never()).save(any(), any());
        verify(technicalAnalysisService, never()).analyzeSupportResistance(any());
        verify(alertService, never()).dispatch(any());
    }

    @Test
    void runScheduledAnalysis_shouldContinueAfterSymbolFailure() {
        ComprehensiveAnalysis eth = scored("ETHUSDT");
        MultiTimeframeTrend trend = MultiTimeframeTrend.builder().symbol("ETHUSDT").build();
        when(technicalAnalysisService.performComprehensiveAnalysis("BTCUSDT", Timeframe.H1, 100))
                .thenThrow(new MarketDataException("exchange unavailable"));
        when(technicalAnalysisService.performComprehensiveAnalysis("ETHUSDT", Timeframe.H1, 100)).thenReturn(eth);
        when(analysisResultService.findLatest("ETHUSDT", Timeframe.H1)).thenReturn(Optional.empty());
        when(technicalAnalysisService.analyzeSupportResistance("ETHUSDT"))
                .thenThrow(new MarketDataException("rate limited"));
        when(alertService.evaluateAnalysis(eth, Optional.empty())).thenReturn(Optional.empty());
        when(technicalAnalysisService.analyzeMultiTimeframeTrend("ETHUSDT")).thenReturn(trend);
        when(alertService.evaluateTrend(trend)).thenReturn(Optional.empty());

        scheduledAnalysisService.runScheduledAnalysis();

        verify(analysisResultService).save(eq(eth), isNull());
    }

    @Test
    void runScheduledAnalysis_whenDisabled_shouldDoNothing() {
        ReflectionTestUtils.setField(scheduledAnalysisService, "enabled", false);

        scheduledAnalysisService.runScheduledAnalysis();

        verify(technicalAnalysisService, never()).performComprehensiveAnalysis(any(String.class), any(Timeframe.class), eq(100));
    }

    @Test
    void purgeOldResults_shouldDeleteBeyondRetention() {
        scheduledAnalysisService.purgeOldResults();

        verify(analysisResultService).deleteOlderThan(any(LocalDateTime.class));
    }
}
