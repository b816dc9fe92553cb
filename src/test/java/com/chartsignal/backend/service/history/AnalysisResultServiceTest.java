package com.chartsignal.backend.service.history;

import com.chartsignal.backend.model.AnalysisResult;
import com.chartsignal.backend.model.ComprehensiveAnalysis;
import com.chartsignal.backend.model.ComprehensiveScore;
import com.chartsignal.backend.model.KeyLevels;
import com.chartsignal.backend.model.PatternResult;
import com.chartsignal.backend.model.PatternType;
import com.chartsignal.backend.model.PriceRange;
import com.chartsignal.backend.model.SignalType;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.SupportResistanceAnalysis.TradingZone;
import com.chartsignal.backend.model.SupportResistanceAnalysis.TradingZones;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.repository.AnalysisResultRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;

import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class AnalysisResultServiceTest {

    @Mock
    private AnalysisResultRepository analysisResultRepository;

    private AnalysisResultService analysisResultService;

    @BeforeEach
    void setUp() {
        analysisResultService = new AnalysisResultService(analysisResultRepository, new ObjectMapper());
    }

    private ComprehensiveAnalysis scoredAnalysis(String summary) {
        PatternResult box = PatternResult.builder()
                .type(PatternType.BOX)
                .signal(SignalType.NEUTRAL)
                .confidence(85)
                .keyLevels(new KeyLevels(100.0, 110.0, null))
                .build();
        return ComprehensiveAnalysis.builder()
                .symbol("BTCUSDT")
                .interval(Timeframe.H4)
                .timestamp(1700000000000L)
                .currentPrice(102.5)
                .patterns(Collections.singletonList(box))
                .score(ComprehensiveScore.builder()
                        .trend(-25).momentum(-30).volatility(15).signal(SignalType.SELL).confidence(55).build())
                .summary(summary)
                .build();
    }

    @Test
    void save_withoutScore_shouldSkipRepository() {
        ComprehensiveAnalysis analysis = ComprehensiveAnalysis.builder()
                .symbol("BTCUSDT").interval(Timeframe.H1).summary("Not enough data").build();

        assertFalse(analysisResultService.save(analysis).isPresent());
        verifyNoInteractions(analysisResultRepository);
    }

    @Test
    void save_shouldMapScoreAndSerializePatterns() {
        when(analysisResultRepository.save(any(AnalysisResult.class))).thenAnswer(invocation -> {
            AnalysisResult result = invocation.getArgument(0);
            result.setId(1L);
            return result;
        });

        Optional<AnalysisResult> saved = analysisResultService.save(scoredAnalysis("Weak downtrend"));

        assertTrue(saved.isPresent());
        ArgumentCaptor<AnalysisResult> captor = ArgumentCaptor.forClass(AnalysisResult.class);
        verify(analysisResultRepository).save(captor.capture());
        AnalysisResult result = captor.getValue();
        assertEquals("BTCUSDT", result.getSymbol());
        assertEquals("4h", result.getTimeframe());
        assertEquals(1700000000000L, result.getAnalysisTimestamp());
        assertEquals(102.5, result.getCurrentPrice(), 1e-9);
        assertEquals(-25, result.getTrendScore());
        assertEquals(-30, result.getMomentumScore());
        assertEquals(15, result.getVolatilityScore());
        assertEquals(SignalType.SELL, result.getSignal());
        assertEquals(55, result.getConfidence());
        assertTrue(result.getPatternsJson().contains("\"type\":\"BOX\""));
        assertEquals("[]", result.getLevelsJson());
        assertEquals("Weak downtrend", result.getSummary());
    }

    @Test
    void save_withLevels_shouldStoreTradingZones() {
        when(analysisResultRepository.save(any(AnalysisResult.class))).thenAnswer(invocation -> invocation.getArgument(0));
        TradingZones zones = new TradingZones();
        zones.getBuyZones().add(new TradingZone(new PriceRange(99.5, 100.5, 100.0), "STRONG support, confidence 90%"));
        SupportResistanceAnalysis levels = SupportResistanceAnalysis.builder().symbol("BTCUSDT").tradingZones(zones).build();

        AnalysisResult result = analysisResultService.save(scoredAnalysis("Sideways"), levels).get();

        assertTrue(result.getZonesJson().contains("\"buyZones\":[{\"range\":{\"min\":99.5"));
        assertTrue(result.getZonesJson().contains("\"sellZones\":[]"));
    }

    @Test
    void save_shouldTruncateLongSummary() {
        when(analysisResultRepository.save(any(AnalysisResult.class))).thenAnswer(invocation -> invocation.getArgument(0));
        StringBuilder summary = new StringBuilder();
        while (summary.length() < 1500) {
            summary.append("Sideways, ");
        }

        AnalysisResult result = analysisResultService.save(scoredAnalysis(summary.toString())).get();

        assertEquals(1000, result.getSummary().length());
    }

    @Test
    void save_whenRepositoryFails_shouldReturnEmpty() {
        when(analysisResultRepository.save(any(AnalysisResult.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate"));

        assertFalse(analysisResultService.save(scoredAnalysis("Sideways")).isPresent());
    }

    @Test
    void getHistory_shouldCapPageSize() {
        when(analysisResultRepository.findBySymbolAndTimeframeOrderByAnalysisTimestampDesc(
                eq("BTCUSDT"), eq("1h"), any(Pageable.class))).thenReturn(Collections.emptyList());

        analysisResultService.getHistory("BTCUSDT", Timeframe.H1, 10_000);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(analysisResultRepository).findBySymbolAndTimeframeOrderByAnalysisTimestampDesc(
                eq("BTCUSDT"), eq("1h"), captor.capture());
        assertEquals(500, captor.getValue().getPageSize());
        assertEquals(0, captor.getValue().getPageNumber());
    }
}
