package com.chartsignal.backend.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "analysis_results", indexes = {
        @Index(name = "idx_analysis_symbol_interval", columnList = "symbol, timeframe, analysis_timestamp")
})
@Data
public class AnalysisResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(name = "timeframe", nullable = false, length = 8)
    private String timeframe;

    @Column(name = "analysis_timestamp", nullable = false)
    private Long analysisTimestamp;

    @Column(name = "current_price")
    private Double currentPrice;

    @Column(name = "trend_score")
    private Integer trendScore;

    @Column(name = "momentum_score")
    private Integer momentumScore;

    @Column(name = "volatility_score")
    private Integer volatilityScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SignalType signal;

    private Integer confidence;

    @Column(name = "patterns_json", columnDefinition = "TEXT")
    private String patternsJson;

    @Column(name = "levels_json", columnDefinition = "TEXT")
    private String levelsJson;

    @Column(name = "zones_json", columnDefinition = "TEXT")
    private String zonesJson;

    @Column(length = 1000)
    private String summary;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
