package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Merged support/resistance picture for one symbol across the analysed timeframes.
 * Supports are ordered by center price descending, resistances ascending, so the
 * first element of each list is the level closest to the current price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportResistanceAnalysis {
    private String symbol;
    private long timestamp;
    private double currentPrice;
    @Builder.Default
    private List<SupportResistanceLevel> supports = new ArrayList<>();
    @Builder.Default
    private List<SupportResistanceLevel> resistances = new ArrayList<>();
    private KeyLevelSet keyLevels;
    private CurrentPosition currentPosition;
    private TradingZones tradingZones;
    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();

    public enum PriceAction {
        APPROACHING_SUPPORT,
        APPROACHING_RESISTANCE,
        CONSOLIDATING
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeyLevelSet {
        private SupportResistanceLevel nearestSupport;
        private SupportResistanceLevel nearestResistance;
        private SupportResistanceLevel strongestSupport;
        private SupportResistanceLevel strongestResistance;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrentPosition {
        private boolean betweenLevels;
        private SupportResistanceLevel supportBelow;
        private SupportResistanceLevel resistanceAbove;
        private boolean inSupportZone;
        private boolean inResistanceZone;
        private PriceAction priceAction;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TradingZone {
        private PriceRange range;
        private String reason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TradingZones {
        private List<TradingZone> buyZones = new ArrayList<>();
        private List<TradingZone> sellZones = new ArrayList<>();
    }
}
