package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SupportResistanceLevel {
    private LevelType type;
    private PriceRange priceRange;
    private LevelStrength strength;
    private int confidence;
    private int touchCount;
    private long lastTouchTimestamp;
    private Timeframe timeframe;
    private boolean active;
    private double distance; // percent from current price
    private String description;
}
