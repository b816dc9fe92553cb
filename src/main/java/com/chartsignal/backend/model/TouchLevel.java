package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Swing price that the series returned to at least twice. Strength is the
 * touch count capped at 10. Used as input to pattern detection.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TouchLevel {
    private double price;
    private LevelType type;
    private int strength;
    private int touchCount;
    private long firstTouch;
    private long lastTouch;
}
