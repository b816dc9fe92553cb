package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternResult {
    private PatternType type;
    private SignalType signal;
    private double confidence;
    private long startTime;
    private long endTime;
    private String description;
    private KeyLevels keyLevels;
}
