package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fused score. Trend and momentum lie in [-100, 100], volatility and
 * confidence in [0, 100].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComprehensiveScore {
    private int trend;
    private int momentum;
    private int volatility;
    private SignalType signal;
    private int confidence;
}
