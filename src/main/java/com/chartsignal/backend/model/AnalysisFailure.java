package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A sub-analysis that failed while the rest of the result was still produced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisFailure {
    private String component;
    private String timeframe;
    private String message;
}
