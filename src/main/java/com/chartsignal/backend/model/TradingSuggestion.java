package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradingSuggestion {
    private SuggestedAction action;
    private String reason;
    private RiskLevel riskLevel;
}
