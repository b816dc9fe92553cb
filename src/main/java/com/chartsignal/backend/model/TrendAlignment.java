package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrendAlignment {
    private boolean aligned;
    private double alignmentScore;
    private List<Timeframe> conflictingTimeframes = new ArrayList<>();
}
