package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MacdValue {
    private double macd;
    private double signal;
    private double histogram;
}
