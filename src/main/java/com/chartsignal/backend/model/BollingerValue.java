package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BollingerValue {
    private double upper;
    private double middle;
    private double lower;
}
