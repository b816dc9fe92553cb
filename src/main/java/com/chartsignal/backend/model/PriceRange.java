package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceRange {
    private double min;
    private double max;
    private double center;

    public boolean contains(double price) {
        return price >= min && price <= max;
    }
}
