package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single indicator reading stamped with the open time of the candle it was computed at.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorPoint<T> {
    private long timestamp;
    private T value;
}
