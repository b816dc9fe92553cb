package com.chartsignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyLevels {
    private Double support;
    private Double resistance;
    private Double breakoutLevel;
}
