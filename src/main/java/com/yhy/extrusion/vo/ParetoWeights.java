package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Scalarization used to pick one recommended solution from a Pareto front.
 */
@Value
@Builder
public class ParetoWeights {
    @Builder.Default
    double waste = 0.5;
    @Builder.Default
    double cost = 0.3;
    @Builder.Default
    double barCount = 0.2;

    public static ParetoWeights defaults() {
        return ParetoWeights.builder().build();
    }
}
