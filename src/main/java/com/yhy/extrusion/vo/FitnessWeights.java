package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Weights of the scalar GA fitness. Fitness is minimised; the reclaim weight is a bonus.
 */
@Value
@Builder
public class FitnessWeights {
    @Builder.Default
    double waste = 0.5;
    @Builder.Default
    double barCount = 0.3;
    @Builder.Default
    double cost = 0.15;
    @Builder.Default
    double reclaimBonus = 0.05;

    public static FitnessWeights defaults() {
        return FitnessWeights.builder().build();
    }
}
