package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Unit rates of the cost model. Currency is whatever the caller prices stock in.
 */
@Value
@Builder
public class CostRates {
    /** per metre of stock consumed */
    @Builder.Default
    double materialPerMeter = 12.0;
    /** per metre of unused remainder, on top of its material cost */
    @Builder.Default
    double wastePerMeter = 2.0;
    /** per change of profile or stock length on the saw */
    @Builder.Default
    double setupPerEvent = 15.0;
    /** per blade pass */
    @Builder.Default
    double cuttingPerCut = 0.5;
    @Builder.Default
    double laborPerHour = 40.0;
    @Builder.Default
    double machinePerHour = 25.0;
    @Builder.Default
    double setupMinutesPerBar = 1.5;
    @Builder.Default
    double cutMinutesPerSegment = 0.5;

    public static CostRates defaults() {
        return CostRates.builder().build();
    }
}
