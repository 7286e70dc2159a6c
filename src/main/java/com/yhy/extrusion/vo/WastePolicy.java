package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Remainder thresholds (mm) separating the waste categories, and the reuse floor.
 */
@Value
@Builder
public class WastePolicy {
    @Builder.Default
    double smallFrom = 50;
    @Builder.Default
    double mediumFrom = 150;
    @Builder.Default
    double largeFrom = 300;
    @Builder.Default
    double excessiveAbove = 500;
    @Builder.Default
    double reuseFloor = 300;
    /** share of bars in the excessive category that triggers a stock-length recommendation */
    @Builder.Default
    double excessiveShareAlert = 0.2;
    /** efficiency below which a heuristic result suggests a search strategy */
    @Builder.Default
    double efficiencyTarget = 0.85;

    public WasteCategory classify(double remainder) {
        if (remainder < smallFrom) {
            return WasteCategory.MINIMAL;
        }
        if (remainder < mediumFrom) {
            return WasteCategory.SMALL;
        }
        if (remainder < largeFrom) {
            return WasteCategory.MEDIUM;
        }
        if (remainder <= excessiveAbove) {
            return WasteCategory.LARGE;
        }
        return WasteCategory.EXCESSIVE;
    }

    public boolean isReclaimable(double remainder) {
        return remainder >= reuseFloor && classify(remainder).isReclaimableClass();
    }

    public static WastePolicy defaults() {
        return WastePolicy.builder().build();
    }
}
