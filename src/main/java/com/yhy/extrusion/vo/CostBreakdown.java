package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CostBreakdown {
    double materialCost;
    double laborCost;
    double wasteCost;
    double setupCost;
    double cuttingCost;
    double timeCost;
    int setupEvents;
    double machineMinutes;

    public double getTotalCost() {
        return materialCost + laborCost + wasteCost + setupCost + cuttingCost + timeCost;
    }

    public static CostBreakdown zero() {
        return CostBreakdown.builder().build();
    }
}
