package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.AlgorithmConfig;
import com.yhy.extrusion.vo.CostBreakdown;
import lombok.Builder;
import lombok.Value;

/**
 * What the rules look at once a run is finished.
 */
@Value
@Builder
public class RecommendationInput {
    AlgorithmConfig config;
    WasteReport waste;
    CostBreakdown cost;
    boolean timeBudgetHit;
    /** profiles whose demand came from more than one work order but was planned per order */
    int separatelyPlannedProfiles;
}
