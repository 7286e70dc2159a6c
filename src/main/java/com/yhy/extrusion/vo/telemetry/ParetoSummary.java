package com.yhy.extrusion.vo.telemetry;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Rank-0 front of an NSGA-II run, sorted by waste.
 */
@Value
@Builder
public class ParetoSummary {
    List<ParetoPoint> front;
    int recommendedIndex;
    /** normalised to the front's own ideal/nadir box, reference point 1.1 on each axis */
    double hypervolume;
    double spacing;

    public int getFrontSize() {
        return front.size();
    }

    public ParetoPoint getRecommended() {
        return front.get(recommendedIndex);
    }
}
