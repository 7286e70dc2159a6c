package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.WasteCategory;
import com.yhy.extrusion.vo.WasteHistogram;

/**
 * Single 0..1 score of a plan: mostly material efficiency, then how small the remainders are,
 * then how many pieces kept their nominal length.
 */
public class QualityScorer {

    static final double EFFICIENCY_WEIGHT = 0.6;
    static final double DISTRIBUTION_WEIGHT = 0.25;
    static final double COMPLIANCE_WEIGHT = 0.15;

    public double score(WasteReport report) {
        WasteHistogram histogram = report.getHistogram();
        int bars = histogram.total();
        if (bars == 0) {
            return 0;
        }
        double tight = histogram.count(WasteCategory.MINIMAL) + histogram.count(WasteCategory.SMALL);
        // reclaimable remnants count half
        double distribution = (tight + 0.5 * report.getReclaimableCount()) / bars;
        double compliance = report.getSegmentCount() == 0
                ? 1
                : 1 - (double) report.getToleranceAdjustedCount() / report.getSegmentCount();
        double score = EFFICIENCY_WEIGHT * report.getEfficiency()
                + DISTRIBUTION_WEIGHT * distribution
                + COMPLIANCE_WEIGHT * compliance;
        return Math.max(0, Math.min(1, score));
    }
}
