package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.AlgorithmConfig;
import com.yhy.extrusion.vo.Recommendation;
import com.yhy.extrusion.vo.Recommendation.Effort;
import com.yhy.extrusion.vo.Recommendation.Severity;
import com.yhy.extrusion.vo.Recommendation.Type;
import com.yhy.extrusion.vo.WasteCategory;
import com.yhy.extrusion.vo.WasteHistogram;
import com.yhy.extrusion.vo.WastePolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule based advice on a finished plan. Savings are rough material-cost estimates.
 */
public class RecommendationEngine {

    private static final double MM_PER_METER = 1000.0;

    public List<Recommendation> recommend(RecommendationInput input) {
        AlgorithmConfig config = input.getConfig();
        WastePolicy policy = config.getWastePolicy();
        WasteReport waste = input.getWaste();
        double materialRate = config.getCostRates().getMaterialPerMeter();
        List<Recommendation> out = new ArrayList<>();

        WasteHistogram histogram = waste.getHistogram();
        int bars = histogram.total();
        if (bars == 0) {
            return out;
        }

        double excessiveShare = (double) histogram.count(WasteCategory.EXCESSIVE) / bars;
        if (excessiveShare > policy.getExcessiveShareAlert()) {
            out.add(Recommendation.builder()
                    .type(Type.ALTERNATE_STOCK_LENGTH)
                    .severity(excessiveShare > 2 * policy.getExcessiveShareAlert() ? Severity.CRITICAL : Severity.WARNING)
                    .message(String.format("%.0f%% of bars leave more than %.0f mm; add a shorter stock length",
                            excessiveShare * 100, policy.getExcessiveAbove()))
                    .potentialSavings(histogram.length(WasteCategory.EXCESSIVE) / MM_PER_METER * materialRate)
                    .implementationEffort(Effort.MEDIUM)
                    .build());
        }

        if (waste.getReclaimableCount() > 0) {
            out.add(Recommendation.builder()
                    .type(Type.STORE_REMNANTS)
                    .severity(Severity.INFO)
                    .message(String.format("%d remnants (%.0f mm) are long enough to return to stock",
                            waste.getReclaimableCount(), waste.getReclaimableLength()))
                    .potentialSavings(waste.getReclaimableLength() / MM_PER_METER * materialRate)
                    .implementationEffort(Effort.LOW)
                    .build());
        }

        if (!config.effectiveMode().isEvolutionary() && waste.getEfficiency() < policy.getEfficiencyTarget()) {
            double gap = policy.getEfficiencyTarget() - waste.getEfficiency();
            out.add(Recommendation.builder()
                    .type(Type.ALGORITHM_CHANGE)
                    .severity(Severity.WARNING)
                    .message(String.format("Efficiency %.1f%% is below the %.0f%% target; try the genetic or nsga-ii strategy",
                            waste.getEfficiency() * 100, policy.getEfficiencyTarget() * 100))
                    .potentialSavings(gap * waste.getTotalStockLength() / MM_PER_METER * materialRate)
                    .implementationEffort(Effort.LOW)
                    .build());
        }

        if (input.isTimeBudgetHit()) {
            out.add(Recommendation.builder()
                    .type(Type.PARAMETER_ADJUSTMENT)
                    .severity(Severity.INFO)
                    .message(String.format("Search stopped at the %d ms time budget; a larger budget may find a better plan",
                            config.getTimeBudgetMs()))
                    .implementationEffort(Effort.LOW)
                    .build());
        }

        if (waste.getToleranceAdjustedCount() > 0) {
            out.add(Recommendation.builder()
                    .type(Type.TOLERANCE_REVIEW)
                    .severity(Severity.INFO)
                    .message(String.format("%d pieces were cut below nominal length within tolerance",
                            waste.getToleranceAdjustedCount()))
                    .implementationEffort(Effort.MEDIUM)
                    .build());
        }

        if (input.getSeparatelyPlannedProfiles() > 0) {
            out.add(Recommendation.builder()
                    .type(Type.ENABLE_POOLING)
                    .severity(Severity.INFO)
                    .message(String.format("%d profiles are shared by several work orders; pooling lets them share bars",
                            input.getSeparatelyPlannedProfiles()))
                    .implementationEffort(Effort.LOW)
                    .build());
        }
        return out;
    }
}
