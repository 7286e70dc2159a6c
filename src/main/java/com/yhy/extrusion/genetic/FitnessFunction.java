package com.yhy.extrusion.genetic;

import com.yhy.extrusion.vo.FitnessWeights;

/**
 * Weighted scalar fitness, lower is better. Bar count and cost are measured relative to a
 * baseline plan so the weights stay comparable across partitions of different size.
 */
public class FitnessFunction {

    private final FitnessWeights weights;
    private final ObjectiveVector baseline;

    public FitnessFunction(FitnessWeights weights, ObjectiveVector baseline) {
        this.weights = weights;
        this.baseline = baseline;
    }

    public double evaluate(ObjectiveVector v) {
        double stock = v.getTotalStockLength();
        double wasteRatio = stock > 0 ? v.getTotalWaste() / stock : 0;
        double reclaimRatio = stock > 0 ? v.getReclaimableLength() / stock : 0;
        double barRatio = ratio(v.getBarCount(), baseline.getBarCount());
        double costRatio = ratio(v.getTotalCost(), baseline.getTotalCost());
        return weights.getWaste() * wasteRatio
                + weights.getBarCount() * barRatio
                + weights.getCost() * costRatio
                - weights.getReclaimBonus() * reclaimRatio;
    }

    private static double ratio(double value, double reference) {
        return reference > 0 ? value / reference : 0;
    }

    public ObjectiveVector getBaseline() {
        return baseline;
    }
}
