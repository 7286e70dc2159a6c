package com.yhy.extrusion.genetic;

import com.yhy.extrusion.analytics.CostCalculator;
import com.yhy.extrusion.vo.Cut;
import lombok.Value;

import java.util.List;

/**
 * Measured outcome of one decoded plan. The first three values are the objectives NSGA-II minimises.
 */
@Value
public class ObjectiveVector {
    public static final int OBJECTIVES = 3;

    double totalWaste;
    double totalCost;
    int barCount;
    double totalStockLength;
    double usedLength;
    double reclaimableLength;

    public static ObjectiveVector of(List<Cut> cuts, CostCalculator costs) {
        double stock = 0;
        double waste = 0;
        double used = 0;
        double reclaimable = 0;
        for (Cut cut : cuts) {
            stock += cut.getStockLength();
            waste += cut.getRemainingLength();
            used += cut.getUsedLength();
            if (cut.isReclaimable()) {
                reclaimable += cut.getRemainingLength();
            }
        }
        return new ObjectiveVector(waste, costs.calculate(cuts).getTotalCost(), cuts.size(), stock, used, reclaimable);
    }

    /**
     * Objective {@code k}: 0 waste, 1 cost, 2 bar count.
     */
    public double get(int k) {
        switch (k) {
            case 0:
                return totalWaste;
            case 1:
                return totalCost;
            case 2:
                return barCount;
            default:
                throw new IndexOutOfBoundsException("objective " + k);
        }
    }

    public double getEfficiency() {
        return totalStockLength <= 0 ? 0 : usedLength / totalStockLength;
    }
}
