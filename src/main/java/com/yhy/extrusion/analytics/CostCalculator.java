package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.CostBreakdown;
import com.yhy.extrusion.vo.CostRates;
import com.yhy.extrusion.vo.Cut;

import java.util.List;
import java.util.Objects;

/**
 * Prices a cutting plan. Lengths are millimetres, rates are per metre, per event or per hour.
 */
public class CostCalculator {

    private static final double MM_PER_METER = 1000.0;

    private final CostRates rates;

    public CostCalculator(CostRates rates) {
        this.rates = rates;
    }

    public CostBreakdown calculate(List<Cut> cuts) {
        if (cuts.isEmpty()) {
            return CostBreakdown.zero();
        }
        double stockMm = 0;
        double remainderMm = 0;
        int segments = 0;
        int setupEvents = 0;
        Cut previous = null;
        for (Cut cut : cuts) {
            stockMm += cut.getStockLength();
            remainderMm += cut.getRemainingLength();
            segments += cut.getSegmentCount();
            if (previous == null || needsSetup(previous, cut)) {
                setupEvents++;
            }
            previous = cut;
        }
        double machineMinutes = rates.getSetupMinutesPerBar() * cuts.size() + rates.getCutMinutesPerSegment() * segments;
        double machineHours = machineMinutes / 60.0;

        return CostBreakdown.builder()
                .materialCost(stockMm / MM_PER_METER * rates.getMaterialPerMeter())
                .wasteCost(remainderMm / MM_PER_METER * rates.getWastePerMeter())
                .setupCost(setupEvents * rates.getSetupPerEvent())
                .cuttingCost(segments * rates.getCuttingPerCut())
                .laborCost(machineHours * rates.getLaborPerHour())
                .timeCost(machineHours * rates.getMachinePerHour())
                .setupEvents(setupEvents)
                .machineMinutes(machineMinutes)
                .build();
    }

    /**
     * Total cost divided by the metres actually delivered as pieces; zero when nothing was cut.
     */
    public double costPerMeter(CostBreakdown breakdown, List<Cut> cuts) {
        double usedMm = cuts.stream().mapToDouble(Cut::getUsedLength).sum();
        if (usedMm <= 0) {
            return 0;
        }
        return breakdown.getTotalCost() / (usedMm / MM_PER_METER);
    }

    // the saw is re-set whenever the profile or the bar length changes
    private static boolean needsSetup(Cut previous, Cut current) {
        return !Objects.equals(previous.getProfileType(), current.getProfileType())
                || Double.compare(previous.getStockLength(), current.getStockLength()) != 0;
    }
}
