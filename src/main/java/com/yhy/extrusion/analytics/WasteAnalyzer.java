package com.yhy.extrusion.analytics;

import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.WasteCategory;
import com.yhy.extrusion.vo.WasteHistogram;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Totals and waste distribution of a plan. Categories and reclaimability are read from the
 * cuts, which were classified when they were built.
 */
public class WasteAnalyzer {

    public WasteReport analyze(List<Cut> cuts) {
        Map<WasteCategory, Integer> counts = new EnumMap<>(WasteCategory.class);
        Map<WasteCategory, Double> lengths = new EnumMap<>(WasteCategory.class);
        double stock = 0;
        double used = 0;
        double kerf = 0;
        double waste = 0;
        int reclaimableCount = 0;
        double reclaimableLength = 0;
        int segments = 0;
        long adjusted = 0;
        for (Cut cut : cuts) {
            stock += cut.getStockLength();
            used += cut.getUsedLength();
            kerf += cut.getKerfLoss();
            waste += cut.getRemainingLength();
            segments += cut.getSegmentCount();
            adjusted += cut.getToleranceAdjustedCount();
            counts.merge(cut.getWasteCategory(), 1, Integer::sum);
            lengths.merge(cut.getWasteCategory(), cut.getRemainingLength(), Double::sum);
            if (cut.isReclaimable()) {
                reclaimableCount++;
                reclaimableLength += cut.getRemainingLength();
            }
        }
        return WasteReport.builder()
                .totalStockLength(stock)
                .totalUsedLength(used)
                .totalKerfLoss(kerf)
                .totalWaste(waste)
                .histogram(new WasteHistogram(counts, lengths))
                .reclaimableCount(reclaimableCount)
                .reclaimableLength(reclaimableLength)
                .segmentCount(segments)
                .toleranceAdjustedCount(adjusted)
                .build();
    }
}
