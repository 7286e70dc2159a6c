package com.yhy.extrusion.vo;

import com.yhy.extrusion.vo.telemetry.AlgorithmTelemetry;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Value
@Builder
public class OptimizationResult {
    String runId;
    AlgorithmMode algorithm;
    List<Cut> cuts;

    double totalStockLength;
    double totalUsedLength;
    double totalKerfLoss;
    double totalWaste;
    double wastePercentage;
    /** used length over stock length, 0..1 */
    double efficiency;

    WasteHistogram wasteHistogram;
    int reclaimableCount;
    double reclaimableLength;

    CostBreakdown costBreakdown;
    double costPerMeter;

    double qualityScore;
    QualityGrade qualityGrade;
    List<Recommendation> recommendations;

    List<StockSummary> stockSummary;
    List<WorkOrderYield> workOrderYield;

    long executionTimeMs;
    /** root seed of an evolutionary run, drawn when the caller gave none; null for the heuristics */
    Long seed;
    /** keyed by partition, empty for the greedy heuristics */
    Map<String, AlgorithmTelemetry> telemetry;

    public int getBarCount() {
        return cuts.size();
    }

    public double getTotalCost() {
        return costBreakdown.getTotalCost();
    }

    /**
     * The least favourable reason across partitions; TIME_BUDGET wins when any partition ran out of time.
     */
    public Optional<ConvergenceReason> getConvergenceReason() {
        return telemetry.values().stream()
                .map(AlgorithmTelemetry::getConvergenceReason)
                .max(Comparator.naturalOrder());
    }
}
