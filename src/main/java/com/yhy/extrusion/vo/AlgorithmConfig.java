package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Everything one optimization run needs besides the items and the stock catalog.
 */
@Value
@Builder(toBuilder = true)
public class AlgorithmConfig {
    @Builder.Default
    AlgorithmMode mode = AlgorithmMode.FFD;
    /** blade width lost per placed piece, mm */
    @Builder.Default
    double kerf = 0;
    /** trimmed off the head of every bar before the first piece, mm */
    @Builder.Default
    double startSafety = 0;
    /** trimmed off the tail of every bar, mm */
    @Builder.Default
    double endSafety = 0;
    /** best fit avoids leaving offcuts shorter than this, mm; 0 disables */
    @Builder.Default
    double minScrapLength = 0;
    @Builder.Default
    long timeBudgetMs = 30_000;
    /** null means draw one and report it in the telemetry */
    Long seed;
    @Builder.Default
    StockSelectionPolicy stockSelection = StockSelectionPolicy.PRIORITY;
    /** strategy used on the pooled demand when mode is POOLING */
    @Builder.Default
    AlgorithmMode poolingDelegate = AlgorithmMode.BFD;
    @Builder.Default
    boolean toleranceSqueeze = false;
    @Builder.Default
    boolean parallelPartitions = false;
    @Builder.Default
    GeneticSettings genetic = GeneticSettings.defaults();
    @Builder.Default
    FitnessWeights fitnessWeights = FitnessWeights.defaults();
    @Builder.Default
    ParetoWeights paretoWeights = ParetoWeights.defaults();
    @Builder.Default
    CostRates costRates = CostRates.defaults();
    @Builder.Default
    WastePolicy wastePolicy = WastePolicy.defaults();

    public AlgorithmMode effectiveMode() {
        return mode == AlgorithmMode.POOLING ? poolingDelegate : mode;
    }

    public static AlgorithmConfig of(AlgorithmMode mode, double kerf) {
        return AlgorithmConfig.builder().mode(mode).kerf(kerf).build();
    }
}
