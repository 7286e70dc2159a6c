package com.yhy.extrusion.config;

import com.yhy.extrusion.vo.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Engine defaults bound from {@code optimizer.*}. A request only overrides what it sets.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    /**
     * Saw blade width in mm, lost once per piece.
     */
    private double kerf = 0;

    /**
     * Trim taken off the head and the tail of every bar, in mm.
     */
    private double startSafety = 0;

    private double endSafety = 0;

    /**
     * Offcuts shorter than this are avoided by best fit. 0 disables.
     */
    private double minScrapLength = 0;

    /**
     * Wall-clock limit of one run in milliseconds.
     */
    private long timeBudgetMs = 30_000;

    /**
     * Threads of the shared worker pool.
     */
    private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    private StockSelectionPolicy stockSelection = StockSelectionPolicy.PRIORITY;

    private AlgorithmMode poolingDelegate = AlgorithmMode.BFD;

    private boolean toleranceSqueeze = false;

    private boolean parallelPartitions = false;

    private Genetic genetic = new Genetic();

    private Fitness fitness = new Fitness();

    private Pareto pareto = new Pareto();

    private Cost cost = new Cost();

    private Waste waste = new Waste();

    @Data
    public static class Genetic {
        /**
         * Empty means twice the number of pieces, kept within 20..200.
         */
        private Integer populationSize;
        private int maxGenerations = 200;
        private int plateauGenerations = 30;
        private int tournamentSize = 3;
        private double crossoverRate = 0.85;
        private double mutationRate = 0.15;
        private int eliteCount = 2;
        private boolean parallelEvaluation = false;
    }

    @Data
    public static class Fitness {
        private double waste = 0.5;
        private double barCount = 0.3;
        private double cost = 0.15;
        private double reclaimBonus = 0.05;
    }

    @Data
    public static class Pareto {
        private double waste = 0.5;
        private double cost = 0.3;
        private double barCount = 0.2;
    }

    @Data
    public static class Cost {
        private double materialPerMeter = 12.0;
        private double wastePerMeter = 2.0;
        private double setupPerEvent = 15.0;
        private double cuttingPerCut = 0.5;
        private double laborPerHour = 40.0;
        private double machinePerHour = 25.0;
        private double setupMinutesPerBar = 1.5;
        private double cutMinutesPerSegment = 0.5;
    }

    @Data
    public static class Waste {
        private double smallFrom = 50;
        private double mediumFrom = 150;
        private double largeFrom = 300;
        private double excessiveAbove = 500;
        private double reuseFloor = 300;
        private double excessiveShareAlert = 0.2;
        private double efficiencyTarget = 0.85;
    }

    public AlgorithmConfig toConfig(AlgorithmMode mode) {
        return AlgorithmConfig.builder()
                .mode(mode)
                .kerf(kerf)
                .startSafety(startSafety)
                .endSafety(endSafety)
                .minScrapLength(minScrapLength)
                .timeBudgetMs(timeBudgetMs)
                .stockSelection(stockSelection)
                .poolingDelegate(poolingDelegate)
                .toleranceSqueeze(toleranceSqueeze)
                .parallelPartitions(parallelPartitions)
                .genetic(GeneticSettings.builder()
                        .populationSize(genetic.getPopulationSize())
                        .maxGenerations(genetic.getMaxGenerations())
                        .plateauGenerations(genetic.getPlateauGenerations())
                        .tournamentSize(genetic.getTournamentSize())
                        .crossoverRate(genetic.getCrossoverRate())
                        .mutationRate(genetic.getMutationRate())
                        .eliteCount(genetic.getEliteCount())
                        .parallelEvaluation(genetic.isParallelEvaluation())
                        .build())
                .fitnessWeights(FitnessWeights.builder()
                        .waste(fitness.getWaste())
                        .barCount(fitness.getBarCount())
                        .cost(fitness.getCost())
                        .reclaimBonus(fitness.getReclaimBonus())
                        .build())
                .paretoWeights(ParetoWeights.builder()
                        .waste(pareto.getWaste())
                        .cost(pareto.getCost())
                        .barCount(pareto.getBarCount())
                        .build())
                .costRates(CostRates.builder()
                        .materialPerMeter(cost.getMaterialPerMeter())
                        .wastePerMeter(cost.getWastePerMeter())
                        .setupPerEvent(cost.getSetupPerEvent())
                        .cuttingPerCut(cost.getCuttingPerCut())
                        .laborPerHour(cost.getLaborPerHour())
                        .machinePerHour(cost.getMachinePerHour())
                        .setupMinutesPerBar(cost.getSetupMinutesPerBar())
                        .cutMinutesPerSegment(cost.getCutMinutesPerSegment())
                        .build())
                .wastePolicy(WastePolicy.builder()
                        .smallFrom(waste.getSmallFrom())
                        .mediumFrom(waste.getMediumFrom())
                        .largeFrom(waste.getLargeFrom())
                        .excessiveAbove(waste.getExcessiveAbove())
                        .reuseFloor(waste.getReuseFloor())
                        .excessiveShareAlert(waste.getExcessiveShareAlert())
                        .efficiencyTarget(waste.getEfficiencyTarget())
                        .build())
                .build();
    }
}
