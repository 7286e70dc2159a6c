package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Search parameters shared by the GA and NSGA-II.
 * A null population size means "derive from the number of pieces".
 */
@Value
@Builder(toBuilder = true)
public class GeneticSettings {
    public static final int MIN_AUTO_POPULATION = 20;
    public static final int MAX_AUTO_POPULATION = 200;

    Integer populationSize;
    @Builder.Default
    int maxGenerations = 200;
    @Builder.Default
    int plateauGenerations = 30;
    @Builder.Default
    int tournamentSize = 3;
    @Builder.Default
    double crossoverRate = 0.85;
    @Builder.Default
    double mutationRate = 0.15;
    @Builder.Default
    int eliteCount = 2;
    @Builder.Default
    boolean parallelEvaluation = false;

    public int resolvePopulationSize(int unitCount) {
        if (populationSize != null) {
            return populationSize;
        }
        return Math.max(MIN_AUTO_POPULATION, Math.min(MAX_AUTO_POPULATION, unitCount * 2));
    }

    public static GeneticSettings defaults() {
        return GeneticSettings.builder().build();
    }
}
