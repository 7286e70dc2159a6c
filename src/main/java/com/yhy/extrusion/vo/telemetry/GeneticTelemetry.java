package com.yhy.extrusion.vo.telemetry;

import com.yhy.extrusion.vo.AlgorithmMode;
import com.yhy.extrusion.vo.ConvergenceReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GeneticTelemetry implements AlgorithmTelemetry {
    /** the search that produced this record; NSGA_II when nested in {@link ParetoTelemetry} */
    @Builder.Default
    AlgorithmMode mode = AlgorithmMode.GENETIC;
    long seed;
    int generations;
    int populationSize;
    long evaluations;
    double bestFitness;
    ConvergenceReason convergenceReason;
    List<Double> bestFitnessHistory;
}
