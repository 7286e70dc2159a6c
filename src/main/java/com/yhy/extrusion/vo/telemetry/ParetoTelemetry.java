package com.yhy.extrusion.vo.telemetry;

import com.yhy.extrusion.vo.AlgorithmMode;
import com.yhy.extrusion.vo.ConvergenceReason;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParetoTelemetry implements AlgorithmTelemetry {
    GeneticTelemetry search;
    ParetoSummary pareto;

    @Override
    public AlgorithmMode getMode() {
        return AlgorithmMode.NSGA_II;
    }

    @Override
    public ConvergenceReason getConvergenceReason() {
        return search.getConvergenceReason();
    }

    @Override
    public int getGenerations() {
        return search.getGenerations();
    }
}
