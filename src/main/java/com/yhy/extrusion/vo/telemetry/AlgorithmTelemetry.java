package com.yhy.extrusion.vo.telemetry;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.yhy.extrusion.vo.AlgorithmMode;
import com.yhy.extrusion.vo.ConvergenceReason;

/**
 * Search telemetry of one partition. Implemented by {@link GeneticTelemetry} and {@link ParetoTelemetry} only.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GeneticTelemetry.class, name = "genetic"),
        @JsonSubTypes.Type(value = ParetoTelemetry.class, name = "pareto")
})
public interface AlgorithmTelemetry {

    AlgorithmMode getMode();

    ConvergenceReason getConvergenceReason();

    int getGenerations();
}
