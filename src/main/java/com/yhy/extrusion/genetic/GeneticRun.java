package com.yhy.extrusion.genetic;

import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.telemetry.AlgorithmTelemetry;
import lombok.Value;

import java.util.List;

/**
 * Plan and telemetry produced by one evolutionary search over a partition.
 */
@Value
public class GeneticRun {
    List<Cut> cuts;
    ObjectiveVector objectives;
    AlgorithmTelemetry telemetry;
}
