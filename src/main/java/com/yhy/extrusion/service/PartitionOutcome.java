package com.yhy.extrusion.service;

import com.yhy.extrusion.vo.Cut;
import com.yhy.extrusion.vo.telemetry.AlgorithmTelemetry;
import lombok.Value;

import java.util.List;

@Value
public class PartitionOutcome {
    Partition partition;
    List<Cut> cuts;
    /** null for the greedy heuristics */
    AlgorithmTelemetry telemetry;
}
