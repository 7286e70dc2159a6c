package com.yhy.extrusion.service.strategy;

import com.yhy.extrusion.service.Partition;
import com.yhy.extrusion.service.PartitionOutcome;
import com.yhy.extrusion.service.RunContext;
import com.yhy.extrusion.vo.AlgorithmMode;

/**
 * Plans the bars of one partition. Implementations are stateless.
 */
public interface CuttingStrategy {

    AlgorithmMode getMode();

    /**
     * @param seed partition seed; ignored by deterministic strategies
     */
    PartitionOutcome plan(Partition partition, RunContext run, long seed);
}
