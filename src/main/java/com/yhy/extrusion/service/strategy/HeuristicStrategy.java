package com.yhy.extrusion.service.strategy;

import com.yhy.extrusion.heuristic.PackingHeuristic;
import com.yhy.extrusion.service.Partition;
import com.yhy.extrusion.service.PartitionOutcome;
import com.yhy.extrusion.service.RunContext;
import com.yhy.extrusion.vo.Cut;

import java.util.List;

/**
 * Adapts a greedy packer. Heuristics are deterministic, so the seed is unused.
 */
public abstract class HeuristicStrategy implements CuttingStrategy {

    private final PackingHeuristic heuristic;

    protected HeuristicStrategy(PackingHeuristic heuristic) {
        this.heuristic = heuristic;
    }

    @Override
    public PartitionOutcome plan(Partition partition, RunContext run, long seed) {
        List<Cut> cuts = heuristic.pack(partition.getItems(), run.packingContext(partition.getProfileType()));
        return new PartitionOutcome(partition, cuts, null);
    }
}
