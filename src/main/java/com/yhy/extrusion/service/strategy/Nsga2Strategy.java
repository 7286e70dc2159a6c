package com.yhy.extrusion.service.strategy;

import com.yhy.extrusion.genetic.GeneticRun;
import com.yhy.extrusion.nsga.Nsga2Optimizer;
import com.yhy.extrusion.service.Partition;
import com.yhy.extrusion.service.PartitionOutcome;
import com.yhy.extrusion.service.RunContext;
import com.yhy.extrusion.vo.AlgorithmMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class Nsga2Strategy implements CuttingStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(Nsga2Strategy.class);

    private final Nsga2Optimizer optimizer = new Nsga2Optimizer();

    @Override
    public AlgorithmMode getMode() {
        return AlgorithmMode.NSGA_II;
    }

    @Override
    public PartitionOutcome plan(Partition partition, RunContext run, long seed) {
        GeneticRun result = optimizer.optimize(partition.getItems(), run.packingContext(partition.getProfileType()),
                run.getConfig(), seed, run.getBudget(), run.getEvaluationPool());
        LOGGER.info("NSGA-II on {}: {} bars after {} generations ({})", partition.getKey(),
                result.getObjectives().getBarCount(), result.getTelemetry().getGenerations(),
                result.getTelemetry().getConvergenceReason());
        return new PartitionOutcome(partition, result.getCuts(), result.getTelemetry());
    }
}
