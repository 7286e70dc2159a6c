package com.yhy.extrusion.service;

import cn.hutool.core.util.RandomUtil;
import com.yhy.extrusion.analytics.ResultAssembler;
import com.yhy.extrusion.exception.OptimizationCancelledException;
import com.yhy.extrusion.exception.OptimizationException;
import com.yhy.extrusion.pooling.ProfilePoolingStrategy;
import com.yhy.extrusion.service.strategy.CuttingStrategy;
import com.yhy.extrusion.service.strategy.StrategyRegistry;
import com.yhy.extrusion.support.CancellationToken;
import com.yhy.extrusion.support.TimeBudget;
import com.yhy.extrusion.vo.*;
import com.yhy.extrusion.vo.telemetry.AlgorithmTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one optimization: VALIDATING, RUNNING, AGGREGATING, then DONE or FAILED.
 * <p>
 * Partitions are planned independently, optionally in parallel. Each gets its own seed drawn
 * in partition order from the root seed, so scheduling never changes the result.
 */
public class OptimizationOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptimizationOrchestrator.class);

    private final StrategyRegistry strategies;
    private final ExecutorService executor;
    private final InputValidator validator = new InputValidator();
    private final ProfilePoolingStrategy pooling = new ProfilePoolingStrategy();
    private final Partitioner partitioner = new Partitioner(pooling);
    private final ResultAssembler assembler = new ResultAssembler();

    /**
     * @param executor worker pool for parallel partitions and population evaluation; null runs
     *                 everything on the calling thread
     */
    public OptimizationOrchestrator(StrategyRegistry strategies, ExecutorService executor) {
        this.strategies = strategies;
        this.executor = executor;
    }

    public OptimizationResult optimize(List<CutItem> items, StockCatalog catalog, AlgorithmConfig config) {
        return optimize(items, catalog, config, CancellationToken.none());
    }

    public OptimizationResult optimize(List<CutItem> items, StockCatalog catalog, AlgorithmConfig config,
                                       CancellationToken cancellation) {
        long started = System.currentTimeMillis();
        RunState state = RunState.VALIDATING;
        LOGGER.info("Optimization {}: {} items", state, items == null ? 0 : items.size());
        try {
            validator.validate(items, catalog, config);
            TimeBudget budget = TimeBudget.startingNow(config.getTimeBudgetMs());
            AlgorithmMode mode = config.effectiveMode();
            Long seed = mode.isEvolutionary() ? (config.getSeed() != null ? config.getSeed() : RandomUtil.randomLong()) : null;

            state = transition(state, RunState.RUNNING);
            boolean pooled = config.getMode() == AlgorithmMode.POOLING;
            List<Partition> partitions = pooled ? partitioner.pooled(items) : partitioner.byWorkOrder(items);
            LOGGER.info("Planning {} partitions with {}{}", partitions.size(), mode.getLabel(),
                    seed == null ? "" : " (seed " + seed + ")");

            boolean parallel = config.isParallelPartitions() && executor != null && partitions.size() > 1;
            RunContext run = RunContext.builder()
                    .config(config)
                    .catalog(catalog)
                    .budget(budget)
                    // cancelled on its own when a parallel partition fails
                    .cancellation(cancellation.linked())
                    // partitions already occupy the pool
                    .evaluationPool(parallel ? null : executor)
                    .build();
            CuttingStrategy strategy = strategies.get(mode);
            long[] seeds = partitionSeeds(seed, partitions.size());
            List<PartitionOutcome> outcomes = parallel
                    ? runParallel(strategy, partitions, run, seeds)
                    : runSequential(strategy, partitions, run, seeds);

            state = transition(state, RunState.AGGREGATING);
            List<Cut> cuts = new ArrayList<>();
            Map<String, AlgorithmTelemetry> telemetry = new LinkedHashMap<>();
            for (PartitionOutcome outcome : outcomes) {
                for (Cut cut : outcome.getCuts()) {
                    cuts.add(cut.toBuilder().index(cuts.size()).build());
                }
                if (outcome.getTelemetry() != null) {
                    telemetry.put(outcome.getPartition().getKey(), outcome.getTelemetry());
                }
            }
            int separatelyPlanned = pooled ? 0 : partitioner.sharedProfiles(items);
            OptimizationResult result = assembler.assemble(cuts, config, telemetry, separatelyPlanned, seed,
                    System.currentTimeMillis() - started);

            transition(state, RunState.DONE);
            LOGGER.info("Optimization {} finished: {} bars, efficiency {}, cost {}, {} ms", result.getRunId(),
                    result.getBarCount(), String.format("%.4f", result.getEfficiency()),
                    String.format("%.2f", result.getTotalCost()), result.getExecutionTimeMs());
            return result;
        } catch (OptimizationException e) {
            transition(state, RunState.FAILED);
            LOGGER.warn("Optimization failed [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        }
    }

    private static RunState transition(RunState from, RunState to) {
        LOGGER.debug("Optimization {} -> {}", from, to);
        return to;
    }

    static long[] partitionSeeds(Long seed, int count) {
        long[] seeds = new long[count];
        if (seed == null) {
            return seeds;
        }
        Random root = new Random(seed);
        for (int i = 0; i < count; i++) {
            seeds[i] = root.nextLong();
        }
        return seeds;
    }

    private List<PartitionOutcome> runSequential(CuttingStrategy strategy, List<Partition> partitions,
                                                 RunContext run, long[] seeds) {
        List<PartitionOutcome> outcomes = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            run.getCancellation().checkpoint();
            outcomes.add(plan(strategy, partitions.get(i), run, seeds[i]));
        }
        return outcomes;
    }

    private List<PartitionOutcome> runParallel(CuttingStrategy strategy, List<Partition> partitions,
                                               RunContext run, long[] seeds) {
        CancellationToken siblings = run.getCancellation();
        List<CompletableFuture<PartitionOutcome>> futures = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            Partition partition = partitions.get(i);
            long seed = seeds[i];
            futures.add(CompletableFuture.supplyAsync(() -> plan(strategy, partition, run, seed), executor)
                    .whenComplete((outcome, error) -> {
                        if (error != null && !(unwrap(error) instanceof OptimizationCancelledException)) {
                            siblings.cancel("partition " + partition.getKey() + " failed");
                        }
                    }));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw firstFailure(futures);
        }
        List<PartitionOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<PartitionOutcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    /**
     * The first real error in partition order. Cancellations only win when nothing else failed.
     */
    private static RuntimeException firstFailure(List<CompletableFuture<PartitionOutcome>> futures) {
        RuntimeException cancelled = null;
        for (CompletableFuture<PartitionOutcome> future : futures) {
            if (!future.isCompletedExceptionally()) {
                continue;
            }
            Throwable cause = future.handle((outcome, error) -> unwrap(error)).join();
            RuntimeException failure = cause instanceof RuntimeException
                    ? (RuntimeException) cause : new CompletionException(cause);
            if (!(failure instanceof OptimizationCancelledException)) {
                return failure;
            }
            if (cancelled == null) {
                cancelled = failure;
            }
        }
        return cancelled;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private PartitionOutcome plan(CuttingStrategy strategy, Partition partition, RunContext run, long seed) {
        PartitionOutcome outcome = strategy.plan(partition, run, seed);
        if (!partition.isPooled()) {
            return outcome;
        }
        return new PartitionOutcome(partition, pooling.reattribute(outcome.getCuts(), partition.getPool()),
                outcome.getTelemetry());
    }
}
