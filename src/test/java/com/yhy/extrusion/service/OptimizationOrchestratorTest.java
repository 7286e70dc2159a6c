package com.yhy.extrusion.service;

import com.yhy.extrusion.exception.EmptyInputException;
import com.yhy.extrusion.exception.InfeasibleConstraintException;
import com.yhy.extrusion.exception.ItemTooLongException;
import com.yhy.extrusion.exception.OptimizationCancelledException;
import com.yhy.extrusion.service.strategy.CuttingStrategy;
import com.yhy.extrusion.service.strategy.StrategyRegistry;
import com.yhy.extrusion.support.CancellationToken;
import com.yhy.extrusion.support.TestData;
import com.yhy.extrusion.vo.*;
import com.yhy.extrusion.vo.telemetry.GeneticTelemetry;
import com.yhy.extrusion.vo.telemetry.ParetoTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationOrchestratorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private final OptimizationOrchestrator orchestrator = new OptimizationOrchestrator(StrategyRegistry.defaults(), pool);

    private final StockCatalog catalog = StockCatalog.of(
            StockOption.of("P1", 6000, 1),
            StockOption.of("P2", 6000, 1),
            StockOption.of("P2", 4000, 2));

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static GeneticSettings smallSearch() {
        return GeneticSettings.builder().populationSize(20).maxGenerations(10).plateauGenerations(1000).build();
    }

    private static List<CutItem> twoOrders() {
        return List.of(
                CutItem.builder().id("a").profileType("P1").length(2500).quantity(3).workOrderId("WO-1").build(),
                CutItem.builder().id("b").profileType("P1").length(1100).quantity(2).workOrderId("WO-2").build(),
                CutItem.builder().id("c").profileType("P2").length(1900).quantity(4).workOrderId("WO-1").build(),
                CutItem.builder().id("d").profileType("P1").length(700).quantity(3).workOrderId("WO-2").build());
    }

    @Test
    void singleBarScenario() {
        OptimizationResult result = orchestrator.optimize(List.of(CutItem.of("A", "P1", 1000, 3)),
                StockCatalog.of(StockOption.of("P1", 3100, 1)), AlgorithmConfig.of(AlgorithmMode.FFD, 5));

        assertEquals(1, result.getBarCount());
        assertEquals(85, result.getTotalWaste(), 1e-9);
        assertEquals(15, result.getTotalKerfLoss(), 1e-9);
        assertEquals(WasteCategory.SMALL, result.getCuts().get(0).getWasteCategory());
        assertEquals(AlgorithmMode.FFD, result.getAlgorithm());
        assertTrue(result.getTelemetry().isEmpty());
        assertNull(result.getSeed());
    }

    @Test
    void oversizedItemFailsTheRun() {
        ItemTooLongException ex = assertThrows(ItemTooLongException.class, () -> orchestrator.optimize(
                List.of(CutItem.of("L", "P1", 5000, 1)),
                StockCatalog.of(StockOption.of("P1", 3000, 1)), AlgorithmConfig.of(AlgorithmMode.FFD, 0)));

        assertEquals(List.of("L"), ex.getItemIds());
    }

    @Test
    void emptyInputFails() {
        assertThrows(EmptyInputException.class,
                () -> orchestrator.optimize(List.of(), catalog, AlgorithmConfig.of(AlgorithmMode.BFD, 0)));
    }

    @Test
    void tinyBudgetStillReturnsAFeasiblePlan() {
        List<CutItem> items = TestData.many("P1", 200);
        AlgorithmConfig config = AlgorithmConfig.builder()
                .mode(AlgorithmMode.GENETIC)
                .kerf(3)
                .timeBudgetMs(1)
                .seed(5L)
                .genetic(GeneticSettings.builder().maxGenerations(100_000).plateauGenerations(100_000).build())
                .build();

        OptimizationResult result = orchestrator.optimize(items, catalog, config);

        assertEquals(ConvergenceReason.TIME_BUDGET, result.getConvergenceReason().orElseThrow());
        TestData.assertFeasible(items, result.getCuts(), 3);
        assertTrue(result.getRecommendations().stream()
                .anyMatch(r -> r.getType() == Recommendation.Type.PARAMETER_ADJUSTMENT));
    }

    @Test
    void everyModeConservesPieces() {
        List<CutItem> items = twoOrders();
        for (AlgorithmMode mode : AlgorithmMode.values()) {
            AlgorithmConfig config = AlgorithmConfig.builder().mode(mode).kerf(4).seed(1L).genetic(smallSearch()).build();

            OptimizationResult result = orchestrator.optimize(items, catalog, config);

            TestData.assertFeasible(items, result.getCuts(), 4);
            for (int i = 0; i < result.getCuts().size(); i++) {
                assertEquals(i, result.getCuts().get(i).getIndex(), mode + " cut numbering");
            }
        }
    }

    @Test
    void workOrdersArePlannedSeparatelyUnlessPooled() {
        List<CutItem> items = twoOrders();

        OptimizationResult separate = orchestrator.optimize(items, catalog, AlgorithmConfig.of(AlgorithmMode.BFD, 0));
        OptimizationResult pooled = orchestrator.optimize(items, catalog, AlgorithmConfig.of(AlgorithmMode.POOLING, 0));

        assertTrue(separate.getCuts().stream().noneMatch(Cut::isMixed));
        assertTrue(separate.getRecommendations().stream()
                .anyMatch(r -> r.getType() == Recommendation.Type.ENABLE_POOLING));
        assertTrue(pooled.getCuts().stream().anyMatch(Cut::isMixed));
        assertTrue(pooled.getBarCount() <= separate.getBarCount());
        assertEquals(AlgorithmMode.POOLING, pooled.getAlgorithm());
    }

    @Test
    void seededSearchIsReproducibleAndParallelSafe() {
        List<CutItem> items = new ArrayList<>(TestData.mixedProfile("P1"));
        items.addAll(TestData.mixedProfile("P2"));
        AlgorithmConfig sequential = AlgorithmConfig.builder().mode(AlgorithmMode.GENETIC).kerf(3).seed(77L)
                .genetic(smallSearch()).build();
        AlgorithmConfig parallel = sequential.toBuilder().parallelPartitions(true).build();

        OptimizationResult first = orchestrator.optimize(items, catalog, sequential);
        OptimizationResult second = orchestrator.optimize(items, catalog, parallel);

        assertEquals(TestData.layout(first.getCuts()), TestData.layout(second.getCuts()));
        assertEquals(2, first.getTelemetry().size());
        assertEquals(77L, first.getSeed());
        assertTrue(first.getTelemetry().get("-/P1") instanceof GeneticTelemetry);
    }

    @Test
    void unseededSearchRecordsItsSeed() {
        AlgorithmConfig config = AlgorithmConfig.builder().mode(AlgorithmMode.NSGA_II).genetic(smallSearch()).build();

        OptimizationResult result = orchestrator.optimize(TestData.mixedProfile("P1"), catalog, config);

        assertNotNull(result.getSeed());
        assertTrue(result.getTelemetry().values().iterator().next() instanceof ParetoTelemetry);
    }

    @Test
    void cancelledRunFails() {
        CancellationToken token = CancellationToken.none();
        token.cancel("shutdown");

        assertThrows(OptimizationCancelledException.class, () -> orchestrator.optimize(
                TestData.mixedProfile("P1"), catalog, AlgorithmConfig.of(AlgorithmMode.FFD, 0), token));
    }

    @Test
    void partitionSeedsDependOnlyOnTheRootSeed() {
        assertArrayEquals(OptimizationOrchestrator.partitionSeeds(3L, 4), OptimizationOrchestrator.partitionSeeds(3L, 4));
        assertArrayEquals(new long[2], OptimizationOrchestrator.partitionSeeds(null, 2));
    }

    @Test
    void largestTimeBudgetRunsEveryGeneration() {
        AlgorithmConfig config = AlgorithmConfig.builder()
                .mode(AlgorithmMode.GENETIC)
                .timeBudgetMs(Long.MAX_VALUE)
                .seed(1L)
                .genetic(GeneticSettings.builder().populationSize(20).maxGenerations(3).plateauGenerations(1000).build())
                .build();

        OptimizationResult result = orchestrator.optimize(TestData.mixedProfile("P1"), catalog, config);

        assertEquals(ConvergenceReason.MAX_GENERATIONS, result.getConvergenceReason().orElseThrow());
        assertEquals(3, result.getTelemetry().values().iterator().next().getGenerations());
    }

    @Test
    void workOrderNamedLikeTheUnassignedGroupKeepsItsOwnTelemetry() {
        List<CutItem> items = List.of(
                CutItem.builder().id("dash").profileType("P1").length(1200).quantity(2).workOrderId("-").build(),
                CutItem.builder().id("loose").profileType("P1").length(800).quantity(2).build());
        AlgorithmConfig config = AlgorithmConfig.builder().mode(AlgorithmMode.GENETIC).seed(2L)
                .genetic(smallSearch()).build();

        OptimizationResult result = orchestrator.optimize(items, catalog, config);

        assertEquals(List.of("-/P1", "-/P1#2"), new ArrayList<>(result.getTelemetry().keySet()));
        TestData.assertFeasible(items, result.getCuts(), 0);
    }

    @Test
    void safetyTrimsReachThePlan() {
        List<CutItem> items = List.of(CutItem.of("A", "P1", 1000, 3));
        AlgorithmConfig config = AlgorithmConfig.builder().kerf(5).startSafety(20).endSafety(30).build();

        OptimizationResult result = orchestrator.optimize(items, StockCatalog.of(StockOption.of("P1", 3100, 1)), config);

        assertEquals(1, result.getBarCount());
        assertEquals(35, result.getTotalWaste(), 1e-9);
        assertEquals(20, result.getCuts().get(0).getSegments().get(0).getPosition(), 1e-9);
    }

    @Test
    void failedPartitionStopsItsParallelSiblings() {
        AtomicBoolean siblingStopped = new AtomicBoolean();
        CuttingStrategy strategy = new CuttingStrategy() {
            @Override
            public AlgorithmMode getMode() {
                return AlgorithmMode.FFD;
            }

            @Override
            public PartitionOutcome plan(Partition partition, RunContext run, long seed) {
                if ("WO-2".equals(partition.getWorkOrderId())) {
                    throw new InfeasibleConstraintException("b", "rejected by planner");
                }
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
                try {
                    while (System.nanoTime() < deadline) {
                        run.getCancellation().checkpoint();
                        Thread.onSpinWait();
                    }
                } catch (OptimizationCancelledException e) {
                    siblingStopped.set(true);
                    throw e;
                }
                return new PartitionOutcome(partition, List.of(), null);
            }
        };
        OptimizationOrchestrator stubbed = new OptimizationOrchestrator(new StrategyRegistry(List.of(strategy)), pool);
        List<CutItem> items = List.of(
                CutItem.builder().id("a").profileType("P1").length(1000).quantity(1).workOrderId("WO-1").build(),
                CutItem.builder().id("b").profileType("P1").length(1000).quantity(1).workOrderId("WO-2").build());
        AlgorithmConfig config = AlgorithmConfig.builder().parallelPartitions(true).build();
        CancellationToken caller = CancellationToken.none();

        long started = System.nanoTime();
        InfeasibleConstraintException ex = assertThrows(InfeasibleConstraintException.class,
                () -> stubbed.optimize(items, catalog, config, caller));

        assertEquals("b", ex.getItemId());
        assertTrue(siblingStopped.get());
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(20));
        assertFalse(caller.isCancelled());
    }
}
