package com.yhy.extrusion.nsga;

import com.yhy.extrusion.genetic.Chromosome;
import com.yhy.extrusion.genetic.GeneticRun;
import com.yhy.extrusion.heuristic.PackingContext;
import com.yhy.extrusion.support.TestData;
import com.yhy.extrusion.support.TimeBudget;
import com.yhy.extrusion.vo.*;
import com.yhy.extrusion.vo.telemetry.ParetoPoint;
import com.yhy.extrusion.vo.telemetry.ParetoSummary;
import com.yhy.extrusion.vo.telemetry.ParetoTelemetry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.yhy.extrusion.nsga.ParetoRankingTest.point;
import static org.junit.jupiter.api.Assertions.*;

class Nsga2OptimizerTest {

    private static final double KERF = 3;

    private final List<CutItem> items = TestData.mixedProfile("P2");
    private final PackingContext context = TestData.context(KERF,
            StockOption.of("P2", 6000, 1), StockOption.of("P2", 4200, 2));
    private final AlgorithmConfig config = AlgorithmConfig.builder()
            .mode(AlgorithmMode.NSGA_II)
            .kerf(KERF)
            .genetic(GeneticSettings.builder().populationSize(24).maxGenerations(15).plateauGenerations(1000).build())
            .build();

    private GeneticRun run(long seed) {
        return new Nsga2Optimizer().optimize(items, context, config, seed, TimeBudget.unlimited(), null);
    }

    @Test
    void frontIsMutuallyNonDominatedAndSortedByWaste() {
        ParetoSummary pareto = ((ParetoTelemetry) run(21L).getTelemetry()).getPareto();
        List<ParetoPoint> front = pareto.getFront();

        assertFalse(front.isEmpty());
        for (int i = 0; i < front.size(); i++) {
            for (int j = 0; j < front.size(); j++) {
                if (i != j) {
                    assertFalse(dominates(front.get(i), front.get(j)), "front point " + i + " dominates " + j);
                }
            }
            if (i > 0) {
                assertTrue(front.get(i - 1).getTotalWaste() <= front.get(i).getTotalWaste());
            }
        }
        assertTrue(pareto.getRecommendedIndex() >= 0 && pareto.getRecommendedIndex() < pareto.getFrontSize());
        assertTrue(pareto.getHypervolume() > 0);
    }

    @Test
    void returnsTheRecommendedPlan() {
        GeneticRun result = run(21L);
        ParetoPoint recommended = ((ParetoTelemetry) result.getTelemetry()).getPareto().getRecommended();

        assertEquals(recommended.getBarCount(), result.getCuts().size());
        assertEquals(recommended.getTotalWaste(), result.getObjectives().getTotalWaste(), 1e-6);
        TestData.assertFeasible(items, result.getCuts(), KERF);
    }

    @Test
    void sameSeedSameFront() {
        ParetoSummary first = ((ParetoTelemetry) run(8L).getTelemetry()).getPareto();
        ParetoSummary second = ((ParetoTelemetry) run(8L).getTelemetry()).getPareto();

        assertEquals(first.getFront(), second.getFront());
        assertEquals(first.getRecommendedIndex(), second.getRecommendedIndex());
    }

    @Test
    void telemetryReportsTheSearch() {
        ParetoTelemetry telemetry = (ParetoTelemetry) run(4L).getTelemetry();

        assertEquals(AlgorithmMode.NSGA_II, telemetry.getMode());
        assertEquals(AlgorithmMode.NSGA_II, telemetry.getSearch().getMode());
        assertEquals(ConvergenceReason.MAX_GENERATIONS, telemetry.getConvergenceReason());
        assertEquals(15, telemetry.getGenerations());
        assertEquals(4L, telemetry.getSearch().getSeed());
    }

    @Test
    void survivorsFillByRankThenCrowding() {
        Chromosome a = point(0, 10, 2);
        Chromosome b = point(5, 5, 2);
        Chromosome c = point(10, 0, 2);
        Chromosome dominated = point(20, 20, 3);

        List<Chromosome> next = Nsga2Optimizer.survivors(new ArrayList<>(List.of(dominated, b, a, c)), 2);

        assertEquals(2, next.size());
        assertTrue(next.contains(a));
        assertTrue(next.contains(c));
    }

    @Test
    void recommendationMinimisesWeightedNormalisedSum() {
        List<Chromosome> front = List.of(point(0, 100, 5), point(50, 40, 4), point(100, 0, 3));

        assertEquals(1, Nsga2Optimizer.recommend(front, ParetoWeights.defaults()));
        assertEquals(0, Nsga2Optimizer.recommend(front, ParetoWeights.builder().waste(1).cost(0).barCount(0).build()));
    }

    private static boolean dominates(ParetoPoint a, ParetoPoint b) {
        boolean noWorse = a.getTotalWaste() <= b.getTotalWaste() + 1e-9
                && a.getTotalCost() <= b.getTotalCost() + 1e-9
                && a.getBarCount() <= b.getBarCount();
        boolean better = a.getTotalWaste() < b.getTotalWaste() - 1e-9
                || a.getTotalCost() < b.getTotalCost() - 1e-9
                || a.getBarCount() < b.getBarCount();
        return noWorse && better;
    }
}
