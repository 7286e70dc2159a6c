package com.yhy.extrusion.genetic;

import com.yhy.extrusion.analytics.CostCalculator;
import com.yhy.extrusion.heuristic.PackingContext;
import com.yhy.extrusion.heuristic.StockSelector;
import com.yhy.extrusion.heuristic.UnitDemand;
import com.yhy.extrusion.vo.AlgorithmConfig;
import com.yhy.extrusion.vo.CutItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/**
 * One partition prepared for an evolutionary search: the unit pieces, the decoder, and the
 * FFD-ordered baseline every fitness value is measured against.
 */
public final class SearchProblem {

    private final List<UnitDemand> units;
    private final PopulationEvaluator evaluator;
    private final Chromosome baseline;
    private final int populationSize;

    private SearchProblem(List<UnitDemand> units, PopulationEvaluator evaluator, Chromosome baseline, int populationSize) {
        this.units = units;
        this.evaluator = evaluator;
        this.baseline = baseline;
        this.populationSize = populationSize;
    }

    /**
     * @param executor used for population evaluation when the settings ask for it; may be null
     */
    public static SearchProblem prepare(List<CutItem> items, PackingContext context, AlgorithmConfig config,
                                        ExecutorService executor) {
        new StockSelector(context).requireFits(items, context.isToleranceSqueeze());

        List<UnitDemand> units = UnitDemand.expand(items);
        SequenceDecoder decoder = new SequenceDecoder(units, context);
        ExecutorService pool = config.getGenetic().isParallelEvaluation() ? executor : null;
        PopulationEvaluator evaluator = new PopulationEvaluator(decoder, new CostCalculator(config.getCostRates()), pool);

        List<UnitDemand> sorted = UnitDemand.sortDecreasing(units);
        int[] ffdOrder = new int[sorted.size()];
        for (int i = 0; i < ffdOrder.length; i++) {
            ffdOrder[i] = sorted.get(i).getIndex();
        }
        Chromosome baseline = new Chromosome(ffdOrder);
        ObjectiveVector reference = evaluator.measure(baseline);
        evaluator.useFitness(new FitnessFunction(config.getFitnessWeights(), reference));
        evaluator.evaluate(baseline);

        int size = config.getGenetic().resolvePopulationSize(units.size());
        return new SearchProblem(units, evaluator, baseline, size);
    }

    /**
     * The baseline plus random permutations, all evaluated.
     */
    public List<Chromosome> initialPopulation(Random rnd) {
        List<Chromosome> population = new ArrayList<>(populationSize);
        population.add(baseline);
        while (population.size() < populationSize) {
            population.add(new Chromosome(GeneticOperators.randomPermutation(units.size(), rnd)));
        }
        evaluator.evaluateAll(population);
        return population;
    }

    public PopulationEvaluator getEvaluator() {
        return evaluator;
    }

    public Chromosome getBaseline() {
        return baseline;
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public int getUnitCount() {
        return units.size();
    }
}
