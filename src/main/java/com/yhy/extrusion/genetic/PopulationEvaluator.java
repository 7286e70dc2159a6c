package com.yhy.extrusion.genetic;

import com.yhy.extrusion.analytics.CostCalculator;
import com.yhy.extrusion.vo.Cut;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Decodes and scores chromosomes, optionally on an executor. Evaluation never touches the
 * run's random generator, so parallel and sequential runs give identical results.
 */
public class PopulationEvaluator {

    private final SequenceDecoder decoder;
    private final CostCalculator costs;
    private final ExecutorService executor;
    private FitnessFunction fitness;
    private long evaluations;

    /**
     * @param executor null for sequential evaluation
     */
    public PopulationEvaluator(SequenceDecoder decoder, CostCalculator costs, ExecutorService executor) {
        this.decoder = decoder;
        this.costs = costs;
        this.executor = executor;
    }

    /**
     * Decodes without scoring. Used for the baseline the fitness function is built on.
     */
    public ObjectiveVector measure(Chromosome chromosome) {
        List<Cut> cuts = decoder.decode(chromosome.getGenes());
        ObjectiveVector objectives = ObjectiveVector.of(cuts, costs);
        chromosome.evaluated(cuts, objectives, Double.NaN);
        evaluations++;
        return objectives;
    }

    public void useFitness(FitnessFunction fitness) {
        this.fitness = fitness;
    }

    public void evaluate(Chromosome chromosome) {
        if (chromosome.isEvaluated() && !Double.isNaN(chromosome.getFitness())) {
            return;
        }
        List<Cut> cuts = chromosome.isEvaluated() ? chromosome.getCuts() : decoder.decode(chromosome.getGenes());
        ObjectiveVector objectives = chromosome.isEvaluated() ? chromosome.getObjectives() : ObjectiveVector.of(cuts, costs);
        if (!chromosome.isEvaluated()) {
            evaluations++;
        }
        chromosome.evaluated(cuts, objectives, fitness.evaluate(objectives));
    }

    public void evaluateAll(List<Chromosome> population) {
        if (executor == null) {
            population.forEach(this::evaluate);
            return;
        }
        List<Chromosome> pending = new ArrayList<>();
        for (Chromosome chromosome : population) {
            if (!chromosome.isEvaluated()) {
                pending.add(chromosome);
            }
        }
        List<Callable<List<Cut>>> tasks = new ArrayList<>(pending.size());
        for (Chromosome chromosome : pending) {
            tasks.add(() -> decoder.decode(chromosome.getGenes()));
        }
        try {
            List<Future<List<Cut>>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < pending.size(); i++) {
                List<Cut> cuts = futures.get(i).get();
                ObjectiveVector objectives = ObjectiveVector.of(cuts, costs);
                pending.get(i).evaluated(cuts, objectives, fitness.evaluate(objectives));
                evaluations++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Population evaluation interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Population evaluation failed", e.getCause());
        }
        // baseline chromosomes measured earlier still need a score
        population.forEach(this::evaluate);
    }

    public long getEvaluations() {
        return evaluations;
    }
}
