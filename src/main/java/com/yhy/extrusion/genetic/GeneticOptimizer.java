package com.yhy.extrusion.genetic;

import com.yhy.extrusion.heuristic.PackingContext;
import com.yhy.extrusion.support.TimeBudget;
import com.yhy.extrusion.vo.AlgorithmConfig;
import com.yhy.extrusion.vo.AlgorithmMode;
import com.yhy.extrusion.vo.ConvergenceReason;
import com.yhy.extrusion.vo.CutItem;
import com.yhy.extrusion.vo.GeneticSettings;
import com.yhy.extrusion.vo.telemetry.GeneticTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/**
 * Permutation GA over the cutting order of one partition.
 * <ul>
 *     <li>gene = unit piece index, decoded by first-fit replay</li>
 *     <li>fitness = weighted waste, bar count, cost and reclaim bonus against the FFD plan</li>
 *     <li>selection = tournament, crossover = OX, mutation = swap / segment shuffle / inversion</li>
 *     <li>elitism keeps the best individuals unchanged</li>
 * </ul>
 * The result is never worse than the FFD order, which seeds the population.
 */
public class GeneticOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneticOptimizer.class);

    public GeneticRun optimize(List<CutItem> items, PackingContext context, AlgorithmConfig config,
                               long seed, TimeBudget budget, ExecutorService evaluationPool) {
        GeneticSettings settings = config.getGenetic();
        Random rnd = new Random(seed);
        SearchProblem problem = SearchProblem.prepare(items, context, config, evaluationPool);
        PopulationEvaluator evaluator = problem.getEvaluator();
        ConvergenceMonitor monitor = new ConvergenceMonitor(settings, budget);

        Chromosome best = problem.getBaseline();
        if (monitor.isOutOfTime()) {
            monitor.record(best.getFitness());
            LOGGER.warn("Time budget spent before the first generation; returning the FFD order");
            return finish(best, seed, 0, problem, monitor, ConvergenceReason.TIME_BUDGET);
        }

        List<Chromosome> population = problem.initialPopulation(rnd);
        population.sort(Chromosome.BY_FITNESS);
        best = population.get(0);
        monitor.record(best.getFitness());

        int generation = 0;
        ConvergenceReason reason;
        while (true) {
            Optional<ConvergenceReason> stop = monitor.check(generation);
            if (stop.isPresent()) {
                reason = stop.get();
                break;
            }
            context.getCancellation().checkpoint();

            List<Chromosome> next = new ArrayList<>(problem.getPopulationSize());
            int elites = Math.min(settings.getEliteCount(), population.size());
            for (int i = 0; i < elites; i++) {
                next.add(population.get(i));
            }
            boolean stagnating = monitor.isStagnating();
            while (next.size() < problem.getPopulationSize()) {
                Chromosome p1 = GeneticOperators.tournament(population, settings.getTournamentSize(), Chromosome.BY_FITNESS, rnd);
                Chromosome p2 = GeneticOperators.tournament(population, settings.getTournamentSize(), Chromosome.BY_FITNESS, rnd);
                int[][] children = rnd.nextDouble() < settings.getCrossoverRate()
                        ? GeneticOperators.orderCrossover(p1.getGenes(), p2.getGenes(), rnd)
                        : new int[][]{p1.getGenes().clone(), p2.getGenes().clone()};
                for (int[] child : children) {
                    GeneticOperators.mutate(child, settings.getMutationRate(), stagnating, rnd);
                    if (next.size() < problem.getPopulationSize()) {
                        next.add(new Chromosome(child));
                    }
                }
            }
            evaluator.evaluateAll(next);
            next.sort(Chromosome.BY_FITNESS);
            population = next;
            generation++;

            if (population.get(0).getFitness() < best.getFitness()) {
                best = population.get(0);
            }
            monitor.record(best.getFitness());
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("GA generation {}: best fitness {}, bars {}", generation, best.getFitness(),
                        best.getObjectives().getBarCount());
            }
        }
        if (reason == ConvergenceReason.TIME_BUDGET) {
            LOGGER.warn("GA stopped by time budget after {} generations", generation);
        }
        return finish(best, seed, generation, problem, monitor, reason);
    }

    private static GeneticRun finish(Chromosome best, long seed, int generations, SearchProblem problem,
                                     ConvergenceMonitor monitor, ConvergenceReason reason) {
        GeneticTelemetry telemetry = telemetry(AlgorithmMode.GENETIC, best, seed, generations, problem, monitor, reason);
        return new GeneticRun(best.getCuts(), best.getObjectives(), telemetry);
    }

    public static GeneticTelemetry telemetry(AlgorithmMode mode, Chromosome best, long seed, int generations,
                                             SearchProblem problem, ConvergenceMonitor monitor,
                                             ConvergenceReason reason) {
        return GeneticTelemetry.builder()
                .mode(mode)
                .seed(seed)
                .generations(generations)
                .populationSize(problem.getPopulationSize())
                .evaluations(problem.getEvaluator().getEvaluations())
                .bestFitness(best.getFitness())
                .convergenceReason(reason)
                .bestFitnessHistory(List.copyOf(monitor.getHistory()))
                .build();
    }
}
