package com.yhy.extrusion.nsga;

import com.yhy.extrusion.genetic.Chromosome;
import com.yhy.extrusion.genetic.ConvergenceMonitor;
import com.yhy.extrusion.genetic.GeneticOperators;
import com.yhy.extrusion.genetic.GeneticOptimizer;
import com.yhy.extrusion.genetic.GeneticRun;
import com.yhy.extrusion.genetic.ObjectiveVector;
import com.yhy.extrusion.genetic.SearchProblem;
import com.yhy.extrusion.heuristic.PackingContext;
import com.yhy.extrusion.support.TimeBudget;
import com.yhy.extrusion.vo.AlgorithmConfig;
import com.yhy.extrusion.vo.AlgorithmMode;
import com.yhy.extrusion.vo.ConvergenceReason;
import com.yhy.extrusion.vo.CutItem;
import com.yhy.extrusion.vo.GeneticSettings;
import com.yhy.extrusion.vo.ParetoWeights;
import com.yhy.extrusion.vo.telemetry.GeneticTelemetry;
import com.yhy.extrusion.vo.telemetry.ParetoPoint;
import com.yhy.extrusion.vo.telemetry.ParetoSummary;
import com.yhy.extrusion.vo.telemetry.ParetoTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/**
 * NSGA-II over the same permutation encoding as the GA, minimising waste, cost and bar count.
 * Returns the front member with the lowest weighted sum of normalised objectives.
 */
public class Nsga2Optimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Nsga2Optimizer.class);

    private static final Comparator<Chromosome> FRONT_ORDER = Comparator
            .comparingDouble((Chromosome c) -> c.getObjectives().getTotalWaste())
            .thenComparingDouble(c -> c.getObjectives().getTotalCost())
            .thenComparingInt(c -> c.getObjectives().getBarCount());

    public GeneticRun optimize(List<CutItem> items, PackingContext context, AlgorithmConfig config,
                               long seed, TimeBudget budget, ExecutorService evaluationPool) {
        GeneticSettings settings = config.getGenetic();
        Random rnd = new Random(seed);
        SearchProblem problem = SearchProblem.prepare(items, context, config, evaluationPool);
        ConvergenceMonitor monitor = new ConvergenceMonitor(settings, budget);

        List<Chromosome> population;
        int generation = 0;
        ConvergenceReason reason;
        if (monitor.isOutOfTime()) {
            population = new ArrayList<>(List.of(problem.getBaseline()));
            monitor.record(problem.getBaseline().getFitness());
            reason = ConvergenceReason.TIME_BUDGET;
            LOGGER.warn("Time budget spent before the first generation; front holds the FFD order only");
        } else {
            population = problem.initialPopulation(rnd);
            rankAndCrowd(population);
            monitor.record(bestFitness(population));
            while (true) {
                Optional<ConvergenceReason> stop = monitor.check(generation);
                if (stop.isPresent()) {
                    reason = stop.get();
                    break;
                }
                context.getCancellation().checkpoint();

                List<Chromosome> offspring = breed(population, problem.getPopulationSize(), settings,
                        monitor.isStagnating(), rnd);
                problem.getEvaluator().evaluateAll(offspring);

                List<Chromosome> union = new ArrayList<>(population);
                union.addAll(offspring);
                population = survivors(union, problem.getPopulationSize());
                generation++;
                monitor.record(bestFitness(population));
                LOGGER.debug("NSGA-II generation {}: front size {}", generation,
                        population.stream().filter(c -> c.getRank() == 0).count());
            }
            if (reason == ConvergenceReason.TIME_BUDGET) {
                LOGGER.warn("NSGA-II stopped by time budget after {} generations", generation);
            }
        }

        List<Chromosome> front = firstFront(population);
        int recommended = recommend(front, config.getParetoWeights());
        Chromosome chosen = front.get(recommended);

        GeneticTelemetry search = GeneticOptimizer.telemetry(AlgorithmMode.NSGA_II, chosen, seed, generation,
                problem, monitor, reason);
        ParetoTelemetry telemetry = ParetoTelemetry.builder()
                .search(search)
                .pareto(summarise(front, recommended))
                .build();
        return new GeneticRun(chosen.getCuts(), chosen.getObjectives(), telemetry);
    }

    private static List<Chromosome> breed(List<Chromosome> parents, int size, GeneticSettings settings,
                                          boolean stagnating, Random rnd) {
        List<Chromosome> offspring = new ArrayList<>(size);
        while (offspring.size() < size) {
            Chromosome p1 = GeneticOperators.tournament(parents, settings.getTournamentSize(), CrowdingDistance.CROWDED_ORDER, rnd);
            Chromosome p2 = GeneticOperators.tournament(parents, settings.getTournamentSize(), CrowdingDistance.CROWDED_ORDER, rnd);
            int[][] children = rnd.nextDouble() < settings.getCrossoverRate()
                    ? GeneticOperators.orderCrossover(p1.getGenes(), p2.getGenes(), rnd)
                    : new int[][]{p1.getGenes().clone(), p2.getGenes().clone()};
            for (int[] child : children) {
                GeneticOperators.mutate(child, settings.getMutationRate(), stagnating, rnd);
                if (offspring.size() < size) {
                    offspring.add(new Chromosome(child));
                }
            }
        }
        return offspring;
    }

    /**
     * Environmental selection: whole fronts by rank, the last one cut by crowding distance.
     */
    static List<Chromosome> survivors(List<Chromosome> union, int size) {
        List<Chromosome> next = new ArrayList<>(size);
        for (List<Chromosome> front : ParetoRanking.sort(union)) {
            CrowdingDistance.assign(front);
            if (next.size() + front.size() <= size) {
                next.addAll(front);
                continue;
            }
            List<Chromosome> byCrowding = new ArrayList<>(front);
            byCrowding.sort(Comparator.comparing(Chromosome::getCrowding, Comparator.reverseOrder()));
            next.addAll(byCrowding.subList(0, size - next.size()));
            break;
        }
        return next;
    }

    private static void rankAndCrowd(List<Chromosome> population) {
        ParetoRanking.sort(population).forEach(CrowdingDistance::assign);
    }

    private static double bestFitness(List<Chromosome> population) {
        return population.stream().mapToDouble(Chromosome::getFitness).min().orElse(Double.POSITIVE_INFINITY);
    }

    /**
     * Rank-0 members without duplicate objective vectors, sorted by waste, then cost, then bars.
     */
    static List<Chromosome> firstFront(List<Chromosome> population) {
        List<Chromosome> ranked = new ArrayList<>();
        for (Chromosome c : population) {
            if (c.getRank() == 0) {
                ranked.add(c);
            }
        }
        ranked.sort(FRONT_ORDER);
        List<Chromosome> front = new ArrayList<>(ranked.size());
        for (Chromosome c : ranked) {
            boolean duplicate = front.stream().anyMatch(f -> ParetoRanking.sameObjectives(f.getObjectives(), c.getObjectives()));
            if (!duplicate) {
                front.add(c);
            }
        }
        return front;
    }

    static int recommend(List<Chromosome> front, ParetoWeights weights) {
        double[][] norm = ParetoMetrics.normalise(objectives(front));
        double[] w = {weights.getWaste(), weights.getCost(), weights.getBarCount()};
        int best = 0;
        double bestScore = Double.POSITIVE_INFINITY;
        for (int i = 0; i < norm.length; i++) {
            double score = 0;
            for (int k = 0; k < ObjectiveVector.OBJECTIVES; k++) {
                score += w[k] * norm[i][k];
            }
            if (score < bestScore - ParetoRanking.EPS) {
                bestScore = score;
                best = i;
            }
        }
        return best;
    }

    private static ParetoSummary summarise(List<Chromosome> front, int recommended) {
        List<ParetoPoint> points = new ArrayList<>(front.size());
        for (Chromosome c : front) {
            ObjectiveVector v = c.getObjectives();
            points.add(new ParetoPoint(v.getTotalWaste(), v.getTotalCost(), v.getBarCount(), v.getEfficiency()));
        }
        double[][] norm = ParetoMetrics.normalise(objectives(front));
        return ParetoSummary.builder()
                .front(List.copyOf(points))
                .recommendedIndex(recommended)
                .hypervolume(ParetoMetrics.hypervolume(norm))
                .spacing(ParetoMetrics.spacing(norm))
                .build();
    }

    private static double[][] objectives(List<Chromosome> front) {
        double[][] out = new double[front.size()][ObjectiveVector.OBJECTIVES];
        for (int i = 0; i < front.size(); i++) {
            for (int k = 0; k < ObjectiveVector.OBJECTIVES; k++) {
                out[i][k] = front.get(i).getObjectives().get(k);
            }
        }
        return out;
    }
}
