package com.yhy.extrusion.genetic;

import com.yhy.extrusion.support.TimeBudget;
import com.yhy.extrusion.vo.ConvergenceReason;
import com.yhy.extrusion.vo.GeneticSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the best fitness per generation and decides when a search stops.
 */
public class ConvergenceMonitor {

    static final double IMPROVEMENT_EPS = 1e-9;

    private final GeneticSettings settings;
    private final TimeBudget budget;
    private final List<Double> history = new ArrayList<>();
    private double best = Double.POSITIVE_INFINITY;
    private int stale;

    public ConvergenceMonitor(GeneticSettings settings, TimeBudget budget) {
        this.settings = settings;
        this.budget = budget;
    }

    public void record(double bestFitness) {
        if (bestFitness < best - IMPROVEMENT_EPS) {
            best = bestFitness;
            stale = 0;
        } else if (!history.isEmpty()) {
            stale++;
        }
        history.add(Math.min(best, bestFitness));
    }

    /**
     * Checked before generation {@code generation} starts; empty means keep going.
     */
    public Optional<ConvergenceReason> check(int generation) {
        if (budget.exhausted()) {
            return Optional.of(ConvergenceReason.TIME_BUDGET);
        }
        if (generation >= settings.getMaxGenerations()) {
            return Optional.of(ConvergenceReason.MAX_GENERATIONS);
        }
        if (stale >= settings.getPlateauGenerations()) {
            return Optional.of(ConvergenceReason.FITNESS_PLATEAU);
        }
        return Optional.empty();
    }

    public boolean isStagnating() {
        return stale >= Math.max(1, settings.getPlateauGenerations() / 2);
    }

    public boolean isOutOfTime() {
        return budget.exhausted();
    }

    public double getBest() {
        return best;
    }

    public List<Double> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
