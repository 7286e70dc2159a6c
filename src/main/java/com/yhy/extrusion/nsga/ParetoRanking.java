package com.yhy.extrusion.nsga;

import com.yhy.extrusion.genetic.Chromosome;
import com.yhy.extrusion.genetic.ObjectiveVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Fast non-dominated sort over waste, cost and bar count.
 */
public final class ParetoRanking {

    static final double EPS = 1e-9;

    private ParetoRanking() {
    }

    /**
     * True when {@code a} is no worse than {@code b} on every objective and strictly better on one.
     */
    public static boolean dominates(ObjectiveVector a, ObjectiveVector b) {
        boolean better = false;
        for (int k = 0; k < ObjectiveVector.OBJECTIVES; k++) {
            double x = a.get(k);
            double y = b.get(k);
            if (x > y + EPS) {
                return false;
            }
            if (x < y - EPS) {
                better = true;
            }
        }
        return better;
    }

    public static boolean sameObjectives(ObjectiveVector a, ObjectiveVector b) {
        for (int k = 0; k < ObjectiveVector.OBJECTIVES; k++) {
            if (Math.abs(a.get(k) - b.get(k)) > EPS) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits the population into fronts and sets each chromosome's rank (0 = non-dominated).
     * Members of a front keep their population order.
     */
    public static List<List<Chromosome>> sort(List<Chromosome> population) {
        int n = population.size();
        List<List<Integer>> dominated = new ArrayList<>(n);
        int[] dominatedBy = new int[n];
        List<Integer> current = new ArrayList<>();
        for (int p = 0; p < n; p++) {
            List<Integer> mine = new ArrayList<>();
            ObjectiveVector pv = population.get(p).getObjectives();
            for (int q = 0; q < n; q++) {
                if (p == q) {
                    continue;
                }
                ObjectiveVector qv = population.get(q).getObjectives();
                if (dominates(pv, qv)) {
                    mine.add(q);
                } else if (dominates(qv, pv)) {
                    dominatedBy[p]++;
                }
            }
            dominated.add(mine);
            if (dominatedBy[p] == 0) {
                current.add(p);
            }
        }

        List<List<Chromosome>> fronts = new ArrayList<>();
        int rank = 0;
        while (!current.isEmpty()) {
            List<Chromosome> front = new ArrayList<>(current.size());
            List<Integer> next = new ArrayList<>();
            for (int p : current) {
                Chromosome member = population.get(p);
                member.setRank(rank);
                front.add(member);
                for (int q : dominated.get(p)) {
                    if (--dominatedBy[q] == 0) {
                        next.add(q);
                    }
                }
            }
            next.sort(null);
            fronts.add(front);
            current = next;
            rank++;
        }
        return fronts;
    }
}
