package com.yhy.extrusion.nsga;

import com.yhy.extrusion.genetic.Chromosome;
import com.yhy.extrusion.genetic.ObjectiveVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Crowding distance within one front. Boundary members get infinity; an objective on which
 * the whole front agrees contributes nothing.
 */
public final class CrowdingDistance {

    /**
     * Lower rank first, then larger crowding distance.
     */
    public static final Comparator<Chromosome> CROWDED_ORDER = Comparator
            .comparingInt(Chromosome::getRank)
            .thenComparing(Chromosome::getCrowding, Comparator.reverseOrder());

    private CrowdingDistance() {
    }

    public static void assign(List<Chromosome> front) {
        int n = front.size();
        for (Chromosome c : front) {
            c.setCrowding(0);
        }
        if (n <= 2) {
            front.forEach(c -> c.setCrowding(Double.POSITIVE_INFINITY));
            return;
        }
        for (int k = 0; k < ObjectiveVector.OBJECTIVES; k++) {
            final int objective = k;
            List<Chromosome> sorted = new ArrayList<>(front);
            sorted.sort(Comparator.comparingDouble(c -> c.getObjectives().get(objective)));
            double min = sorted.get(0).getObjectives().get(k);
            double max = sorted.get(n - 1).getObjectives().get(k);
            if (max - min <= ParetoRanking.EPS) {
                continue;
            }
            sorted.get(0).setCrowding(Double.POSITIVE_INFINITY);
            sorted.get(n - 1).setCrowding(Double.POSITIVE_INFINITY);
            for (int i = 1; i < n - 1; i++) {
                Chromosome c = sorted.get(i);
                if (Double.isInfinite(c.getCrowding())) {
                    continue;
                }
                double gap = sorted.get(i + 1).getObjectives().get(k) - sorted.get(i - 1).getObjectives().get(k);
                c.setCrowding(c.getCrowding() + gap / (max - min));
            }
        }
    }
}
