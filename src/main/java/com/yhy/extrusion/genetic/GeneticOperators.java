package com.yhy.extrusion.genetic;

import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Permutation operators. All randomness comes from the {@link Random} passed in, so a run is
 * reproducible from its seed.
 */
public final class GeneticOperators {

    private GeneticOperators() {
    }

    /**
     * Draws {@code size} individuals with replacement and returns the best according to {@code order}.
     */
    public static Chromosome tournament(List<Chromosome> population, int size, Comparator<Chromosome> order, Random rnd) {
        Chromosome best = population.get(rnd.nextInt(population.size()));
        for (int i = 1; i < size; i++) {
            Chromosome challenger = population.get(rnd.nextInt(population.size()));
            if (order.compare(challenger, best) < 0) {
                best = challenger;
            }
        }
        return best;
    }

    /**
     * Order crossover (OX). Each child keeps a slice of one parent and takes the remaining genes
     * in the other parent's order, starting after the slice.
     */
    public static int[][] orderCrossover(int[] a, int[] b, Random rnd) {
        int n = a.length;
        if (n < 2) {
            return new int[][]{a.clone(), b.clone()};
        }
        int i = rnd.nextInt(n);
        int j = rnd.nextInt(n);
        if (i > j) {
            int t = i;
            i = j;
            j = t;
        }
        return new int[][]{ox(a, b, i, j), ox(b, a, i, j)};
    }

    private static int[] ox(int[] keep, int[] fill, int from, int to) {
        int n = keep.length;
        int[] child = new int[n];
        boolean[] taken = new boolean[n];
        for (int k = from; k <= to; k++) {
            child[k] = keep[k];
            taken[keep[k]] = true;
        }
        int write = (to + 1) % n;
        for (int step = 0; step < n; step++) {
            int gene = fill[(to + 1 + step) % n];
            if (taken[gene]) {
                continue;
            }
            child[write] = gene;
            taken[gene] = true;
            write = (write + 1) % n;
        }
        return child;
    }

    /**
     * Mutates in place with probability {@code rate}. Swap or segment shuffle normally;
     * a stagnating search also uses inversion.
     */
    public static void mutate(int[] genes, double rate, boolean stagnating, Random rnd) {
        if (genes.length < 2 || rnd.nextDouble() >= rate) {
            return;
        }
        int kind = rnd.nextInt(stagnating ? 3 : 2);
        switch (kind) {
            case 0:
                swap(genes, rnd);
                break;
            case 1:
                shuffleSegment(genes, rnd);
                break;
            default:
                invert(genes, rnd);
                break;
        }
    }

    static void swap(int[] genes, Random rnd) {
        int i = rnd.nextInt(genes.length);
        int j = rnd.nextInt(genes.length);
        int t = genes[i];
        genes[i] = genes[j];
        genes[j] = t;
    }

    static void shuffleSegment(int[] genes, Random rnd) {
        int[] bounds = segment(genes.length, rnd);
        for (int k = bounds[1]; k > bounds[0]; k--) {
            int r = bounds[0] + rnd.nextInt(k - bounds[0] + 1);
            int t = genes[k];
            genes[k] = genes[r];
            genes[r] = t;
        }
    }

    static void invert(int[] genes, Random rnd) {
        int[] bounds = segment(genes.length, rnd);
        for (int i = bounds[0], j = bounds[1]; i < j; i++, j--) {
            int t = genes[i];
            genes[i] = genes[j];
            genes[j] = t;
        }
    }

    private static int[] segment(int n, Random rnd) {
        int i = rnd.nextInt(n);
        int j = rnd.nextInt(n);
        return i <= j ? new int[]{i, j} : new int[]{j, i};
    }

    /**
     * Fisher-Yates shuffle of 0..n-1.
     */
    public static int[] randomPermutation(int n, Random rnd) {
        int[] genes = new int[n];
        for (int i = 0; i < n; i++) {
            genes[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int r = rnd.nextInt(i + 1);
            int t = genes[i];
            genes[i] = genes[r];
            genes[r] = t;
        }
        return genes;
    }
}
