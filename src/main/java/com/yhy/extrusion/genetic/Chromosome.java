package com.yhy.extrusion.genetic;

import com.yhy.extrusion.vo.Cut;

import java.util.Comparator;
import java.util.List;

/**
 * A cutting order over the unit pieces of one partition. Genes are a permutation of unit indices.
 */
public final class Chromosome {

    public static final Comparator<Chromosome> BY_FITNESS = Comparator.comparingDouble(Chromosome::getFitness);

    private final int[] genes;
    private List<Cut> cuts;
    private ObjectiveVector objectives;
    private double fitness = Double.NaN;

    // NSGA-II bookkeeping
    private int rank;
    private double crowding;

    public Chromosome(int[] genes) {
        this.genes = genes;
    }

    public Chromosome(int[] genes, List<Cut> cuts, ObjectiveVector objectives, double fitness) {
        this(genes);
        evaluated(cuts, objectives, fitness);
    }

    public int[] getGenes() {
        return genes;
    }

    public int length() {
        return genes.length;
    }

    void evaluated(List<Cut> cuts, ObjectiveVector objectives, double fitness) {
        this.cuts = cuts;
        this.objectives = objectives;
        this.fitness = fitness;
    }

    public boolean isEvaluated() {
        return objectives != null;
    }

    public List<Cut> getCuts() {
        return cuts;
    }

    public ObjectiveVector getObjectives() {
        return objectives;
    }

    public double getFitness() {
        return fitness;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public double getCrowding() {
        return crowding;
    }

    public void setCrowding(double crowding) {
        this.crowding = crowding;
    }
}
