package com.railplan.resolve.genetic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** One candidate solution: a gene per evolving train, plus the results of its last evaluation. */
public class Chromosome {

    public final List<TrainGene> genes;

    boolean evaluated;

    public double fitness = Double.POSITIVE_INFINITY;

    public int conflictCount;

    public double delayMinutes;

    public int trackChanges;

    /** IDs of the evolving trains involved in at least one conflict. */
    public Set<String> conflictingTrainIds = new HashSet<>();

    public Chromosome (List<TrainGene> genes) {
        this.genes = genes;
    }

    /** Deep copy, keeping the evaluation results since the genes are identical. */
    public Chromosome copy () {
        List<TrainGene> geneCopies = new ArrayList<>(genes.size());
        for (TrainGene gene : genes) {
            geneCopies.add(gene.copy());
        }
        Chromosome copy = new Chromosome(geneCopies);
        copy.evaluated = evaluated;
        copy.fitness = fitness;
        copy.conflictCount = conflictCount;
        copy.delayMinutes = delayMinutes;
        copy.trackChanges = trackChanges;
        copy.conflictingTrainIds = new HashSet<>(conflictingTrainIds);
        return copy;
    }

}
