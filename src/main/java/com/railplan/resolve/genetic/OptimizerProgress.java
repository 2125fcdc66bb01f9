package com.railplan.resolve.genetic;

/**
 * Live state of the population optimizer, readable from other threads while a run is in progress.
 */
public class OptimizerProgress {

    public enum Status {
        IDLE, RUNNING, CONVERGED, EXHAUSTED, CANCELLED
    }

    private volatile Status status = Status.IDLE;

    private volatile int generation;

    private volatile int bestConflictCount = -1;

    private volatile double bestFitness = Double.POSITIVE_INFINITY;

    void start () {
        status = Status.RUNNING;
        generation = 0;
        bestConflictCount = -1;
        bestFitness = Double.POSITIVE_INFINITY;
    }

    void update (int generation, Chromosome best) {
        this.generation = generation;
        this.bestConflictCount = best.conflictCount;
        this.bestFitness = best.fitness;
    }

    void finish (Status status) {
        this.status = status;
    }

    public Status getStatus () {
        return status;
    }

    public int getGeneration () {
        return generation;
    }

    /** Conflicts of the best solution so far, or -1 before the first generation has been evaluated. */
    public int getBestConflictCount () {
        return bestConflictCount;
    }

    public double getBestFitness () {
        return bestFitness;
    }

    @Override
    public String toString () {
        return String.format("%s at generation %d, best has %d conflicts (fitness %.1f)",
                status, generation, bestConflictCount, bestFitness);
    }

}
