package com.railplan.resolve.genetic;

import com.railplan.resolve.Adjustment;
import com.railplan.transit.Train;

import java.util.List;

/**
 * Outcome of a population optimizer run. INCOMPLETE means the generation budget ran out with conflicts remaining;
 * the best solution found is still returned.
 */
public class OptimizationResult {

    public enum Status {
        CONVERGED, INCOMPLETE, CANCELLED
    }

    public final Status status;

    /** Copies of the input trains with the best solution applied, in input order. */
    public final List<Train> trains;

    public final List<Adjustment> adjustments;

    /** Conflicts involving the evolving trains before optimization. */
    public final int initialConflictCount;

    public final int finalConflictCount;

    public final int generations;

    /** Fitness of the best solution after each generation. Never increases. */
    public final List<Double> bestFitnessHistory;

    public OptimizationResult (Status status, List<Train> trains, List<Adjustment> adjustments,
                               int initialConflictCount, int finalConflictCount, int generations,
                               List<Double> bestFitnessHistory) {
        this.status = status;
        this.trains = trains;
        this.adjustments = adjustments;
        this.initialConflictCount = initialConflictCount;
        this.finalConflictCount = finalConflictCount;
        this.generations = generations;
        this.bestFitnessHistory = bestFitnessHistory;
    }

}
