package com.railplan.resolve;

import com.railplan.conflict.Conflict;
import com.railplan.transit.Timetable;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a priority resolution run. An EXHAUSTED state with remaining conflicts is a normal result, not an error.
 */
public class ResolutionReport {

    public final PriorityResolver.State state;

    public final int iterations;

    /** The resolved timetables, one per input timetable in the same order. */
    public final List<Timetable> timetables;

    public final List<Conflict> initialConflicts;

    public final List<Conflict> remainingConflicts;

    /** Total delay in minutes applied to each train that was delayed. */
    public final Map<String, Integer> delayMinutesByTrain;

    /** The delays expressed as changes to the trains, so they survive a new propagation. */
    public final List<Adjustment> adjustments;

    public ResolutionReport (PriorityResolver.State state, int iterations, List<Timetable> timetables,
                             List<Conflict> initialConflicts, List<Conflict> remainingConflicts,
                             Map<String, Integer> delayMinutesByTrain, List<Adjustment> adjustments) {
        this.state = state;
        this.iterations = iterations;
        this.timetables = timetables;
        this.initialConflicts = initialConflicts;
        this.remainingConflicts = remainingConflicts;
        this.delayMinutesByTrain = delayMinutesByTrain;
        this.adjustments = adjustments;
    }

    public boolean isConflictFree () {
        return remainingConflicts.isEmpty();
    }

    public int totalDelayMinutes () {
        return delayMinutesByTrain.values().stream().mapToInt(Integer::intValue).sum();
    }

}
