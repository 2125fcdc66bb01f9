package com.railplan.pipeline;

import com.railplan.conflict.Conflict;
import com.railplan.resolve.Adjustment;
import com.railplan.resolve.genetic.OptimizationResult;
import com.railplan.transit.Train;

import java.util.List;
import java.util.Map;

/**
 * The outcome of a hybrid pipeline run: the merged fleet, what each stage did, and the conflicts that remain.
 * Remaining conflicts are always reported in full, even when the run could not remove them.
 */
public class PipelineResult {

    public enum Status {
        COMPLETED, CANCELLED
    }

    public Status status;

    /** Existing trains (the same, untouched objects) followed by the refined new trains. */
    public List<Train> trains;

    /** The refined copies of the new trains, or the unchanged input trains when cancelled. */
    public List<Train> newTrains;

    public int baselineConflictCount;

    public List<Conflict> finalConflicts;

    /** The first few remaining conflicts, for display. */
    public List<Conflict> residualPreview;

    /** Number of remaining conflicts per location, busiest first. */
    public Map<String, Integer> hotspots;

    public OracleOutcome oracleOutcome = OracleOutcome.DISABLED;

    /** Null when the optimizer did not run. */
    public OptimizationResult optimization;

    /** All adjustments kept, in the order they were applied. */
    public List<Adjustment> adjustments;

    /** Trains that could not be scheduled, with the reason. */
    public Map<String, String> failures;

    public int finalConflictCount () {
        return finalConflicts == null ? 0 : finalConflicts.size();
    }

    public boolean isConflictFree () {
        return finalConflictCount() == 0;
    }

}
