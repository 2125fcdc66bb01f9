package com.railplan.resolve;

import com.railplan.common.TimeUtils;
import com.railplan.transit.Train;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * A change to one train produced by a resolution step: a departure shift, additional dwell at some stops and
 * platform reassignments. Applying an adjustment changes the train; the new times are obtained by propagating again.
 */
public class Adjustment {

    public enum Source {
        PRIORITY_RESOLVER,
        DEPARTURE_SEARCH,
        ORACLE,
        POPULATION_OPTIMIZER
    }

    public final String trainId;

    public final Source source;

    /** Signed shift of the nominal departure in minutes. */
    public double departureShiftMinutes;

    /** Extra dwell to add at each stop, aligned with the train's stops. */
    public final double[] dwellDeltas;

    /** New platform assignments, keyed on stop index. */
    public final Map<Integer, String> trackAssignments = new HashMap<>();

    public Adjustment (String trainId, Source source, int nStops) {
        this.trainId = trainId;
        this.source = source;
        this.dwellDeltas = new double[nStops];
    }

    /**
     * Apply to the given train. Planned times move with the shift and the added dwell, and extra dwell never becomes
     * negative. Deltas beyond the end of the route are ignored, which only happens when an external party sends more
     * delays than the train has stops.
     */
    public void applyTo (Train train) {
        if (!train.id.equals(trainId)) {
            throw new IllegalArgumentException("Adjustment for " + trainId + " applied to train " + train.id);
        }
        train.shiftDeparture(TimeUtils.minutesToSeconds(departureShiftMinutes));
        for (int i = 0; i < dwellDeltas.length && i < train.stops.size(); i++) {
            if (dwellDeltas[i] != 0) {
                train.addExtraDwell(i, dwellDeltas[i]);
            }
        }
        for (Map.Entry<Integer, String> assignment : trackAssignments.entrySet()) {
            if (assignment.getKey() >= 0 && assignment.getKey() < train.stops.size()) {
                train.stops.get(assignment.getKey()).track = assignment.getValue();
            }
        }
    }

    public boolean isEmpty () {
        return departureShiftMinutes == 0 && trackAssignments.isEmpty() &&
                Arrays.stream(dwellDeltas).allMatch(d -> d == 0);
    }

    /** Delay introduced by this adjustment: the absolute departure shift plus all added dwell. */
    public double delayMinutes () {
        double delay = Math.abs(departureShiftMinutes);
        for (double delta : dwellDeltas) {
            delay += Math.max(0, delta);
        }
        return delay;
    }

    @Override
    public String toString () {
        return String.format("Adjustment of %s by %s: shift %+.1f min, dwell %s, tracks %s", trainId, source,
                departureShiftMinutes, Arrays.toString(dwellDeltas), trackAssignments);
    }

}
