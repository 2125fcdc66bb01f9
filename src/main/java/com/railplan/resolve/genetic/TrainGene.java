package com.railplan.resolve.genetic;

import com.railplan.resolve.Adjustment;

import java.util.Arrays;

/**
 * The part of a chromosome describing one train: how far its departure is shifted, how much extra dwell it gets at
 * each stop and which platform it uses. A null track means the train keeps its current assignment.
 */
public class TrainGene {

    public final String trainId;

    public double departureOffsetMinutes;

    public final double[] dwellOffsets;

    public final String[] tracks;

    public TrainGene (String trainId, int nStops) {
        this.trainId = trainId;
        this.dwellOffsets = new double[nStops];
        this.tracks = new String[nStops];
    }

    public TrainGene copy () {
        TrainGene copy = new TrainGene(trainId, dwellOffsets.length);
        copy.departureOffsetMinutes = departureOffsetMinutes;
        System.arraycopy(dwellOffsets, 0, copy.dwellOffsets, 0, dwellOffsets.length);
        System.arraycopy(tracks, 0, copy.tracks, 0, tracks.length);
        return copy;
    }

    public double delayMinutes () {
        return Math.abs(departureOffsetMinutes) + Arrays.stream(dwellOffsets).sum();
    }

    public Adjustment toAdjustment () {
        Adjustment adjustment = new Adjustment(trainId, Adjustment.Source.POPULATION_OPTIMIZER, dwellOffsets.length);
        adjustment.departureShiftMinutes = departureOffsetMinutes;
        System.arraycopy(dwellOffsets, 0, adjustment.dwellDeltas, 0, dwellOffsets.length);
        for (int i = 0; i < tracks.length; i++) {
            if (tracks[i] != null) {
                adjustment.trackAssignments.put(i, tracks[i]);
            }
        }
        return adjustment;
    }

}
