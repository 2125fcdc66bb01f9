package com.railplan.conflict;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.railplan.common.TimeUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Two trains occupying the same resource (a station platform or a single-occupancy segment) at overlapping times.
 * The interval is the overlap of the two occupations. Conflicts are recomputed after every change and never stored.
 */
public class Conflict {

    /** Deterministic processing order: by location, then start of the overlap, then trains involved. */
    public static final Comparator<Conflict> ORDER = (a, b) -> ComparisonChain.start()
            .compare(a.locationId, b.locationId)
            .compare(a.start, b.start)
            .compare(a.end, b.end)
            .compare(String.join(",", a.trainIds), String.join(",", b.trainIds))
            .result();

    public final ConflictType type;

    /** Station ID for station conflicts, segment ID for track conflicts. */
    public final String locationId;

    public final List<String> trainIds;

    public final List<String> trainNames;

    /**
     * For each train, the index of the stop where the conflict happens. For a track conflict this is the stop the
     * train is heading to on the conflicting segment.
     */
    public final List<Integer> stopIndexes;

    /** Start of the overlap in seconds after the reference midnight. */
    public final int start;

    public final int end;

    public Conflict (ConflictType type, String locationId, List<String> trainIds, List<String> trainNames,
                     List<Integer> stopIndexes, int start, int end) {
        this.type = type;
        this.locationId = locationId;
        this.trainIds = ImmutableList.copyOf(trainIds);
        this.trainNames = ImmutableList.copyOf(trainNames);
        this.stopIndexes = ImmutableList.copyOf(stopIndexes);
        this.start = start;
        this.end = end;
    }

    public boolean involves (String trainId) {
        return trainIds.contains(trainId);
    }

    /** The stop index of the given train in this conflict, or -1 if the train is not involved. */
    public int stopIndexOf (String trainId) {
        int i = trainIds.indexOf(trainId);
        return i < 0 ? -1 : stopIndexes.get(i);
    }

    public int durationSeconds () {
        return end - start;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conflict other = (Conflict) o;
        return start == other.start && end == other.end && type == other.type &&
                locationId.equals(other.locationId) && trainIds.equals(other.trainIds) &&
                stopIndexes.equals(other.stopIndexes);
    }

    @Override
    public int hashCode () {
        return Objects.hash(type, locationId, trainIds, stopIndexes, start, end);
    }

    @Override
    public String toString () {
        return String.format("%s at %s between %s, %s-%s", type, locationId, String.join(" and ", trainNames),
                TimeUtils.format(start), TimeUtils.format(end));
    }

}
