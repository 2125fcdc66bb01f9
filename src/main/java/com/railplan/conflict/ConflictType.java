package com.railplan.conflict;

public enum ConflictType {
    /** Two trains on the same station platform at overlapping times. */
    STATION_OCCUPANCY,
    /** Two trains on the same single-occupancy track segment at overlapping times. */
    TRACK_OCCUPANCY
}
