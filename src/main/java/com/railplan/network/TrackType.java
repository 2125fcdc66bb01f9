package com.railplan.network;

/** Kind of track laid on a segment between two stations. */
public enum TrackType {
    SINGLE,
    DOUBLE,
    REGIONAL,
    HIGH_SPEED;

    /** Regional lines are worked as single track: one train at a time between stations. */
    public boolean isExclusive () {
        return this == SINGLE || this == REGIONAL;
    }
}
