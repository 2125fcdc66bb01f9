package com.railplan.transit;

import com.railplan.network.TrackSegment;

/** The interval during which a train is on one track segment, in seconds after the reference midnight. */
public class SegmentOccupancy {

    public final TrackSegment segment;

    public int entry;

    public int exit;

    public SegmentOccupancy (TrackSegment segment, int entry, int exit) {
        this.segment = segment;
        this.entry = entry;
        this.exit = exit;
    }

    public SegmentOccupancy copy () {
        return new SegmentOccupancy(segment, entry, exit);
    }

    void shift (int seconds) {
        entry += seconds;
        exit += seconds;
    }

}
