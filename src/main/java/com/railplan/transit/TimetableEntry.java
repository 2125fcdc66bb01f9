package com.railplan.transit;

import java.util.ArrayList;
import java.util.List;

/**
 * The computed times of one stop of a train, together with the platform occupation window at the station and the
 * occupation of each segment on the way in from the previous stop.
 */
public class TimetableEntry {

    public final String stationId;

    public final String track;

    public final boolean skipped;

    public Integer arrival;

    public Integer departure;

    /**
     * The interval during which the train holds its platform. For intermediate stops this is arrival to departure.
     * At the origin and terminus the dwell is spent before departure or after arrival respectively. Null when the
     * train does not occupy a platform here (skipped stop or zero dwell at an end of the route).
     */
    public Integer occupancyStart;

    public Integer occupancyEnd;

    /** Segments traversed since the previous stop, in travel order. Empty for the first stop. */
    public final List<SegmentOccupancy> inboundSegments;

    public TimetableEntry (String stationId, String track, boolean skipped, List<SegmentOccupancy> inboundSegments) {
        this.stationId = stationId;
        this.track = track;
        this.skipped = skipped;
        this.inboundSegments = inboundSegments;
    }

    public boolean occupiesPlatform () {
        return occupancyStart != null && occupancyEnd != null && occupancyStart < occupancyEnd;
    }

    public TimetableEntry copy () {
        List<SegmentOccupancy> segments = new ArrayList<>(inboundSegments.size());
        for (SegmentOccupancy occupancy : inboundSegments) {
            segments.add(occupancy.copy());
        }
        TimetableEntry copy = new TimetableEntry(stationId, track, skipped, segments);
        copy.arrival = arrival;
        copy.departure = departure;
        copy.occupancyStart = occupancyStart;
        copy.occupancyEnd = occupancyEnd;
        return copy;
    }

    /** Shift every time of this entry, including the inbound segments. */
    void shift (int seconds) {
        arrival = plus(arrival, seconds);
        departure = plus(departure, seconds);
        occupancyStart = plus(occupancyStart, seconds);
        occupancyEnd = plus(occupancyEnd, seconds);
        for (SegmentOccupancy occupancy : inboundSegments) {
            occupancy.shift(seconds);
        }
    }

    /** Hold the train here longer: only the departure moves, and the platform stays occupied until it. */
    void holdDeparture (int seconds) {
        if (departure == null) return;
        if (occupancyEnd != null && occupancyEnd.equals(departure)) {
            occupancyEnd += seconds;
        }
        departure += seconds;
    }

    private static Integer plus (Integer time, int seconds) {
        return time == null ? null : time + seconds;
    }

}
