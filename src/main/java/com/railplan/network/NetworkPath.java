package com.railplan.network;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** The result of a shortest path search: the stations passed through and the total length. */
public class NetworkPath {

    public final List<String> stationIds;

    public final List<TrackSegment> segments;

    public final double distanceKm;

    public NetworkPath (List<String> stationIds, List<TrackSegment> segments, double distanceKm) {
        this.stationIds = ImmutableList.copyOf(stationIds);
        this.segments = ImmutableList.copyOf(segments);
        this.distanceKm = distanceKm;
    }

}
