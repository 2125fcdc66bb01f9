package com.railplan;

import com.railplan.common.TimeUtils;
import com.railplan.network.RailwayNetwork;
import com.railplan.network.Station;
import com.railplan.network.StationType;
import com.railplan.network.TrackSegment;
import com.railplan.network.TrackType;
import com.railplan.transit.Train;
import com.railplan.transit.TrainCategory;

/**
 * Small networks and trains for tests. The line is A - B - C - D:
 * A-B 20 km at 160 km/h, B-C 30 km at 120 km/h, C-D 25 km at 160 km/h.
 */
public class FakeNetwork {

    public static RailwayNetwork doubleTrackLine () {
        return line(TrackType.DOUBLE);
    }

    public static RailwayNetwork singleTrackLine () {
        return line(TrackType.SINGLE);
    }

    public static RailwayNetwork regionalLine () {
        return line(TrackType.REGIONAL);
    }

    private static RailwayNetwork line (TrackType trackType) {
        RailwayNetwork network = new RailwayNetwork();
        network.addStation(new Station("A", "Alton", StationType.INTERCHANGE, 4));
        network.addStation(new Station("B", "Bexley", StationType.STATION, 2));
        network.addStation(new Station("C", "Carford", StationType.STATION, 2));
        network.addStation(new Station("D", "Dunmore", StationType.INTERCHANGE, 4));
        network.addSegment(new TrackSegment("AB", "A", "B", 20, 160, trackType));
        network.addSegment(new TrackSegment("BC", "B", "C", 30, 120, trackType));
        network.addSegment(new TrackSegment("CD", "C", "D", 25, 160, trackType));
        return network;
    }

    /**
     * A regional train calling at the given stations. It dwells three minutes at its origin and two at intermediate
     * stops, and clears the platform immediately at its terminus.
     */
    public static Train train (String id, int priority, int departureTime, String... stationIds) {
        Train train = new Train(id, "Train " + id, priority, 160, departureTime);
        train.category = TrainCategory.REGIONAL;
        train.acceleration = 0.5;
        train.deceleration = 0.5;
        for (int i = 0; i < stationIds.length; i++) {
            int dwell = i == 0 ? 3 : i == stationIds.length - 1 ? 0 : 2;
            train.addStop(stationIds[i], dwell);
        }
        return train;
    }

    public static int time (int hours, int minutes) {
        return TimeUtils.hms(hours, minutes, 0);
    }

}
