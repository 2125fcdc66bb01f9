package com.railplan.oracle;

import com.railplan.conflict.Conflict;
import com.railplan.network.NetworkPathService;
import com.railplan.network.Station;
import com.railplan.network.TrackSegment;
import com.railplan.transit.SegmentOccupancy;
import com.railplan.transit.Stop;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetableEntry;
import com.railplan.transit.Train;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the scheduling problem sent to the optimization oracle: the part of the network used by the trains,
 * every train with its computed times, the conflicts found and the trains that must not be changed.
 * Serialized with snake_case field names.
 */
public class OracleRequest {

    public List<StationInfo> stations = new ArrayList<>();

    public List<SegmentInfo> segments = new ArrayList<>();

    public List<TrainInfo> trains = new ArrayList<>();

    public List<ConflictInfo> conflicts = new ArrayList<>();

    public List<String> fixedTrainIds = new ArrayList<>();

    public static class StationInfo {
        public String id;
        public String name;
        public int platforms;
    }

    public static class SegmentInfo {
        public String id;
        public String fromStation;
        public String toStation;
        public double distanceKm;
        public double speedLimitKmh;
        public String trackType;
        public int capacity;
    }

    public static class TrainInfo {
        public String id;
        public String name;
        public int priority;
        public double maxSpeedKmh;
        public int departureTime;
        public List<StopInfo> stops = new ArrayList<>();
    }

    public static class StopInfo {
        public String stationId;
        public String track;
        public Integer arrival;
        public Integer departure;
        public int minDwellMinutes;
        public boolean skipped;
    }

    public static class ConflictInfo {
        public String type;
        public String locationId;
        public List<String> trainIds;
        public int start;
        public int end;
    }

    /**
     * Build a request from trains and their timetables. Trains without a timetable (unreachable) are left out.
     */
    public static OracleRequest create (NetworkPathService network, Collection<Train> trains,
                                        Map<String, Timetable> timetables, Collection<Conflict> conflicts,
                                        Collection<String> fixedTrainIds) {
        OracleRequest request = new OracleRequest();
        Map<String, StationInfo> stations = new LinkedHashMap<>();
        Map<String, SegmentInfo> segments = new LinkedHashMap<>();
        for (Train train : trains) {
            Timetable timetable = timetables.get(train.id);
            if (timetable == null) continue;
            TrainInfo trainInfo = new TrainInfo();
            trainInfo.id = train.id;
            trainInfo.name = train.displayName();
            trainInfo.priority = train.priority;
            trainInfo.maxSpeedKmh = train.maxSpeedKmh;
            trainInfo.departureTime = train.departureTime;
            for (int i = 0; i < train.stops.size(); i++) {
                Stop stop = train.stops.get(i);
                TimetableEntry entry = timetable.entries.get(i);
                StopInfo stopInfo = new StopInfo();
                stopInfo.stationId = stop.stationId;
                stopInfo.track = stop.track;
                stopInfo.arrival = entry.arrival;
                stopInfo.departure = entry.departure;
                stopInfo.minDwellMinutes = stop.minDwellMinutes;
                stopInfo.skipped = stop.skipped;
                trainInfo.stops.add(stopInfo);
                stations.computeIfAbsent(stop.stationId, id -> stationInfo(network, id));
                for (SegmentOccupancy occupancy : entry.inboundSegments) {
                    segments.computeIfAbsent(occupancy.segment.id, id -> segmentInfo(occupancy.segment));
                }
            }
            request.trains.add(trainInfo);
        }
        for (Conflict conflict : conflicts) {
            ConflictInfo conflictInfo = new ConflictInfo();
            conflictInfo.type = conflict.type.name();
            conflictInfo.locationId = conflict.locationId;
            conflictInfo.trainIds = conflict.trainIds;
            conflictInfo.start = conflict.start;
            conflictInfo.end = conflict.end;
            request.conflicts.add(conflictInfo);
        }
        request.stations.addAll(stations.values());
        request.segments.addAll(segments.values());
        request.fixedTrainIds.addAll(fixedTrainIds);
        return request;
    }

    private static StationInfo stationInfo (NetworkPathService network, String stationId) {
        StationInfo info = new StationInfo();
        info.id = stationId;
        Station station = network.getStation(stationId);
        if (station != null) {
            info.name = station.name;
            info.platforms = station.platforms;
        }
        return info;
    }

    private static SegmentInfo segmentInfo (TrackSegment segment) {
        SegmentInfo info = new SegmentInfo();
        info.id = segment.id;
        info.fromStation = segment.fromStationId;
        info.toStation = segment.toStationId;
        info.distanceKm = segment.distanceKm;
        info.speedLimitKmh = segment.speedLimitKmh;
        info.trackType = segment.trackType.name();
        info.capacity = segment.capacity;
        return info;
    }

}
