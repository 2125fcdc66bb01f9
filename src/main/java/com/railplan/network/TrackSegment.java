package com.railplan.network;

import com.railplan.ScheduleException;

/**
 * An undirected edge of the railway network. Trains may traverse it in either direction.
 */
public class TrackSegment {

    public final String id;

    public final String fromStationId;

    public final String toStationId;

    /** Length in kilometers, always positive. */
    public final double distanceKm;

    /** Maximum permitted speed in km/h. */
    public final double speedLimitKmh;

    public final TrackType trackType;

    /** Number of trains that may occupy the segment at the same time. */
    public final int capacity;

    public TrackSegment (String id, String fromStationId, String toStationId, double distanceKm,
                         double speedLimitKmh, TrackType trackType, int capacity) {
        if (id == null || fromStationId == null || toStationId == null) {
            throw ScheduleException.badInput("Track segment must have an ID and two station IDs.");
        }
        if (!(distanceKm > 0)) {
            throw ScheduleException.badInput("Track segment " + id + " must have a positive distance: " + distanceKm);
        }
        if (!(speedLimitKmh > 0)) {
            throw ScheduleException.badInput("Track segment " + id + " must have a positive speed limit.");
        }
        if (capacity < 1) {
            throw ScheduleException.badInput("Track segment " + id + " must have a capacity of at least one.");
        }
        this.id = id;
        this.fromStationId = fromStationId;
        this.toStationId = toStationId;
        this.distanceKm = distanceKm;
        this.speedLimitKmh = speedLimitKmh;
        this.trackType = trackType == null ? TrackType.DOUBLE : trackType;
        this.capacity = capacity;
    }

    /** Convenience constructor deriving capacity from the track type: one for single and regional track, two otherwise. */
    public TrackSegment (String id, String fromStationId, String toStationId, double distanceKm,
                         double speedLimitKmh, TrackType trackType) {
        this(id, fromStationId, toStationId, distanceKm, speedLimitKmh, trackType,
                trackType.isExclusive() ? 1 : 2);
    }

    /**
     * True if two trains may not be on this segment at the same time, whatever their direction. Single and regional
     * track are always exclusive, other track only when its capacity is one.
     */
    public boolean isSingleOccupancy () {
        return trackType.isExclusive() || capacity == 1;
    }

    /** Given one end of this segment, return the other one, or null if the station is not an end. */
    public String otherEnd (String stationId) {
        if (fromStationId.equals(stationId)) return toStationId;
        if (toStationId.equals(stationId)) return fromStationId;
        return null;
    }

    @Override
    public String toString () {
        return String.format("Segment %s %s-%s (%.1f km, %.0f km/h, %s)",
                id, fromStationId, toStationId, distanceKm, speedLimitKmh, trackType);
    }

}
