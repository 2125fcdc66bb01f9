package com.railplan.network;

import java.util.List;

/**
 * Read-only view of the railway network used by the scheduling engine. Segments are traversable in both directions.
 * Implementations must be safe to call from several threads at once.
 */
public interface NetworkPathService {

    /**
     * @return the segments of the shortest path between the two stations in travel order, an empty list when both
     *         IDs are the same station, or null when the stations are not connected.
     */
    List<TrackSegment> findPathEdges (String fromStationId, String toStationId);

    /** @return the shortest path between two stations, or null when they are not connected. */
    NetworkPath findShortestPath (String fromStationId, String toStationId);

    /** @return the station with the given ID, or null if there is none. */
    Station getStation (String stationId);

}
