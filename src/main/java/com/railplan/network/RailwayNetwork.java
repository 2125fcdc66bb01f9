package com.railplan.network;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.Lists;
import com.railplan.ScheduleException;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * In-memory railway network. Stations are assigned consecutive integer indexes in the order they are added, and
 * adjacency is stored per station index. Shortest paths (by distance) are found with Dijkstra's algorithm and cached,
 * since the same legs are requested many thousands of times during optimization.
 *
 * The network should be fully built before it is handed to the scheduling engine. Adding stations or segments later
 * clears the path cache but is not safe while another thread is searching.
 */
public class RailwayNetwork implements NetworkPathService {

    private static final Logger LOG = LoggerFactory.getLogger(RailwayNetwork.class);

    private final List<Station> stations = new ArrayList<>();

    /** Maps station IDs to their integer index. No entry value is -1. */
    private final TObjectIntMap<String> indexForStationId = new TObjectIntHashMap<>(64, 0.5f, -1);

    /** Segments touching each station, keyed on station index. */
    private final TIntObjectMap<List<TrackSegment>> segmentsForStation = new TIntObjectHashMap<>();

    private final Map<String, TrackSegment> segmentForId = new HashMap<>();

    private final LoadingCache<Leg, Optional<NetworkPath>> pathCache = CacheBuilder.newBuilder()
            .maximumSize(100_000)
            .build(new CacheLoader<>() {
                @Override
                public Optional<NetworkPath> load (Leg leg) {
                    return Optional.ofNullable(dijkstra(leg.from, leg.to));
                }
            });

    public void addStation (Station station) {
        if (indexForStationId.containsKey(station.id)) {
            throw ScheduleException.badInput("Duplicate station ID " + station.id);
        }
        indexForStationId.put(station.id, stations.size());
        stations.add(station);
        pathCache.invalidateAll();
    }

    public void addSegment (TrackSegment segment) {
        int fromIndex = indexForStationId.get(segment.fromStationId);
        int toIndex = indexForStationId.get(segment.toStationId);
        if (fromIndex < 0 || toIndex < 0) {
            throw ScheduleException.badInput("Segment " + segment.id + " refers to an unknown station.");
        }
        if (segmentForId.containsKey(segment.id)) {
            throw ScheduleException.badInput("Duplicate segment ID " + segment.id);
        }
        segmentForId.put(segment.id, segment);
        addAdjacent(fromIndex, segment);
        if (toIndex != fromIndex) {
            addAdjacent(toIndex, segment);
        }
        pathCache.invalidateAll();
    }

    private void addAdjacent (int stationIndex, TrackSegment segment) {
        List<TrackSegment> adjacent = segmentsForStation.get(stationIndex);
        if (adjacent == null) {
            adjacent = new ArrayList<>();
            segmentsForStation.put(stationIndex, adjacent);
        }
        adjacent.add(segment);
    }

    @Override
    public Station getStation (String stationId) {
        int index = indexForStationId.get(stationId);
        return index < 0 ? null : stations.get(index);
    }

    public TrackSegment getSegment (String segmentId) {
        return segmentForId.get(segmentId);
    }

    public Collection<Station> getStations () {
        return Collections.unmodifiableList(stations);
    }

    public Collection<TrackSegment> getSegments () {
        return Collections.unmodifiableCollection(segmentForId.values());
    }

    @Override
    public List<TrackSegment> findPathEdges (String fromStationId, String toStationId) {
        NetworkPath path = findShortestPath(fromStationId, toStationId);
        return path == null ? null : path.segments;
    }

    @Override
    public NetworkPath findShortestPath (String fromStationId, String toStationId) {
        if (fromStationId == null || toStationId == null) return null;
        return pathCache.getUnchecked(new Leg(fromStationId, toStationId)).orElse(null);
    }

    private NetworkPath dijkstra (String fromStationId, String toStationId) {
        int origin = indexForStationId.get(fromStationId);
        int destination = indexForStationId.get(toStationId);
        if (origin < 0 || destination < 0) {
            LOG.warn("Path requested between unknown stations {} and {}.", fromStationId, toStationId);
            return null;
        }
        if (origin == destination) {
            return new NetworkPath(List.of(fromStationId), List.of(), 0);
        }
        int nStations = stations.size();
        double[] distance = new double[nStations];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        TrackSegment[] backSegment = new TrackSegment[nStations];
        int[] backStation = new int[nStations];
        Arrays.fill(backStation, -1);
        boolean[] settled = new boolean[nStations];

        PriorityQueue<QueueEntry> queue = new PriorityQueue<>();
        distance[origin] = 0;
        queue.add(new QueueEntry(origin, 0));
        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            if (settled[entry.stationIndex]) continue;
            settled[entry.stationIndex] = true;
            if (entry.stationIndex == destination) break;
            List<TrackSegment> adjacent = segmentsForStation.get(entry.stationIndex);
            if (adjacent == null) continue;
            String stationId = stations.get(entry.stationIndex).id;
            for (TrackSegment segment : adjacent) {
                int neighbor = indexForStationId.get(segment.otherEnd(stationId));
                double candidate = entry.distance + segment.distanceKm;
                if (!settled[neighbor] && candidate < distance[neighbor]) {
                    distance[neighbor] = candidate;
                    backSegment[neighbor] = segment;
                    backStation[neighbor] = entry.stationIndex;
                    queue.add(new QueueEntry(neighbor, candidate));
                }
            }
        }
        if (!settled[destination]) {
            return null;
        }
        List<String> stationIds = new ArrayList<>();
        List<TrackSegment> segments = new ArrayList<>();
        for (int s = destination; s != origin; s = backStation[s]) {
            stationIds.add(stations.get(s).id);
            segments.add(backSegment[s]);
        }
        stationIds.add(fromStationId);
        return new NetworkPath(Lists.reverse(stationIds), Lists.reverse(segments), distance[destination]);
    }

    private static class QueueEntry implements Comparable<QueueEntry> {
        final int stationIndex;
        final double distance;

        QueueEntry (int stationIndex, double distance) {
            this.stationIndex = stationIndex;
            this.distance = distance;
        }

        @Override
        public int compareTo (QueueEntry other) {
            return Double.compare(distance, other.distance);
        }
    }

    private static class Leg {
        final String from;
        final String to;

        Leg (String from, String to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public boolean equals (Object o) {
            if (this == o) return true;
            if (!(o instanceof Leg)) return false;
            Leg other = (Leg) o;
            return from.equals(other.from) && to.equals(other.to);
        }

        @Override
        public int hashCode () {
            return Objects.hash(from, to);
        }
    }

}
