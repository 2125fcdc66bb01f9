package com.railplan.conflict;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.railplan.transit.SegmentOccupancy;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetableEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds pairs of trains that occupy the same station platform or the same single-occupancy segment at overlapping
 * times. Occupations are grouped by resource and sorted by start time, so each occupation is only compared with the
 * ones that start before it ends.
 *
 * Two trains stopping at the same station do not conflict when both have a platform assigned and the platforms are
 * different. Occupations of the same train never conflict with each other (a route may visit a station twice).
 * Track occupation does not consider direction: two trains on a single-track segment at the same time conflict
 * whichever way they travel.
 *
 * Detection has no side effects. The order of the returned conflicts is unspecified, sort with Conflict.ORDER.
 */
public class ConflictDetector {

    public interface Config {
        /** Process station and segment groups in a parallel stream. */
        boolean parallelDetection ();
    }

    private final boolean parallel;

    public ConflictDetector () {
        this(false);
    }

    public ConflictDetector (Config config) {
        this(config.parallelDetection());
    }

    public ConflictDetector (boolean parallel) {
        this.parallel = parallel;
    }

    public List<Conflict> detect (Collection<Timetable> timetables) {
        ListMultimap<String, Occupation> stationOccupations = ArrayListMultimap.create();
        ListMultimap<String, Occupation> segmentOccupations = ArrayListMultimap.create();
        for (Timetable timetable : timetables) {
            for (int i = 0; i < timetable.entries.size(); i++) {
                TimetableEntry entry = timetable.entries.get(i);
                if (entry.occupiesPlatform()) {
                    stationOccupations.put(entry.stationId, new Occupation(timetable, i, entry.track,
                            entry.occupancyStart, entry.occupancyEnd));
                }
                for (SegmentOccupancy occupancy : entry.inboundSegments) {
                    if (occupancy.segment.isSingleOccupancy() && occupancy.exit > occupancy.entry) {
                        segmentOccupations.put(occupancy.segment.id,
                                new Occupation(timetable, i, null, occupancy.entry, occupancy.exit));
                    }
                }
            }
        }
        Stream<Conflict> stationConflicts = groups(stationOccupations)
                .flatMap(e -> sweep(ConflictType.STATION_OCCUPANCY, e.getKey(), e.getValue()).stream());
        Stream<Conflict> trackConflicts = groups(segmentOccupations)
                .flatMap(e -> sweep(ConflictType.TRACK_OCCUPANCY, e.getKey(), e.getValue()).stream());
        return Stream.concat(stationConflicts, trackConflicts).collect(Collectors.toList());
    }

    private Stream<Map.Entry<String, List<Occupation>>> groups (ListMultimap<String, Occupation> occupations) {
        // Copy into a plain list of entries so the stream can be split across threads.
        List<Map.Entry<String, List<Occupation>>> entries = new ArrayList<>();
        for (String key : occupations.keySet()) {
            entries.add(Map.entry(key, occupations.get(key)));
        }
        return parallel ? entries.parallelStream() : entries.stream();
    }

    private static List<Conflict> sweep (ConflictType type, String locationId, List<Occupation> occupations) {
        List<Occupation> sorted = new ArrayList<>(occupations);
        sorted.sort(Comparator.comparingInt(o -> o.start));
        ImmutableList.Builder<Conflict> conflicts = ImmutableList.builder();
        for (int i = 0; i < sorted.size(); i++) {
            Occupation a = sorted.get(i);
            for (int j = i + 1; j < sorted.size() && sorted.get(j).start < a.end; j++) {
                Occupation b = sorted.get(j);
                if (a.timetable == b.timetable || a.timetable.trainId.equals(b.timetable.trainId)) continue;
                if (a.track != null && b.track != null && !a.track.equals(b.track)) continue;
                conflicts.add(new Conflict(type, locationId,
                        List.of(a.timetable.trainId, b.timetable.trainId),
                        List.of(a.timetable.trainName, b.timetable.trainName),
                        List.of(a.stopIndex, b.stopIndex),
                        b.start, Math.min(a.end, b.end)));
            }
        }
        return conflicts.build();
    }

    private static class Occupation {
        final Timetable timetable;
        final int stopIndex;
        final String track;
        final int start;
        final int end;

        Occupation (Timetable timetable, int stopIndex, String track, int start, int end) {
            this.timetable = timetable;
            this.stopIndex = stopIndex;
            this.track = track;
            this.start = start;
            this.end = end;
        }
    }

}
