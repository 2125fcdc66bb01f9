package com.railplan.transit;

import com.railplan.ScheduleException;
import com.railplan.common.TimeUtils;
import com.railplan.network.NetworkPathService;
import com.railplan.network.TrackSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Computes the arrival and departure at every stop of a train from its nominal departure, the running time over
 * each track segment between stops, dwell times and operator pins.
 *
 * Running times are computed per segment from rest to rest at the lower of the train's maximum speed and the segment
 * speed limit. Times are rounded to the nearest second as they are computed, and the rounded value is used as the
 * starting point for the next computation. Propagation does not modify the train, so it can be called as often as
 * needed on the same input and always gives the same result.
 */
public class TimetablePropagator {

    private static final Logger LOG = LoggerFactory.getLogger(TimetablePropagator.class);

    private final NetworkPathService network;

    public TimetablePropagator (NetworkPathService network) {
        this.network = network;
    }

    /**
     * @throws ScheduleException of type BAD_INPUT for a train with an empty route, UNREACHABLE_STOP if two consecutive
     *         stops are not connected, or INVALID_KINEMATICS for a train that cannot move.
     */
    public Timetable propagate (Train train) {
        train.validate();
        List<TimetableEntry> entries = new ArrayList<>(train.stops.size());

        Stop origin = train.stops.get(0);
        TimetableEntry originEntry = new TimetableEntry(origin.stationId, origin.track, origin.skipped, List.of());
        originEntry.departure = origin.plannedDeparture != null
                ? origin.plannedDeparture
                : train.departureTime;
        int originDwell = TimeUtils.minutesToSeconds(origin.dwellMinutes());
        if (originDwell > 0) {
            originEntry.occupancyStart = originEntry.departure - originDwell;
            originEntry.occupancyEnd = originEntry.departure;
        }
        entries.add(originEntry);

        for (int i = 1; i < train.stops.size(); i++) {
            Stop previous = train.stops.get(i - 1);
            Stop stop = train.stops.get(i);
            int previousDeparture = entries.get(i - 1).departure;
            List<TrackSegment> path = network.findPathEdges(previous.stationId, stop.stationId);
            if (path == null) {
                throw ScheduleException.unreachableStop(train.id, previous.stationId, stop.stationId);
            }

            List<SegmentOccupancy> inbound = new ArrayList<>(path.size());
            double clock = previousDeparture;
            for (TrackSegment segment : path) {
                int entry = (int) Math.round(clock);
                clock = entry + TravelTimeCalculator.travelTimeSeconds(
                        segment.distanceKm, segment.speedLimitKmh, train, 0, 0);
                inbound.add(new SegmentOccupancy(segment, entry, (int) Math.round(clock)));
            }

            TimetableEntry entry = new TimetableEntry(stop.stationId, stop.track, stop.skipped, inbound);
            entry.arrival = stop.plannedArrival != null ? stop.plannedArrival : (int) Math.round(clock);
            int dwell = TimeUtils.minutesToSeconds(stop.dwellMinutes());
            boolean last = i == train.stops.size() - 1;
            if (last) {
                if (dwell > 0) {
                    entry.occupancyStart = entry.arrival;
                    entry.occupancyEnd = entry.arrival + dwell;
                }
            } else {
                int earliestDeparture = entry.arrival + dwell;
                entry.departure = stop.plannedDeparture == null
                        ? earliestDeparture
                        : Math.max(earliestDeparture, stop.plannedDeparture);
                if (!stop.skipped) {
                    entry.occupancyStart = entry.arrival;
                    entry.occupancyEnd = entry.departure;
                }
            }
            entries.add(entry);
        }
        return new Timetable(train.id, train.displayName(), train.priority, entries);
    }

    /**
     * Propagate every train, isolating per-train failures. Malformed input (BAD_INPUT) is not isolated: it is thrown
     * before any train is propagated.
     */
    public PropagationReport propagateAll (Collection<Train> trains) {
        for (Train train : trains) {
            train.validate();
        }
        PropagationReport report = new PropagationReport();
        for (Train train : trains) {
            try {
                report.timetables.put(train.id, propagate(train));
            } catch (ScheduleException e) {
                LOG.warn("Could not compute timetable of train {}: {}", train.id, e.getMessage());
                report.failures.put(train.id, e.getMessage());
            }
        }
        return report;
    }

}
