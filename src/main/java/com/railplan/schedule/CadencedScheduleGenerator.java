package com.railplan.schedule;

import com.railplan.ScheduleException;
import com.railplan.common.TimeUtils;
import com.railplan.transit.Stop;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates the trains of a service running at a regular interval between a first and a last departure, optionally with
 * a return train leaving the terminus a fixed turnaround time after each outward train arrives. The generated trains
 * have no conflict resolution applied; they are meant to be passed to the resolution pipeline as new trains.
 */
public class CadencedScheduleGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CadencedScheduleGenerator.class);

    /** Rough running time per stop, used only when the outward trip cannot be propagated. */
    private static final int ESTIMATED_MINUTES_PER_STOP = 8;

    private static final int ESTIMATED_EXTRA_MINUTES = 10;

    private final TimetablePropagator propagator;

    public CadencedScheduleGenerator (TimetablePropagator propagator) {
        this.propagator = propagator;
    }

    /** A single outward trip departing at the given clock time. */
    public Train singleTrip (ServiceTemplate template, int departureTime) {
        return createTrain(template, TimeUtils.timeOfDay(departureTime), template.startNumber);
    }

    /**
     * Departures after the first keep counting up past midnight, so the trains of a service are ordered by their
     * departure times.
     *
     * @param firstDeparture clock time of departure of the first outward train, seconds after midnight.
     * @param lastDeparture latest departure of an outward train. If earlier than the first, the service runs past
     *                      midnight.
     * @param intervalMinutes cadence. Zero or negative generates a single outward trip.
     * @param returnTemplate the return service, or null for outward trains only.
     * @param turnaroundMinutes time between arrival at the terminus and departure of the return train.
     */
    public List<Train> generate (ServiceTemplate outward, int firstDeparture, int lastDeparture, int intervalMinutes,
                                 ServiceTemplate returnTemplate, int turnaroundMinutes) {
        if (outward.stops.isEmpty()) {
            throw ScheduleException.badInput("Service " + outward.lineId + " has no stops.");
        }
        int count = 1;
        if (intervalMinutes > 0) {
            int span = TimeUtils.timeOfDay(lastDeparture) - TimeUtils.timeOfDay(firstDeparture);
            if (span < 0) {
                span += TimeUtils.SECONDS_PER_DAY;
            }
            count = span / (intervalMinutes * 60) + 1;
        }
        int first = TimeUtils.timeOfDay(firstDeparture);
        List<Train> trains = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int departure = first + i * intervalMinutes * 60;
            Train train = createTrain(outward, departure, outward.startNumber + 2 * i);
            trains.add(train);
            if (returnTemplate != null) {
                int returnDeparture = arrivalAtTerminus(train) + turnaroundMinutes * 60;
                trains.add(createTrain(returnTemplate, returnDeparture, outward.startNumber + 2 * i + 1));
            }
        }
        LOG.info("Generated {} trains for service {}.", trains.size(), outward.lineId);
        return trains;
    }

    private int arrivalAtTerminus (Train train) {
        try {
            Timetable timetable = propagator.propagate(train);
            Integer arrival = timetable.lastArrival();
            if (arrival != null) {
                return arrival;
            }
            return timetable.firstDeparture();
        } catch (ScheduleException e) {
            int estimate = train.stops.size() * ESTIMATED_MINUTES_PER_STOP + ESTIMATED_EXTRA_MINUTES;
            LOG.warn("Could not propagate {} ({}), estimating {} min running time.", train.id, e.getMessage(),
                    estimate);
            return train.departureTime + estimate * 60;
        }
    }

    private static Train createTrain (ServiceTemplate template, int departureTime, int code) {
        Train train = new Train();
        train.code = code;
        train.id = template.lineId + "-" + code;
        String hhmm = TimeUtils.format(TimeUtils.timeOfDay(departureTime)).substring(0, 5);
        train.name = template.lineName + " " + hhmm;
        train.category = template.category;
        train.priority = template.priority;
        train.maxSpeedKmh = template.effectiveMaxSpeedKmh();
        train.acceleration = template.acceleration;
        train.deceleration = template.deceleration;
        train.lineId = template.lineId;
        train.departureTime = departureTime;
        for (Stop stop : template.stops) {
            Stop copy = stop.clone();
            copy.arrival = null;
            copy.departure = null;
            train.stops.add(copy);
        }
        return train;
    }

}
