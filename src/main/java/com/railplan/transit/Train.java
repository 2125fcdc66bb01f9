package com.railplan.transit;

import com.railplan.ScheduleException;
import com.railplan.common.TimeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * A train service with its performance characteristics and its ordered list of stops.
 * Resolution passes adjust departureTime and the stops' extra dwell and tracks on copies made with clone().
 */
public class Train implements Cloneable {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    public String id;

    /** Operational train number. */
    public int code;

    public String name;

    public TrainCategory category = TrainCategory.REGIONAL;

    public double maxSpeedKmh;

    /** Higher is more important. When two trains conflict the less important one gives way. */
    public int priority = 5;

    /** Meters per second squared. */
    public double acceleration = 0.5;

    /** Meters per second squared, positive. */
    public double deceleration = 0.5;

    /** Optional reference to the line this train was generated for. */
    public String lineId;

    /**
     * Nominal departure from the first stop, in seconds after the reference midnight. Shifts are applied to this value
     * as they are, so a train delayed past midnight departs after 86400 and one moved before midnight departs at a
     * negative time.
     */
    public int departureTime;

    public List<Stop> stops = new ArrayList<>();

    public Train () { }

    /**
     * @param departureTime clock time of departure, reduced to the time of day on the reference day.
     */
    public Train (String id, String name, int priority, double maxSpeedKmh, int departureTime) {
        this.id = id;
        this.name = name;
        this.priority = priority;
        this.maxSpeedKmh = maxSpeedKmh;
        this.departureTime = TimeUtils.timeOfDay(departureTime);
    }

    /** Fluent helper to append a stop. */
    public Train addStop (String stationId, int minDwellMinutes) {
        stops.add(new Stop(stationId, minDwellMinutes));
        return this;
    }

    /**
     * Reject trains that cannot be scheduled at all, before any computation takes place.
     */
    public void validate () {
        if (id == null) {
            throw ScheduleException.badInput("Train has no ID.");
        }
        if (stops == null || stops.isEmpty()) {
            throw ScheduleException.badInput("Train " + id + " has an empty route.");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw ScheduleException.badInput(String.format("Train %s priority %d is outside %d-%d.",
                    id, priority, MIN_PRIORITY, MAX_PRIORITY));
        }
        for (Stop stop : stops) {
            if (stop.stationId == null) {
                throw ScheduleException.badInput("Train " + id + " has a stop without a station.");
            }
            if (stop.minDwellMinutes < 0) {
                throw ScheduleException.badInput("Train " + id + " has a negative dwell at " + stop.stationId);
            }
        }
    }

    /** Clear all dwell added by previous resolution passes, moving planned times back with it. */
    public void resetExtraDwell () {
        for (int i = 0; i < stops.size(); i++) {
            addExtraDwell(i, -stops.get(i).extraDwellMinutes);
        }
    }

    /**
     * Move the whole train by the given number of seconds: the nominal departure and every planned time, so that a
     * planned time cannot hold the train at its old slot.
     */
    public void shiftDeparture (int seconds) {
        departureTime += seconds;
        shiftPlannedTimes(0, seconds);
    }

    /**
     * Make the train wait longer at a stop. Extra dwell never becomes negative. Planned times from the departure at
     * that stop onward move by the wait actually added, so a planned departure cannot absorb it. Extra dwell at the
     * origin precedes the departure and moves nothing.
     */
    public void addExtraDwell (int stopIndex, double minutes) {
        Stop stop = stops.get(stopIndex);
        double before = stop.extraDwellMinutes;
        stop.extraDwellMinutes = Math.max(0, before + minutes);
        int seconds = TimeUtils.minutesToSeconds(stop.extraDwellMinutes) - TimeUtils.minutesToSeconds(before);
        if (stopIndex == 0 || seconds == 0) return;
        if (stop.plannedDeparture != null) {
            stop.plannedDeparture += seconds;
        }
        shiftPlannedTimes(stopIndex + 1, seconds);
    }

    private void shiftPlannedTimes (int fromStop, int seconds) {
        for (int i = fromStop; i < stops.size(); i++) {
            Stop stop = stops.get(i);
            if (stop.plannedArrival != null) {
                stop.plannedArrival += seconds;
            }
            if (stop.plannedDeparture != null) {
                stop.plannedDeparture += seconds;
            }
        }
    }

    /** The name if there is one, otherwise the ID. */
    public String displayName () {
        return name == null ? id : name;
    }

    /** Deep copy: the stops are cloned so the copy can be adjusted independently. */
    @Override
    public Train clone () {
        try {
            Train copy = (Train) super.clone();
            copy.stops = new ArrayList<>(stops.size());
            for (Stop stop : stops) {
                copy.stops.add(stop.clone());
            }
            return copy;
        } catch (CloneNotSupportedException e) {
            throw new RuntimeException(e);
        }
    }

    public static List<Train> deepCopy (List<Train> trains) {
        List<Train> copies = new ArrayList<>(trains.size());
        for (Train train : trains) {
            copies.add(train.clone());
        }
        return copies;
    }

    @Override
    public String toString () {
        return String.format("Train %s (%s, priority %d, %d stops)", id, displayName(), priority, stops.size());
    }

}
