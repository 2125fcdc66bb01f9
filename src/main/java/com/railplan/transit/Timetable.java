package com.railplan.transit;

import com.railplan.common.TimeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * The propagated schedule of one train. This is derived data: it can always be recomputed from the Train and the
 * network. The priority resolver works directly on copies of timetables and accumulates the delay it applies.
 */
public class Timetable {

    public final String trainId;

    public final String trainName;

    public final int priority;

    public final List<TimetableEntry> entries;

    /** Minutes of delay applied to this timetable by the priority resolver. Never decreases. */
    public int totalDelayMinutes;

    public Timetable (String trainId, String trainName, int priority, List<TimetableEntry> entries) {
        this.trainId = trainId;
        this.trainName = trainName;
        this.priority = priority;
        this.entries = entries;
    }

    public Timetable copy () {
        List<TimetableEntry> entryCopies = new ArrayList<>(entries.size());
        for (TimetableEntry entry : entries) {
            entryCopies.add(entry.copy());
        }
        Timetable copy = new Timetable(trainId, trainName, priority, entryCopies);
        copy.totalDelayMinutes = totalDelayMinutes;
        return copy;
    }

    /**
     * Delay this train from the given stop onward. The arrival at that stop and every later time move by the delay,
     * and the train waits that much longer at the previous calling point. Stops the train passes without stopping
     * cannot absorb a wait, so they move along with the delay back to the nearest stop where the train calls.
     *
     * @return the index of the first entry whose times moved. The wait happens at the entry before it, or the train
     *         departs its origin later when this is zero.
     */
    public int delayFrom (int stopIndex, int delayMinutes) {
        int seconds = TimeUtils.minutesToSeconds(delayMinutes);
        int first = stopIndex;
        while (first > 0 && entries.get(first - 1).skipped) {
            first--;
        }
        if (first == 1) {
            // The origin has no arrival to keep. Holding the train there means departing later.
            first = 0;
        }
        if (first > 0) {
            entries.get(first - 1).holdDeparture(seconds);
        }
        for (int i = first; i < entries.size(); i++) {
            entries.get(i).shift(seconds);
        }
        totalDelayMinutes += delayMinutes;
        return first;
    }

    /** Copy the computed arrival and departure of each entry into the corresponding stop of the train. */
    public void writeTimesTo (Train train) {
        if (train.stops.size() != entries.size()) {
            throw new IllegalArgumentException("Timetable of " + trainId + " does not match the stops of " + train.id);
        }
        for (int i = 0; i < entries.size(); i++) {
            Stop stop = train.stops.get(i);
            stop.arrival = entries.get(i).arrival;
            stop.departure = entries.get(i).departure;
        }
    }

    public Integer firstDeparture () {
        return entries.isEmpty() ? null : entries.get(0).departure;
    }

    public Integer lastArrival () {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1).arrival;
    }

    @Override
    public String toString () {
        StringBuilder sb = new StringBuilder("Timetable of ").append(trainName == null ? trainId : trainName);
        for (TimetableEntry entry : entries) {
            sb.append(String.format("%n  %-12s arr %s dep %s%s", entry.stationId, TimeUtils.format(entry.arrival),
                    TimeUtils.format(entry.departure), entry.skipped ? " (pass)" : ""));
        }
        return sb.toString();
    }

}
